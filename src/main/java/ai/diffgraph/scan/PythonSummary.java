package ai.diffgraph.scan;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of the Python summarizer script.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PythonSummary(
        List<FunctionEntry> functions,
        List<ClassEntry> classes,
        List<String> imports,
        List<CallEntry> calls,
        List<BranchEntry> branches
) {
    public PythonSummary {
        functions = functions == null ? List.of() : functions;
        classes = classes == null ? List.of() : classes;
        imports = imports == null ? List.of() : imports;
        calls = calls == null ? List.of() : calls;
        branches = branches == null ? List.of() : branches;
    }

    /**
     * @param qualifiedName dotted scope path inside the module, e.g. {@code Repo.load}
     * @param kind          {@code function} or {@code method}
     * @param body          statement outline, absent for summarizers without one
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FunctionEntry(
            String name,
            String qualifiedName,
            String kind,
            int start,
            int end,
            String params,
            String returnType,
            String documentation,
            boolean async,
            JsonNode body
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassEntry(String name, int start, int end, List<String> bases, String documentation) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CallEntry(String caller, String callee, int line) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BranchEntry(String kind, String owner, int idx, int start, int end, String snippet, String callee) {
    }
}
