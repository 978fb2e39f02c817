package ai.diffgraph.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Per-kind node metadata. The {@code type} property tags the variant on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NodeMetadata.FileMetadata.class, name = "file"),
        @JsonSubTypes.Type(value = NodeMetadata.ClassMetadata.class, name = "class"),
        @JsonSubTypes.Type(value = NodeMetadata.FunctionMetadata.class, name = "function"),
        @JsonSubTypes.Type(value = NodeMetadata.BranchMetadata.class, name = "branch")
})
public sealed interface NodeMetadata
        permits NodeMetadata.FileMetadata,
                NodeMetadata.ClassMetadata,
                NodeMetadata.FunctionMetadata,
                NodeMetadata.BranchMetadata {

    record FileMetadata(int lineCount) implements NodeMetadata {
    }

    record ClassMetadata(
            String superclass,     // heritage text, null when absent
            String documentation
    ) implements NodeMetadata {
    }

    record FunctionMetadata(
            String params,           // raw parameter list text incl. parentheses
            String returnType,
            String documentation,
            String wrappedBy,        // hook name for hook-wrapped callbacks
            String hookDependencies, // dependency-array text, e.g. "[seed]"
            boolean async
    ) implements NodeMetadata {

        public static FunctionMetadata of(String params, String returnType, String documentation) {
            return new FunctionMetadata(params, returnType, documentation, null, null, false);
        }
    }

    record BranchMetadata(
            BranchKind branchType,
            boolean elif,            // an if that is the whole else arm of its parent
            String codeSnippet,
            String callee,
            boolean containsJsx,
            List<String> jsxTagNames
    ) implements NodeMetadata {

        public BranchMetadata {
            jsxTagNames = jsxTagNames == null ? List.of() : List.copyOf(jsxTagNames);
        }
    }
}
