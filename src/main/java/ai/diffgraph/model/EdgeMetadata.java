package ai.diffgraph.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EdgeMetadata.FlowMetadata.class, name = "flow"),
        @JsonSubTypes.Type(value = EdgeMetadata.ImportMetadata.class, name = "import"),
        @JsonSubTypes.Type(value = EdgeMetadata.ReferenceMetadata.class, name = "reference"),
        @JsonSubTypes.Type(value = EdgeMetadata.DeclaresMetadata.class, name = "declares")
})
public sealed interface EdgeMetadata
        permits EdgeMetadata.FlowMetadata,
                EdgeMetadata.ImportMetadata,
                EdgeMetadata.ReferenceMetadata,
                EdgeMetadata.DeclaresMetadata {

    /** Control-flow edge between an owner and its branches, or between branches. */
    record FlowMetadata(FlowType flowType) implements EdgeMetadata {
    }

    record ImportMetadata(String moduleSpecifier) implements EdgeMetadata {
    }

    /** Name-resolved CALLS / RENDERS edge; {@code line} is the call site. */
    record ReferenceMetadata(int line) implements EdgeMetadata {
    }

    record DeclaresMetadata(NodeKind childKind) implements EdgeMetadata {
    }
}
