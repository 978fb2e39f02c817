package ai.diffgraph.model;

import java.util.Objects;

public record GraphEdge(
        String id,
        String source,
        String target,
        EdgeKind kind,
        String filePath,
        EdgeMetadata metadata,
        String snapshotId,
        String ref
) {
    public GraphEdge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
    }

    /** Flow label of a control-flow edge, null for every other edge. */
    public FlowType flowType() {
        return metadata instanceof EdgeMetadata.FlowMetadata flow ? flow.flowType() : null;
    }
}
