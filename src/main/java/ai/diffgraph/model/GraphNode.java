package ai.diffgraph.model;

import java.util.Objects;

public record GraphNode(
        String id,
        NodeKind kind,
        String name,
        String qualifiedName,
        String filePath,
        Language language,
        int startLine,
        int endLine,
        String signatureHash,  // hash of whitespace-stripped source span
        NodeMetadata metadata,
        String snapshotId,
        String ref
) {
    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        Objects.requireNonNull(filePath, "filePath");
    }

    public NodeMetadata.FunctionMetadata functionMetadata() {
        return metadata instanceof NodeMetadata.FunctionMetadata fm ? fm : null;
    }

    public NodeMetadata.BranchMetadata branchMetadata() {
        return metadata instanceof NodeMetadata.BranchMetadata bm ? bm : null;
    }
}
