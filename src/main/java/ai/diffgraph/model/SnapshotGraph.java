package ai.diffgraph.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * All nodes and edges for one tree state. List order is the extraction order and only
 * serves as a matching tie-break.
 */
public record SnapshotGraph(
        String repoId,
        String snapshotId,
        String ref,
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        int warnings            // files dropped by fail-soft extraction
) {
    public SnapshotGraph {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(ref, "ref");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Map<String, GraphNode> nodesById() {
        return nodes.stream().collect(Collectors.toMap(GraphNode::id, Function.identity(), (a, b) -> a));
    }
}
