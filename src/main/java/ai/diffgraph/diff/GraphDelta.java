package ai.diffgraph.diff;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.diffgraph.model.SnapshotGraph;

/**
 * Result of matching two snapshot graphs.
 *
 * @param nodeStatus   status per node id, covering both sides
 * @param edgeStatus   status per edge id, covering both sides
 * @param counterparts paired node ids, old to new
 * @param oldParameters per-token parameter diff of each old function-like node
 * @param newParameters per-token parameter diff of each new function-like node
 * @param oldDependencies dependency-array diff of each old hook-wrapped callback
 * @param newDependencies dependency-array diff of each new hook-wrapped callback
 */
public record GraphDelta(
        SnapshotGraph oldGraph,
        SnapshotGraph newGraph,
        Map<String, DiffStatus> nodeStatus,
        Map<String, DiffStatus> edgeStatus,
        Map<String, String> counterparts,
        Map<String, List<TokenDiff>> oldParameters,
        Map<String, List<TokenDiff>> newParameters,
        Map<String, List<TokenDiff>> oldDependencies,
        Map<String, List<TokenDiff>> newDependencies
) {
    public GraphDelta {
        Objects.requireNonNull(oldGraph, "oldGraph");
        Objects.requireNonNull(newGraph, "newGraph");
        nodeStatus = Map.copyOf(nodeStatus);
        edgeStatus = Map.copyOf(edgeStatus);
        counterparts = Map.copyOf(counterparts);
        oldParameters = Map.copyOf(oldParameters);
        newParameters = Map.copyOf(newParameters);
        oldDependencies = Map.copyOf(oldDependencies);
        newDependencies = Map.copyOf(newDependencies);
    }

    public DiffStatus nodeStatus(String nodeId) {
        return nodeStatus.get(nodeId);
    }

    public DiffStatus edgeStatus(String edgeId) {
        return edgeStatus.get(edgeId);
    }

    public long countNodes(DiffStatus status) {
        return nodeStatus.values().stream().filter(status::equals).count();
    }

    public long countEdges(DiffStatus status) {
        return edgeStatus.values().stream().filter(status::equals).count();
    }
}
