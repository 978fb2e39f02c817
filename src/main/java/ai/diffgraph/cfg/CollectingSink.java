package ai.diffgraph.cfg;

import java.util.ArrayList;
import java.util.List;

import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;

/**
 * Keeps emitted nodes and edges in emission order. Not thread-safe; one per file.
 */
public final class CollectingSink implements GraphSink {

    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();

    @Override
    public void addNode(GraphNode node) {
        nodes.add(node);
    }

    @Override
    public void addEdge(GraphEdge edge) {
        edges.add(edge);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<GraphEdge> edges() {
        return edges;
    }
}
