package ai.diffgraph.cfg;

import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;

/**
 * Receives nodes and edges as an extractor emits them.
 */
public interface GraphSink {

    void addNode(GraphNode node);

    void addEdge(GraphEdge edge);
}
