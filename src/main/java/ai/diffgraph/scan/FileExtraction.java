package ai.diffgraph.scan;

import java.util.List;

import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Language;

/**
 * Everything one file contributes to a snapshot graph, before call resolution.
 */
public record FileExtraction(
        String path,
        Language language,
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<DeclaredSymbol> symbols,
        List<CallSite> callSites
) {
    public FileExtraction {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        symbols = List.copyOf(symbols);
        callSites = List.copyOf(callSites);
    }
}
