package ai.diffgraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ai.diffgraph.model.EdgeMetadata;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.Ids;
import ai.diffgraph.scan.CallSite;
import ai.diffgraph.scan.ExtractionContext;

/**
 * Turns call sites into CALLS / RENDERS edges between declarations by plain name lookup.
 * Sites whose caller or callee is unknown are dropped.
 */
public final class CallResolver {

    public List<GraphEdge> resolve(List<CallSite> sites, SymbolTable symbols, ExtractionContext context) {
        final Map<String, GraphEdge> edges = new LinkedHashMap<>();
        for (CallSite site : sites) {
            final String source = symbols.resolve(site.callerName(), site.filePath());
            final String target = symbols.resolve(site.calleeName(), site.filePath());
            if (source == null || target == null) {
                continue;
            }
            final String id = Ids.edgeId(context.snapshotId(), site.kind(), source, target, String.valueOf(site.line()));
            edges.putIfAbsent(id, new GraphEdge(
                    id,
                    source,
                    target,
                    site.kind(),
                    site.filePath(),
                    new EdgeMetadata.ReferenceMetadata(site.line()),
                    context.snapshotId(),
                    context.ref()
            ));
        }
        return new ArrayList<>(edges.values());
    }
}
