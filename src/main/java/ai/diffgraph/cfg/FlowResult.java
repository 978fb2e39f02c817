package ai.diffgraph.cfg;

import java.util.List;

import ai.diffgraph.model.FlowType;

/**
 * Outcome of walking one statement or block.
 *
 * @param entryId      first emitted branch, null when nothing was emitted
 * @param exits        anchors to connect to whatever follows
 * @param fallsThrough whether control can reach the end without returning or throwing
 */
public record FlowResult(String entryId, List<ExitAnchor> exits, boolean fallsThrough) {

    public FlowResult {
        exits = List.copyOf(exits);
    }

    static FlowResult leaf(String id) {
        return new FlowResult(id, List.of(new ExitAnchor(id, FlowType.NEXT)), true);
    }

    static FlowResult terminal(String id) {
        return new FlowResult(id, List.of(), false);
    }

    static FlowResult nothing() {
        return new FlowResult(null, List.of(), true);
    }
}
