package ai.diffgraph.cfg;

import ai.diffgraph.model.FlowType;

/**
 * A flow edge still waiting for its target: the next statement reached on this path.
 */
public record ExitAnchor(String sourceId, FlowType flowType) {
}
