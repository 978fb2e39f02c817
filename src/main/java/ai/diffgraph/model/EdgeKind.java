package ai.diffgraph.model;

public enum EdgeKind {
    DECLARES,
    IMPORTS,
    /** Both resolved call edges and flow-labeled control-flow edges. */
    CALLS,
    RENDERS
}
