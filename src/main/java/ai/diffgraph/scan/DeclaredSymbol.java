package ai.diffgraph.scan;

/**
 * A name a call site can resolve to.
 *
 * @param nested true for callbacks and other nested functions, which lose to a top-level
 *               declaration of the same name
 */
public record DeclaredSymbol(String name, String nodeId, boolean nested) {
}
