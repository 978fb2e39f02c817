package ai.diffgraph.diff;

/**
 * One parameter or dependency entry and how it changed.
 */
public record TokenDiff(String text, DiffStatus status) {
}
