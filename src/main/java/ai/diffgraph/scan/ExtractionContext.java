package ai.diffgraph.scan;

import java.util.Objects;

/**
 * Snapshot coordinates stamped onto every node and edge an extractor emits.
 */
public record ExtractionContext(String repoId, String snapshotId, String ref) {

    public ExtractionContext {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(ref, "ref");
    }
}
