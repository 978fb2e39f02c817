package ai.diffgraph.diff;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.diffgraph.graph.SnapshotGraphBuilder;
import ai.diffgraph.model.SnapshotGraph;
import ai.diffgraph.model.SourceFile;
import ai.diffgraph.scan.ExtractionContext;

/**
 * Builds the graphs of two tree states and matches them.
 */
public final class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final SnapshotGraphBuilder builder;
    private final GraphMatcher matcher;

    public DiffEngine(SnapshotGraphBuilder builder, GraphMatcher matcher) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public DiffEngine(SnapshotGraphBuilder builder) {
        this(builder, new GraphMatcher());
    }

    /**
     * One side of a diff: the snapshot coordinates and its already-selected files.
     */
    public record SnapshotInput(String snapshotId, String ref, List<SourceFile> files) {

        public SnapshotInput {
            Objects.requireNonNull(snapshotId, "snapshotId");
            Objects.requireNonNull(ref, "ref");
            files = List.copyOf(files);
        }
    }

    public GraphDelta run(String repoId, SnapshotInput oldInput, SnapshotInput newInput) {
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(oldInput, "oldInput");
        Objects.requireNonNull(newInput, "newInput");

        final SnapshotGraph oldGraph = builder.build(
                new ExtractionContext(repoId, oldInput.snapshotId(), oldInput.ref()), oldInput.files());
        final SnapshotGraph newGraph = builder.build(
                new ExtractionContext(repoId, newInput.snapshotId(), newInput.ref()), newInput.files());
        final GraphDelta delta = matcher.match(oldGraph, newGraph);

        log.info("Diff {} -> {}: nodes +{} -{} ~{}, edges +{} -{} ~{}",
                oldInput.ref(), newInput.ref(),
                delta.countNodes(DiffStatus.ADDED), delta.countNodes(DiffStatus.REMOVED),
                delta.countNodes(DiffStatus.MODIFIED),
                delta.countEdges(DiffStatus.ADDED), delta.countEdges(DiffStatus.REMOVED),
                delta.countEdges(DiffStatus.MODIFIED));
        return delta;
    }
}
