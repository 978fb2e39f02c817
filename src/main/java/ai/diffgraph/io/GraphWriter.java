package ai.diffgraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.diffgraph.diff.DiffStatus;
import ai.diffgraph.diff.GraphDelta;
import ai.diffgraph.diff.TokenDiff;
import ai.diffgraph.model.SnapshotGraph;

public final class GraphWriter {

    public static final String SCHEMA_VERSION = "diffgraph/v1";

    private final Path outDir;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper jsonlMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.jsonlMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /** Writes one snapshot graph as {@code nodes.<side>.jsonl} / {@code edges.<side>.jsonl} plus the index. */
    public MasterIndex writeSnapshot(SnapshotGraph graph, String side, String generatedAt) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);
        final SnapshotEntry entry = writeGraph(graph, side);
        final Summary summary = new Summary(
                graph.nodes().size(),
                graph.edges().size(),
                graph.warnings(),
                null,
                null
        );
        final MasterIndex idx = new MasterIndex(SCHEMA_VERSION, generatedAt, List.of(entry), null, summary);
        writeJson(outDir.resolve("index.json"), idx);
        return idx;
    }

    /** Writes both graphs of a delta, {@code delta.json} and the index. */
    public MasterIndex writeDelta(GraphDelta delta, String generatedAt) throws IOException {
        Objects.requireNonNull(delta, "delta");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);
        final List<SnapshotEntry> entries = new ArrayList<>(2);
        entries.add(writeGraph(delta.oldGraph(), "old"));
        entries.add(writeGraph(delta.newGraph(), "new"));

        final DeltaFile deltaFile = new DeltaFile(
                delta.oldGraph().snapshotId(),
                delta.newGraph().snapshotId(),
                new TreeMap<>(delta.nodeStatus()),
                new TreeMap<>(delta.edgeStatus()),
                new TreeMap<>(delta.counterparts()),
                new DetailSides(new TreeMap<>(delta.oldParameters()), new TreeMap<>(delta.newParameters())),
                new DetailSides(new TreeMap<>(delta.oldDependencies()), new TreeMap<>(delta.newDependencies()))
        );
        writeJson(outDir.resolve("delta.json"), deltaFile);

        final Summary summary = new Summary(
                delta.oldGraph().nodes().size() + delta.newGraph().nodes().size(),
                delta.oldGraph().edges().size() + delta.newGraph().edges().size(),
                delta.oldGraph().warnings() + delta.newGraph().warnings(),
                counts(delta.nodeStatus()),
                counts(delta.edgeStatus())
        );
        final MasterIndex idx = new MasterIndex(SCHEMA_VERSION, generatedAt, entries, "delta.json", summary);
        writeJson(outDir.resolve("index.json"), idx);
        return idx;
    }

    private SnapshotEntry writeGraph(SnapshotGraph graph, String side) throws IOException {
        final String nodesName = "nodes." + side + ".jsonl";
        final String edgesName = "edges." + side + ".jsonl";
        writeJsonl(outDir.resolve(nodesName), graph.nodes());
        writeJsonl(outDir.resolve(edgesName), graph.edges());
        return new SnapshotEntry(side, graph.snapshotId(), graph.ref(), nodesName, edgesName,
                graph.nodes().size(), graph.edges().size(), graph.warnings());
    }

    private static StatusCounts counts(Map<String, DiffStatus> statuses) {
        int added = 0;
        int removed = 0;
        int modified = 0;
        int unchanged = 0;
        for (DiffStatus status : statuses.values()) {
            switch (status) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case MODIFIED -> modified++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new StatusCounts(added, removed, modified, unchanged);
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }

    private <T> void writeJsonl(Path file, List<T> lines) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            for (T line : lines) {
                bw.write(jsonlMapper.writeValueAsString(line));
                bw.newLine();
            }
        }
    }

    // --- index records (written as JSON, not JSONL) ---

    public record MasterIndex(
            String schema,
            String generatedAt,
            List<SnapshotEntry> snapshots,
            String delta,
            Summary summary
    ) {
    }

    public record SnapshotEntry(
            String side,
            String snapshotId,
            String ref,
            String nodes,
            String edges,
            int nodeCount,
            int edgeCount,
            int warnings
    ) {
    }

    public record Summary(
            int totalNodes,
            int totalEdges,
            int warnings,
            StatusCounts nodeChanges,
            StatusCounts edgeChanges
    ) {
    }

    public record StatusCounts(int added, int removed, int modified, int unchanged) {
    }

    public record DeltaFile(
            String oldSnapshotId,
            String newSnapshotId,
            Map<String, DiffStatus> nodeStatus,
            Map<String, DiffStatus> edgeStatus,
            Map<String, String> counterparts,
            DetailSides parameters,
            DetailSides dependencies
    ) {
    }

    public record DetailSides(
            Map<String, List<TokenDiff>> old,
            @JsonProperty("new") Map<String, List<TokenDiff>> current
    ) {
    }
}
