package ai.diffgraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import ai.diffgraph.diff.DiffEngine;
import ai.diffgraph.diff.DiffStatus;
import ai.diffgraph.diff.GraphDelta;
import ai.diffgraph.graph.AnalyzerSettings;
import ai.diffgraph.graph.SnapshotGraphBuilder;
import ai.diffgraph.io.GraphWriter;
import ai.diffgraph.model.Ids;
import ai.diffgraph.model.SnapshotGraph;
import ai.diffgraph.model.SourceFile;
import ai.diffgraph.scan.ExtractionContext;
import ai.diffgraph.scan.SnapshotReader;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        final List<String> positional = new ArrayList<>();
        Path outDir = null;
        String repoId = null;
        String ref = "working";
        boolean includeUnchanged = false;
        AnalyzerSettings settings = AnalyzerSettings.defaults();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--repoId=")) {
                    repoId = arg.substring("--repoId=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--ref=")) {
                    ref = arg.substring("--ref=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--includeUnchanged=")) {
                    includeUnchanged = Boolean.parseBoolean(arg.substring("--includeUnchanged=".length()));
                    continue;
                }
                if (arg.startsWith("--python=")) {
                    settings = settings.withPythonExecutable(arg.substring("--python=".length()));
                    continue;
                }
                if (arg.startsWith("--pythonScript=")) {
                    settings = settings.withPythonScript(Paths.get(arg.substring("--pythonScript=".length())));
                    continue;
                }
                if (arg.startsWith("--pythonTimeoutSeconds=")) {
                    settings = settings.withPythonTimeout(Duration.ofSeconds(
                            Long.parseLong(arg.substring("--pythonTimeoutSeconds=".length()).trim())));
                    continue;
                }
                if (arg.startsWith("--threads=")) {
                    settings = settings.withThreads(Integer.parseInt(arg.substring("--threads=".length()).trim()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                positional.add(arg);
            }
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: bad option value: " + safeMsg(ex.getMessage()));
            return 2;
        }

        if (positional.isEmpty()) {
            System.err.println("ERROR: missing command");
            printUsage();
            return 2;
        }

        final String command = positional.get(0);
        try {
            switch (command) {
                case "analyze":
                    if (positional.size() != 2) {
                        System.err.println("ERROR: analyze takes exactly one directory");
                        printUsage();
                        return 2;
                    }
                    return analyze(Paths.get(positional.get(1)), outDir, repoId, ref, settings);
                case "diff":
                    if (positional.size() != 3) {
                        System.err.println("ERROR: diff takes an old and a new directory");
                        printUsage();
                        return 2;
                    }
                    return diff(Paths.get(positional.get(1)), Paths.get(positional.get(2)),
                            outDir, repoId, includeUnchanged, settings);
                default:
                    System.err.println("ERROR: unknown command: " + command);
                    printUsage();
                    return 2;
            }
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static int analyze(Path dir,
                               Path outDir,
                               String repoId,
                               String ref,
                               AnalyzerSettings settings) throws IOException {
        final Path root = dir.toAbsolutePath().normalize();
        final String repo = repoId != null && !repoId.isEmpty() ? repoId : nameOf(root);
        final Path out = resolveOut(root, outDir);

        final SnapshotGraphBuilder builder = SnapshotGraphBuilder.create(settings);
        final List<SourceFile> files = new SnapshotReader(builder::supports).read(root);
        final SnapshotGraph graph = builder.build(
                new ExtractionContext(repo, Ids.snapshotId(repo, ref), ref), files);

        new GraphWriter(out).writeSnapshot(graph, "snapshot", Instant.now().toString());

        System.out.println("Snapshot graph written to: " + out);
        System.out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
        System.out.println("Files: " + files.size()
                + ", nodes: " + graph.nodes().size()
                + ", edges: " + graph.edges().size());
        if (graph.warnings() > 0) {
            System.err.println("WARN: files dropped: " + graph.warnings());
        }
        return 0;
    }

    private static int diff(Path oldDir,
                            Path newDir,
                            Path outDir,
                            String repoId,
                            boolean includeUnchanged,
                            AnalyzerSettings settings) throws IOException {
        final Path oldRoot = oldDir.toAbsolutePath().normalize();
        final Path newRoot = newDir.toAbsolutePath().normalize();
        final String repo = repoId != null && !repoId.isEmpty() ? repoId : nameOf(newRoot);
        final Path out = resolveOut(newRoot, outDir);

        final SnapshotGraphBuilder builder = SnapshotGraphBuilder.create(settings);
        final SnapshotReader reader = new SnapshotReader(builder::supports);
        final Map<String, SourceFile> oldFiles = byPath(reader.read(oldRoot));
        final Map<String, SourceFile> newFiles = byPath(reader.read(newRoot));

        final List<SourceFile> oldSelected = new ArrayList<>();
        final List<SourceFile> newSelected = new ArrayList<>();
        final TreeSet<String> paths = new TreeSet<>(oldFiles.keySet());
        paths.addAll(newFiles.keySet());
        for (String path : paths) {
            final SourceFile before = oldFiles.get(path);
            final SourceFile after = newFiles.get(path);
            if (!includeUnchanged && before != null && after != null
                    && Objects.equals(before.content(), after.content())) {
                continue;
            }
            if (before != null) {
                oldSelected.add(before);
            }
            if (after != null) {
                newSelected.add(after);
            }
        }

        final GraphDelta delta = new DiffEngine(builder).run(repo,
                new DiffEngine.SnapshotInput(Ids.snapshotId(repo, "old"), "old", oldSelected),
                new DiffEngine.SnapshotInput(Ids.snapshotId(repo, "new"), "new", newSelected));
        new GraphWriter(out).writeDelta(delta, Instant.now().toString());

        System.out.println("Graph delta written to: " + out);
        System.out.println("Schema: " + GraphWriter.SCHEMA_VERSION);
        System.out.println("Files: " + oldSelected.size() + " old, " + newSelected.size() + " new"
                + "; nodes added: " + delta.countNodes(DiffStatus.ADDED)
                + ", removed: " + delta.countNodes(DiffStatus.REMOVED)
                + ", modified: " + delta.countNodes(DiffStatus.MODIFIED));
        final int warnings = delta.oldGraph().warnings() + delta.newGraph().warnings();
        if (warnings > 0) {
            System.err.println("WARN: files dropped: " + warnings);
        }
        return 0;
    }

    private static Map<String, SourceFile> byPath(List<SourceFile> files) {
        final Map<String, SourceFile> out = new LinkedHashMap<>();
        for (SourceFile file : files) {
            out.put(file.path(), file);
        }
        return out;
    }

    private static Path resolveOut(Path root, Path outDir) throws IOException {
        final Path out;
        if (outDir == null) {
            out = root.resolve(".diffgraph");
        } else if (!outDir.isAbsolute()) {
            out = root.resolve(outDir).normalize();
        } else {
            out = outDir;
        }
        Files.createDirectories(out);
        return out;
    }

    private static String nameOf(Path root) {
        return root.getFileName() != null ? root.getFileName().toString() : "repo";
    }

    private static void printUsage() {
        System.out.println("Usage: diffgraph analyze <dir> [options]");
        System.out.println("       diffgraph diff <oldDir> <newDir> [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>              Output directory (default: <dir>/.diffgraph)");
        System.out.println("  --repoId=<id>                Repository id (default: directory name)");
        System.out.println("  --ref=<ref>                  Snapshot ref for analyze (default: working)");
        System.out.println("  --includeUnchanged=<bool>    diff: also extract files equal on both sides (default: false)");
        System.out.println("  --python=<exe>               Python interpreter (default: python3, env "
                + AnalyzerSettings.PYTHON_ENV + ")");
        System.out.println("  --pythonScript=<path>        Override the bundled summarizer script");
        System.out.println("  --pythonTimeoutSeconds=<n>   Per-file summarizer timeout (default: 30)");
        System.out.println("  --threads=<n>                Extraction workers (default: processors)");
        System.out.println("  --help, -h                   Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
