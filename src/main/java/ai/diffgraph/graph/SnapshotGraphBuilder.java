package ai.diffgraph.graph;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.diffgraph.cfg.ControlFlowBuilder;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Ids;
import ai.diffgraph.model.Language;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.NodeMetadata;
import ai.diffgraph.model.SnapshotGraph;
import ai.diffgraph.model.SourceFile;
import ai.diffgraph.scan.CallSite;
import ai.diffgraph.scan.DeclaredSymbol;
import ai.diffgraph.scan.ExtractionContext;
import ai.diffgraph.scan.ExtractionException;
import ai.diffgraph.scan.FileExtraction;
import ai.diffgraph.scan.LanguageExtractor;
import ai.diffgraph.scan.ProcessSummaryClient;
import ai.diffgraph.scan.PythonExtractor;
import ai.diffgraph.scan.TypeScriptExtractor;

/**
 * Builds one {@link SnapshotGraph}:
 * 1. extract every file independently (in parallel when configured), dropping failures
 * 2. register declared names per front end
 * 3. resolve call sites into CALLS / RENDERS edges
 * Nodes and edges keep input file order regardless of which worker finished first.
 */
public final class SnapshotGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotGraphBuilder.class);

    private final List<LanguageExtractor> extractors;
    private final int threads;
    private final CallResolver callResolver = new CallResolver();

    public SnapshotGraphBuilder(List<LanguageExtractor> extractors, int threads) {
        this.extractors = List.copyOf(Objects.requireNonNull(extractors, "extractors"));
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
        this.threads = threads;
    }

    public static SnapshotGraphBuilder create(AnalyzerSettings settings) {
        Objects.requireNonNull(settings, "settings");
        final ControlFlowBuilder cfgBuilder = new ControlFlowBuilder();
        final ProcessSummaryClient client = new ProcessSummaryClient(
                settings.pythonExecutable(), settings.pythonScript(), settings.pythonTimeout());
        return new SnapshotGraphBuilder(
                List.of(new TypeScriptExtractor(cfgBuilder), new PythonExtractor(client, cfgBuilder)),
                settings.threads());
    }

    public boolean supports(String path) {
        return extractorFor(path) != null;
    }

    public SnapshotGraph build(ExtractionContext context, List<SourceFile> files) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(files, "files");

        // Step 1: per-file extraction
        final List<FileOutcome> outcomes = extractAll(context, files);

        // Step 2: symbol tables, one per front end
        final Map<LanguageExtractor, SymbolTable> tables = new IdentityHashMap<>();
        final Map<LanguageExtractor, List<CallSite>> sites = new IdentityHashMap<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.extraction() == null || outcome.extractor() == null) {
                continue;
            }
            final SymbolTable table = tables.computeIfAbsent(outcome.extractor(), k -> new SymbolTable());
            for (DeclaredSymbol symbol : outcome.extraction().symbols()) {
                table.register(outcome.extraction().path(), symbol);
            }
            sites.computeIfAbsent(outcome.extractor(), k -> new ArrayList<>()).addAll(outcome.extraction().callSites());
        }

        // Step 3: assemble in input order, then append resolved references
        final List<GraphNode> nodes = new ArrayList<>();
        final List<GraphEdge> edges = new ArrayList<>();
        int warnings = 0;
        for (FileOutcome outcome : outcomes) {
            if (outcome.extraction() == null) {
                warnings++;
                continue;
            }
            nodes.addAll(outcome.extraction().nodes());
            edges.addAll(outcome.extraction().edges());
        }
        for (LanguageExtractor extractor : extractors) {
            final SymbolTable table = tables.get(extractor);
            if (table != null) {
                edges.addAll(callResolver.resolve(sites.getOrDefault(extractor, List.of()), table, context));
            }
        }

        log.info("Snapshot {} ({}): {} files, {} nodes, {} edges, {} dropped",
                context.snapshotId(), context.ref(), files.size(), nodes.size(), edges.size(), warnings);
        return new SnapshotGraph(context.repoId(), context.snapshotId(), context.ref(), nodes, edges, warnings);
    }

    private List<FileOutcome> extractAll(ExtractionContext context, List<SourceFile> files) {
        if (threads == 1 || files.size() < 2) {
            final List<FileOutcome> out = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                out.add(extractOne(context, file));
            }
            return out;
        }

        final ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            final List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(pool.submit(() -> extractOne(context, file)));
            }
            final List<FileOutcome> out = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                out.add(await(futures.get(i), files.get(i)));
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private FileOutcome await(Future<FileOutcome> future, SourceFile file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while extracting " + file.path(), e);
        } catch (ExecutionException e) {
            log.warn("Skipping {}: {}", file.path(), safeMsg(String.valueOf(e.getCause())));
            return FileOutcome.failed(file);
        }
    }

    private FileOutcome extractOne(ExtractionContext context, SourceFile file) {
        final LanguageExtractor extractor = extractorFor(file.path());
        if (extractor == null) {
            return new FileOutcome(file, null, unknownFile(context, file));
        }
        try {
            return new FileOutcome(file, extractor, extractor.extract(file, context));
        } catch (ExtractionException e) {
            log.warn("Skipping {} ({}): {}", file.path(), e.reason(), safeMsg(e.getMessage()));
            return FileOutcome.failed(file);
        } catch (RuntimeException e) {
            log.warn("Skipping {} (unexpected {}): {}", file.path(), e.getClass().getSimpleName(), safeMsg(e.getMessage()));
            return FileOutcome.failed(file);
        }
    }

    private LanguageExtractor extractorFor(String path) {
        for (LanguageExtractor extractor : extractors) {
            if (extractor.supports(path)) {
                return extractor;
            }
        }
        return null;
    }

    /**
     * Files no front end understands still show up as a bare File node, unless empty.
     */
    private static FileExtraction unknownFile(ExtractionContext context, SourceFile file) {
        if (file.content().isBlank()) {
            return new FileExtraction(file.path(), Language.UNKNOWN, List.of(), List.of(), List.of(), List.of());
        }
        final int lineCount = Math.max(1, file.lineCount());
        final GraphNode node = new GraphNode(
                Ids.nodeId(context.snapshotId(), NodeKind.FILE, file.path(), 1, lineCount, null),
                NodeKind.FILE,
                file.fileName(),
                file.path(),
                file.path(),
                Language.UNKNOWN,
                1,
                lineCount,
                Ids.signatureHash(file.content()),
                new NodeMetadata.FileMetadata(file.lineCount()),
                context.snapshotId(),
                context.ref()
        );
        return new FileExtraction(file.path(), Language.UNKNOWN, List.of(node), List.of(), List.of(), List.of());
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }

    private record FileOutcome(SourceFile file, LanguageExtractor extractor, FileExtraction extraction) {

        static FileOutcome failed(SourceFile file) {
            return new FileOutcome(file, null, null);
        }
    }
}
