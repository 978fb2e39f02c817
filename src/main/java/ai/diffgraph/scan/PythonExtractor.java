package ai.diffgraph.scan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.diffgraph.cfg.CollectingSink;
import ai.diffgraph.cfg.ControlFlowBuilder;
import ai.diffgraph.model.BranchKind;
import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.EdgeMetadata;
import ai.diffgraph.model.FlowType;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Ids;
import ai.diffgraph.model.Language;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.NodeMetadata;
import ai.diffgraph.model.SourceFile;

/**
 * Python front end. The file is summarized out of process by a {@link SummaryClient};
 * this class turns the summary into graph nodes and runs the shared CFG builder over each
 * function's statement outline.
 */
public final class PythonExtractor implements LanguageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PythonExtractor.class);

    private final SummaryClient client;
    private final ControlFlowBuilder cfgBuilder;
    private final ObjectMapper mapper = new ObjectMapper();

    public PythonExtractor(SummaryClient client, ControlFlowBuilder cfgBuilder) {
        this.client = Objects.requireNonNull(client, "client");
        this.cfgBuilder = Objects.requireNonNull(cfgBuilder, "cfgBuilder");
    }

    public PythonExtractor(SummaryClient client) {
        this(client, new ControlFlowBuilder());
    }

    @Override
    public boolean supports(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".py");
    }

    @Override
    public FileExtraction extract(SourceFile file, ExtractionContext context) throws ExtractionException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(context, "context");

        final String raw = client.summarize(file.path(), file.content());
        final PythonSummary summary;
        try {
            summary = mapper.readValue(raw, PythonSummary.class);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionException.Reason.MALFORMED_SUMMARY, file.path(),
                    "summary is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (summary == null) {
            throw new ExtractionException(ExtractionException.Reason.MALFORMED_SUMMARY, file.path(), "empty summary");
        }
        return new FileWalk(file, context, summary).run();
    }

    private final class FileWalk {

        private final SourceFile file;
        private final ExtractionContext context;
        private final PythonSummary summary;
        private final PythonOutlineReader outline;
        private final CollectingSink sink = new CollectingSink();
        private final List<DeclaredSymbol> symbols = new ArrayList<>();
        private final Map<String, GraphNode> classesByName = new HashMap<>();
        private final Map<String, GraphNode> functionsByScope = new LinkedHashMap<>();
        private GraphNode fileNode;

        private FileWalk(SourceFile file, ExtractionContext context, PythonSummary summary) {
            this.file = file;
            this.context = context;
            this.summary = summary;
            this.outline = new PythonOutlineReader(file.content());
        }

        FileExtraction run() {
            final int lineCount = Math.max(1, file.lineCount());
            fileNode = node(NodeKind.FILE, file.fileName(), file.path(), 1, lineCount,
                    Ids.signatureHash(file.content()), new NodeMetadata.FileMetadata(file.lineCount()), null);

            for (PythonSummary.ClassEntry entry : summary.classes()) {
                final String bases = entry.bases() == null || entry.bases().isEmpty()
                        ? null
                        : String.join(", ", entry.bases());
                final GraphNode classNode = node(NodeKind.CLASS, entry.name(), file.path() + ":" + entry.name(),
                        entry.start(), entry.end(), spanHash(entry.start(), entry.end()),
                        new NodeMetadata.ClassMetadata(bases, blankToNull(entry.documentation())), null);
                classesByName.putIfAbsent(entry.name(), classNode);
                declare(fileNode, classNode);
                symbols.add(new DeclaredSymbol(entry.name(), classNode.id(), false));
            }

            boolean missingOutline = false;
            for (PythonSummary.FunctionEntry entry : summary.functions()) {
                final GraphNode fn = function(entry);
                final JsonNode body = entry.body();
                if (body != null && body.isArray()) {
                    cfgBuilder.build(fn, outline.block(body), sink);
                } else {
                    missingOutline = true;
                }
            }
            if (missingOutline) {
                chainListedBranches();
            }

            for (String module : summary.imports()) {
                final String target = Ids.moduleId(context.snapshotId(), module);
                sink.addEdge(edge(EdgeKind.IMPORTS, fileNode.id(), target, module, new EdgeMetadata.ImportMetadata(module)));
            }

            final List<CallSite> callSites = new ArrayList<>();
            for (PythonSummary.CallEntry call : summary.calls()) {
                if (call.caller() == null || call.callee() == null || "module".equals(call.caller())) {
                    continue;
                }
                callSites.add(new CallSite(file.path(), Ids.lastSegment(call.caller()), call.callee(),
                        call.line(), EdgeKind.CALLS));
            }
            return new FileExtraction(file.path(), Language.PY, sink.nodes(), sink.edges(), symbols, callSites);
        }

        private GraphNode function(PythonSummary.FunctionEntry entry) {
            final String scope = entry.qualifiedName() == null ? entry.name() : entry.qualifiedName();
            final NodeKind kind = "method".equals(entry.kind()) ? NodeKind.METHOD : NodeKind.FUNCTION;
            final GraphNode fn = node(kind, entry.name(), file.path() + ":" + scope, entry.start(), entry.end(),
                    spanHash(entry.start(), entry.end()),
                    new NodeMetadata.FunctionMetadata(entry.params(), blankToNull(entry.returnType()),
                            blankToNull(entry.documentation()), null, null, entry.async()),
                    null);
            functionsByScope.putIfAbsent(scope, fn);
            declare(parentOf(scope), fn);
            symbols.add(new DeclaredSymbol(entry.name(), fn.id(), scope.indexOf('.') >= 0 && kind == NodeKind.FUNCTION));
            return fn;
        }

        private GraphNode parentOf(String scope) {
            final int dot = scope.lastIndexOf('.');
            if (dot < 0) {
                return fileNode;
            }
            final String enclosing = scope.substring(0, dot);
            final GraphNode function = functionsByScope.get(enclosing);
            if (function != null) {
                return function;
            }
            final GraphNode classNode = classesByName.get(Ids.lastSegment(enclosing));
            return classNode != null ? classNode : fileNode;
        }

        /**
         * Fallback for summaries without outlines: the listed branches of each function are
         * declared by it and chained in statement order with {@code next} edges.
         */
        private void chainListedBranches() {
            final Map<String, String> previousByOwner = new HashMap<>();
            for (PythonSummary.BranchEntry entry : summary.branches()) {
                final BranchKind kind = BranchKind.fromLabel(entry.kind());
                if (kind == null || entry.owner() == null) {
                    continue;
                }
                GraphNode owner = functionsByScope.get(entry.owner());
                if (owner != null && hasOutline(entry.owner())) {
                    continue;
                }
                if (owner == null) {
                    owner = functionsByScope.values().stream()
                            .filter(fn -> fn.name().equals(Ids.lastSegment(entry.owner())))
                            .findFirst()
                            .orElse(fileNode);
                }
                final String qualifiedName = file.path() + ":" + entry.owner() + "::" + kind.label() + "#" + entry.idx();
                final String snippet = entry.snippet() == null ? "" : entry.snippet();
                final GraphNode branch = node(NodeKind.BRANCH, kind.label() + "@" + entry.start(), qualifiedName,
                        entry.start(), entry.end(), Ids.signatureHash(snippet),
                        new NodeMetadata.BranchMetadata(kind, "elif".equals(entry.kind()), Snippets.bounded(snippet), entry.callee(), false, List.of()),
                        owner.id());
                declare(owner, branch);

                final String previous = previousByOwner.put(owner.id(), branch.id());
                final String source = previous != null ? previous : owner.id();
                sink.addEdge(edge(EdgeKind.CALLS, source, branch.id(), FlowType.NEXT.label(),
                        new EdgeMetadata.FlowMetadata(FlowType.NEXT)));
            }
            log.debug("{}: branches chained from the flat branch list", file.path());
        }

        private boolean hasOutline(String scope) {
            for (PythonSummary.FunctionEntry entry : summary.functions()) {
                if (scope.equals(entry.qualifiedName())) {
                    return entry.body() != null && entry.body().isArray();
                }
            }
            return false;
        }

        private String spanHash(int start, int end) {
            return Ids.signatureHash(outline.lines(start, end));
        }

        private GraphNode node(NodeKind kind,
                               String name,
                               String qualifiedName,
                               int start,
                               int end,
                               String signatureHash,
                               NodeMetadata metadata,
                               String disambiguator) {
            final GraphNode node = new GraphNode(
                    Ids.nodeId(context.snapshotId(), kind, qualifiedName, start, end, disambiguator),
                    kind,
                    name,
                    qualifiedName,
                    file.path(),
                    Language.PY,
                    start,
                    end,
                    signatureHash,
                    metadata,
                    context.snapshotId(),
                    context.ref()
            );
            sink.addNode(node);
            return node;
        }

        private void declare(GraphNode parent, GraphNode child) {
            sink.addEdge(edge(EdgeKind.DECLARES, parent.id(), child.id(), null,
                    new EdgeMetadata.DeclaresMetadata(child.kind())));
        }

        private GraphEdge edge(EdgeKind kind, String source, String target, String discriminator, EdgeMetadata metadata) {
            return new GraphEdge(
                    Ids.edgeId(context.snapshotId(), kind, source, target, discriminator),
                    source,
                    target,
                    kind,
                    file.path(),
                    metadata,
                    context.snapshotId(),
                    context.ref()
            );
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
