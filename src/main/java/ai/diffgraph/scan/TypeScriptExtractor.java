package ai.diffgraph.scan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTsx;
import org.treesitter.TreeSitterTypescript;

import ai.diffgraph.cfg.CollectingSink;
import ai.diffgraph.cfg.ControlFlowBuilder;
import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.EdgeMetadata;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Ids;
import ai.diffgraph.model.Language;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.NodeMetadata;
import ai.diffgraph.model.SourceFile;

/**
 * In-process extractor for TypeScript and JavaScript (including JSX/TSX), backed by
 * tree-sitter. A fresh parser and tree are created per file.
 */
public final class TypeScriptExtractor implements LanguageExtractor {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptExtractor.class);

    private static final Set<String> EXTENSIONS = Set.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs");

    private static final Set<String> FUNCTION_NODES = Set.of(
            "function_declaration", "generator_function_declaration",
            "function_expression", "function", "generator_function",
            "arrow_function", "method_definition");

    private static final Set<String> FUNCTION_VALUES = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");

    private static final Pattern HOOK_NAME = Pattern.compile("use[A-Z0-9].*");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final ControlFlowBuilder cfgBuilder;

    public TypeScriptExtractor(ControlFlowBuilder cfgBuilder) {
        this.cfgBuilder = Objects.requireNonNull(cfgBuilder, "cfgBuilder");
    }

    public TypeScriptExtractor() {
        this(new ControlFlowBuilder());
    }

    @Override
    public boolean supports(String path) {
        final String lower = path.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    @Override
    public FileExtraction extract(SourceFile file, ExtractionContext context) throws ExtractionException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(context, "context");

        final TSTree tree;
        try {
            final TSParser parser = new TSParser();
            parser.setLanguage(grammarFor(file.path()));
            tree = parser.parseString(null, file.content());
        } catch (RuntimeException | LinkageError e) {
            throw new ExtractionException(ExtractionException.Reason.PARSE_FAILURE, file.path(),
                    "tree-sitter failed: " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new ExtractionException(ExtractionException.Reason.PARSE_FAILURE, file.path(), "no syntax tree");
        }

        final TSNode root = tree.getRootNode();
        if (root.hasError()) {
            log.debug("Syntax errors in {}, using the recovered tree", file.path());
        }
        return new FileWalk(file, context, root).run();
    }

    private static TSLanguage grammarFor(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".ts") ? new TreeSitterTypescript() : new TreeSitterTsx();
    }

    static boolean isHookName(String name) {
        return HOOK_NAME.matcher(name).matches();
    }

    /** Name, hook wrapper and dependency array of a nested function. */
    private record DeepName(String name, String wrappedBy, String hookDependencies) {
    }

    /**
     * One file's extraction state. Never shared between files.
     */
    private final class FileWalk {

        private final SourceFile file;
        private final ExtractionContext context;
        private final TSNode root;
        private final TsSyntax syntax;
        private final TypeScriptStatements statements;
        private final Language language;
        private final String base;
        private final CollectingSink sink = new CollectingSink();
        private final List<DeclaredSymbol> symbols = new ArrayList<>();
        private final List<CallSite> callSites = new ArrayList<>();
        private final Map<String, GraphNode> functionsByRange = new HashMap<>();
        private GraphNode fileNode;

        private FileWalk(SourceFile file, ExtractionContext context, TSNode root) {
            this.file = file;
            this.context = context;
            this.root = root;
            this.syntax = new TsSyntax(file.content());
            this.statements = new TypeScriptStatements(syntax);
            this.language = Language.fromPath(file.path());
            this.base = Snippets.stripExtension(file.path());
        }

        FileExtraction run() {
            final int lineCount = Math.max(1, file.lineCount());
            fileNode = new GraphNode(
                    Ids.nodeId(context.snapshotId(), NodeKind.FILE, file.path(), 1, lineCount, null),
                    NodeKind.FILE,
                    file.fileName(),
                    file.path(),
                    file.path(),
                    language,
                    1,
                    lineCount,
                    Ids.signatureHash(file.content()),
                    new NodeMetadata.FileMetadata(file.lineCount()),
                    context.snapshotId(),
                    context.ref()
            );
            sink.addNode(fileNode);

            for (TSNode child : TsSyntax.namedChildren(root)) {
                topLevel(child, child);
            }
            nested(root, fileNode);
            collectCallSites(root);

            return new FileExtraction(file.path(), language, sink.nodes(), sink.edges(), symbols, callSites);
        }

        private void topLevel(TSNode node, TSNode docAnchor) {
            switch (node.getType()) {
                case "export_statement" -> {
                    final TSNode declaration = TsSyntax.field(node, "declaration");
                    if (declaration != null) {
                        topLevel(declaration, node);
                    }
                }
                case "import_statement" -> importStatement(node);
                case "class_declaration", "abstract_class_declaration" -> classDeclaration(node, docAnchor);
                case "function_declaration", "generator_function_declaration" -> {
                    final String name = syntax.text(TsSyntax.field(node, "name"));
                    final NodeKind kind = classify(name, node, syntax.text(node));
                    final GraphNode fn = functionNode(kind, name, base + "." + name, node, node,
                            metadata(node, docAnchor, null, null), null);
                    declare(fileNode, fn);
                    symbols.add(new DeclaredSymbol(name, fn.id(), false));
                }
                case "lexical_declaration", "variable_declaration" -> {
                    for (TSNode declarator : TsSyntax.namedChildren(node)) {
                        variableFunction(declarator, docAnchor);
                    }
                }
                default -> {
                }
            }
        }

        private void importStatement(TSNode node) {
            final TSNode source = TsSyntax.field(node, "source");
            if (source == null) {
                return;
            }
            final String specifier = unquote(syntax.text(source));
            final String target = Ids.moduleId(context.snapshotId(), specifier);
            sink.addEdge(new GraphEdge(
                    Ids.edgeId(context.snapshotId(), EdgeKind.IMPORTS, fileNode.id(), target, specifier),
                    fileNode.id(),
                    target,
                    EdgeKind.IMPORTS,
                    file.path(),
                    new EdgeMetadata.ImportMetadata(specifier),
                    context.snapshotId(),
                    context.ref()
            ));
        }

        private void classDeclaration(TSNode node, TSNode docAnchor) {
            final String className = syntax.text(TsSyntax.field(node, "name"));
            final String classQualifiedName = base + "." + className;
            String heritage = null;
            for (TSNode child : TsSyntax.namedChildren(node)) {
                if ("class_heritage".equals(child.getType())) {
                    heritage = Ids.collapseWhitespace(syntax.text(child));
                }
            }
            final GraphNode classNode = new GraphNode(
                    Ids.nodeId(context.snapshotId(), NodeKind.CLASS, classQualifiedName,
                            TsSyntax.startLine(node), TsSyntax.endLine(node), null),
                    NodeKind.CLASS,
                    className,
                    classQualifiedName,
                    file.path(),
                    language,
                    TsSyntax.startLine(node),
                    TsSyntax.endLine(node),
                    Ids.signatureHash(syntax.text(node)),
                    new NodeMetadata.ClassMetadata(heritage, documentation(docAnchor)),
                    context.snapshotId(),
                    context.ref()
            );
            sink.addNode(classNode);
            declare(fileNode, classNode);
            symbols.add(new DeclaredSymbol(className, classNode.id(), false));

            final TSNode classBody = TsSyntax.field(node, "body");
            if (classBody == null) {
                return;
            }
            for (TSNode member : TsSyntax.namedChildren(classBody)) {
                if (!"method_definition".equals(member.getType())) {
                    continue;
                }
                final String methodName = syntax.text(TsSyntax.field(member, "name"));
                final GraphNode method = functionNode(NodeKind.METHOD, methodName,
                        classQualifiedName + "." + methodName, member, member,
                        metadata(member, member, null, null), null);
                declare(classNode, method);
                symbols.add(new DeclaredSymbol(methodName, method.id(), false));
            }
        }

        private void variableFunction(TSNode declarator, TSNode docAnchor) {
            if (!"variable_declarator".equals(declarator.getType())) {
                return;
            }
            final TSNode nameNode = TsSyntax.field(declarator, "name");
            final TSNode value = TsSyntax.unwrap(TsSyntax.field(declarator, "value"));
            if (nameNode == null || value == null || !FUNCTION_VALUES.contains(value.getType())) {
                return;
            }
            final String name = syntax.text(nameNode);
            final String declaratorText = syntax.text(declarator);
            final NodeKind kind = classify(name, value, declaratorText);
            final GraphNode fn = functionNode(kind, name, base + "." + name, declarator, value,
                    metadata(value, docAnchor, null, null), null);
            declare(fileNode, fn);
            symbols.add(new DeclaredSymbol(name, fn.id(), false));
        }

        /**
         * Walks the whole tree for functions not emitted as top-level declarations. Each one
         * is declared by the nearest enclosing emitted function, else by the file.
         */
        private void nested(TSNode node, GraphNode enclosing) {
            GraphNode owner = enclosing;
            if (FUNCTION_NODES.contains(node.getType())) {
                final GraphNode known = functionsByRange.get(TsSyntax.rangeKey(node));
                if (known != null) {
                    owner = known;
                } else {
                    final GraphNode deep = deepFunction(node);
                    if (deep != null) {
                        declare(enclosing, deep);
                        owner = deep;
                    }
                }
            }
            for (TSNode child : TsSyntax.namedNodes(node)) {
                nested(child, owner);
            }
        }

        private GraphNode deepFunction(TSNode fn) {
            final DeepName deepName = deepName(fn);
            final int start = TsSyntax.startLine(fn);
            final int end = TsSyntax.endLine(fn);
            if ("anonymous".equals(deepName.name()) && end - start < 1) {
                return null;
            }
            final NodeMetadata.FunctionMetadata metadata =
                    metadata(fn, fn, deepName.wrappedBy(), deepName.hookDependencies());
            final GraphNode node = functionNode(NodeKind.FUNCTION, deepName.name(),
                    base + ".deep." + deepName.name(), fn, fn, metadata, deepName.name() + "@" + start);
            // a callback named after its hook would capture every call to that hook
            final boolean namedAfterHook = deepName.wrappedBy() != null && deepName.name().equals(deepName.wrappedBy());
            if (!namedAfterHook && IDENTIFIER.matcher(deepName.name()).matches()) {
                symbols.add(new DeclaredSymbol(deepName.name(), node.id(), true));
            }
            return node;
        }

        private DeepName deepName(TSNode fn) {
            final TSNode ownName = TsSyntax.field(fn, "name");
            if (ownName != null) {
                return new DeepName(syntax.text(ownName), null, null);
            }
            TSNode parent = TsSyntax.parent(fn);
            while (parent != null && "parenthesized_expression".equals(parent.getType())) {
                parent = TsSyntax.parent(parent);
            }
            if (parent == null) {
                return new DeepName("anonymous", null, null);
            }
            return switch (parent.getType()) {
                case "variable_declarator" -> new DeepName(syntax.text(TsSyntax.field(parent, "name")), null, null);
                case "pair" -> new DeepName(unquote(syntax.text(TsSyntax.field(parent, "key"))), null, null);
                case "public_field_definition", "field_definition" -> {
                    TSNode fieldName = TsSyntax.field(parent, "name");
                    if (fieldName == null) {
                        fieldName = TsSyntax.field(parent, "property");
                    }
                    yield new DeepName(fieldName == null ? "anonymous" : syntax.text(fieldName), null, null);
                }
                case "assignment_expression" ->
                        new DeepName(Ids.collapseWhitespace(syntax.text(TsSyntax.field(parent, "left"))), null, null);
                case "arguments" -> callbackName(fn, parent);
                case "export_statement" -> new DeepName("default", null, null);
                default -> new DeepName("anonymous", null, null);
            };
        }

        private DeepName callbackName(TSNode fn, TSNode arguments) {
            final TSNode call = TsSyntax.parent(arguments);
            if (call == null || !"call_expression".equals(call.getType())) {
                return new DeepName("anonymous", null, null);
            }
            final String callee = syntax.calleeName(call);
            final String hook = Ids.lastSegment(callee);
            final List<TSNode> args = TsSyntax.namedChildren(arguments);
            if (!isHookName(hook) || args.isEmpty() || !TsSyntax.sameNode(args.get(0), fn)) {
                return new DeepName(callee.isEmpty() ? "anonymous" : callee, null, null);
            }

            String dependencies = null;
            if (args.size() > 1 && "array".equals(args.get(1).getType())) {
                dependencies = Ids.collapseWhitespace(syntax.text(args.get(1)));
            }
            TSNode holder = TsSyntax.parent(call);
            while (holder != null
                    && ("await_expression".equals(holder.getType()) || "parenthesized_expression".equals(holder.getType()))) {
                holder = TsSyntax.parent(holder);
            }
            if (holder != null && "variable_declarator".equals(holder.getType())) {
                return new DeepName(syntax.text(TsSyntax.field(holder, "name")), hook, dependencies);
            }
            return new DeepName(hook, hook, dependencies);
        }

        /**
         * Emits a function-like node and its CFG.
         *
         * @param span     node whose text and lines define identity (the declarator for
         *                 {@code const f = () => ...})
         * @param function the function syntax itself, carrying parameters and body
         */
        private GraphNode functionNode(NodeKind kind,
                                       String name,
                                       String qualifiedName,
                                       TSNode span,
                                       TSNode function,
                                       NodeMetadata.FunctionMetadata metadata,
                                       String disambiguator) {
            final int start = TsSyntax.startLine(span);
            final int end = TsSyntax.endLine(span);
            final GraphNode node = new GraphNode(
                    Ids.nodeId(context.snapshotId(), kind, qualifiedName, start, end, disambiguator),
                    kind,
                    name,
                    qualifiedName,
                    file.path(),
                    language,
                    start,
                    end,
                    Ids.signatureHash(syntax.text(span)),
                    metadata,
                    context.snapshotId(),
                    context.ref()
            );
            sink.addNode(node);
            functionsByRange.put(TsSyntax.rangeKey(function), node);

            final TSNode body = TsSyntax.field(function, "body");
            if (body != null && "statement_block".equals(body.getType())) {
                cfgBuilder.build(node, statements.body(body), sink);
            }
            return node;
        }

        private NodeMetadata.FunctionMetadata metadata(TSNode function,
                                                       TSNode docAnchor,
                                                       String wrappedBy,
                                                       String hookDependencies) {
            String params = syntax.text(TsSyntax.field(function, "parameters"));
            if (params.isEmpty()) {
                final TSNode single = TsSyntax.field(function, "parameter");
                params = single == null ? "()" : "(" + syntax.text(single) + ")";
            }
            String returnType = syntax.text(TsSyntax.field(function, "return_type")).trim();
            if (returnType.startsWith(":")) {
                returnType = returnType.substring(1).trim();
            }
            return new NodeMetadata.FunctionMetadata(
                    Ids.collapseWhitespace(params),
                    returnType.isEmpty() ? null : Ids.collapseWhitespace(returnType),
                    documentation(docAnchor),
                    wrappedBy,
                    hookDependencies,
                    TsSyntax.hasToken(function, "async"));
        }

        private String documentation(TSNode anchor) {
            final TSNode previous = anchor.getPrevNamedSibling();
            if (previous == null || previous.isNull() || !"comment".equals(previous.getType())) {
                return null;
            }
            final String text = syntax.text(previous);
            if (!text.startsWith("/**") || TsSyntax.endLine(previous) + 1 < TsSyntax.startLine(anchor)) {
                return null;
            }
            return text;
        }

        private NodeKind classify(String name, TSNode function, String declarationText) {
            if (syntax.containsJsx(function)
                    || declarationText.contains("React.FC")
                    || declarationText.contains("JSX.Element")) {
                return NodeKind.COMPONENT;
            }
            return isHookName(name) ? NodeKind.HOOK : NodeKind.FUNCTION;
        }

        private void declare(GraphNode parent, GraphNode child) {
            sink.addEdge(new GraphEdge(
                    Ids.edgeId(context.snapshotId(), EdgeKind.DECLARES, parent.id(), child.id(), null),
                    parent.id(),
                    child.id(),
                    EdgeKind.DECLARES,
                    file.path(),
                    new EdgeMetadata.DeclaresMetadata(child.kind()),
                    context.snapshotId(),
                    context.ref()
            ));
        }

        private void collectCallSites(TSNode node) {
            final String type = node.getType();
            if ("call_expression".equals(type)) {
                addCallSite(node, syntax.calleeName(node), EdgeKind.CALLS);
            } else if ("jsx_opening_element".equals(type) || "jsx_self_closing_element".equals(type)) {
                addCallSite(node, syntax.text(TsSyntax.field(node, "name")), EdgeKind.RENDERS);
            }
            for (TSNode child : TsSyntax.namedNodes(node)) {
                collectCallSites(child);
            }
        }

        private void addCallSite(TSNode node, String callee, EdgeKind kind) {
            if (callee == null || callee.isEmpty()) {
                return;
            }
            final String caller = callerName(node);
            if (caller != null) {
                callSites.add(new CallSite(file.path(), caller, callee, TsSyntax.startLine(node), kind));
            }
        }

        /**
         * Nearest enclosing function declaration, else method, else variable declarator.
         */
        private String callerName(TSNode node) {
            String method = null;
            String variable = null;
            TSNode current = TsSyntax.parent(node);
            while (current != null) {
                switch (current.getType()) {
                    case "function_declaration", "generator_function_declaration" -> {
                        return syntax.text(TsSyntax.field(current, "name"));
                    }
                    case "method_definition" -> {
                        if (method == null) {
                            method = syntax.text(TsSyntax.field(current, "name"));
                        }
                    }
                    case "variable_declarator" -> {
                        if (variable == null) {
                            variable = syntax.text(TsSyntax.field(current, "name"));
                        }
                    }
                    default -> {
                    }
                }
                current = TsSyntax.parent(current);
            }
            return method != null ? method : variable;
        }
    }

    private static String unquote(String text) {
        final String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            final char first = trimmed.charAt(0);
            final char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }
}
