package ai.diffgraph.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import ai.diffgraph.graph.SnapshotGraphBuilder;
import ai.diffgraph.model.BranchKind;
import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.FlowType;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Language;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.SnapshotGraph;
import ai.diffgraph.model.SourceFile;

class TypeScriptExtractorTest {

    private static final ExtractionContext CONTEXT = new ExtractionContext("repo", "snap", "ref");

    private final TypeScriptExtractor extractor = new TypeScriptExtractor();

    @Test
    void ifElseIfAndSequentialGuardsGetLabeledEdges() throws Exception {
        final FileExtraction result = extract("sample.ts",
                "function render(override: string | null, isPaidUser: boolean) {",
                "  if (override !== null) {",
                "    if (isPaidUser) {",
                "      const x = 1;",
                "    }",
                "  } else if (isPaidUser) {",
                "    const y = 2;",
                "  }",
                "}",
                "",
                "function auth(user: { status: number } | null) {",
                "  if (!user) {",
                "    throw new Error('404');",
                "  }",
                "  if (user.status === -2) {",
                "    throw new Error('403');",
                "  }",
                "}",
                "",
                "function toy(flag: boolean) {",
                "  if (true) {",
                "    console.log('caca');",
                "  }",
                "  if (flag) {",
                "    return 1;",
                "  }",
                "}",
                "",
                "function toy2(dayOfWeek: string) {",
                "  if (Math.random() > 0.5) {",
                "    console.log('caca');",
                "  }",
                "  if (dayOfWeek === 'Tuesday') {",
                "    console.log('nice');",
                "  }",
                "}",
                "");

        final Map<Integer, String> byStart = branchesByStart(result);
        assertThat(byStart).containsKeys(2, 3, 6, 12, 13, 15, 16, 21, 22, 24, 30, 31, 33);

        assertThat(hasFlow(result, byStart.get(2), byStart.get(3), FlowType.TRUE)).isTrue();
        assertThat(hasFlow(result, byStart.get(2), byStart.get(6), FlowType.FALSE)).isTrue();
        assertThat(hasFlow(result, byStart.get(12), byStart.get(13), FlowType.TRUE)).isTrue();
        assertThat(hasFlow(result, byStart.get(12), byStart.get(15), FlowType.FALSE)).isTrue();
        assertThat(hasFlow(result, byStart.get(15), byStart.get(16), FlowType.TRUE)).isTrue();
        assertThat(hasFlow(result, byStart.get(21), byStart.get(22), FlowType.TRUE)).isTrue();
        assertThat(hasFlow(result, byStart.get(21), byStart.get(24), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, byStart.get(22), byStart.get(24), FlowType.NEXT)).isFalse();
        assertThat(hasFlow(result, byStart.get(21), byStart.get(24), FlowType.FALSE)).isFalse();
        assertThat(hasFlow(result, byStart.get(30), byStart.get(33), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, byStart.get(31), byStart.get(33), FlowType.NEXT)).isFalse();

        final GraphNode elif = node(result, byStart.get(6));
        assertThat(elif.branchMetadata().branchType()).isEqualTo(BranchKind.IF);
        assertThat(elif.branchMetadata().elif()).isTrue();
        assertThat(node(result, byStart.get(2)).branchMetadata().elif()).isFalse();
    }

    @Test
    void plainJavaScriptFollowsTheSameRules() throws Exception {
        final FileExtraction result = extract("sample.js",
                "function demo(flag, other) {",
                "  if (flag) {",
                "    console.log('x');",
                "  }",
                "  if (other) {",
                "    return 1;",
                "  }",
                "}",
                "");

        final Map<Integer, String> byStart = branchesByStart(result);
        assertThat(result.language()).isEqualTo(Language.JS);
        assertThat(hasFlow(result, byStart.get(2), byStart.get(3), FlowType.TRUE)).isTrue();
        assertThat(hasFlow(result, byStart.get(2), byStart.get(5), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, byStart.get(3), byStart.get(5), FlowType.NEXT)).isFalse();
    }

    @Test
    void repeatedHookCallbacksKeepBranchIdsUnique() throws Exception {
        final FileExtraction result = extract("sample.tsx",
                "function Panel(a: boolean, b: boolean) {",
                "  useMemo(() => {",
                "    if (a) {",
                "      return 1;",
                "    }",
                "    return 2;",
                "  }, [a]);",
                "",
                "  useMemo(() => {",
                "    if (b) {",
                "      return 3;",
                "    }",
                "    return 4;",
                "  }, [b]);",
                "}",
                "");

        final List<GraphNode> branches = branches(result);
        assertThat(branches).extracting(GraphNode::id).doesNotHaveDuplicates();
        assertThat(branches).extracting(GraphNode::startLine).contains(3, 10);
        assertThat(result.nodes()).extracting(GraphNode::id).doesNotHaveDuplicates();
    }

    @Test
    void hookCallbacksAreNamedAfterTheirVariable() {
        final SnapshotGraph graph = build(new SourceFile("sample.tsx", String.join("\n",
                "function Panel(seed: number) {",
                "  const build = useCallback((x: number) => x + seed, [seed]);",
                "  const renderText = useMemo(() => build(1), [build]);",
                "  const format = useCallback(() => renderText.toString(), [renderText]);",
                "  return format();",
                "}",
                "")));

        final Map<String, GraphNode> byName = functionLike(graph.nodes());
        assertThat(byName).containsKeys("build", "renderText", "format")
                .doesNotContainKeys("useCallback", "useMemo");
        assertThat(byName.get("build").functionMetadata().wrappedBy()).isEqualTo("useCallback");
        assertThat(byName.get("renderText").functionMetadata().wrappedBy()).isEqualTo("useMemo");
        assertThat(byName.get("build").functionMetadata().hookDependencies()).isEqualTo("[seed]");
        assertThat(byName.get("renderText").functionMetadata().hookDependencies()).isEqualTo("[build]");
        assertThat(byName.get("format").functionMetadata().hookDependencies()).isEqualTo("[renderText]");

        assertThat(hasReference(graph, EdgeKind.CALLS, byName.get("Panel"), byName.get("build"))).isTrue();
        assertThat(hasReference(graph, EdgeKind.CALLS, byName.get("Panel"), byName.get("format"))).isTrue();
    }

    @Test
    void jsxReturnsKeepTheirTags() throws Exception {
        final FileExtraction result = extract("sample.tsx",
                "function Panel() {",
                "  return (",
                "    <section>",
                "      <Header />",
                "      <Card><Body /></Card>",
                "    </section>",
                "  );",
                "}",
                "");

        final GraphNode ret = branches(result).stream()
                .filter(n -> n.branchMetadata().branchType() == BranchKind.RETURN)
                .findFirst()
                .orElseThrow();
        assertThat(ret.branchMetadata().codeSnippet()).contains("return JSX");
        assertThat(ret.branchMetadata().containsJsx()).isTrue();
        assertThat(ret.branchMetadata().jsxTagNames()).contains("Header", "Card", "Body");

        final GraphNode panel = functionLike(result.nodes()).get("Panel");
        assertThat(panel.kind()).isEqualTo(NodeKind.COMPONENT);
    }

    @Test
    void selfClosingJsxTagsBecomeRenders() {
        final SnapshotGraph graph = build(new SourceFile("sample.tsx", String.join("\n",
                "function Child() {",
                "  return <span />;",
                "}",
                "",
                "function Panel() {",
                "  return <Child />;",
                "}",
                "")));

        final Map<String, GraphNode> byName = functionLike(graph.nodes());
        assertThat(hasReference(graph, EdgeKind.RENDERS, byName.get("Panel"), byName.get("Child"))).isTrue();
    }

    @Test
    void whitespaceOnlyEditsKeepHashes() throws Exception {
        final FileExtraction before = extract("sample.ts",
                "function demo(flag: boolean, retries: number) {",
                "  if (",
                "    flag &&",
                "    retries > 0",
                "  ) {",
                "    return retries;",
                "  }",
                "  return 0;",
                "}",
                "");
        final FileExtraction after = extract("sample.ts",
                "function demo( flag:boolean,retries:number ){",
                "if(flag&&retries>0){",
                "return retries;",
                "}",
                "return 0;",
                "}",
                "");

        assertThat(functionLike(before.nodes()).get("demo").signatureHash())
                .isEqualTo(functionLike(after.nodes()).get("demo").signatureHash());
        final GraphNode oldIf = firstBranch(before, BranchKind.IF);
        final GraphNode newIf = firstBranch(after, BranchKind.IF);
        assertThat(oldIf.signatureHash()).isEqualTo(newIf.signatureHash());
        assertThat(oldIf.branchMetadata().codeSnippet()).isEqualTo("if (flag && retries > 0)");
    }

    @Test
    void tryCatchFinallyFlow() throws Exception {
        final FileExtraction result = extract("sample.ts",
                "async function demo(request: Request) {",
                "  try {",
                "    const res = await fetch(request);",
                "    if (res.ok) return res;",
                "  } catch (err) {",
                "    console.error('failed', err);",
                "  } finally {",
                "    await closeResource();",
                "  }",
                "  return request;",
                "}",
                "");

        final GraphNode tryNode = firstBranch(result, BranchKind.TRY);
        final GraphNode catchNode = firstBranch(result, BranchKind.CATCH);
        final GraphNode finallyNode = firstBranch(result, BranchKind.FINALLY);
        final GraphNode fetchCall = callContaining(result, "fetch");
        final GraphNode consoleCall = callContaining(result, "console.error");
        final GraphNode closeCall = callContaining(result, "closeResource");
        final GraphNode finalReturn = node(result, branchesByStart(result).get(10));

        assertThat(hasFlow(result, tryNode.id(), fetchCall.id(), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, tryNode.id(), catchNode.id(), FlowType.FALSE)).isTrue();
        assertThat(hasFlow(result, catchNode.id(), consoleCall.id(), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, consoleCall.id(), finallyNode.id(), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, finallyNode.id(), closeCall.id(), FlowType.NEXT)).isTrue();
        assertThat(hasFlow(result, closeCall.id(), finalReturn.id(), FlowType.NEXT)).isTrue();

        assertThat(functionLike(result.nodes()).get("demo").functionMetadata().async()).isTrue();
    }

    @Test
    void promiseChainsAreThenCatchFinallyBranches() throws Exception {
        final FileExtraction result = extract("sample.ts",
                "async function demo(p: Promise<number>) {",
                "  await p.then((v) => v + 1);",
                "  await p.catch((err) => {",
                "    return 0;",
                "  });",
                "  await p.finally(() => {",
                "    console.log('done');",
                "  });",
                "}",
                "");

        assertThat(branches(result)).extracting(n -> n.branchMetadata().branchType())
                .contains(BranchKind.THEN, BranchKind.CATCH, BranchKind.FINALLY);
    }

    @Test
    void declarationsImportsAndClasses() throws Exception {
        final FileExtraction result = extract("src/store.ts",
                "import { api } from './api';",
                "/** Holds items. */",
                "export class Store extends Base {",
                "  load(id: string): Promise<Item> {",
                "    return api.get(id);",
                "  }",
                "}",
                "export const useItems = (store: Store) => store.items;",
                "");

        final Map<String, GraphNode> byName = result.nodes().stream()
                .collect(Collectors.toMap(GraphNode::name, Function.identity(), (a, b) -> a));
        assertThat(byName.get("Store").kind()).isEqualTo(NodeKind.CLASS);
        assertThat(byName.get("Store").qualifiedName()).isEqualTo("src/store.Store");
        assertThat(byName.get("load").kind()).isEqualTo(NodeKind.METHOD);
        assertThat(byName.get("load").qualifiedName()).isEqualTo("src/store.Store.load");
        assertThat(byName.get("load").functionMetadata().params()).isEqualTo("(id: string)");
        assertThat(byName.get("load").functionMetadata().returnType()).isEqualTo("Promise<Item>");
        assertThat(byName.get("useItems").kind()).isEqualTo(NodeKind.HOOK);

        assertThat(result.edges()).filteredOn(e -> e.kind() == EdgeKind.IMPORTS).hasSize(1);
        assertThat(result.callSites()).extracting(CallSite::callerName, CallSite::calleeName)
                .contains(tuple("load", "api.get"));
    }

    @Test
    void everySiblingDeclarationAndStatementIsVisited() throws Exception {
        final FileExtraction result = extract("p.tsx",
                "function a(x: number) {",
                "  if (x > 0) {",
                "    return 1;",
                "  }",
                "  return 0;",
                "}",
                "function b(y: number) {",
                "  if (y > 0) {",
                "    return 2;",
                "  }",
                "  log(y);",
                "  return 0;",
                "}",
                "function View() {",
                "  return <Row><Cell /><Badge /></Row>;",
                "}",
                "");

        assertThat(result.nodes()).filteredOn(n -> n.kind() != NodeKind.BRANCH)
                .extracting(GraphNode::kind, GraphNode::name)
                .containsExactly(
                        tuple(NodeKind.FILE, "p.tsx"),
                        tuple(NodeKind.FUNCTION, "a"),
                        tuple(NodeKind.FUNCTION, "b"),
                        tuple(NodeKind.COMPONENT, "View"));
        assertThat(result.nodes()).extracting(GraphNode::id).doesNotHaveDuplicates();
        assertThat(branches(result)).extracting(GraphNode::name).containsExactly(
                "if@2", "return@3", "return@5",
                "if@8", "return@9", "call@11", "return@12",
                "return@15");

        final Map<Integer, String> byStart = branchesByStart(result);
        assertThat(hasFlow(result, byStart.get(8), byStart.get(11), FlowType.FALSE)).isTrue();
        assertThat(hasFlow(result, byStart.get(11), byStart.get(12), FlowType.NEXT)).isTrue();
        assertThat(node(result, byStart.get(15)).branchMetadata().jsxTagNames())
                .containsExactly("Row", "Cell", "Badge");
        assertThat(result.callSites()).extracting(CallSite::callerName, CallSite::calleeName)
                .contains(tuple("b", "log"), tuple("View", "Cell"), tuple("View", "Badge"));
    }

    @Test
    void extractionIsDeterministic() throws Exception {
        final String[] source = {
                "export function f(x: number) {",
                "  if (x > 1) { return g(x); }",
                "  return 0;",
                "}",
                ""};

        final FileExtraction first = extract("a.ts", source);
        final FileExtraction second = extract("a.ts", source);

        assertThat(first.nodes()).extracting(GraphNode::id)
                .containsExactlyElementsOf(second.nodes().stream().map(GraphNode::id).collect(Collectors.toList()));
        assertThat(first.edges()).extracting(GraphEdge::id)
                .containsExactlyElementsOf(second.edges().stream().map(GraphEdge::id).collect(Collectors.toList()));
    }

    // --- helpers ---

    private FileExtraction extract(String path, String... lines) throws ExtractionException {
        return extractor.extract(new SourceFile(path, String.join("\n", lines)), CONTEXT);
    }

    private SnapshotGraph build(SourceFile file) {
        return new SnapshotGraphBuilder(List.of(extractor), 1).build(CONTEXT, List.of(file));
    }

    private static List<GraphNode> branches(FileExtraction result) {
        return result.nodes().stream().filter(n -> n.kind() == NodeKind.BRANCH).collect(Collectors.toList());
    }

    private static Map<Integer, String> branchesByStart(FileExtraction result) {
        return branches(result).stream()
                .collect(Collectors.toMap(GraphNode::startLine, GraphNode::id, (a, b) -> a));
    }

    private static GraphNode node(FileExtraction result, String id) {
        return result.nodes().stream().filter(n -> n.id().equals(id)).findFirst().orElseThrow();
    }

    private static GraphNode firstBranch(FileExtraction result, BranchKind kind) {
        return branches(result).stream()
                .filter(n -> n.branchMetadata().branchType() == kind)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind.label() + " branch"));
    }

    private static GraphNode callContaining(FileExtraction result, String text) {
        final Optional<GraphNode> found = branches(result).stream()
                .filter(n -> n.branchMetadata().branchType() == BranchKind.CALL)
                .filter(n -> n.branchMetadata().codeSnippet().contains(text))
                .findFirst();
        return found.orElseThrow(() -> new AssertionError("no call containing " + text));
    }

    private static Map<String, GraphNode> functionLike(List<GraphNode> nodes) {
        return nodes.stream()
                .filter(n -> n.kind().isFunctionLike())
                .collect(Collectors.toMap(GraphNode::name, Function.identity(), (a, b) -> a));
    }

    private static boolean hasFlow(FileExtraction result, String source, String target, FlowType flowType) {
        return result.edges().stream().anyMatch(e -> e.kind() == EdgeKind.CALLS
                && e.source().equals(source)
                && e.target().equals(target)
                && e.flowType() == flowType);
    }

    private static boolean hasReference(SnapshotGraph graph, EdgeKind kind, GraphNode source, GraphNode target) {
        return graph.edges().stream().anyMatch(e -> e.kind() == kind
                && e.source().equals(source.id())
                && e.target().equals(target.id()));
    }
}
