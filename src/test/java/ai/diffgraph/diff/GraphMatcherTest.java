package ai.diffgraph.diff;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

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
import ai.diffgraph.model.SnapshotGraph;

class GraphMatcherTest {

    private final GraphMatcher matcher = new GraphMatcher();

    @Test
    void graphMatchedAgainstItselfIsUnchanged() {
        final Side side = new Side("old");
        final GraphNode file = side.file("src/a.ts", "content");
        final GraphNode fn = side.function("src/a.load", 2, 8, "body", "(id: string, retries = 3)", null);
        final GraphNode hook = side.function("src/a.deep.build", 10, 12, "cb", "()", "[id, mode]");
        final GraphNode branch = side.branch(fn, BranchKind.IF, 0, 3, "if(x)");
        side.declares(file, fn);
        side.declares(fn, branch);
        side.flow(fn, branch, FlowType.NEXT);
        side.imports(file, "react");
        final SnapshotGraph graph = side.graph();

        final GraphDelta delta = matcher.match(graph, graph);

        assertThat(delta.nodeStatus().values()).containsOnly(DiffStatus.UNCHANGED);
        assertThat(delta.nodeStatus()).hasSize(graph.nodes().size());
        assertThat(delta.edgeStatus().values()).containsOnly(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus()).hasSize(graph.edges().size());
        assertThat(delta.oldParameters().get(fn.id())).extracting(TokenDiff::status)
                .containsExactly(DiffStatus.UNCHANGED, DiffStatus.UNCHANGED);
        assertThat(delta.newDependencies().get(hook.id())).extracting(TokenDiff::status)
                .containsOnly(DiffStatus.UNCHANGED);
    }

    @Test
    void movedFunctionWithSameHashIsUnchanged() {
        final Side old = new Side("old");
        final GraphNode before = old.function("src/a.load", 2, 8, "body", "()", null);
        final Side now = new Side("new");
        final GraphNode after = now.function("src/a.load", 12, 18, "body", "()", null);

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.nodeStatus(before.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.nodeStatus(after.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.counterparts()).containsEntry(before.id(), after.id());
    }

    @Test
    void editedFunctionFallsBackToPositionAndCarriesParameterDiff() {
        final Side old = new Side("old");
        final GraphNode before = old.function("src/a.load", 2, 8, "v1", "(a: string, b: boolean)", null);
        final Side now = new Side("new");
        final GraphNode after = now.function("src/a.load", 2, 9, "v2", "(a: number, c: boolean)", null);

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.nodeStatus(before.id())).isEqualTo(DiffStatus.MODIFIED);
        assertThat(delta.nodeStatus(after.id())).isEqualTo(DiffStatus.MODIFIED);
        assertThat(delta.oldParameters().get(before.id())).containsExactly(
                new TokenDiff("a: string", DiffStatus.MODIFIED),
                new TokenDiff("b: boolean", DiffStatus.REMOVED));
        assertThat(delta.newParameters().get(after.id())).containsExactly(
                new TokenDiff("a: number", DiffStatus.MODIFIED),
                new TokenDiff("c: boolean", DiffStatus.ADDED));
    }

    @Test
    void exactPassPrefersTheSameSpan() {
        final Side old = new Side("old");
        final GraphNode first = old.method("src/a.A.run", 2, 4, "same");
        final GraphNode second = old.method("src/a.A.run", 6, 8, "same");
        final Side now = new Side("new");
        final GraphNode moved = now.method("src/a.A.run", 1, 3, "same");
        final GraphNode kept = now.method("src/a.A.run", 6, 8, "same");

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.counterparts())
                .containsEntry(first.id(), moved.id())
                .containsEntry(second.id(), kept.id());
        assertThat(delta.countNodes(DiffStatus.UNCHANGED)).isEqualTo(4);
    }

    @Test
    void exactPassTiesFollowGraphOrder() {
        final Side old = new Side("old");
        final GraphNode late = old.method("src/a.A.run", 10, 12, "same");
        final GraphNode early = old.method("src/a.A.run", 2, 4, "same");
        final Side now = new Side("new");
        final GraphNode firstListed = now.method("src/a.A.run", 20, 22, "same");
        final GraphNode secondListed = now.method("src/a.A.run", 30, 32, "same");

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.counterparts())
                .containsEntry(late.id(), firstListed.id())
                .containsEntry(early.id(), secondListed.id());
    }

    @Test
    void elseIfRewriteKeepsTheBranchPaired() {
        final Side old = new Side("old");
        final GraphNode fn = old.function("src/a.load", 1, 9, "v1", "()", null);
        final GraphNode nested = old.branch(fn, BranchKind.IF, 1, 4, "if(b)", false);
        final Side now = new Side("new");
        final GraphNode fnAfter = now.function("src/a.load", 1, 8, "v2", "()", null);
        final GraphNode elif = now.branch(fnAfter, BranchKind.IF, 1, 4, "if(b)", true);

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.counterparts()).containsEntry(nested.id(), elif.id());
        assertThat(delta.nodeStatus(elif.id())).isEqualTo(DiffStatus.UNCHANGED);
    }

    @Test
    void unmatchedFunctionsAreAddedOrRemovedWithUniformDetails() {
        final Side old = new Side("old");
        final GraphNode gone = old.function("src/a.gone", 2, 4, "x", "(a, b)", null);
        final Side now = new Side("new");
        final GraphNode fresh = now.function("src/a.fresh", 2, 4, "y", "(c)", "[c]");

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.nodeStatus(gone.id())).isEqualTo(DiffStatus.REMOVED);
        assertThat(delta.nodeStatus(fresh.id())).isEqualTo(DiffStatus.ADDED);
        assertThat(delta.oldParameters().get(gone.id())).extracting(TokenDiff::status)
                .containsOnly(DiffStatus.REMOVED);
        assertThat(delta.newParameters().get(fresh.id())).containsExactly(new TokenDiff("c", DiffStatus.ADDED));
        assertThat(delta.newDependencies().get(fresh.id())).containsExactly(new TokenDiff("c", DiffStatus.ADDED));
        assertThat(delta.counterparts()).isEmpty();
    }

    @Test
    void nestedCallbacksMatchAcrossLineSuffixes() {
        final Side old = new Side("old");
        final GraphNode before = old.function("src/a.deep.onClick@12", 12, 14, "cb", "()", "[count, mode]");
        final Side now = new Side("new");
        final GraphNode after = now.function("src/a.deep.onClick@15", 15, 18, "cb2", "()", "[count, modeId, status]");

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.counterparts()).containsEntry(before.id(), after.id());
        assertThat(delta.oldDependencies().get(before.id())).containsExactly(
                new TokenDiff("count", DiffStatus.UNCHANGED),
                new TokenDiff("mode", DiffStatus.MODIFIED));
        assertThat(delta.newDependencies().get(after.id())).containsExactly(
                new TokenDiff("count", DiffStatus.UNCHANGED),
                new TokenDiff("modeId", DiffStatus.MODIFIED),
                new TokenDiff("status", DiffStatus.ADDED));
    }

    @Test
    void edgesFollowTheNodePairing() {
        final Side old = new Side("old");
        final GraphNode oldFile = old.file("src/a.ts", "v1");
        final GraphNode oldFn = old.function("src/a.load", 2, 8, "v1", "()", null);
        final GraphNode oldIf = old.branch(oldFn, BranchKind.IF, 0, 3, "if(x)");
        final GraphNode oldCall = old.branch(oldFn, BranchKind.CALL, 0, 4, "run()");
        final GraphEdge oldDeclares = old.declares(oldFile, oldFn);
        final GraphEdge oldFlow = old.flow(oldIf, oldCall, FlowType.TRUE);
        final GraphEdge oldImport = old.imports(oldFile, "react");
        final GraphEdge oldLodash = old.imports(oldFile, "lodash");

        final Side now = new Side("new");
        final GraphNode newFile = now.file("src/a.ts", "v2");
        final GraphNode newFn = now.function("src/a.load", 2, 9, "v2", "()", null);
        final GraphNode newIf = now.branch(newFn, BranchKind.IF, 0, 3, "if(x)");
        final GraphNode newCall = now.branch(newFn, BranchKind.CALL, 0, 5, "run()");
        final GraphEdge newDeclares = now.declares(newFile, newFn);
        final GraphEdge newFlow = now.flow(newIf, newCall, FlowType.FALSE);
        final GraphEdge newImport = now.imports(newFile, "react");
        final GraphEdge newAxios = now.imports(newFile, "axios");

        final GraphDelta delta = matcher.match(old.graph(), now.graph());

        assertThat(delta.nodeStatus(oldFile.id())).isEqualTo(DiffStatus.MODIFIED);
        assertThat(delta.nodeStatus(oldCall.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus(oldDeclares.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus(newDeclares.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus(oldFlow.id())).isEqualTo(DiffStatus.MODIFIED);
        assertThat(delta.edgeStatus(newFlow.id())).isEqualTo(DiffStatus.MODIFIED);
        assertThat(delta.edgeStatus(oldImport.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus(newImport.id())).isEqualTo(DiffStatus.UNCHANGED);
        assertThat(delta.edgeStatus(oldLodash.id())).isEqualTo(DiffStatus.REMOVED);
        assertThat(delta.edgeStatus(newAxios.id())).isEqualTo(DiffStatus.ADDED);
    }

    @Test
    void normalizeOnlyTouchesNestedCallbacks() {
        assertThat(GraphMatcher.normalizeQualifiedName("src/a.deep.cb@12")).isEqualTo("src/a.deep.cb");
        assertThat(GraphMatcher.normalizeQualifiedName("src/a.load@2")).isEqualTo("src/a.load@2");
    }

    /** Builds one side of a comparison with ids scoped to its own snapshot. */
    private static final class Side {

        private final String ref;
        private final String snapshotId;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<GraphEdge> edges = new ArrayList<>();

        Side(String ref) {
            this.ref = ref;
            this.snapshotId = Ids.snapshotId("repo", ref);
        }

        GraphNode file(String path, String content) {
            return add(NodeKind.FILE, path.substring(path.lastIndexOf('/') + 1), path, 1, 10, content,
                    new NodeMetadata.FileMetadata(10), null);
        }

        GraphNode function(String qualifiedName, int start, int end, String body, String params, String deps) {
            return add(NodeKind.FUNCTION, Ids.lastSegment(qualifiedName), qualifiedName, start, end, body,
                    new NodeMetadata.FunctionMetadata(params, null, null, deps != null ? "useCallback" : null, deps, false),
                    null);
        }

        GraphNode method(String qualifiedName, int start, int end, String body) {
            return add(NodeKind.METHOD, Ids.lastSegment(qualifiedName), qualifiedName, start, end, body,
                    NodeMetadata.FunctionMetadata.of("()", null, null), null);
        }

        GraphNode branch(GraphNode owner, BranchKind kind, int idx, int line, String text) {
            return branch(owner, kind, idx, line, text, false);
        }

        GraphNode branch(GraphNode owner, BranchKind kind, int idx, int line, String text, boolean elif) {
            return add(NodeKind.BRANCH, kind.label() + "@" + line,
                    owner.qualifiedName() + "::" + kind.label() + "#" + idx, line, line, text,
                    new NodeMetadata.BranchMetadata(kind, elif, text, null, false, List.of()), owner.id());
        }

        GraphEdge declares(GraphNode parent, GraphNode child) {
            return edge(EdgeKind.DECLARES, parent.id(), child.id(), null, new EdgeMetadata.DeclaresMetadata(child.kind()));
        }

        GraphEdge flow(GraphNode from, GraphNode to, FlowType flowType) {
            return edge(EdgeKind.CALLS, from.id(), to.id(), flowType.label(), new EdgeMetadata.FlowMetadata(flowType));
        }

        GraphEdge imports(GraphNode file, String module) {
            return edge(EdgeKind.IMPORTS, file.id(), Ids.moduleId(snapshotId, module), module,
                    new EdgeMetadata.ImportMetadata(module));
        }

        SnapshotGraph graph() {
            return new SnapshotGraph("repo", snapshotId, ref, nodes, edges, 0);
        }

        private GraphNode add(NodeKind kind, String name, String qualifiedName, int start, int end, String text,
                              NodeMetadata metadata, String disambiguator) {
            final GraphNode node = new GraphNode(
                    Ids.nodeId(snapshotId, kind, qualifiedName, start, end, disambiguator),
                    kind, name, qualifiedName, "src/a.ts", Language.TS, start, end,
                    Ids.signatureHash(text), metadata, snapshotId, ref);
            nodes.add(node);
            return node;
        }

        private GraphEdge edge(EdgeKind kind, String source, String target, String discriminator, EdgeMetadata metadata) {
            final GraphEdge edge = new GraphEdge(
                    Ids.edgeId(snapshotId, kind, source, target, discriminator),
                    source, target, kind, "src/a.ts", metadata, snapshotId, ref);
            edges.add(edge);
            return edge;
        }
    }
}
