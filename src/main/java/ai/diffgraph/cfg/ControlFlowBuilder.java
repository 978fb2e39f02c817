package ai.diffgraph.cfg;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.diffgraph.model.BranchKind;
import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.EdgeMetadata;
import ai.diffgraph.model.FlowType;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.Ids;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.NodeMetadata;

/**
 * Builds the statement-level control-flow graph of one function-like declaration.
 *
 * <p>Each statement yields an entry branch, a list of pending exit anchors and a
 * falls-through flag. Blocks thread the pending anchors into the next statement's entry
 * (backpatching), so every emitted flow edge is labeled {@code true}, {@code false} or
 * {@code next}. Loop back-edges, {@code break}/{@code continue} and switch fallthrough
 * are not modeled.
 *
 * <p>The builder is stateless; all per-owner state lives in one {@link Walk}.
 */
public final class ControlFlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowBuilder.class);

    /**
     * Emits the branches of {@code body} into {@code sink}, each declared by {@code owner},
     * and links the owner to the first of them.
     *
     * @return the result of the outermost block; its exits are the function's fall-off points
     */
    public FlowResult build(GraphNode owner, List<Stmt> body, GraphSink sink) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(sink, "sink");

        final Walk walk = new Walk(owner, sink);
        final FlowResult result = walk.block(body);
        if (result.entryId() != null) {
            walk.flow(owner.id(), result.entryId(), FlowType.NEXT);
        }
        if (log.isDebugEnabled()) {
            log.debug("CFG for {}: {} branches, {} open exits",
                    owner.qualifiedName(), walk.branchCount(), result.exits().size());
        }
        return result;
    }

    private static final class Walk {

        private final GraphNode owner;
        private final GraphSink sink;
        private final Map<BranchKind, Integer> counters = new EnumMap<>(BranchKind.class);
        private final Set<String> emittedFlows = new HashSet<>();

        private Walk(GraphNode owner, GraphSink sink) {
            this.owner = owner;
            this.sink = sink;
        }

        int branchCount() {
            return counters.values().stream().mapToInt(Integer::intValue).sum();
        }

        FlowResult block(List<Stmt> statements) {
            String entryId = null;
            List<ExitAnchor> pending = new ArrayList<>();
            boolean pathOpen = true;

            for (Stmt statement : statements) {
                final FlowResult result = statement(statement);
                if (result.entryId() != null) {
                    if (entryId == null) {
                        entryId = result.entryId();
                    }
                    for (ExitAnchor anchor : pending) {
                        flow(anchor.sourceId(), result.entryId(), anchor.flowType());
                    }
                    pending = new ArrayList<>(result.exits());
                } else if (!result.fallsThrough()) {
                    pending = new ArrayList<>();
                }
                if (!result.fallsThrough()) {
                    pathOpen = false;
                }
            }
            return new FlowResult(entryId, pending, pathOpen);
        }

        private FlowResult statement(Stmt statement) {
            if (statement instanceof Stmt.If ifStmt) {
                return ifStatement(ifStmt);
            }
            if (statement instanceof Stmt.Loop loop) {
                final String id = branch(loop.kind(), loop.source(), null, List.of());
                final FlowResult body = block(loop.body());
                if (body.entryId() != null) {
                    flow(id, body.entryId(), FlowType.TRUE);
                }
                return FlowResult.leaf(id);
            }
            if (statement instanceof Stmt.Switch switchStmt) {
                final String id = branch(BranchKind.SWITCH, switchStmt.source(), null, List.of());
                for (List<Stmt> clause : switchStmt.clauses()) {
                    final FlowResult body = block(clause);
                    if (body.entryId() != null) {
                        flow(id, body.entryId(), FlowType.TRUE);
                    }
                }
                return FlowResult.leaf(id);
            }
            if (statement instanceof Stmt.Try tryStmt) {
                return tryStatement(tryStmt);
            }
            if (statement instanceof Stmt.Return ret) {
                return FlowResult.terminal(branch(BranchKind.RETURN, ret.source(), null, ret.jsxTags()));
            }
            if (statement instanceof Stmt.Throw thr) {
                return FlowResult.terminal(branch(BranchKind.THROW, thr.source(), null, List.of()));
            }
            if (statement instanceof Stmt.Call call) {
                return FlowResult.leaf(branch(BranchKind.forCallee(call.callee()), call.source(), call.callee(), List.of()));
            }
            if (statement instanceof Stmt.Ternary ternary) {
                return FlowResult.leaf(branch(BranchKind.TERNARY, ternary.source(), null, List.of()));
            }
            if (statement instanceof Stmt.Block nested) {
                return block(nested.body());
            }
            return FlowResult.nothing();
        }

        private FlowResult ifStatement(Stmt.If ifStmt) {
            final String id = branch(BranchKind.IF, ifStmt.elif(), ifStmt.source(), null, List.of());
            final Boolean known = ifStmt.knownTruth();
            final boolean thenReachable = !Boolean.FALSE.equals(known);
            final boolean elseReachable = !Boolean.TRUE.equals(known);
            final boolean hasElse = ifStmt.elseBody() != null;

            // unreachable arms are never walked, so they emit nothing
            final FlowResult thenArm = thenReachable ? block(ifStmt.thenBody()) : null;
            final FlowResult elseArm = hasElse && elseReachable ? block(ifStmt.elseBody()) : null;

            if (thenArm != null && thenArm.entryId() != null) {
                flow(id, thenArm.entryId(), FlowType.TRUE);
            }
            if (elseArm != null && elseArm.entryId() != null) {
                flow(id, elseArm.entryId(), FlowType.FALSE);
            }

            if (!hasElse) {
                if (thenArm != null && !thenArm.fallsThrough() && !elseReachable) {
                    return new FlowResult(id, List.of(), false);
                }
                final FlowType label = thenArm == null || thenArm.fallsThrough() ? FlowType.NEXT : FlowType.FALSE;
                return new FlowResult(id, List.of(new ExitAnchor(id, label)), true);
            }

            final Set<ExitAnchor> exits = new LinkedHashSet<>();
            if (thenArm != null) {
                exits.addAll(thenArm.exits());
                if (thenArm.entryId() == null && thenArm.fallsThrough()) {
                    exits.add(new ExitAnchor(id, FlowType.TRUE));
                }
            }
            if (elseArm != null) {
                exits.addAll(elseArm.exits());
                if (elseArm.entryId() == null && elseArm.fallsThrough()) {
                    exits.add(new ExitAnchor(id, FlowType.FALSE));
                }
            }
            final boolean fallsThrough = thenArm != null && thenArm.fallsThrough()
                    || elseArm != null && elseArm.fallsThrough();
            return new FlowResult(id, new ArrayList<>(exits), fallsThrough);
        }

        private FlowResult tryStatement(Stmt.Try tryStmt) {
            final String tryId = branch(BranchKind.TRY, tryStmt.source(), null, List.of());
            final Set<ExitAnchor> accumulated = new LinkedHashSet<>();

            final FlowResult body = block(tryStmt.body());
            if (body.entryId() != null) {
                flow(tryId, body.entryId(), FlowType.NEXT);
            }
            accumulated.addAll(body.exits());
            if (body.entryId() == null && body.fallsThrough()) {
                accumulated.add(new ExitAnchor(tryId, FlowType.NEXT));
            }
            boolean fallsThrough = body.fallsThrough();

            for (Stmt.Handler handler : tryStmt.handlers()) {
                final String catchId = branch(BranchKind.CATCH, handler.source(), null, List.of());
                flow(tryId, catchId, FlowType.FALSE);
                final FlowResult catchBody = block(handler.body());
                if (catchBody.entryId() != null) {
                    flow(catchId, catchBody.entryId(), FlowType.NEXT);
                }
                accumulated.addAll(catchBody.exits());
                if (catchBody.entryId() == null && catchBody.fallsThrough()) {
                    accumulated.add(new ExitAnchor(catchId, FlowType.NEXT));
                }
                fallsThrough |= catchBody.fallsThrough();
            }

            final Stmt.Handler finalizer = tryStmt.finalizer();
            if (finalizer == null) {
                return new FlowResult(tryId, new ArrayList<>(accumulated), fallsThrough);
            }

            final String finallyId = branch(BranchKind.FINALLY, finalizer.source(), null, List.of());
            if (accumulated.isEmpty()) {
                flow(tryId, finallyId, FlowType.NEXT);
            } else {
                for (ExitAnchor anchor : accumulated) {
                    flow(anchor.sourceId(), finallyId, anchor.flowType());
                }
            }
            final FlowResult finallyBody = block(finalizer.body());
            if (finallyBody.entryId() != null) {
                flow(finallyId, finallyBody.entryId(), FlowType.NEXT);
                return new FlowResult(tryId, finallyBody.exits(), fallsThrough && finallyBody.fallsThrough());
            }
            if (finallyBody.fallsThrough()) {
                return new FlowResult(tryId, List.of(new ExitAnchor(finallyId, FlowType.NEXT)), fallsThrough);
            }
            return new FlowResult(tryId, List.of(), false);
        }

        private String branch(BranchKind kind, Stmt.Source source, String callee, List<String> jsxTags) {
            return branch(kind, false, source, callee, jsxTags);
        }

        private String branch(BranchKind kind, boolean elif, Stmt.Source source, String callee, List<String> jsxTags) {
            final int idx = counters.merge(kind, 1, Integer::sum) - 1;
            final String qualifiedName = owner.qualifiedName() + "::" + kind.label() + "#" + idx;
            final String id = Ids.nodeId(owner.snapshotId(), NodeKind.BRANCH, qualifiedName,
                    source.startLine(), source.endLine(), owner.id());

            sink.addNode(new GraphNode(
                    id,
                    NodeKind.BRANCH,
                    kind.label() + "@" + source.startLine(),
                    qualifiedName,
                    owner.filePath(),
                    owner.language(),
                    source.startLine(),
                    source.endLine(),
                    Ids.signatureHash(source.text()),
                    new NodeMetadata.BranchMetadata(kind, elif, source.snippet(), callee, !jsxTags.isEmpty(), jsxTags),
                    owner.snapshotId(),
                    owner.ref()
            ));
            sink.addEdge(new GraphEdge(
                    Ids.edgeId(owner.snapshotId(), EdgeKind.DECLARES, owner.id(), id, null),
                    owner.id(),
                    id,
                    EdgeKind.DECLARES,
                    owner.filePath(),
                    new EdgeMetadata.DeclaresMetadata(NodeKind.BRANCH),
                    owner.snapshotId(),
                    owner.ref()
            ));
            return id;
        }

        void flow(String sourceId, String targetId, FlowType flowType) {
            final String edgeId = Ids.edgeId(owner.snapshotId(), EdgeKind.CALLS, sourceId, targetId, flowType.label());
            if (!emittedFlows.add(edgeId)) {
                return;
            }
            sink.addEdge(new GraphEdge(
                    edgeId,
                    sourceId,
                    targetId,
                    EdgeKind.CALLS,
                    owner.filePath(),
                    new EdgeMetadata.FlowMetadata(flowType),
                    owner.snapshotId(),
                    owner.ref()
            ));
        }
    }
}
