package ai.diffgraph.diff;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.diffgraph.model.EdgeKind;
import ai.diffgraph.model.EdgeMetadata;
import ai.diffgraph.model.GraphEdge;
import ai.diffgraph.model.GraphNode;
import ai.diffgraph.model.NodeKind;
import ai.diffgraph.model.NodeMetadata;
import ai.diffgraph.model.SnapshotGraph;

/**
 * Pairs the nodes and edges of two snapshot graphs and classifies each as added, removed,
 * modified or unchanged.
 *
 * Nodes are matched within groups of the same identity key (qualified name and kind for
 * functions, owner and branch type for branches). Inside a group, equal signature hashes
 * pair first, then the leftovers pair by source position. Edges are matched by kind and
 * their endpoints mapped through the node pairing. The matcher holds no state between calls.
 */
public final class GraphMatcher {

    private static final Logger log = LoggerFactory.getLogger(GraphMatcher.class);

    private static final Pattern LINE_SUFFIX = Pattern.compile("@\\d+");

    private static final Comparator<GraphNode> BY_POSITION = Comparator
            .comparingInt(GraphNode::startLine)
            .thenComparingInt(GraphNode::endLine)
            .thenComparing(GraphNode::id);

    public GraphDelta match(SnapshotGraph oldGraph, SnapshotGraph newGraph) {
        Objects.requireNonNull(oldGraph, "oldGraph");
        Objects.requireNonNull(newGraph, "newGraph");
        final Run run = new Run(oldGraph, newGraph);
        run.matchNodes();
        run.diffDetails();
        run.matchEdges();
        log.debug("Matched {} -> {}: {} node and {} edge statuses",
                oldGraph.snapshotId(), newGraph.snapshotId(), run.nodeStatus.size(), run.edgeStatus.size());
        return new GraphDelta(oldGraph, newGraph, run.nodeStatus, run.edgeStatus, run.oldToNew,
                run.oldParameters, run.newParameters, run.oldDependencies, run.newDependencies);
    }

    /**
     * Qualified name with the line disambiguation of nested anonymous callbacks removed, so
     * a callback that moved keeps its group.
     */
    static String normalizeQualifiedName(String qualifiedName) {
        if (qualifiedName.contains(".deep.")) {
            return LINE_SUFFIX.matcher(qualifiedName).replaceAll("");
        }
        return qualifiedName;
    }

    static String groupKey(GraphNode node) {
        if (node.kind().isFunctionLike()) {
            return "fn|" + normalizeQualifiedName(node.qualifiedName()) + "|" + node.kind().label();
        }
        if (node.kind() == NodeKind.BRANCH) {
            final String qualifiedName = node.qualifiedName();
            final int owner = qualifiedName.lastIndexOf("::");
            final String ownerName = owner >= 0 ? qualifiedName.substring(0, owner) : qualifiedName;
            final NodeMetadata.BranchMetadata meta = node.branchMetadata();
            final String branchType = meta != null && meta.branchType() != null ? meta.branchType().label() : "";
            return "branch|" + normalizeQualifiedName(ownerName) + "|" + branchType;
        }
        return node.kind().label() + "|" + node.qualifiedName();
    }

    private static final class Run {

        private final SnapshotGraph oldGraph;
        private final SnapshotGraph newGraph;

        private final Map<String, DiffStatus> nodeStatus = new LinkedHashMap<>();
        private final Map<String, DiffStatus> edgeStatus = new LinkedHashMap<>();
        private final Map<String, String> oldToNew = new LinkedHashMap<>();
        private final Set<String> pairedNew = new HashSet<>();
        private final Map<String, List<TokenDiff>> oldParameters = new LinkedHashMap<>();
        private final Map<String, List<TokenDiff>> newParameters = new LinkedHashMap<>();
        private final Map<String, List<TokenDiff>> oldDependencies = new LinkedHashMap<>();
        private final Map<String, List<TokenDiff>> newDependencies = new LinkedHashMap<>();

        private Run(SnapshotGraph oldGraph, SnapshotGraph newGraph) {
            this.oldGraph = oldGraph;
            this.newGraph = newGraph;
        }

        void matchNodes() {
            final Map<String, GraphNode> newById = newGraph.nodesById();

            // Same id on both sides: the node kept its identity
            final List<GraphNode> oldRest = new ArrayList<>();
            for (GraphNode oldNode : oldGraph.nodes()) {
                final GraphNode newNode = newById.get(oldNode.id());
                if (newNode != null && newNode.kind() == oldNode.kind() && !pairedNew.contains(newNode.id())) {
                    pair(oldNode, newNode, Objects.equals(oldNode.signatureHash(), newNode.signatureHash())
                            ? DiffStatus.UNCHANGED
                            : DiffStatus.MODIFIED);
                } else {
                    oldRest.add(oldNode);
                }
            }
            final List<GraphNode> newRest = new ArrayList<>();
            for (GraphNode newNode : newGraph.nodes()) {
                if (!pairedNew.contains(newNode.id())) {
                    newRest.add(newNode);
                }
            }

            final Map<String, List<GraphNode>> oldGroups = group(oldRest);
            final Map<String, List<GraphNode>> newGroups = group(newRest);
            for (Map.Entry<String, List<GraphNode>> entry : oldGroups.entrySet()) {
                matchGroup(entry.getValue(), newGroups.getOrDefault(entry.getKey(), new ArrayList<>()));
            }
            for (GraphNode newNode : newGraph.nodes()) {
                nodeStatus.putIfAbsent(newNode.id(), DiffStatus.ADDED);
            }
        }

        private void matchGroup(List<GraphNode> olds, List<GraphNode> news) {
            // Exact pass on signature hash, buckets in graph order
            final Map<String, List<GraphNode>> newByHash = new LinkedHashMap<>();
            for (GraphNode newNode : news) {
                newByHash.computeIfAbsent(String.valueOf(newNode.signatureHash()), k -> new ArrayList<>()).add(newNode);
            }
            final List<GraphNode> oldLeft = new ArrayList<>();
            for (GraphNode oldNode : olds) {
                final List<GraphNode> bucket = newByHash.get(String.valueOf(oldNode.signatureHash()));
                if (bucket == null || bucket.isEmpty()) {
                    oldLeft.add(oldNode);
                    continue;
                }
                pair(oldNode, takePreferred(bucket, oldNode), DiffStatus.UNCHANGED);
            }

            // Positional fallback
            final List<GraphNode> newLeft = new ArrayList<>();
            for (GraphNode newNode : news) {
                if (!pairedNew.contains(newNode.id())) {
                    newLeft.add(newNode);
                }
            }
            oldLeft.sort(BY_POSITION);
            newLeft.sort(BY_POSITION);
            final int paired = Math.min(oldLeft.size(), newLeft.size());
            for (int i = 0; i < paired; i++) {
                pair(oldLeft.get(i), newLeft.get(i), DiffStatus.MODIFIED);
            }
            for (int i = paired; i < oldLeft.size(); i++) {
                nodeStatus.put(oldLeft.get(i).id(), DiffStatus.REMOVED);
            }
        }

        private static GraphNode takePreferred(List<GraphNode> bucket, GraphNode oldNode) {
            final Iterator<GraphNode> it = bucket.iterator();
            while (it.hasNext()) {
                final GraphNode candidate = it.next();
                if (candidate.startLine() == oldNode.startLine() && candidate.endLine() == oldNode.endLine()) {
                    it.remove();
                    return candidate;
                }
            }
            return bucket.remove(0);
        }

        private void pair(GraphNode oldNode, GraphNode newNode, DiffStatus status) {
            oldToNew.put(oldNode.id(), newNode.id());
            pairedNew.add(newNode.id());
            nodeStatus.put(oldNode.id(), status);
            nodeStatus.put(newNode.id(), status);
        }

        void diffDetails() {
            final Map<String, GraphNode> newById = newGraph.nodesById();
            for (GraphNode oldNode : oldGraph.nodes()) {
                final NodeMetadata.FunctionMetadata before = oldNode.functionMetadata();
                if (!oldNode.kind().isFunctionLike() || before == null) {
                    continue;
                }
                final String newId = oldToNew.get(oldNode.id());
                final GraphNode newNode = newId != null ? newById.get(newId) : null;
                final NodeMetadata.FunctionMetadata after = newNode != null ? newNode.functionMetadata() : null;
                if (after == null) {
                    oldParameters.put(oldNode.id(), ParameterDiffer.uniform(before.params(), DiffStatus.REMOVED));
                    putDependencies(oldDependencies, oldNode.id(),
                            DependencyDiffer.uniform(before.hookDependencies(), DiffStatus.REMOVED), before);
                    continue;
                }
                final DetailDiff params = ParameterDiffer.diff(before.params(), after.params());
                oldParameters.put(oldNode.id(), params.before());
                newParameters.put(newNode.id(), params.after());
                if (before.hookDependencies() != null || after.hookDependencies() != null) {
                    final DetailDiff deps = DependencyDiffer.diff(before.hookDependencies(), after.hookDependencies());
                    oldDependencies.put(oldNode.id(), deps.before());
                    newDependencies.put(newNode.id(), deps.after());
                }
            }
            for (GraphNode newNode : newGraph.nodes()) {
                final NodeMetadata.FunctionMetadata after = newNode.functionMetadata();
                if (!newNode.kind().isFunctionLike() || after == null || newParameters.containsKey(newNode.id())) {
                    continue;
                }
                newParameters.put(newNode.id(), ParameterDiffer.uniform(after.params(), DiffStatus.ADDED));
                putDependencies(newDependencies, newNode.id(),
                        DependencyDiffer.uniform(after.hookDependencies(), DiffStatus.ADDED), after);
            }
        }

        private static void putDependencies(Map<String, List<TokenDiff>> target,
                                            String nodeId,
                                            List<TokenDiff> tokens,
                                            NodeMetadata.FunctionMetadata meta) {
            if (meta.hookDependencies() != null) {
                target.put(nodeId, tokens);
            }
        }

        void matchEdges() {
            final Set<String> newEdgeIds = new HashSet<>();
            for (GraphEdge edge : newGraph.edges()) {
                newEdgeIds.add(edge.id());
            }

            final Map<String, List<GraphEdge>> oldByKey = new LinkedHashMap<>();
            final Set<String> sharedIds = new HashSet<>();
            for (GraphEdge edge : oldGraph.edges()) {
                if (newEdgeIds.contains(edge.id())) {
                    sharedIds.add(edge.id());
                    edgeStatus.put(edge.id(), DiffStatus.UNCHANGED);
                } else {
                    oldByKey.computeIfAbsent(oldKey(edge), k -> new ArrayList<>()).add(edge);
                }
            }
            final Map<String, List<GraphEdge>> newByKey = new HashMap<>();
            for (GraphEdge edge : newGraph.edges()) {
                if (!sharedIds.contains(edge.id())) {
                    newByKey.computeIfAbsent(newKey(edge), k -> new ArrayList<>()).add(edge);
                }
            }

            for (Map.Entry<String, List<GraphEdge>> entry : oldByKey.entrySet()) {
                final List<GraphEdge> olds = entry.getValue();
                final List<GraphEdge> news = newByKey.getOrDefault(entry.getKey(), new ArrayList<>());

                final List<GraphEdge> oldLeft = new ArrayList<>();
                for (GraphEdge oldEdge : olds) {
                    final GraphEdge same = takeSameFlow(news, oldEdge);
                    if (same != null) {
                        edgeStatus.put(oldEdge.id(), DiffStatus.UNCHANGED);
                        edgeStatus.put(same.id(), DiffStatus.UNCHANGED);
                    } else {
                        oldLeft.add(oldEdge);
                    }
                }
                final int paired = Math.min(oldLeft.size(), news.size());
                for (int i = 0; i < paired; i++) {
                    edgeStatus.put(oldLeft.get(i).id(), DiffStatus.MODIFIED);
                    edgeStatus.put(news.get(i).id(), DiffStatus.MODIFIED);
                }
                for (int i = paired; i < oldLeft.size(); i++) {
                    edgeStatus.put(oldLeft.get(i).id(), DiffStatus.REMOVED);
                }
            }
            for (GraphEdge edge : newGraph.edges()) {
                edgeStatus.putIfAbsent(edge.id(), DiffStatus.ADDED);
            }
        }

        private static GraphEdge takeSameFlow(List<GraphEdge> candidates, GraphEdge oldEdge) {
            final Iterator<GraphEdge> it = candidates.iterator();
            while (it.hasNext()) {
                final GraphEdge candidate = it.next();
                if (candidate.flowType() == oldEdge.flowType()) {
                    it.remove();
                    return candidate;
                }
            }
            return null;
        }

        private String oldKey(GraphEdge edge) {
            final String source = oldToNew.getOrDefault(edge.source(), "old:" + edge.source());
            return edge.kind() + "|" + source + "|" + targetKey(edge, oldToNew.get(edge.target()), "old:");
        }

        private String newKey(GraphEdge edge) {
            final String source = pairedNew.contains(edge.source()) ? edge.source() : "new:" + edge.source();
            final String target = pairedNew.contains(edge.target()) ? edge.target() : null;
            return edge.kind() + "|" + source + "|" + targetKey(edge, target, "new:");
        }

        private static String targetKey(GraphEdge edge, String pairedTarget, String unpairedPrefix) {
            if (edge.kind() == EdgeKind.IMPORTS && edge.metadata() instanceof EdgeMetadata.ImportMetadata imp) {
                return "module:" + imp.moduleSpecifier();
            }
            return pairedTarget != null ? pairedTarget : unpairedPrefix + edge.target();
        }

        private static Map<String, List<GraphNode>> group(List<GraphNode> nodes) {
            final Map<String, List<GraphNode>> out = new LinkedHashMap<>();
            for (GraphNode node : nodes) {
                out.computeIfAbsent(groupKey(node), k -> new ArrayList<>()).add(node);
            }
            return out;
        }
    }
}
