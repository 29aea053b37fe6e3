package com.blastradius.engine.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Composes two dependency graphs, e.g. a whole-project context with a diff overlay.
 *
 * Nodes are matched by (kind, qualified name). The first graph plays the role
 * of the earlier declaration for the {@link ConflictPolicy}: under FIRST_WINS its
 * definition is kept, under LAST_WINS the second graph's definition replaces it
 * (the first graph's id survives either way). An EXTERNAL placeholder in one
 * graph is upgraded to the declared node when the other graph declares the name.
 * Colliding ids of distinct entities are renamed with a {@code ~n} suffix.
 */
public final class GraphMerger {

    private static final Logger log = LoggerFactory.getLogger(GraphMerger.class);

    private GraphMerger() {}

    public static DependencyGraph merge(DependencyGraph first, DependencyGraph second) {
        return merge(first, second, ConflictPolicy.FIRST_WINS);
    }

    public static DependencyGraph merge(DependencyGraph first, DependencyGraph second, ConflictPolicy policy) {
        DependencyGraph.Builder merged = new DependencyGraph.Builder();
        Map<String, String> firstIds = new HashMap<>();
        Map<String, String> secondIds = new HashMap<>();
        Map<NodeKey, String> idByKey = new HashMap<>();
        Map<String, String> declaredByName = new HashMap<>();

        // --- First graph: taken as is ---
        for (Node node : first.nodes().values()) {
            merged.addNode(node);
            firstIds.put(node.id(), node.id());
            idByKey.put(node.key(), node.id());
            if (!node.isExternal()) declaredByName.putIfAbsent(node.qualifiedName(), node.id());
        }

        // --- Second graph: matched against the first ---
        int conflicts = 0;
        for (Node node : second.nodes().values()) {
            String existingId = idByKey.get(node.key());
            if (existingId != null) {
                if (!node.isExternal() && resolveDuplicate(merged, existingId, node, policy)) conflicts++;
                secondIds.put(node.id(), existingId);
                continue;
            }

            if (node.isExternal()) {
                String declared = declaredByName.get(node.qualifiedName());
                if (declared != null) {
                    secondIds.put(node.id(), declared);
                    continue;
                }
            }

            String id = NodeIdGenerator.disambiguate(node.id(), merged.nodeIds());
            merged.addNode(node.withId(id));
            secondIds.put(node.id(), id);
            idByKey.put(node.key(), id);
            if (!node.isExternal()) {
                declaredByName.putIfAbsent(node.qualifiedName(), id);
                upgradePlaceholder(merged, idByKey, node.qualifiedName(), id, firstIds, secondIds);
            }
        }

        // --- Edges, remapped onto surviving ids ---
        for (Edge e : first.edges()) {
            merged.addEdge(new Edge(firstIds.get(e.sourceId()), firstIds.get(e.targetId()), e.kind(), e.weight()));
        }
        for (Edge e : second.edges()) {
            merged.addEdge(new Edge(secondIds.get(e.sourceId()), secondIds.get(e.targetId()), e.kind(), e.weight()));
        }

        merged.addDiagnostics(first.diagnostics()).addDiagnostics(second.diagnostics());
        merged.addConflicts(first.conflicts()).addConflicts(second.conflicts());

        DependencyGraph result = merged.build();
        log.debug("Merged {} + {} into {} ({} new conflicts, policy {})",
                first, second, result, conflicts, policy);
        return result;
    }

    /**
     * Applies the policy to a second definition of an entity already in the merge.
     *
     * @return true if a conflict was recorded
     */
    private static boolean resolveDuplicate(DependencyGraph.Builder merged, String existingId,
                                            Node incoming, ConflictPolicy policy) {
        Node existing = merged.getNode(existingId);
        boolean differs = !existing.fingerprint().equals(incoming.fingerprint())
                || existing.visibility() != incoming.visibility();
        if (differs) {
            merged.addConflict(new MergeConflict(existing.key(), existingId, incoming.id(), policy));
        }
        if (policy == ConflictPolicy.LAST_WINS) {
            merged.addNode(incoming.withId(existingId));
        }
        return differs;
    }

    /** Replaces the first graph's EXTERNAL node for {@code qualifiedName}, if any, by {@code declaredId}. */
    private static void upgradePlaceholder(DependencyGraph.Builder merged, Map<NodeKey, String> idByKey,
                                           String qualifiedName, String declaredId,
                                           Map<String, String> firstIds, Map<String, String> secondIds) {
        NodeKey placeholderKey = new NodeKey(NodeKind.EXTERNAL, qualifiedName);
        String placeholderId = idByKey.remove(placeholderKey);
        if (placeholderId == null) return;

        merged.removeNode(placeholderId);
        firstIds.replaceAll((original, mapped) -> mapped.equals(placeholderId) ? declaredId : mapped);
        secondIds.replaceAll((original, mapped) -> mapped.equals(placeholderId) ? declaredId : mapped);
        log.debug("Resolved external reference {} to {}", qualifiedName, declaredId);
    }
}
