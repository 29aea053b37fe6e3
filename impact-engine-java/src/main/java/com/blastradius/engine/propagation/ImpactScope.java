package com.blastradius.engine.propagation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Result of one propagation run: the changed nodes and everything that depends on them.
 */
public final class ImpactScope {

    private static final ImpactScope EMPTY = new ImpactScope(Map.of(), ImpactStatistics.empty());

    /** Every reached node including the sources, keyed and sorted by id. */
    private final Map<String, ImpactedNode> reached;
    private final ImpactStatistics statistics;

    ImpactScope(Map<String, ImpactedNode> reached, ImpactStatistics statistics) {
        this.reached = Collections.unmodifiableMap(new TreeMap<>(reached));
        this.statistics = statistics;
    }

    public static ImpactScope empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return reached.isEmpty();
    }

    /** Changed node ids present in the graph, sorted. */
    public Set<String> sources() {
        return idsAt(0, 0).keySet();
    }

    /** Ids of the nodes at distance 1, sorted. */
    public Set<String> directImpacts() {
        return idsAt(1, 1).keySet();
    }

    /** Nodes at distance 2 and beyond, keyed by id. */
    public Map<String, ImpactedNode> indirectImpacts() {
        return idsAt(2, Integer.MAX_VALUE);
    }

    /** Every impacted node except the sources, closest first, then by id. */
    public List<ImpactedNode> impacted() {
        List<ImpactedNode> result = new ArrayList<>();
        for (ImpactedNode node : reached.values()) {
            if (!node.isSource()) result.add(node);
        }
        result.sort(Comparator.comparingInt(ImpactedNode::distance).thenComparing(ImpactedNode::nodeId));
        return result;
    }

    /** @return the reached node, or null */
    public ImpactedNode get(String id) {
        return reached.get(id);
    }

    public boolean contains(String id) {
        return reached.containsKey(id);
    }

    /** @return impact score, 1.0 for sources and 0.0 for nodes that were not reached */
    public double scoreOf(String id) {
        ImpactedNode node = reached.get(id);
        return node == null ? 0.0 : node.score();
    }

    /**
     * Rebuilds the chain from a changed node to {@code id} along the parents chosen
     * during propagation.
     *
     * @return ids from source to {@code id}, or an empty list when {@code id} was not reached
     */
    public List<String> pathTo(String id) {
        List<String> path = new ArrayList<>();
        ImpactedNode node = reached.get(id);
        while (node != null) {
            path.add(node.nodeId());
            node = node.via() == null ? null : reached.get(node.via());
        }
        Collections.reverse(path);
        return path;
    }

    public ImpactStatistics statistics() {
        return statistics;
    }

    private Map<String, ImpactedNode> idsAt(int minDistance, int maxDistance) {
        Map<String, ImpactedNode> result = new LinkedHashMap<>();
        for (ImpactedNode node : reached.values()) {
            if (node.distance() >= minDistance && node.distance() <= maxDistance) {
                result.put(node.nodeId(), node);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return "ImpactScope[" + sources().size() + " sources, " + statistics.totalTouched() + " touched]";
    }
}
