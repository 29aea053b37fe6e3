package com.blastradius.engine.propagation;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Spreads impact from changed nodes to their dependents.
 *
 * Level-synchronous BFS over reverse edges: every node at distance d is
 * settled before any node at d + 1, and a node is visited once. Its score is
 * the best of {@code parentScore × edgeWeight × decay^d} over the parents on
 * the previous level; converging paths never add up.
 */
public class ImpactPropagation {

    private static final Logger log = LoggerFactory.getLogger(ImpactPropagation.class);

    private final AnalysisConfig config;

    public ImpactPropagation() {
        this(AnalysisConfig.defaults());
    }

    public ImpactPropagation(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * @param graph   the dependency graph
     * @param changed ids of changed nodes; ids not in the graph are ignored
     */
    public ImpactScope propagate(DependencyGraph graph, Collection<String> changed) {
        TreeSet<String> sources = new TreeSet<>();
        for (String id : changed) {
            if (id != null && graph.contains(id)) sources.add(id);
        }
        if (sources.isEmpty()) return ImpactScope.empty();

        Map<String, ImpactedNode> reached = new HashMap<>();
        for (String id : sources) {
            reached.put(id, new ImpactedNode(id, 0, 1.0, null));
        }

        List<String> frontier = new ArrayList<>(sources);
        for (int distance = 1; distance <= config.getMaxDepth() && !frontier.isEmpty(); distance++) {
            double decay = Math.pow(config.getDecayFactor(), distance);
            Map<String, ImpactedNode> level = new TreeMap<>();

            for (String parentId : frontier) {
                double parentScore = reached.get(parentId).score();
                for (Edge edge : graph.incoming(parentId)) {
                    String dependent = edge.sourceId();
                    if (reached.containsKey(dependent)) continue;

                    double score = parentScore * edge.weight() * decay;
                    ImpactedNode best = level.get(dependent);
                    if (best == null || score > best.score()) {
                        level.put(dependent, new ImpactedNode(dependent, distance, score, parentId));
                    }
                }
            }

            reached.putAll(level);
            frontier = new ArrayList<>(level.keySet());
        }

        ImpactScope scope = new ImpactScope(reached, statistics(reached.values()));
        log.debug("Propagated from {} sources: {}", sources.size(), scope.statistics());
        return scope;
    }

    private ImpactStatistics statistics(Collection<ImpactedNode> reached) {
        int touched = 0;
        int direct = 0;
        int indirect = 0;
        int high = 0;
        int maxDistance = 0;
        double total = 0.0;
        for (ImpactedNode node : reached) {
            if (node.isSource()) continue;
            touched++;
            if (node.distance() == 1) direct++;
            else indirect++;
            if (node.score() >= config.getHighImpactThreshold()) high++;
            maxDistance = Math.max(maxDistance, node.distance());
            total += node.score();
        }
        return new ImpactStatistics(touched, direct, indirect, high, maxDistance,
                touched == 0 ? 0.0 : total / touched);
    }
}
