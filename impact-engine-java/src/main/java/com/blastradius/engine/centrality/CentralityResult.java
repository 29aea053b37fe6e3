package com.blastradius.engine.centrality;

import java.util.Map;
import java.util.Set;

/**
 * PageRank scores of one graph.
 *
 * @param scores        node id to score, in ascending id order; sums to about 1.0
 * @param converged     false when the iteration cap was hit before the scores settled
 * @param iterations    number of power iterations performed
 * @param criticalNodes ids flagged by the configured critical-node policy, sorted
 */
public record CentralityResult(
        Map<String, Double> scores,
        boolean converged,
        int iterations,
        Set<String> criticalNodes
) {

    public static CentralityResult empty() {
        return new CentralityResult(Map.of(), true, 0, Set.of());
    }

    /** @return the node's score, 0.0 for unknown ids */
    public double scoreOf(String id) {
        return scores.getOrDefault(id, 0.0);
    }

    public boolean isCritical(String id) {
        return criticalNodes.contains(id);
    }

    public double maxScore() {
        double max = 0.0;
        for (double s : scores.values()) max = Math.max(max, s);
        return max;
    }
}
