package com.blastradius.engine.centrality;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.config.CriticalNodePolicy;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weighted PageRank over the dependency graph.
 *
 * An edge hands its source's rank to its target in proportion to the edge's
 * share of the source's total outgoing weight. Nodes without outgoing weight
 * (dangling nodes) spread their rank uniformly over every node, which keeps
 * the scores a probability distribution. Nodes are visited in ascending id
 * order so repeated runs give the same scores.
 */
public class CentralityEngine {

    private static final Logger log = LoggerFactory.getLogger(CentralityEngine.class);

    private static final double TOLERANCE = 1e-12;

    private final AnalysisConfig config;

    public CentralityEngine() {
        this(AnalysisConfig.defaults());
    }

    public CentralityEngine(AnalysisConfig config) {
        this.config = config;
    }

    public CentralityResult compute(DependencyGraph graph) {
        List<String> ids = graph.nodeIds();
        int n = ids.size();
        if (n == 0) return CentralityResult.empty();

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) index.put(ids.get(i), i);

        double[] outWeight = new double[n];
        for (int i = 0; i < n; i++) {
            for (Edge e : graph.outgoing(ids.get(i))) outWeight[i] += e.weight();
        }

        double damping = config.getDampingFactor();
        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);

        boolean converged = false;
        int iterations = 0;
        while (iterations < config.getMaxIterations()) {
            iterations++;

            double danglingMass = 0.0;
            for (int i = 0; i < n; i++) {
                if (outWeight[i] <= 0.0) danglingMass += rank[i];
            }

            double[] next = new double[n];
            Arrays.fill(next, (1.0 - damping) / n + damping * danglingMass / n);
            for (int i = 0; i < n; i++) {
                if (outWeight[i] <= 0.0) continue;
                for (Edge e : graph.outgoing(ids.get(i))) {
                    next[index.get(e.targetId())] += damping * rank[i] * e.weight() / outWeight[i];
                }
            }

            double delta = 0.0;
            for (int i = 0; i < n; i++) delta += Math.abs(next[i] - rank[i]);
            rank = next;
            if (delta < config.getConvergenceEpsilon()) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.debug("PageRank stopped after {} iterations without converging", iterations);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) scores.put(ids.get(i), rank[i]);

        Set<String> critical = criticalNodes(scores, config.getCriticalNodePolicy());
        log.debug("Centrality over {} nodes: {} iterations, converged={}, {} critical",
                n, iterations, converged, critical.size());
        return new CentralityResult(Collections.unmodifiableMap(scores), converged, iterations,
                Collections.unmodifiableSet(critical));
    }

    static Set<String> criticalNodes(Map<String, Double> scores, CriticalNodePolicy policy) {
        Set<String> critical = new TreeSet<>();
        if (scores.isEmpty()) return critical;

        double[] sorted = scores.values().stream().mapToDouble(Double::doubleValue).sorted().toArray();
        switch (policy.mode()) {
            case STD_DEV -> {
                double mean = Arrays.stream(sorted).average().orElse(0.0);
                double variance = 0.0;
                for (double s : sorted) variance += (s - mean) * (s - mean);
                double sigma = Math.sqrt(variance / sorted.length);
                // Uniform scores carry no signal
                if (sigma < TOLERANCE) return critical;
                double threshold = mean + policy.value() * sigma;
                scores.forEach((id, s) -> {
                    if (s > threshold) critical.add(id);
                });
            }
            case PERCENTILE -> {
                int position = Math.max(0, (int) Math.ceil(policy.value() * sorted.length) - 1);
                double threshold = sorted[position];
                double min = sorted[0];
                scores.forEach((id, s) -> {
                    if (s >= threshold && s > min + TOLERANCE) critical.add(id);
                });
            }
        }
        return critical;
    }
}
