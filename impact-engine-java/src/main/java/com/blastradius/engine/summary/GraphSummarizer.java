package com.blastradius.engine.summary;

import com.blastradius.engine.centrality.CentralityResult;
import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.Node;
import com.blastradius.engine.propagation.ImpactScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the nodes worth reporting within a record cap and a token budget.
 *
 * Nodes are ranked by {@code centralityWeight × centrality / maxCentrality +
 * impactWeight × impact} and taken greedily, ties by id. Selection stops at
 * the record cap or at the first record that would overrun the budget.
 */
public class GraphSummarizer {

    private static final Logger log = LoggerFactory.getLogger(GraphSummarizer.class);

    private static final Comparator<RankedNode> ORDER = Comparator
            .comparingDouble(RankedNode::rank).reversed()
            .thenComparing(RankedNode::nodeId);

    private final AnalysisConfig config;
    private final TokenEstimator estimator;

    public GraphSummarizer() {
        this(AnalysisConfig.defaults());
    }

    public GraphSummarizer(AnalysisConfig config) {
        this(config, TokenEstimator.charsOverFour());
    }

    public GraphSummarizer(AnalysisConfig config, TokenEstimator estimator) {
        this.config = config;
        this.estimator = estimator;
    }

    public GraphSummary summarize(DependencyGraph graph, CentralityResult centrality, ImpactScope impact) {
        double maxCentrality = centrality.maxScore();

        List<RankedNode> candidates = new ArrayList<>();
        for (Node node : graph.nodes().values()) {
            double normalized = maxCentrality > 0.0 ? centrality.scoreOf(node.id()) / maxCentrality : 0.0;
            double impactScore = impact.scoreOf(node.id());
            double rank = config.getCentralityWeight() * normalized + config.getImpactWeight() * impactScore;
            candidates.add(new RankedNode(node.id(), node.kind(), node.qualifiedName(), node.signature(),
                    normalized, impactScore, rank, estimator.estimate(node)));
        }
        candidates.sort(ORDER);

        List<RankedNode> selected = new ArrayList<>();
        int used = 0;
        for (RankedNode candidate : candidates) {
            if (selected.size() >= config.getTopK()) break;
            if (used + candidate.tokens() > config.getTokenBudget()) break;
            selected.add(candidate);
            used += candidate.tokens();
        }

        int omitted = candidates.size() - selected.size();
        if (omitted > 0) {
            log.debug("Summary truncated: kept {} of {} nodes ({} of {} tokens)",
                    selected.size(), candidates.size(), used, config.getTokenBudget());
        }
        return new GraphSummary(selected, omitted > 0, omitted, used, config.getTokenBudget(), config.getTopK());
    }
}
