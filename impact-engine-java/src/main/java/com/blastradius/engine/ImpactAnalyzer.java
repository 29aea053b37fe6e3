package com.blastradius.engine;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.breaking.BreakingChangeDetector;
import com.blastradius.engine.breaking.RiskAssessment;
import com.blastradius.engine.breaking.Severity;
import com.blastradius.engine.cascade.CascadeDetector;
import com.blastradius.engine.cascade.CascadeEffect;
import com.blastradius.engine.centrality.CentralityEngine;
import com.blastradius.engine.centrality.CentralityResult;
import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.graph.GraphBuilder;
import com.blastradius.engine.graph.GraphMerger;
import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.propagation.ImpactPropagation;
import com.blastradius.engine.propagation.ImpactScope;
import com.blastradius.engine.summary.GraphSummarizer;
import com.blastradius.engine.summary.GraphSummary;
import com.blastradius.engine.summary.TokenEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the whole pipeline for one change: graph, centrality, breaking changes,
 * impact, cascades, summary and risk.
 *
 * Stateless apart from its configuration; one instance may serve concurrent calls.
 */
public class ImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    private final AnalysisConfig config;
    private final TokenEstimator estimator;

    public ImpactAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public ImpactAnalyzer(AnalysisConfig config) {
        this(config, TokenEstimator.charsOverFour());
    }

    public ImpactAnalyzer(AnalysisConfig config, TokenEstimator estimator) {
        this.config = config;
        this.estimator = estimator;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /**
     * Analyzes the difference between two versions of the code.
     *
     * The graph is the after view laid over the before view: post-edit
     * definitions win, while removed entities and their callers stay visible.
     *
     * @throws AnalysisConfig.ConfigurationException if the configuration is invalid
     */
    public ImpactAnalysis analyze(List<StructuralSummary> before, List<StructuralSummary> after) {
        config.validate();
        long start = System.nanoTime();

        GraphBuilder builder = new GraphBuilder(config);
        DependencyGraph context = builder.build(before);
        DependencyGraph overlay = builder.build(after);
        DependencyGraph graph = GraphMerger.merge(overlay, context);

        List<BreakingChange> changes = new BreakingChangeDetector(config).detect(before, after);
        ImpactAnalysis analysis = run(graph, changes);

        log.debug("Analysis finished in {} ms", (System.nanoTime() - start) / 1_000_000);
        return analysis;
    }

    /**
     * Runs centrality, propagation, cascade detection, summarizing and risk
     * assessment on a graph built elsewhere.
     *
     * @throws AnalysisConfig.ConfigurationException if the configuration is invalid
     */
    public ImpactAnalysis analyzeGraph(DependencyGraph graph, List<BreakingChange> changes) {
        config.validate();
        return run(graph, changes);
    }

    private ImpactAnalysis run(DependencyGraph graph, List<BreakingChange> changes) {
        CentralityResult centrality = new CentralityEngine(config).compute(graph);

        Set<String> changed = new LinkedHashSet<>();
        for (BreakingChange change : changes) {
            if (change.severity() == Severity.INFO) continue;
            String id = graph.idOf(change.kind(), change.qualifiedName());
            if (id != null) changed.add(id);
        }
        ImpactScope scope = new ImpactPropagation(config).propagate(graph, changed);

        List<CascadeEffect> cascades = new CascadeDetector(config).detect(graph, changes);
        GraphSummary summary = new GraphSummarizer(config, estimator).summarize(graph, centrality, scope);
        RiskAssessment risk = RiskAssessment.of(changes);

        log.info("Analyzed {}: {} changes, {} impacted, {} cascades, risk {} ({})",
                graph, changes.size(), scope.statistics().totalTouched(), cascades.size(),
                risk.score(), risk.level());
        return new ImpactAnalysis(graph, centrality, changes, scope, cascades, summary, risk);
    }
}
