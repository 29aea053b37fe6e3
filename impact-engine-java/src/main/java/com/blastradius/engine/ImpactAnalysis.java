package com.blastradius.engine;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.breaking.RiskAssessment;
import com.blastradius.engine.cascade.CascadeEffect;
import com.blastradius.engine.centrality.CentralityResult;
import com.blastradius.engine.graph.DependencyGraph;
import com.blastradius.engine.propagation.ImpactScope;
import com.blastradius.engine.summary.GraphSummary;

import java.util.List;

/**
 * Every artifact of one analysis call.
 */
public record ImpactAnalysis(
        DependencyGraph graph,
        CentralityResult centrality,
        List<BreakingChange> breakingChanges,
        ImpactScope impactScope,
        List<CascadeEffect> cascades,
        GraphSummary summary,
        RiskAssessment risk
) {

    public ImpactAnalysis {
        breakingChanges = List.copyOf(breakingChanges);
        cascades = List.copyOf(cascades);
    }

    public boolean hasBreakingChanges() {
        return breakingChanges.stream().anyMatch(BreakingChange::isBreaking);
    }
}
