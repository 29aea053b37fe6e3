package com.blastradius.io.config;

import com.blastradius.engine.config.AnalysisConfig;
import com.blastradius.engine.config.CriticalNodePolicy;
import com.blastradius.engine.graph.ConflictPolicy;
import com.blastradius.engine.graph.EdgeKind;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deserialized form of an analysis settings file. Every field is optional;
 * absent fields fall back to the engine defaults.
 */
public class AnalysisConfigFile {

    @SerializedName("damping_factor")
    private Double dampingFactor;

    @SerializedName("convergence_epsilon")
    private Double convergenceEpsilon;

    @SerializedName("max_iterations")
    private Integer maxIterations;

    @SerializedName("decay_factor")
    private Double decayFactor;

    @SerializedName("max_depth")
    private Integer maxDepth;

    @SerializedName("top_k")
    private Integer topK;

    @SerializedName("token_budget")
    private Integer tokenBudget;

    /** Relationship kind ("calls", "contains", ...) to weight; unlisted kinds keep their default. */
    @SerializedName("edge_weights")
    private Map<String, Double> edgeWeights;

    /** "std_dev" (default) or "percentile". */
    @SerializedName("critical_node_mode")
    private String criticalNodeMode;

    /** σ multiplier or percentile fraction, depending on the mode. */
    @SerializedName("critical_node_threshold")
    private Double criticalNodeThreshold;

    @SerializedName("high_impact_threshold")
    private Double highImpactThreshold;

    /** "first_wins" (default) or "last_wins". */
    @SerializedName("conflict_policy")
    private String conflictPolicy;

    @SerializedName("centrality_weight")
    private Double centralityWeight;

    @SerializedName("impact_weight")
    private Double impactWeight;

    @SerializedName("max_cascades")
    private Integer maxCascades;

    public double getDampingFactor()      { return dampingFactor != null ? dampingFactor : AnalysisConfig.DEFAULT_DAMPING_FACTOR; }
    public double getConvergenceEpsilon() { return convergenceEpsilon != null ? convergenceEpsilon : AnalysisConfig.DEFAULT_CONVERGENCE_EPSILON; }
    public int getMaxIterations()         { return maxIterations != null ? maxIterations : AnalysisConfig.DEFAULT_MAX_ITERATIONS; }
    public double getDecayFactor()        { return decayFactor != null ? decayFactor : AnalysisConfig.DEFAULT_DECAY_FACTOR; }
    public int getMaxDepth()              { return maxDepth != null ? maxDepth : AnalysisConfig.DEFAULT_MAX_DEPTH; }
    public int getTopK()                  { return topK != null ? topK : AnalysisConfig.DEFAULT_TOP_K; }
    public int getTokenBudget()           { return tokenBudget != null ? tokenBudget : AnalysisConfig.DEFAULT_TOKEN_BUDGET; }
    public Map<String, Double> getEdgeWeights() { return edgeWeights != null ? edgeWeights : Collections.emptyMap(); }
    public String getCriticalNodeMode()   { return criticalNodeMode != null ? criticalNodeMode : "std_dev"; }
    public Double getCriticalNodeThreshold() { return criticalNodeThreshold; }
    public double getHighImpactThreshold() {
        return highImpactThreshold != null ? highImpactThreshold : AnalysisConfig.DEFAULT_HIGH_IMPACT_THRESHOLD;
    }
    public String getConflictPolicy()     { return conflictPolicy != null ? conflictPolicy : "first_wins"; }
    public double getCentralityWeight()   { return centralityWeight != null ? centralityWeight : AnalysisConfig.DEFAULT_CENTRALITY_WEIGHT; }
    public double getImpactWeight()       { return impactWeight != null ? impactWeight : AnalysisConfig.DEFAULT_IMPACT_WEIGHT; }
    public int getMaxCascades()           { return maxCascades != null ? maxCascades : AnalysisConfig.DEFAULT_MAX_CASCADES; }

    /**
     * Converts the file into a validated engine configuration.
     *
     * @throws AnalysisConfig.ConfigurationException on unknown names or invalid values
     */
    public AnalysisConfig toAnalysisConfig() {
        List<String> errors = new ArrayList<>();
        AnalysisConfig.Builder builder = AnalysisConfig.builder()
                .dampingFactor(getDampingFactor())
                .convergenceEpsilon(getConvergenceEpsilon())
                .maxIterations(getMaxIterations())
                .decayFactor(getDecayFactor())
                .maxDepth(getMaxDepth())
                .topK(getTopK())
                .tokenBudget(getTokenBudget())
                .highImpactThreshold(getHighImpactThreshold())
                .centralityWeight(getCentralityWeight())
                .impactWeight(getImpactWeight())
                .maxCascades(getMaxCascades());

        for (Map.Entry<String, Double> entry : getEdgeWeights().entrySet()) {
            EdgeKind kind = EdgeKind.parse(entry.getKey());
            if (kind == null) {
                errors.add("unknown edge kind '" + entry.getKey() + "' in edge_weights");
            } else if (entry.getValue() == null) {
                errors.add("edge weight for '" + entry.getKey() + "' is null");
            } else {
                builder.edgeWeight(kind, entry.getValue());
            }
        }

        switch (getCriticalNodeMode().toLowerCase(Locale.ROOT)) {
            case "std_dev", "stddev", "sigma" -> builder.criticalNodePolicy(CriticalNodePolicy.stdDev(
                    criticalNodeThreshold != null ? criticalNodeThreshold : CriticalNodePolicy.defaults().value()));
            case "percentile" -> builder.criticalNodePolicy(CriticalNodePolicy.percentile(
                    criticalNodeThreshold != null ? criticalNodeThreshold : 0.9));
            default -> errors.add("unknown critical_node_mode '" + getCriticalNodeMode() + "'");
        }

        switch (getConflictPolicy().toLowerCase(Locale.ROOT)) {
            case "first_wins" -> builder.conflictPolicy(ConflictPolicy.FIRST_WINS);
            case "last_wins" -> builder.conflictPolicy(ConflictPolicy.LAST_WINS);
            default -> errors.add("unknown conflict_policy '" + getConflictPolicy() + "'");
        }

        if (!errors.isEmpty()) {
            throw new AnalysisConfig.ConfigurationException(
                    "Invalid analysis configuration: " + String.join("; ", errors));
        }
        return builder.build();
    }
}
