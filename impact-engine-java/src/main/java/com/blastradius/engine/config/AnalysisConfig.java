package com.blastradius.engine.config;

import com.blastradius.engine.graph.ConflictPolicy;
import com.blastradius.engine.graph.EdgeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Every tunable of one analysis run. Immutable; obtain through {@link #defaults()}
 * or {@link #builder()}. {@link Builder#build()} rejects invalid values, so a
 * constructed config is always safe to run.
 */
public final class AnalysisConfig {

    public static final double DEFAULT_DAMPING_FACTOR = 0.85;
    public static final double DEFAULT_CONVERGENCE_EPSILON = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_DECAY_FACTOR = 0.7;
    public static final int DEFAULT_MAX_DEPTH = 4;
    public static final int DEFAULT_TOP_K = 200;
    public static final int DEFAULT_TOKEN_BUDGET = 3000;
    public static final double DEFAULT_HIGH_IMPACT_THRESHOLD = 0.5;
    public static final double DEFAULT_CENTRALITY_WEIGHT = 0.5;
    public static final double DEFAULT_IMPACT_WEIGHT = 0.5;
    public static final int DEFAULT_MAX_CASCADES = 1000;

    private static final AnalysisConfig DEFAULTS = builder().build();

    private final double dampingFactor;
    private final double convergenceEpsilon;
    private final int maxIterations;
    private final double decayFactor;
    private final int maxDepth;
    private final int topK;
    private final int tokenBudget;
    private final Map<EdgeKind, Double> edgeWeights;
    private final CriticalNodePolicy criticalNodePolicy;
    private final double highImpactThreshold;
    private final ConflictPolicy conflictPolicy;
    private final double centralityWeight;
    private final double impactWeight;
    private final int maxCascades;

    private AnalysisConfig(Builder b) {
        this.dampingFactor = b.dampingFactor;
        this.convergenceEpsilon = b.convergenceEpsilon;
        this.maxIterations = b.maxIterations;
        this.decayFactor = b.decayFactor;
        this.maxDepth = b.maxDepth;
        this.topK = b.topK;
        this.tokenBudget = b.tokenBudget;
        this.edgeWeights = Collections.unmodifiableMap(new EnumMap<>(b.edgeWeights));
        this.criticalNodePolicy = b.criticalNodePolicy;
        this.highImpactThreshold = b.highImpactThreshold;
        this.conflictPolicy = b.conflictPolicy;
        this.centralityWeight = b.centralityWeight;
        this.impactWeight = b.impactWeight;
        this.maxCascades = b.maxCascades;
    }

    public static AnalysisConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this config's values. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .dampingFactor(dampingFactor)
                .convergenceEpsilon(convergenceEpsilon)
                .maxIterations(maxIterations)
                .decayFactor(decayFactor)
                .maxDepth(maxDepth)
                .topK(topK)
                .tokenBudget(tokenBudget)
                .criticalNodePolicy(criticalNodePolicy)
                .highImpactThreshold(highImpactThreshold)
                .conflictPolicy(conflictPolicy)
                .centralityWeight(centralityWeight)
                .impactWeight(impactWeight)
                .maxCascades(maxCascades);
        edgeWeights.forEach(b::edgeWeight);
        return b;
    }

    public double getDampingFactor()           { return dampingFactor; }
    public double getConvergenceEpsilon()      { return convergenceEpsilon; }
    public int getMaxIterations()              { return maxIterations; }
    public double getDecayFactor()             { return decayFactor; }
    public int getMaxDepth()                   { return maxDepth; }
    public int getTopK()                       { return topK; }
    public int getTokenBudget()                { return tokenBudget; }
    public Map<EdgeKind, Double> getEdgeWeights() { return edgeWeights; }
    public CriticalNodePolicy getCriticalNodePolicy() { return criticalNodePolicy; }
    public double getHighImpactThreshold()     { return highImpactThreshold; }
    public ConflictPolicy getConflictPolicy()  { return conflictPolicy; }
    public double getCentralityWeight()        { return centralityWeight; }
    public double getImpactWeight()            { return impactWeight; }
    public int getMaxCascades()                { return maxCascades; }

    public double weightOf(EdgeKind kind) {
        return edgeWeights.get(kind);
    }

    /**
     * Re-checks every setting. Builders already call this; callers that receive a
     * config from elsewhere can use it to fail fast before starting work.
     *
     * @throws ConfigurationException listing every invalid setting
     */
    public void validate() {
        toBuilder().build();
    }

    @Override
    public String toString() {
        return "AnalysisConfig{damping=" + dampingFactor + ", epsilon=" + convergenceEpsilon
                + ", maxIterations=" + maxIterations + ", decay=" + decayFactor
                + ", maxDepth=" + maxDepth + ", topK=" + topK + ", tokenBudget=" + tokenBudget
                + ", edgeWeights=" + edgeWeights + ", critical=" + criticalNodePolicy
                + ", conflictPolicy=" + conflictPolicy + "}";
    }

    public static final class Builder {

        private double dampingFactor = DEFAULT_DAMPING_FACTOR;
        private double convergenceEpsilon = DEFAULT_CONVERGENCE_EPSILON;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double decayFactor = DEFAULT_DECAY_FACTOR;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int topK = DEFAULT_TOP_K;
        private int tokenBudget = DEFAULT_TOKEN_BUDGET;
        private final Map<EdgeKind, Double> edgeWeights = defaultEdgeWeights();
        private CriticalNodePolicy criticalNodePolicy = CriticalNodePolicy.defaults();
        private double highImpactThreshold = DEFAULT_HIGH_IMPACT_THRESHOLD;
        private ConflictPolicy conflictPolicy = ConflictPolicy.FIRST_WINS;
        private double centralityWeight = DEFAULT_CENTRALITY_WEIGHT;
        private double impactWeight = DEFAULT_IMPACT_WEIGHT;
        private int maxCascades = DEFAULT_MAX_CASCADES;

        private Builder() {}

        public Builder dampingFactor(double v)      { this.dampingFactor = v; return this; }
        public Builder convergenceEpsilon(double v) { this.convergenceEpsilon = v; return this; }
        public Builder maxIterations(int v)         { this.maxIterations = v; return this; }
        public Builder decayFactor(double v)        { this.decayFactor = v; return this; }
        public Builder maxDepth(int v)              { this.maxDepth = v; return this; }
        public Builder topK(int v)                  { this.topK = v; return this; }
        public Builder tokenBudget(int v)           { this.tokenBudget = v; return this; }
        public Builder highImpactThreshold(double v) { this.highImpactThreshold = v; return this; }
        public Builder centralityWeight(double v)   { this.centralityWeight = v; return this; }
        public Builder impactWeight(double v)       { this.impactWeight = v; return this; }
        public Builder maxCascades(int v)           { this.maxCascades = v; return this; }

        public Builder edgeWeight(EdgeKind kind, double weight) {
            edgeWeights.put(kind, weight);
            return this;
        }

        public Builder criticalNodePolicy(CriticalNodePolicy policy) {
            this.criticalNodePolicy = policy;
            return this;
        }

        public Builder conflictPolicy(ConflictPolicy policy) {
            this.conflictPolicy = policy;
            return this;
        }

        /**
         * @throws ConfigurationException listing every invalid setting
         */
        public AnalysisConfig build() {
            List<String> errors = new ArrayList<>();

            if (!(dampingFactor > 0.0 && dampingFactor < 1.0)) {
                errors.add("damping factor must be in (0, 1), got " + dampingFactor);
            }
            if (!(convergenceEpsilon > 0.0)) {
                errors.add("convergence epsilon must be > 0, got " + convergenceEpsilon);
            }
            if (maxIterations < 1) {
                errors.add("max iterations must be >= 1, got " + maxIterations);
            }
            if (!(decayFactor > 0.0 && decayFactor <= 1.0)) {
                errors.add("decay factor must be in (0, 1], got " + decayFactor);
            }
            if (maxDepth < 0) {
                errors.add("max depth must be >= 0, got " + maxDepth);
            }
            if (topK < 1) {
                errors.add("top_k must be >= 1, got " + topK);
            }
            if (tokenBudget <= 0) {
                errors.add("token budget must be > 0, got " + tokenBudget);
            }
            for (EdgeKind kind : EdgeKind.values()) {
                Double w = edgeWeights.get(kind);
                if (w == null || !Double.isFinite(w) || w < 0.0) {
                    errors.add("edge weight for " + kind + " must be a finite value >= 0, got " + w);
                }
            }
            if (criticalNodePolicy == null || criticalNodePolicy.mode() == null) {
                errors.add("critical node policy is required");
            } else if (criticalNodePolicy.mode() == CriticalNodePolicy.Mode.STD_DEV
                    && !(criticalNodePolicy.value() >= 0.0 && Double.isFinite(criticalNodePolicy.value()))) {
                errors.add("critical node σ multiplier must be a finite value >= 0, got "
                        + criticalNodePolicy.value());
            } else if (criticalNodePolicy.mode() == CriticalNodePolicy.Mode.PERCENTILE
                    && !(criticalNodePolicy.value() > 0.0 && criticalNodePolicy.value() <= 1.0)) {
                errors.add("critical node percentile must be in (0, 1], got " + criticalNodePolicy.value());
            }
            if (!(highImpactThreshold >= 0.0 && highImpactThreshold <= 1.0)) {
                errors.add("high impact threshold must be in [0, 1], got " + highImpactThreshold);
            }
            if (conflictPolicy == null) {
                errors.add("conflict policy is required");
            }
            if (!(centralityWeight >= 0.0) || !(impactWeight >= 0.0)
                    || !Double.isFinite(centralityWeight) || !Double.isFinite(impactWeight)) {
                errors.add("ranking weights must be finite values >= 0, got centrality="
                        + centralityWeight + " impact=" + impactWeight);
            } else if (centralityWeight == 0.0 && impactWeight == 0.0) {
                errors.add("ranking weights must not both be 0");
            }
            if (maxCascades < 1) {
                errors.add("max cascades must be >= 1, got " + maxCascades);
            }

            if (!errors.isEmpty()) {
                throw new ConfigurationException("Invalid analysis configuration: " + String.join("; ", errors));
            }
            return new AnalysisConfig(this);
        }

        private static Map<EdgeKind, Double> defaultEdgeWeights() {
            Map<EdgeKind, Double> weights = new EnumMap<>(EdgeKind.class);
            weights.put(EdgeKind.CALLS, 1.0);
            weights.put(EdgeKind.CONTAINS, 0.5);
            weights.put(EdgeKind.IMPLEMENTS, 0.8);
            weights.put(EdgeKind.DEPENDS_ON, 0.8);
            return weights;
        }
    }

    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) { super(message); }
    }
}
