package com.blastradius.engine.propagation;

/**
 * Aggregate figures of one propagation run. Changed nodes are not counted as touched.
 */
public record ImpactStatistics(
        int totalTouched,
        int directCount,
        int indirectCount,
        int highImpactCount,
        int maxDistanceReached,
        double averageScore
) {

    public static ImpactStatistics empty() {
        return new ImpactStatistics(0, 0, 0, 0, 0, 0.0);
    }
}
