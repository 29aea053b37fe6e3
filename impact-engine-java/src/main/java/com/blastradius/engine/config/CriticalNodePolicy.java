package com.blastradius.engine.config;

/**
 * Rule deciding which centrality scores mark a node as critical.
 *
 * @param mode  how {@code value} is read
 * @param value σ multiplier for {@link Mode#STD_DEV}, fraction in (0, 1] for {@link Mode#PERCENTILE}
 */
public record CriticalNodePolicy(Mode mode, double value) {

    public enum Mode {
        /** Critical when score &gt; mean + value × standard deviation. */
        STD_DEV,
        /** Critical when score is at or above the value-th percentile and above the minimum score. */
        PERCENTILE
    }

    public static CriticalNodePolicy stdDev(double multiplier) {
        return new CriticalNodePolicy(Mode.STD_DEV, multiplier);
    }

    public static CriticalNodePolicy percentile(double fraction) {
        return new CriticalNodePolicy(Mode.PERCENTILE, fraction);
    }

    public static CriticalNodePolicy defaults() {
        return stdDev(1.0);
    }
}
