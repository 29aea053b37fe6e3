package com.blastradius.engine.breaking;

/**
 * Severity of a change, declared from most to least severe.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    public boolean isMoreSevereThan(Severity other) {
        return ordinal() < other.ordinal();
    }
}
