package com.blastradius.engine.graph;

import java.util.Locale;

/**
 * Declared visibility, ordered from narrowest to widest by {@link #rank()}.
 * UNKNOWN has no rank and never compares as narrower or wider.
 */
public enum Visibility {
    PRIVATE(0),
    PACKAGE(1),
    INTERNAL(2),
    PROTECTED(3),
    PUBLIC(4),
    UNKNOWN(-1);

    private final int rank;

    Visibility(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public boolean isNarrowerThan(Visibility other) {
        return isKnown() && other.isKnown() && rank < other.rank;
    }

    public boolean isWiderThan(Visibility other) {
        return isKnown() && other.isKnown() && rank > other.rank;
    }

    public static Visibility parse(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "public", "pub", "exported", "export" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "internal", "pub(crate)", "crate" -> INTERNAL;
            case "package", "default", "package-private" -> PACKAGE;
            case "private" -> PRIVATE;
            default -> UNKNOWN;
        };
    }
}
