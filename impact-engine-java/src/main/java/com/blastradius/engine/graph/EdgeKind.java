package com.blastradius.engine.graph;

import java.util.Locale;

/**
 * Kind of a directed relationship. Direction is always dependent to dependency:
 * caller to callee, container to member, implementor to interface.
 */
public enum EdgeKind {
    CALLS,
    CONTAINS,
    IMPLEMENTS,
    DEPENDS_ON;

    /**
     * @return the kind, or null when the value is missing or not recognized
     */
    public static EdgeKind parse(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "calls", "call", "invokes" -> CALLS;
            case "contains", "declares" -> CONTAINS;
            case "implements", "extends", "inherits" -> IMPLEMENTS;
            case "depends_on", "dependson", "imports", "uses", "references" -> DEPENDS_ON;
            default -> null;
        };
    }
}
