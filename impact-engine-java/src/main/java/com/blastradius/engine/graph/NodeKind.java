package com.blastradius.engine.graph;

import java.util.Locale;

/**
 * Kind of code entity a node stands for.
 */
public enum NodeKind {
    FUNCTION,
    TYPE,
    INTERFACE,
    MODULE,
    /** Synthetic node for a reference no summary declares. */
    EXTERNAL;

    /**
     * Maps the extractor's kind vocabulary onto a node kind.
     *
     * @return the kind, or null when the value is missing or not recognized
     */
    public static NodeKind parse(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "function", "method", "constructor", "fn" -> FUNCTION;
            case "type", "class", "struct", "enum", "record" -> TYPE;
            case "interface", "trait", "protocol" -> INTERFACE;
            case "module", "package", "namespace", "file" -> MODULE;
            case "external" -> EXTERNAL;
            default -> null;
        };
    }
}
