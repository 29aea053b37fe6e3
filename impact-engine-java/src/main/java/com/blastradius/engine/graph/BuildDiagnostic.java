package com.blastradius.engine.graph;

/**
 * Non-fatal problem found while building or merging a graph.
 *
 * @param category what went wrong
 * @param file     summary file the entry came from, null when not applicable
 * @param subject  the offending name or reference
 * @param message  human-readable explanation
 */
public record BuildDiagnostic(Category category, String file, String subject, String message) {

    public enum Category {
        MALFORMED_INPUT,
        UNRESOLVED_REFERENCE,
        AMBIGUOUS_REFERENCE,
        DUPLICATE_ENTITY
    }

    @Override
    public String toString() {
        return category + " [" + (file != null ? file : "-") + "] " + subject + ": " + message;
    }
}
