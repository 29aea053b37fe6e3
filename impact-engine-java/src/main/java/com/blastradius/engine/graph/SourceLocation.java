package com.blastradius.engine.graph;

/**
 * Where an entity is declared. Lines are 1-based, 0 when the extractor did not report them.
 */
public record SourceLocation(String file, int lineStart, int lineEnd) {

    public static SourceLocation unknown() {
        return new SourceLocation(null, 0, 0);
    }

    @Override
    public String toString() {
        return file == null ? "<unknown>" : file + ":" + lineStart;
    }
}
