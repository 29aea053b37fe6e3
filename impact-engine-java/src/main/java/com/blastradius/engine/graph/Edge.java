package com.blastradius.engine.graph;

/**
 * Directed, weighted relationship from a dependent to its dependency.
 */
public record Edge(String sourceId, String targetId, EdgeKind kind, double weight) {

    public boolean isSelfLoop() {
        return sourceId.equals(targetId);
    }

    /** (source, target, kind) triple used to collapse duplicate edges. */
    String dedupKey() {
        return sourceId + "→" + targetId + "→" + kind;
    }
}
