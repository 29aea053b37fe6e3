package com.blastradius.engine.graph;

/**
 * Identity of an entity across graphs and across before/after summaries.
 */
public record NodeKey(NodeKind kind, String qualifiedName) {

    @Override
    public String toString() {
        return kind + " " + qualifiedName;
    }
}
