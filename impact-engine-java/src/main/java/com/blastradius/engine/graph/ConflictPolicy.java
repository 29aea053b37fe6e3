package com.blastradius.engine.graph;

/**
 * Which definition survives when two entities share a kind and qualified name.
 */
public enum ConflictPolicy {
    /** The definition seen first is kept; later ones are recorded as conflicts. */
    FIRST_WINS,
    /** The definition seen last replaces the earlier one but keeps its node id. */
    LAST_WINS
}
