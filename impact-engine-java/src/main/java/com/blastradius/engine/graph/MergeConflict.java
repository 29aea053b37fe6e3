package com.blastradius.engine.graph;

/**
 * Two definitions of the same entity that disagree on signature or visibility.
 *
 * @param key         shared identity
 * @param keptId      id of the node that stays in the graph
 * @param discardedId id of the definition that lost
 * @param policy      policy that decided the outcome
 */
public record MergeConflict(NodeKey key, String keptId, String discardedId, ConflictPolicy policy) {}
