package com.blastradius.engine.propagation;

/**
 * A node reached by impact propagation.
 *
 * @param nodeId   the impacted node
 * @param distance hops from the nearest changed node, 0 for the changed nodes themselves
 * @param score    impact score in [0, 1]
 * @param via      node this one was reached through, null for changed nodes
 */
public record ImpactedNode(String nodeId, int distance, double score, String via) {

    public boolean isSource() {
        return distance == 0;
    }
}
