package com.blastradius.engine.graph;

/**
 * Size and shape figures of a graph.
 */
public record GraphStatistics(
        int nodeCount,
        int edgeCount,
        int externalNodeCount,
        double averageDegree,
        int cycleCount
) {}
