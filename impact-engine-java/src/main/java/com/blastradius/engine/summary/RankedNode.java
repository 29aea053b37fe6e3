package com.blastradius.engine.summary;

import com.blastradius.engine.graph.NodeKind;

/**
 * A node picked for the summary.
 *
 * @param centrality normalized centrality in [0, 1]
 * @param impact     impact score in [0, 1]
 * @param rank       combined score the selection was ordered by
 * @param tokens     estimated token cost of the record
 */
public record RankedNode(
        String nodeId,
        NodeKind kind,
        String qualifiedName,
        String signature,
        double centrality,
        double impact,
        double rank,
        int tokens
) {}
