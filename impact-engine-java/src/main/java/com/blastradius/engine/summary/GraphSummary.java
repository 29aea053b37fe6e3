package com.blastradius.engine.summary;

import java.util.List;

/**
 * Budget-constrained selection of the most relevant nodes.
 *
 * @param selected     chosen nodes, highest rank first
 * @param truncated    true whenever a candidate was left out
 * @param omittedCount number of candidates left out
 * @param budgetUsed   estimated tokens of the selection
 * @param budgetTotal  configured token budget
 * @param topK         configured cap on the number of records
 */
public record GraphSummary(
        List<RankedNode> selected,
        boolean truncated,
        int omittedCount,
        int budgetUsed,
        int budgetTotal,
        int topK
) {

    public GraphSummary {
        selected = List.copyOf(selected);
    }
}
