package com.blastradius.engine.cascade;

import com.blastradius.engine.breaking.BreakingChange;
import com.blastradius.engine.graph.EdgeKind;

import java.util.List;

/**
 * A chain of dependents through which a breaking change spreads.
 *
 * @param path       node ids from the changed node outwards, never repeating a node
 * @param edgeKinds  kind of each hop, one shorter than {@code path}
 * @param rootChange the change at {@code path.get(0)}
 * @param terminal   why the chain ends at its last node
 * @param strength   product of hop weights times decay per hop
 */
public record CascadeEffect(
        List<String> path,
        List<EdgeKind> edgeKinds,
        BreakingChange rootChange,
        TerminalClassification terminal,
        double strength
) {

    public CascadeEffect {
        path = List.copyOf(path);
        edgeKinds = List.copyOf(edgeKinds);
    }
}
