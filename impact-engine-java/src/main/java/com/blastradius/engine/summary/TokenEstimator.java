package com.blastradius.engine.summary;

import com.blastradius.engine.graph.Node;

/**
 * Estimates how many tokens a node's summary record costs.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(Node node);

    /** Text the default estimator measures: kind, qualified name and signature. */
    static String recordText(Node node) {
        String text = node.kind().name() + " " + node.qualifiedName();
        return node.signature().isEmpty() ? text : text + " " + node.signature();
    }

    /** About four characters per token, rounded up. */
    static TokenEstimator charsOverFour() {
        return node -> (recordText(node).length() + 3) / 4;
    }
}
