package com.blastradius.engine.cascade;

/**
 * Why a cascade path ends where it does.
 */
public enum TerminalClassification {
    /** The last node carries a breaking change of its own. */
    COMPOUND_BREAK,
    /** The last node is part of the public surface. */
    PUBLIC_API_EXPOSURE,
    /** The depth limit was reached while dependents remained. */
    DEPTH_LIMITED,
    /** The last node has no dependents left to visit. */
    CHAIN_END
}
