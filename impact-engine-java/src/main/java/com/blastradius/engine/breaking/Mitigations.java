package com.blastradius.engine.breaking;

import java.util.List;

/**
 * Fixed follow-up suggestions per change type.
 */
public final class Mitigations {

    private Mitigations() {}

    public static List<String> forChange(ChangeType type, String qualifiedName) {
        return switch (type) {
            case REMOVED -> List.of(
                    "Mark '" + qualifiedName + "' as deprecated instead of removing it outright",
                    "Provide a compatibility shim or a migration guide",
                    "Make sure every caller has been updated");
            case SIGNATURE_CHANGED -> List.of(
                    "Keep a backward-compatible overload of '" + qualifiedName + "'",
                    "Migrate callers incrementally",
                    "Update related documentation and examples");
            case VISIBILITY_REDUCED -> List.of(
                    "Check that no caller outside the new scope still uses '" + qualifiedName + "'",
                    "Deprecate outside access before narrowing visibility");
            case ADDED, VISIBILITY_WIDENED -> List.of(
                    "Review whether '" + qualifiedName + "' should be part of the public surface");
        };
    }
}
