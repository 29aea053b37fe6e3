package com.blastradius.engine.breaking;

/**
 * Kind of difference between the before and after version of an entity.
 */
public enum ChangeType {
    ADDED(false),
    REMOVED(true),
    SIGNATURE_CHANGED(true),
    VISIBILITY_REDUCED(true),
    VISIBILITY_WIDENED(false);

    private final boolean breaking;

    ChangeType(boolean breaking) {
        this.breaking = breaking;
    }

    /** Whether existing dependents can stop compiling or working because of this change. */
    public boolean isBreaking() {
        return breaking;
    }
}
