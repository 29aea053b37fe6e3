package com.blastradius.engine.breaking;

import com.blastradius.engine.graph.NodeKind;

import java.util.List;

/**
 * One classified difference between two versions of an entity.
 *
 * @param changeType      what changed
 * @param kind            entity kind
 * @param qualifiedName   entity name, shared by both versions
 * @param file            file of the after version, or of the before version when removed
 * @param beforeSignature signature before the edit, null when added
 * @param afterSignature  signature after the edit, null when removed
 * @param severity        severity per the classification table
 * @param description     human-readable explanation
 * @param mitigations     suggested follow-ups for this change type
 */
public record BreakingChange(
        ChangeType changeType,
        NodeKind kind,
        String qualifiedName,
        String file,
        String beforeSignature,
        String afterSignature,
        Severity severity,
        String description,
        List<String> mitigations
) {

    public BreakingChange {
        mitigations = mitigations == null ? List.of() : List.copyOf(mitigations);
    }

    public boolean isBreaking() {
        return changeType.isBreaking();
    }
}
