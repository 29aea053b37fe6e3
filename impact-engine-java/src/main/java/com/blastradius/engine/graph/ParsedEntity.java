package com.blastradius.engine.graph;

import com.blastradius.engine.model.SummaryModel.SummaryEntity;

import java.util.List;

/**
 * A summary entity that passed validation, with its raw strings mapped onto
 * engine types. Shared by graph building and before/after diffing so both
 * read the extractor's output the same way.
 */
public record ParsedEntity(
        NodeKind kind,
        String qualifiedName,
        Visibility visibility,
        boolean exported,
        String signature,
        List<String> parameters,
        String returnType,
        String fingerprint,
        String container,
        SourceLocation location
) {

    public NodeKey key() {
        return new NodeKey(kind, qualifiedName);
    }

    public String file() {
        return location.file();
    }

    /**
     * Checks the fields every consumer relies on.
     *
     * @param entity      raw entity, may be null
     * @param summaryFile file of the enclosing summary, used when the entity has no location
     * @return a description of the first problem, or null when the entity is usable
     */
    public static String problemWith(SummaryEntity entity, String summaryFile) {
        if (entity == null) return "entity is null";
        if (entity.kind == null || entity.kind.isBlank()) return "missing kind";
        NodeKind kind = NodeKind.parse(entity.kind);
        if (kind == null) return "unknown kind '" + entity.kind + "'";
        if (kind == NodeKind.EXTERNAL) return "kind 'external' is reserved for unresolved references";
        if (entity.qualifiedName == null || entity.qualifiedName.isBlank()) return "missing qualified_name";
        if (fileOf(entity, summaryFile) == null) return "no file in location or summary";
        return null;
    }

    /**
     * Maps a valid entity. Call {@link #problemWith} first.
     */
    public static ParsedEntity parse(SummaryEntity entity, String summaryFile) {
        NodeKind kind = NodeKind.parse(entity.kind);
        String qualifiedName = entity.qualifiedName.trim();
        Visibility visibility = Visibility.parse(entity.visibility);
        boolean exported = entity.exported != null ? entity.exported : visibility == Visibility.PUBLIC;
        List<String> parameters = entity.getParameters().stream()
                .map(p -> p == null ? "" : NodeIdGenerator.normalize(p))
                .toList();
        String returnType = entity.returnType == null ? null : NodeIdGenerator.normalize(entity.returnType);
        String signature = displaySignature(qualifiedName, entity.signature, parameters, returnType);
        String fingerprint = NodeIdGenerator.fingerprint(entity.signature, parameters, returnType);

        int lineStart = entity.location != null ? entity.location.lineStart : 0;
        int lineEnd = entity.location != null ? entity.location.lineEnd : 0;
        SourceLocation location = new SourceLocation(fileOf(entity, summaryFile), lineStart, lineEnd);

        String container = entity.container == null || entity.container.isBlank() ? null : entity.container.trim();
        return new ParsedEntity(kind, qualifiedName, visibility, exported, signature, parameters,
                returnType, fingerprint, container, location);
    }

    private static String fileOf(SummaryEntity entity, String summaryFile) {
        if (entity.location != null && entity.location.file != null && !entity.location.file.isBlank()) {
            return entity.location.file.trim();
        }
        return summaryFile == null || summaryFile.isBlank() ? null : summaryFile.trim();
    }

    private static String displaySignature(String qualifiedName, String signature,
                                           List<String> parameters, String returnType) {
        String normalized = NodeIdGenerator.normalize(signature);
        if (!normalized.isEmpty()) return normalized;
        if (parameters.isEmpty() && returnType == null) return "";
        String base = NodeIdGenerator.simpleName(qualifiedName) + "(" + String.join(", ", parameters) + ")";
        return returnType == null ? base : base + " -> " + returnType;
    }
}
