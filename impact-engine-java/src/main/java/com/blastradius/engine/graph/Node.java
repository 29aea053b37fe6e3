package com.blastradius.engine.graph;

/**
 * One code entity in the dependency graph.
 *
 * @param id            stable id, see {@link NodeIdGenerator}
 * @param kind          entity kind
 * @param qualifiedName fully qualified name as reported by the extractor
 * @param visibility    declared visibility
 * @param signature     normalized signature text, empty when unknown
 * @param fingerprint   short hash of the signature, parameters and return type
 * @param location      declaration site
 * @param exported      whether the entity is part of the public surface
 */
public record Node(
        String id,
        NodeKind kind,
        String qualifiedName,
        Visibility visibility,
        String signature,
        String fingerprint,
        SourceLocation location,
        boolean exported
) {

    public NodeKey key() {
        return new NodeKey(kind, qualifiedName);
    }

    public boolean isExternal() {
        return kind == NodeKind.EXTERNAL;
    }

    /** Copy of this node under another id. */
    Node withId(String newId) {
        return new Node(newId, kind, qualifiedName, visibility, signature, fingerprint, location, exported);
    }
}
