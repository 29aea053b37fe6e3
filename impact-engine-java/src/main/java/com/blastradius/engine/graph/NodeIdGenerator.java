package com.blastradius.engine.graph;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * Generates deterministic, stable node IDs following the convention:
 *   <file>#<declaration-ordinal>:<qualified-name>     (declared entity)
 *   external::<referenced-name>                      (unresolved reference)
 */
public final class NodeIdGenerator {

    static final String EXTERNAL_PREFIX = "external::";

    private NodeIdGenerator() {}

    public static String forEntity(String file, int ordinal, String qualifiedName) {
        return file + "#" + ordinal + ":" + qualifiedName;
    }

    public static String forExternal(String referencedName) {
        return EXTERNAL_PREFIX + referencedName;
    }

    /**
     * Produces an id not contained in {@code taken} by appending {@code ~2}, {@code ~3}, ...
     */
    static String disambiguate(String candidate, Set<String> taken) {
        if (!taken.contains(candidate)) return candidate;
        int suffix = 2;
        while (taken.contains(candidate + "~" + suffix)) {
            suffix++;
        }
        return candidate + "~" + suffix;
    }

    /**
     * Short SHA-256 prefix over signature, parameter list and return type.
     * Two entities with equal fingerprints are treated as signature-compatible.
     */
    public static String fingerprint(String signature, List<String> parameters, String returnType) {
        String canonical = normalize(signature) + "|" + String.join(",", parameters.stream()
                .map(NodeIdGenerator::normalize).toList()) + "|" + normalize(returnType);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Collapses runs of whitespace so formatting-only edits do not count as changes. */
    static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }

    /**
     * Last segment of a qualified name, split on '.', "::", '#', '/' or '\'.
     */
    public static String simpleName(String qualifiedName) {
        String name = qualifiedName;
        int cut = Math.max(
                Math.max(name.lastIndexOf('.'), name.lastIndexOf('#')),
                Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')));
        int colons = name.lastIndexOf("::");
        if (colons >= 0 && colons + 1 > cut) {
            cut = colons + 1;
        }
        return cut >= 0 ? name.substring(cut + 1) : name;
    }
}
