package com.e2eq.cnl.graph;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic identifiers for nodes, morphs, edges and transitions.
 * Equivalent display names always map to the same id, which is what makes node resolution
 * and edge upserts idempotent.
 */
public final class GraphIds {
    private GraphIds() {}

    public static final String EDGE_SEPARATOR = "::";
    public static final String BASIC_MORPH_NAME = "basic";

    private static final Pattern SEPARATOR_RUN = Pattern.compile("[\\s\\-_]+");

    /**
     * Trims, case-folds and collapses a display name into an id fragment.
     * Runs of whitespace, hyphens and underscores become a single underscore. Every other
     * character is kept, so {@code C}, {@code C++} and {@code C#} stay distinct.
     */
    public static String normalize(String name) {
        if (name == null) return "unnamed";
        String s = name.trim().toLowerCase(Locale.ROOT);
        s = SEPARATOR_RUN.matcher(s).replaceAll("_");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        s = s.substring(start, end);
        return s.isEmpty() ? "unnamed" : s;
    }

    /** Canonical relation type name: trimmed, lower case, whitespace runs joined by {@code _}. */
    public static String relationName(String name) {
        if (name == null) return null;
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    /** Collapses internal whitespace of a display string without changing case. */
    public static String tidy(String text) {
        if (text == null) return null;
        return text.trim().replaceAll("\\s+", " ");
    }

    public static String nodeId(String baseName, String qualifier) {
        String base = normalize(baseName);
        if (qualifier == null || qualifier.isBlank()) {
            return base;
        }
        return normalize(qualifier) + "_" + base;
    }

    /** Morph ids lead with the owning node id so morphs of different nodes never share one. */
    public static String morphId(String morphName, String nodeId) {
        return nodeId + EDGE_SEPARATOR + normalize(morphName);
    }

    public static String basicMorphId(String nodeId) {
        return morphId(BASIC_MORPH_NAME, nodeId);
    }

    public static String relationId(String sourceId, String relationName, String targetId) {
        return sourceId + EDGE_SEPARATOR + relationName + EDGE_SEPARATOR + targetId;
    }

    public static String attributeId(String ownerId, String attributeName) {
        return ownerId + EDGE_SEPARATOR + attributeName;
    }

    public static String transitionId(String name, String adjective) {
        if (adjective == null || adjective.isBlank()) {
            return normalize(name);
        }
        return normalize(adjective) + "_" + normalize(name);
    }
}
