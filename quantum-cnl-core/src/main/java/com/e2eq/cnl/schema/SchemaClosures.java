package com.e2eq.cnl.schema;

import com.e2eq.cnl.schema.SchemaRegistry.*;

import java.util.*;

/**
 * Transitive closures over the node-type hierarchy and relation inverses.
 */
public final class SchemaClosures {
    private SchemaClosures() {}

    /**
     * Returns all ancestor node types of the given type (transitive closure of parentTypes).
     */
    public static Set<String> computeAncestors(String nodeTypeName, SchemaRegistry registry) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeTypeName);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            Optional<NodeTypeDef> def = registry.nodeType(current);
            if (def.isEmpty()) continue;

            for (String parent : def.get().parentTypes()) {
                if (result.add(parent)) {
                    queue.add(parent);
                }
            }
        }
        return result;
    }

    /**
     * Returns all descendant node types of the given type.
     */
    public static Set<String> computeDescendants(String nodeTypeName, SchemaRegistry registry) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeTypeName);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (NodeTypeDef t : registry.nodeTypes().values()) {
                if (t.parentTypes().contains(current) && result.add(t.name())) {
                    queue.add(t.name());
                }
            }
        }
        return result;
    }

    /**
     * Returns the inverse relation name of the given relation type.
     * Checks the direct declaration first, then a type declaring this one as its inverse.
     * A symmetric relation is its own inverse.
     */
    public static Optional<String> computeInverse(String relationName, SchemaRegistry registry) {
        Optional<RelationTypeDef> def = registry.relationType(relationName);
        if (def.isEmpty()) return Optional.empty();

        if (def.get().inverseName().isPresent()) {
            return def.get().inverseName();
        }
        if (def.get().symmetric()) {
            return Optional.of(relationName);
        }

        for (RelationTypeDef r : registry.relationTypes().values()) {
            if (r.inverseName().isPresent() && r.inverseName().get().equals(relationName)) {
                return Optional.of(r.name());
            }
        }
        return Optional.empty();
    }
}
