package com.e2eq.cnl.schema;

import com.e2eq.cnl.schema.SchemaRegistry.*;

import java.util.*;

/**
 * Consistency checks for type definitions: reference integrity and cycle detection in the
 * node-type hierarchy.
 */
public final class SchemaDefinitionValidator {
    private SchemaDefinitionValidator() {}

    public static void validate(SchemaDefs defs) {
        if (defs == null) return;
        Map<String, NodeTypeDef> nodeTypes = defs.nodeTypes();

        for (NodeTypeDef t : nodeTypes.values()) {
            requireName(t.name(), "node type");
            for (String parent : t.parentTypes()) {
                require(nodeTypes.containsKey(parent), "Unknown node type '" + parent + "' in parents of " + t.name());
            }
        }

        for (RelationTypeDef r : defs.relationTypes().values()) {
            requireName(r.name(), "relation type");
            for (String d : r.domain()) {
                require(nodeTypes.containsKey(d), "Unknown node type '" + d + "' in domain of " + r.name());
            }
            for (String rg : r.range()) {
                require(nodeTypes.containsKey(rg), "Unknown node type '" + rg + "' in range of " + r.name());
            }
            if (r.symmetric()) {
                require(new HashSet<>(r.domain()).equals(new HashSet<>(r.range())),
                        "Symmetric relation '" + r.name() + "' must have the same domain and range");
            }
        }

        for (AttributeTypeDef a : defs.attributeTypes().values()) {
            requireName(a.name(), "attribute type");
            for (String allowed : a.allowedValues()) {
                require(a.dataType().accepts(allowed),
                        "Allowed value '" + allowed + "' of " + a.name() + " is not a valid " + a.dataType().jsonName());
            }
        }

        detectNodeTypeCycles(nodeTypes);
    }

    private static void detectNodeTypeCycles(Map<String, NodeTypeDef> nodeTypes) {
        for (String start : nodeTypes.keySet()) {
            Set<String> visited = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            visited.add(start);

            while (!stack.isEmpty()) {
                String current = stack.pop();
                NodeTypeDef def = nodeTypes.get(current);
                if (def == null) continue;

                for (String parent : def.parentTypes()) {
                    if (parent.equals(start)) {
                        throw new IllegalArgumentException("Cycle detected in node type hierarchy involving '" + start + "'");
                    }
                    if (!visited.contains(parent)) {
                        visited.add(parent);
                        stack.push(parent);
                    }
                }
            }
        }
    }

    private static void requireName(String name, String what) {
        require(name != null && !name.isBlank(), "A " + what + " must have a name");
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
