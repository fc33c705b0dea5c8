package com.e2eq.cnl.graph;

import java.util.Optional;

/**
 * Typed value held by a node, keyed by {@code owner::name}. Re-submitting the same attribute
 * name for the same owner replaces the value.
 */
public record AttributeEdge(String id,
                            String name,
                            String ownerId,
                            String value,
                            Optional<String> unit,
                            Optional<String> adverb,
                            Optional<String> modality,
                            Optional<String> quantifier) {

    public AttributeEdge {
        unit = Node.blankToEmpty(unit);
        adverb = Node.blankToEmpty(adverb);
        modality = Node.blankToEmpty(modality);
        quantifier = Node.blankToEmpty(quantifier);
        if (id == null) {
            id = GraphIds.attributeId(ownerId, name);
        }
    }

    public static AttributeEdge of(String ownerId, String name, String value) {
        return new AttributeEdge(null, name, ownerId, value, Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty());
    }
}
