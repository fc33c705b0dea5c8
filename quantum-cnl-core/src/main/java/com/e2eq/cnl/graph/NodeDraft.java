package com.e2eq.cnl.graph;

/**
 * Client input for creating a node explicitly. Only {@code name} is required.
 */
public record NodeDraft(String name,
                        String qualifier,
                        String quantifier,
                        NodeRole role,
                        String nodeType,
                        String description) {

    public static NodeDraft named(String name) {
        return new NodeDraft(name, null, null, null, null, null);
    }
}
