package com.e2eq.cnl.graph;

/**
 * Partial update of a node's descriptive fields. Null leaves a field unchanged and an empty
 * string clears it. Name and qualifier are part of the id and cannot be patched.
 */
public record NodePatch(NodeRole role,
                        String nodeType,
                        String description,
                        String quantifier) {
}
