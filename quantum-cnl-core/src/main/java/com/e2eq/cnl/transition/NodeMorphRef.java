package com.e2eq.cnl.transition;

/**
 * A node in one of its states.
 */
public record NodeMorphRef(String nodeId, String morphId) {
}
