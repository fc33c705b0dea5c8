package com.e2eq.cnl.rest.models;

/**
 * Edge reference operation. {@code toMorphId} is ignored by unlist.
 */
public record RefRequest(String edgeId, String fromMorphId, String toMorphId) {
}
