package com.e2eq.cnl.rest.models;

public record UnlistResponse(String edgeId, boolean purged) {
}
