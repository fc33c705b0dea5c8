package com.e2eq.cnl.rest.models;

public record MorphRequest(String name, String seedFrom) {
}
