package com.e2eq.cnl.rest.models;

public record SchemaVersion(String version) {
}
