package com.e2eq.cnl.rest.models;

public record ResolveRequest(String name, String qualifier) {
}
