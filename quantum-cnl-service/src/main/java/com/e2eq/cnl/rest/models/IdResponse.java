package com.e2eq.cnl.rest.models;

public record IdResponse(String id) {
}
