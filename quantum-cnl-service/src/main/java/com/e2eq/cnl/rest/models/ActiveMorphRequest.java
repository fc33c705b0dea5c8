package com.e2eq.cnl.rest.models;

public record ActiveMorphRequest(String morphId) {
}
