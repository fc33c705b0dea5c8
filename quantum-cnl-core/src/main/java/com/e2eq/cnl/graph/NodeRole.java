package com.e2eq.cnl.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeRole {
    INDIVIDUAL,
    CLASS,
    PROCESS,
    FUNCTION;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return INDIVIDUAL;
        }
        return NodeRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
