package com.e2eq.cnl.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SchemaTier {
    GLOBAL,
    USER;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SchemaTier fromString(String value) {
        return SchemaTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
