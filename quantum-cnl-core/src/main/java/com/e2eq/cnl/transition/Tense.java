package com.e2eq.cnl.transition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Tense {
    PAST,
    PRESENT,
    FUTURE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Tense fromString(String value) {
        if (value == null || value.isBlank()) {
            return PRESENT;
        }
        return Tense.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
