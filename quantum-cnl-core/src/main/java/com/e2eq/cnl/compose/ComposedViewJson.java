package com.e2eq.cnl.compose;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * JSON form of composed views and scores for presentation collaborators.
 */
public final class ComposedViewJson {
    private ComposedViewJson() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static String toJson(ComposedView view) {
        return write(view);
    }

    public static String toJson(GraphScore score) {
        return write(score);
    }

    public static ComposedView fromJson(String json) {
        try {
            return MAPPER.readValue(json, ComposedView.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid composed view JSON", e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
