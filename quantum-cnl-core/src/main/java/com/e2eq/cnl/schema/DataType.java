package com.e2eq.cnl.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;

/**
 * Value domain of an attribute type.
 */
public enum DataType {
    STRING,
    NUMBER,
    BOOLEAN,
    FLOAT;

    /**
     * Whether the raw CNL value can be read as this data type.
     */
    public boolean accepts(String raw) {
        if (raw == null) return false;
        String v = raw.trim();
        switch (this) {
            case STRING:
                return true;
            case NUMBER:
                try {
                    new BigDecimal(v);
                    return true;
                } catch (NumberFormatException e) {
                    return false;
                }
            case FLOAT:
                try {
                    return Double.isFinite(Double.parseDouble(v));
                } catch (NumberFormatException e) {
                    return false;
                }
            case BOOLEAN:
                return toBoolean(v) != null;
            default:
                return false;
        }
    }

    /**
     * Converts an accepted raw value into its Java representation
     * ({@link String}, {@link BigDecimal}, {@link Double} or {@link Boolean}).
     *
     * @throws IllegalArgumentException when {@link #accepts(String)} is false
     */
    public Object coerce(String raw) {
        if (!accepts(raw)) {
            throw new IllegalArgumentException("Value '" + raw + "' is not a valid " + jsonName());
        }
        String v = raw.trim();
        switch (this) {
            case NUMBER:
                return new BigDecimal(v);
            case FLOAT:
                return Double.parseDouble(v);
            case BOOLEAN:
                return toBoolean(v);
            default:
                return raw;
        }
    }

    private static Boolean toBoolean(String v) {
        switch (v.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
                return Boolean.TRUE;
            case "false":
            case "no":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DataType fromString(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        try {
            return DataType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new IllegalArgumentException("Unknown data type '" + value + "'. Expected one of: "
                    + Arrays.toString(values()).toLowerCase(Locale.ROOT));
        }
    }
}
