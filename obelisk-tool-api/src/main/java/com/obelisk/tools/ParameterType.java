package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a tool parameter. Serialized in lower case ("string", "integer", ...).
 */
public enum ParameterType {

    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParameterType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Parameter type must be non-blank");
        }
        return ParameterType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Whether the value has the Java shape this type maps to. Booleans are never numbers;
     * INTEGER accepts only whole-number boxed types.
     */
    public boolean accepts(Object value) {
        if (value == null) return false;
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte
                    || value instanceof java.math.BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof List;
            case OBJECT -> value instanceof Map;
        };
    }
}
