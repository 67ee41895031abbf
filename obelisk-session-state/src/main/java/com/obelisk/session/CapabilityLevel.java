package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Coarse classification of a model's tool-calling support. */
public enum CapabilityLevel {

    /** No tool calling. */
    NONE,
    /** Plain function calling. */
    BASIC,
    /** Tool calling with complex parameters. */
    ADVANCED,
    /** Tool chaining and multi-step workflows. */
    EXPERT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CapabilityLevel fromWire(String value) {
        return CapabilityLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
