package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Availability of one tool for one session. */
public enum ToolAvailabilityState {

    AVAILABLE,
    UNAVAILABLE,
    LOADING,
    ERROR,
    CACHED,
    EXPIRED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ToolAvailabilityState fromWire(String value) {
        return ToolAvailabilityState.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** AVAILABLE or CACHED; expiry is checked separately. */
    public boolean isUsable() {
        return this == AVAILABLE || this == CACHED;
    }
}
