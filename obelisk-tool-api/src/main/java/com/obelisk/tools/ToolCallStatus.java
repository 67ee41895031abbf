package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Lifecycle status of a tool call. Terminal statuses are COMPLETED, FAILED, TIMEOUT and CANCELLED. */
public enum ToolCallStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ToolCallStatus fromWire(String value) {
        return ToolCallStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
