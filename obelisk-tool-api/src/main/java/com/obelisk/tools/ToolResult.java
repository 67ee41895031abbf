package com.obelisk.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a tool body returns from {@link Tool#execute}: success flag, data payload,
 * error message and metadata.
 */
public final class ToolResult {

    private final boolean success;
    private final Map<String, Object> data;
    private final String error;
    private final Map<String, Object> metadata;

    private ToolResult(boolean success, Map<String, Object> data, String error, Map<String, Object> metadata) {
        this.success = success;
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Collections.emptyMap();
        this.error = error;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public static ToolResult success(Map<String, Object> data) {
        return new ToolResult(true, data, null, null);
    }

    public static ToolResult success(Map<String, Object> data, Map<String, Object> metadata) {
        return new ToolResult(true, data, null, metadata);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null);
    }

    public static ToolResult failure(String error, Map<String, Object> metadata) {
        return new ToolResult(false, null, error, metadata);
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
