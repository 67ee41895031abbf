package com.obelisk.worker.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Declarative predicate evaluated against the results of earlier successful calls in a
 * conditional chain. Types: {@code always}, {@code never}, {@code success} (the tool has a
 * result), {@code failure} (it has none) and {@code value_equals} (a dot-path lookup into the
 * tool's result equals {@code value}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChainCondition {

    public static final String ALWAYS = "always";
    public static final String NEVER = "never";
    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";
    public static final String VALUE_EQUALS = "value_equals";

    private final String type;
    private final String tool;
    private final String path;
    private final Object value;

    @JsonCreator
    public ChainCondition(
            @JsonProperty("type") String type,
            @JsonProperty("tool") String tool,
            @JsonProperty("path") String path,
            @JsonProperty("value") Object value) {
        this.type = type != null ? type : ALWAYS;
        this.tool = tool;
        this.path = path;
        this.value = value;
    }

    public static ChainCondition always() {
        return new ChainCondition(ALWAYS, null, null, null);
    }

    public static ChainCondition never() {
        return new ChainCondition(NEVER, null, null, null);
    }

    public static ChainCondition succeeded(String tool) {
        return new ChainCondition(SUCCESS, tool, null, null);
    }

    public static ChainCondition failed(String tool) {
        return new ChainCondition(FAILURE, tool, null, null);
    }

    public static ChainCondition valueEquals(String tool, String path, Object value) {
        return new ChainCondition(VALUE_EQUALS, tool, path, value);
    }

    /**
     * @param accumulator results of earlier successful calls, keyed by tool name
     * @param log         receives a warning for an unknown type, which evaluates to true
     */
    public boolean evaluate(Map<String, Map<String, Object>> accumulator, Logger log) {
        switch (type) {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            case SUCCESS:
                return accumulator.containsKey(tool);
            case FAILURE:
                return !accumulator.containsKey(tool);
            case VALUE_EQUALS:
                Map<String, Object> result = accumulator.get(tool != null ? tool : "");
                if (result == null || result.isEmpty()) {
                    return false;
                }
                return sameValue(lookup(result, path), value);
            default:
                log.warn("Unknown condition type: {}", type);
                return true;
        }
    }

    /** Dot-path lookup; an empty path yields the whole map, a missing segment yields null. */
    static Object lookup(Map<String, Object> root, String path) {
        if (path == null || path.isEmpty()) {
            return root;
        }
        Object current = root;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            if (isIntegral(a) && isIntegral(e)) {
                return a.longValue() == e.longValue();
            }
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    public String getType() {
        return type;
    }

    public String getTool() {
        return tool;
    }

    public String getPath() {
        return path;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainCondition that)) return false;
        return type.equals(that.type) && Objects.equals(tool, that.tool)
                && Objects.equals(path, that.path) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, tool, path, value);
    }

    @Override
    public String toString() {
        return "ChainCondition{" + type + (tool != null ? ", tool=" + tool : "")
                + (path != null ? ", path=" + path : "") + (value != null ? ", value=" + value : "") + "}";
    }
}
