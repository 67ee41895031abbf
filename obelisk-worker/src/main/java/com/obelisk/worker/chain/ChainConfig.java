package com.obelisk.worker.chain;

import com.obelisk.config.ObeliskConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over a chain's configuration map. Values may arrive as JSON numbers, booleans or
 * strings; unparseable values fall back to the default. Immutable: {@link #merge} returns a copy.
 */
public final class ChainConfig {

    public static final String FAIL_FAST = "failFast";
    public static final String MAX_CONCURRENT = "maxConcurrent";
    public static final String TIMEOUT_PER_TOOL_SECONDS = "timeoutPerToolSeconds";
    public static final String RETRY_INITIAL_INTERVAL_MS = "retryInitialIntervalMs";
    public static final String RETRY_MAX_INTERVAL_MS = "retryMaxIntervalMs";
    public static final String RETRY_BACKOFF = "retryBackoff";
    public static final String MODEL = "model";
    public static final String ROLE = "role";
    public static final String FAIL_ON_DEPENDENCY_CYCLE = "failOnDependencyCycle";

    static final int DEFAULT_MAX_CONCURRENT = 5;
    static final int DEFAULT_TIMEOUT_PER_TOOL_SECONDS = 60;
    static final long DEFAULT_RETRY_INITIAL_INTERVAL_MS = 1000;
    static final long DEFAULT_RETRY_MAX_INTERVAL_MS = 10_000;
    static final double DEFAULT_RETRY_BACKOFF = 2.0;
    static final String DEFAULT_ROLE = "user";

    private final Map<String, Object> values;

    public ChainConfig(Map<String, Object> values) {
        this.values = values != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                : Collections.emptyMap();
    }

    /** Worker-level defaults for keys the request leaves unset. */
    public static Map<String, Object> defaultsFrom(ObeliskConfig config) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(MAX_CONCURRENT, config.getMaxConcurrentTools());
        defaults.put(TIMEOUT_PER_TOOL_SECONDS, config.getToolTimeoutSeconds());
        defaults.put(RETRY_INITIAL_INTERVAL_MS, config.getRetryInitialIntervalMs());
        return defaults;
    }

    public ChainConfig merge(Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        if (updates != null) merged.putAll(updates);
        return new ChainConfig(merged);
    }

    public boolean failFast() {
        return bool(FAIL_FAST, false);
    }

    public boolean failOnDependencyCycle() {
        return bool(FAIL_ON_DEPENDENCY_CYCLE, false);
    }

    public int maxConcurrent() {
        int n = (int) number(MAX_CONCURRENT, DEFAULT_MAX_CONCURRENT);
        return n > 0 ? n : DEFAULT_MAX_CONCURRENT;
    }

    public double timeoutPerToolSeconds() {
        double t = number(TIMEOUT_PER_TOOL_SECONDS, DEFAULT_TIMEOUT_PER_TOOL_SECONDS);
        return t > 0 ? t : DEFAULT_TIMEOUT_PER_TOOL_SECONDS;
    }

    public long retryInitialIntervalMs() {
        return Math.max(0L, (long) number(RETRY_INITIAL_INTERVAL_MS, DEFAULT_RETRY_INITIAL_INTERVAL_MS));
    }

    public long retryMaxIntervalMs() {
        return Math.max(retryInitialIntervalMs(), (long) number(RETRY_MAX_INTERVAL_MS, DEFAULT_RETRY_MAX_INTERVAL_MS));
    }

    public double retryBackoff() {
        double b = number(RETRY_BACKOFF, DEFAULT_RETRY_BACKOFF);
        return b >= 1.0 ? b : DEFAULT_RETRY_BACKOFF;
    }

    public String model() {
        Object v = values.get(MODEL);
        return v != null ? v.toString() : null;
    }

    public String role() {
        Object v = values.get(ROLE);
        return v != null ? v.toString() : DEFAULT_ROLE;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private boolean bool(String key, boolean fallback) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && !s.isBlank()) return Boolean.parseBoolean(s.trim());
        return fallback;
    }

    private double number(String key, double fallback) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    @Override
    public String toString() {
        return "ChainConfig" + values;
    }
}
