package com.obelisk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the Obelisk tool worker.
 * <p>
 * Queue names: OBELISK_TASK_QUEUE (comma-separated). If OBELISK_IS_DEBUG_ENABLED is true,
 * each queue also gets a -debug variant. Temporal: OBELISK_TEMPORAL_TARGET, OBELISK_TEMPORAL_NAMESPACE.
 * <p>
 * Tool and session defaults: OBELISK_MAX_CONCURRENT_TOOLS, OBELISK_TOOL_TIMEOUT_SECONDS,
 * OBELISK_CACHE_DURATION_MINUTES, OBELISK_SESSION_MAX_AGE_HOURS, OBELISK_TOOL_SNAPSHOT_TTL_MINUTES.
 * Chain defaults: OBELISK_CHAIN_TIMEOUT_SECONDS, OBELISK_CHAIN_MAX_RETRIES, OBELISK_RETRY_INITIAL_INTERVAL_MS.
 * Model catalog: OBELISK_MODELS_FILE (falls back to the bundled classpath catalog).
 */
public final class ObeliskConfig {

    private static final Logger log = LoggerFactory.getLogger(ObeliskConfig.class);

    static final String ENV_TASK_QUEUE = "OBELISK_TASK_QUEUE";
    static final String ENV_IS_DEBUG_ENABLED = "OBELISK_IS_DEBUG_ENABLED";
    static final String ENV_TEMPORAL_TARGET = "OBELISK_TEMPORAL_TARGET";
    static final String ENV_TEMPORAL_NAMESPACE = "OBELISK_TEMPORAL_NAMESPACE";
    static final String ENV_MAX_CONCURRENT_TOOLS = "OBELISK_MAX_CONCURRENT_TOOLS";
    static final String ENV_TOOL_TIMEOUT_SECONDS = "OBELISK_TOOL_TIMEOUT_SECONDS";
    static final String ENV_CACHE_DURATION_MINUTES = "OBELISK_CACHE_DURATION_MINUTES";
    static final String ENV_SESSION_MAX_AGE_HOURS = "OBELISK_SESSION_MAX_AGE_HOURS";
    static final String ENV_TOOL_SNAPSHOT_TTL_MINUTES = "OBELISK_TOOL_SNAPSHOT_TTL_MINUTES";
    static final String ENV_CHAIN_TIMEOUT_SECONDS = "OBELISK_CHAIN_TIMEOUT_SECONDS";
    static final String ENV_CHAIN_MAX_RETRIES = "OBELISK_CHAIN_MAX_RETRIES";
    static final String ENV_RETRY_INITIAL_INTERVAL_MS = "OBELISK_RETRY_INITIAL_INTERVAL_MS";
    static final String ENV_MODELS_FILE = "OBELISK_MODELS_FILE";

    private static final String DEBUG_QUEUE_SUFFIX = "-debug";
    public static final String DEFAULT_TASK_QUEUE = "obelisk-task-queue";
    public static final String DEFAULT_TEMPORAL_TARGET = "localhost:7233";
    public static final String DEFAULT_TEMPORAL_NAMESPACE = "default";
    private static final int DEFAULT_MAX_CONCURRENT_TOOLS = 3;
    private static final int DEFAULT_TOOL_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_CACHE_DURATION_MINUTES = 30;
    private static final int DEFAULT_SESSION_MAX_AGE_HOURS = 24;
    private static final int DEFAULT_TOOL_SNAPSHOT_TTL_MINUTES = 60;
    private static final int DEFAULT_CHAIN_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_CHAIN_MAX_RETRIES = 3;
    private static final long DEFAULT_RETRY_INITIAL_INTERVAL_MS = 1000L;

    private final List<String> taskQueues;
    private final boolean debugQueueEnabled;
    private final String temporalTarget;
    private final String temporalNamespace;
    private final int maxConcurrentTools;
    private final int toolTimeoutSeconds;
    private final int cacheDurationMinutes;
    private final int sessionMaxAgeHours;
    private final int toolSnapshotTtlMinutes;
    private final int chainTimeoutSeconds;
    private final int chainMaxRetries;
    private final long retryInitialIntervalMs;
    private final String modelsFile;

    private ObeliskConfig(Builder b) {
        this.taskQueues = Collections.unmodifiableList(new ArrayList<>(b.taskQueues));
        this.debugQueueEnabled = b.debugQueueEnabled;
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.maxConcurrentTools = requirePositive(b.maxConcurrentTools, ENV_MAX_CONCURRENT_TOOLS);
        this.toolTimeoutSeconds = requirePositive(b.toolTimeoutSeconds, ENV_TOOL_TIMEOUT_SECONDS);
        this.cacheDurationMinutes = requirePositive(b.cacheDurationMinutes, ENV_CACHE_DURATION_MINUTES);
        this.sessionMaxAgeHours = requirePositive(b.sessionMaxAgeHours, ENV_SESSION_MAX_AGE_HOURS);
        this.toolSnapshotTtlMinutes = requirePositive(b.toolSnapshotTtlMinutes, ENV_TOOL_SNAPSHOT_TTL_MINUTES);
        this.chainTimeoutSeconds = requirePositive(b.chainTimeoutSeconds, ENV_CHAIN_TIMEOUT_SECONDS);
        if (b.chainMaxRetries < 0) {
            throw new IllegalArgumentException(ENV_CHAIN_MAX_RETRIES + " must be >= 0");
        }
        this.chainMaxRetries = b.chainMaxRetries;
        if (b.retryInitialIntervalMs < 0) {
            throw new IllegalArgumentException(ENV_RETRY_INITIAL_INTERVAL_MS + " must be >= 0");
        }
        this.retryInitialIntervalMs = b.retryInitialIntervalMs;
        this.modelsFile = b.modelsFile;
    }

    /** Reads the process environment. */
    public static ObeliskConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds a config from an environment-style map (keys are the OBELISK_* variable names).
     * Missing, blank or unparseable values fall back to defaults.
     */
    public static ObeliskConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> baseQueues = parseCommaSeparated(env.get(ENV_TASK_QUEUE));
        if (baseQueues.isEmpty()) {
            baseQueues = List.of(DEFAULT_TASK_QUEUE);
        }
        boolean isDebug = parseBoolean(env.get(ENV_IS_DEBUG_ENABLED), false);
        List<String> allQueues = new ArrayList<>(baseQueues);
        if (isDebug) {
            for (String q : baseQueues) {
                allQueues.add(q + DEBUG_QUEUE_SUFFIX);
            }
        }
        return builder()
                .taskQueues(allQueues)
                .debugQueueEnabled(isDebug)
                .temporalTarget(getOrDefault(env, ENV_TEMPORAL_TARGET, DEFAULT_TEMPORAL_TARGET))
                .temporalNamespace(getOrDefault(env, ENV_TEMPORAL_NAMESPACE, DEFAULT_TEMPORAL_NAMESPACE))
                .maxConcurrentTools(parseInt(env, ENV_MAX_CONCURRENT_TOOLS, DEFAULT_MAX_CONCURRENT_TOOLS))
                .toolTimeoutSeconds(parseInt(env, ENV_TOOL_TIMEOUT_SECONDS, DEFAULT_TOOL_TIMEOUT_SECONDS))
                .cacheDurationMinutes(parseInt(env, ENV_CACHE_DURATION_MINUTES, DEFAULT_CACHE_DURATION_MINUTES))
                .sessionMaxAgeHours(parseInt(env, ENV_SESSION_MAX_AGE_HOURS, DEFAULT_SESSION_MAX_AGE_HOURS))
                .toolSnapshotTtlMinutes(parseInt(env, ENV_TOOL_SNAPSHOT_TTL_MINUTES, DEFAULT_TOOL_SNAPSHOT_TTL_MINUTES))
                .chainTimeoutSeconds(parseInt(env, ENV_CHAIN_TIMEOUT_SECONDS, DEFAULT_CHAIN_TIMEOUT_SECONDS))
                .chainMaxRetries(parseInt(env, ENV_CHAIN_MAX_RETRIES, DEFAULT_CHAIN_MAX_RETRIES))
                .retryInitialIntervalMs(parseInt(env, ENV_RETRY_INITIAL_INTERVAL_MS, (int) DEFAULT_RETRY_INITIAL_INTERVAL_MS))
                .modelsFile(getOrDefault(env, ENV_MODELS_FILE, null))
                .build();
    }

    public static ObeliskConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * All task queue names this worker should poll: base queues from OBELISK_TASK_QUEUE,
     * and if OBELISK_IS_DEBUG_ENABLED is true, also each base queue with "-debug" suffix.
     */
    public List<String> getTaskQueues() {
        return taskQueues;
    }

    public boolean isDebugQueueEnabled() {
        return debugQueueEnabled;
    }

    /** Temporal frontend address. Default {@value #DEFAULT_TEMPORAL_TARGET}. */
    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    /** Default per-session tool concurrency and default chain batch concurrency. Default 3. */
    public int getMaxConcurrentTools() {
        return maxConcurrentTools;
    }

    /** Default per-tool timeout for sessions. Default 30. */
    public int getToolTimeoutSeconds() {
        return toolTimeoutSeconds;
    }

    /** TTL of a session's tool-availability entries. Default 30. */
    public int getCacheDurationMinutes() {
        return cacheDurationMinutes;
    }

    /** Age after which untouched sessions are purged. Default 24. */
    public int getSessionMaxAgeHours() {
        return sessionMaxAgeHours;
    }

    /** TTL of the coordinator's per-session tool snapshot. Default 60. */
    public int getToolSnapshotTtlMinutes() {
        return toolSnapshotTtlMinutes;
    }

    /** Global chain timeout when a request does not set one. Default 300. */
    public int getChainTimeoutSeconds() {
        return chainTimeoutSeconds;
    }

    public int getChainMaxRetries() {
        return chainMaxRetries;
    }

    /** First retry backoff; doubles per attempt. Default 1000. */
    public long getRetryInitialIntervalMs() {
        return retryInitialIntervalMs;
    }

    /** Path of a JSON model catalog, or null to use the bundled one. */
    public String getModelsFile() {
        return modelsFile;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}; using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String getOrDefault(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> taskQueues = List.of(DEFAULT_TASK_QUEUE);
        private boolean debugQueueEnabled;
        private String temporalTarget = DEFAULT_TEMPORAL_TARGET;
        private String temporalNamespace = DEFAULT_TEMPORAL_NAMESPACE;
        private int maxConcurrentTools = DEFAULT_MAX_CONCURRENT_TOOLS;
        private int toolTimeoutSeconds = DEFAULT_TOOL_TIMEOUT_SECONDS;
        private int cacheDurationMinutes = DEFAULT_CACHE_DURATION_MINUTES;
        private int sessionMaxAgeHours = DEFAULT_SESSION_MAX_AGE_HOURS;
        private int toolSnapshotTtlMinutes = DEFAULT_TOOL_SNAPSHOT_TTL_MINUTES;
        private int chainTimeoutSeconds = DEFAULT_CHAIN_TIMEOUT_SECONDS;
        private int chainMaxRetries = DEFAULT_CHAIN_MAX_RETRIES;
        private long retryInitialIntervalMs = DEFAULT_RETRY_INITIAL_INTERVAL_MS;
        private String modelsFile;

        public Builder taskQueues(List<String> taskQueues) {
            this.taskQueues = Objects.requireNonNull(taskQueues, "taskQueues");
            return this;
        }

        public Builder debugQueueEnabled(boolean debugQueueEnabled) {
            this.debugQueueEnabled = debugQueueEnabled;
            return this;
        }

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget != null ? temporalTarget : DEFAULT_TEMPORAL_TARGET;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace != null ? temporalNamespace : DEFAULT_TEMPORAL_NAMESPACE;
            return this;
        }

        public Builder maxConcurrentTools(int maxConcurrentTools) {
            this.maxConcurrentTools = maxConcurrentTools;
            return this;
        }

        public Builder toolTimeoutSeconds(int toolTimeoutSeconds) {
            this.toolTimeoutSeconds = toolTimeoutSeconds;
            return this;
        }

        public Builder cacheDurationMinutes(int cacheDurationMinutes) {
            this.cacheDurationMinutes = cacheDurationMinutes;
            return this;
        }

        public Builder sessionMaxAgeHours(int sessionMaxAgeHours) {
            this.sessionMaxAgeHours = sessionMaxAgeHours;
            return this;
        }

        public Builder toolSnapshotTtlMinutes(int toolSnapshotTtlMinutes) {
            this.toolSnapshotTtlMinutes = toolSnapshotTtlMinutes;
            return this;
        }

        public Builder chainTimeoutSeconds(int chainTimeoutSeconds) {
            this.chainTimeoutSeconds = chainTimeoutSeconds;
            return this;
        }

        public Builder chainMaxRetries(int chainMaxRetries) {
            this.chainMaxRetries = chainMaxRetries;
            return this;
        }

        public Builder retryInitialIntervalMs(long retryInitialIntervalMs) {
            this.retryInitialIntervalMs = retryInitialIntervalMs;
            return this;
        }

        public Builder modelsFile(String modelsFile) {
            this.modelsFile = modelsFile;
            return this;
        }

        public ObeliskConfig build() {
            return new ObeliskConfig(this);
        }
    }
}
