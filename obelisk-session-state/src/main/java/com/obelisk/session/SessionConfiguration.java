package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.obelisk.config.ObeliskConfig;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tool configuration of one session. Immutable; use {@link #toBuilder()} to derive a changed copy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SessionConfiguration {

    public static final int DEFAULT_MAX_CONCURRENT_TOOLS = 3;
    public static final double DEFAULT_TOOL_TIMEOUT_SECONDS = 30.0;
    public static final int DEFAULT_MAX_TOOL_RETRIES = 2;
    public static final int DEFAULT_CACHE_DURATION_MINUTES = 30;

    private final String sessionId;
    private final boolean enableTools;
    private final int maxConcurrentTools;
    private final double toolTimeoutSeconds;
    private final boolean autoRetryFailedTools;
    private final int maxToolRetries;
    private final boolean cacheToolResults;
    private final int cacheDurationMinutes;
    private final Set<String> allowedTools;
    private final Set<String> blockedTools;
    private final Map<String, Map<String, Object>> toolSpecificConfig;
    private final Map<String, Integer> rateLimits;
    private final long createdAt;
    private final long updatedAt;

    @JsonCreator
    public SessionConfiguration(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("enableTools") boolean enableTools,
            @JsonProperty("maxConcurrentTools") int maxConcurrentTools,
            @JsonProperty("toolTimeoutSeconds") double toolTimeoutSeconds,
            @JsonProperty("autoRetryFailedTools") boolean autoRetryFailedTools,
            @JsonProperty("maxToolRetries") int maxToolRetries,
            @JsonProperty("cacheToolResults") boolean cacheToolResults,
            @JsonProperty("cacheDurationMinutes") int cacheDurationMinutes,
            @JsonProperty("allowedTools") Set<String> allowedTools,
            @JsonProperty("blockedTools") Set<String> blockedTools,
            @JsonProperty("toolSpecificConfig") Map<String, Map<String, Object>> toolSpecificConfig,
            @JsonProperty("rateLimits") Map<String, Integer> rateLimits,
            @JsonProperty("createdAt") long createdAt,
            @JsonProperty("updatedAt") long updatedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        if (maxConcurrentTools <= 0) {
            throw new IllegalArgumentException("maxConcurrentTools must be positive");
        }
        if (toolTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("toolTimeoutSeconds must be positive");
        }
        if (maxToolRetries < 0) {
            throw new IllegalArgumentException("maxToolRetries must be >= 0");
        }
        if (cacheDurationMinutes <= 0) {
            throw new IllegalArgumentException("cacheDurationMinutes must be positive");
        }
        this.enableTools = enableTools;
        this.maxConcurrentTools = maxConcurrentTools;
        this.toolTimeoutSeconds = toolTimeoutSeconds;
        this.autoRetryFailedTools = autoRetryFailedTools;
        this.maxToolRetries = maxToolRetries;
        this.cacheToolResults = cacheToolResults;
        this.cacheDurationMinutes = cacheDurationMinutes;
        this.allowedTools = allowedTools != null ? Collections.unmodifiableSet(new LinkedHashSet<>(allowedTools)) : null;
        this.blockedTools = blockedTools != null ? Collections.unmodifiableSet(new LinkedHashSet<>(blockedTools)) : Set.of();
        this.toolSpecificConfig = toolSpecificConfig != null ? Collections.unmodifiableMap(new HashMap<>(toolSpecificConfig)) : Map.of();
        this.rateLimits = rateLimits != null ? Collections.unmodifiableMap(new HashMap<>(rateLimits)) : Map.of();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static SessionConfiguration defaults(String sessionId) {
        return builder(sessionId).build();
    }

    /** Session defaults taken from the worker configuration. */
    public static SessionConfiguration fromConfig(String sessionId, ObeliskConfig config) {
        return builder(sessionId)
                .maxConcurrentTools(config.getMaxConcurrentTools())
                .toolTimeoutSeconds(config.getToolTimeoutSeconds())
                .cacheDurationMinutes(config.getCacheDurationMinutes())
                .build();
    }

    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    public Builder toBuilder() {
        Builder b = new Builder(sessionId);
        b.enableTools = enableTools;
        b.maxConcurrentTools = maxConcurrentTools;
        b.toolTimeoutSeconds = toolTimeoutSeconds;
        b.autoRetryFailedTools = autoRetryFailedTools;
        b.maxToolRetries = maxToolRetries;
        b.cacheToolResults = cacheToolResults;
        b.cacheDurationMinutes = cacheDurationMinutes;
        b.allowedTools = allowedTools;
        b.blockedTools = blockedTools;
        b.toolSpecificConfig = toolSpecificConfig;
        b.rateLimits = rateLimits;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        return b;
    }

    /** Blocked tools are never allowed; a null allow-list admits every other tool. */
    public boolean isToolAllowed(String toolName) {
        if (blockedTools.contains(toolName)) {
            return false;
        }
        return allowedTools == null || allowedTools.contains(toolName);
    }

    public Map<String, Object> getToolConfig(String toolName) {
        return toolSpecificConfig.getOrDefault(toolName, Map.of());
    }

    /** Calls per minute allowed for the tool in this session, if limited. */
    public Optional<Integer> getRateLimit(String toolName) {
        return Optional.ofNullable(rateLimits.get(toolName));
    }

    SessionConfiguration forSession(String id, long now) {
        Builder b = toBuilder();
        b.sessionId = id;
        b.updatedAt = now;
        return b.build();
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isEnableTools() {
        return enableTools;
    }

    public int getMaxConcurrentTools() {
        return maxConcurrentTools;
    }

    public double getToolTimeoutSeconds() {
        return toolTimeoutSeconds;
    }

    public boolean isAutoRetryFailedTools() {
        return autoRetryFailedTools;
    }

    public int getMaxToolRetries() {
        return maxToolRetries;
    }

    public boolean isCacheToolResults() {
        return cacheToolResults;
    }

    public int getCacheDurationMinutes() {
        return cacheDurationMinutes;
    }

    public Set<String> getAllowedTools() {
        return allowedTools;
    }

    public Set<String> getBlockedTools() {
        return blockedTools;
    }

    public Map<String, Map<String, Object>> getToolSpecificConfig() {
        return toolSpecificConfig;
    }

    public Map<String, Integer> getRateLimits() {
        return rateLimits;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "SessionConfiguration{sessionId='" + sessionId + "', enableTools=" + enableTools
                + ", maxConcurrentTools=" + maxConcurrentTools + ", allowedTools=" + allowedTools
                + ", blockedTools=" + blockedTools + '}';
    }

    public static final class Builder {
        private String sessionId;
        private boolean enableTools = true;
        private int maxConcurrentTools = DEFAULT_MAX_CONCURRENT_TOOLS;
        private double toolTimeoutSeconds = DEFAULT_TOOL_TIMEOUT_SECONDS;
        private boolean autoRetryFailedTools = true;
        private int maxToolRetries = DEFAULT_MAX_TOOL_RETRIES;
        private boolean cacheToolResults = true;
        private int cacheDurationMinutes = DEFAULT_CACHE_DURATION_MINUTES;
        private Set<String> allowedTools;
        private Set<String> blockedTools;
        private Map<String, Map<String, Object>> toolSpecificConfig;
        private Map<String, Integer> rateLimits;
        private long createdAt = System.currentTimeMillis();
        private long updatedAt = createdAt;

        private Builder(String sessionId) {
            this.sessionId = sessionId;
        }

        public Builder enableTools(boolean enableTools) {
            this.enableTools = enableTools;
            return this;
        }

        public Builder maxConcurrentTools(int maxConcurrentTools) {
            this.maxConcurrentTools = maxConcurrentTools;
            return this;
        }

        public Builder toolTimeoutSeconds(double toolTimeoutSeconds) {
            this.toolTimeoutSeconds = toolTimeoutSeconds;
            return this;
        }

        public Builder autoRetryFailedTools(boolean autoRetryFailedTools) {
            this.autoRetryFailedTools = autoRetryFailedTools;
            return this;
        }

        public Builder maxToolRetries(int maxToolRetries) {
            this.maxToolRetries = maxToolRetries;
            return this;
        }

        public Builder cacheToolResults(boolean cacheToolResults) {
            this.cacheToolResults = cacheToolResults;
            return this;
        }

        public Builder cacheDurationMinutes(int cacheDurationMinutes) {
            this.cacheDurationMinutes = cacheDurationMinutes;
            return this;
        }

        /** Null admits every tool that is not blocked. */
        public Builder allowedTools(Set<String> allowedTools) {
            this.allowedTools = allowedTools;
            return this;
        }

        public Builder blockedTools(Set<String> blockedTools) {
            this.blockedTools = blockedTools;
            return this;
        }

        public Builder toolConfig(String toolName, Map<String, Object> config) {
            Map<String, Map<String, Object>> copy = toolSpecificConfig != null ? new HashMap<>(toolSpecificConfig) : new HashMap<>();
            copy.put(toolName, Map.copyOf(config));
            this.toolSpecificConfig = copy;
            return this;
        }

        public Builder rateLimit(String toolName, int callsPerMinute) {
            Map<String, Integer> copy = rateLimits != null ? new HashMap<>(rateLimits) : new HashMap<>();
            copy.put(toolName, callsPerMinute);
            this.rateLimits = copy;
            return this;
        }

        public SessionConfiguration build() {
            return new SessionConfiguration(sessionId, enableTools, maxConcurrentTools, toolTimeoutSeconds,
                    autoRetryFailedTools, maxToolRetries, cacheToolResults, cacheDurationMinutes,
                    allowedTools, blockedTools, toolSpecificConfig, rateLimits, createdAt, updatedAt);
        }
    }
}
