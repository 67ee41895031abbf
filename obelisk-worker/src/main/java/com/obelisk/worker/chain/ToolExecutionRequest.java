package com.obelisk.worker.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.obelisk.tools.ToolCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A chain submission. {@code conditions} and {@code dependencies} are keyed by call id;
 * a call without a condition always runs.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ToolExecutionRequest {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String executionId;
    private final String sessionId;
    private final List<ToolCall> toolCalls;
    private final ChainStrategy strategy;
    private final Map<String, Object> config;
    private final int timeoutSeconds;
    private final int maxRetries;
    private final Map<String, List<String>> dependencies;
    private final Map<String, ChainCondition> conditions;

    @JsonCreator
    public ToolExecutionRequest(
            @JsonProperty("executionId") String executionId,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("toolCalls") List<ToolCall> toolCalls,
            @JsonProperty("strategy") ChainStrategy strategy,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
            @JsonProperty("maxRetries") Integer maxRetries,
            @JsonProperty("dependencies") Map<String, List<String>> dependencies,
            @JsonProperty("conditions") Map<String, ChainCondition> conditions) {
        this.executionId = Objects.requireNonNull(executionId, "executionId");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        this.strategy = strategy != null ? strategy : ChainStrategy.SEQUENTIAL;
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Collections.emptyMap();
        this.timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        if (this.timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive");
        }
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        if (this.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Map<String, List<String>> deps = new LinkedHashMap<>();
        if (dependencies != null) {
            dependencies.forEach((k, v) -> deps.put(k, v != null ? List.copyOf(v) : List.of()));
        }
        this.dependencies = Collections.unmodifiableMap(deps);
        this.conditions = conditions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(conditions))
                : Collections.emptyMap();
    }

    /** Builder with a generated execution id. */
    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    public ChainStrategy getStrategy() {
        return strategy;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public Map<String, ChainCondition> getConditions() {
        return conditions;
    }

    public ChainCondition conditionFor(String callId) {
        ChainCondition c = conditions.get(callId);
        return c != null ? c : ChainCondition.always();
    }

    @Override
    public String toString() {
        return "ToolExecutionRequest{executionId='" + executionId + "', sessionId='" + sessionId
                + "', strategy=" + strategy + ", calls=" + toolCalls.size() + "}";
    }

    public static final class Builder {
        private String executionId;
        private final String sessionId;
        private final List<ToolCall> toolCalls = new ArrayList<>();
        private ChainStrategy strategy = ChainStrategy.SEQUENTIAL;
        private final Map<String, Object> config = new LinkedHashMap<>();
        private Integer timeoutSeconds;
        private Integer maxRetries;
        private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        private final Map<String, ChainCondition> conditions = new LinkedHashMap<>();

        private Builder(String sessionId) {
            this.sessionId = sessionId;
            this.executionId = "exec_" + UUID.randomUUID().toString().substring(0, 8);
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder call(ToolCall call) {
            toolCalls.add(call);
            return this;
        }

        /** Adds a call that runs only when the condition holds (conditional strategy). */
        public Builder call(ToolCall call, ChainCondition condition) {
            toolCalls.add(call);
            conditions.put(call.getId(), condition);
            return this;
        }

        public Builder strategy(ChainStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder config(String key, Object value) {
            config.put(key, value);
            return this;
        }

        public Builder config(Map<String, Object> values) {
            config.putAll(values);
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder dependsOn(String callId, String... prerequisites) {
            dependencies.put(callId, List.of(prerequisites));
            return this;
        }

        public ToolExecutionRequest build() {
            return new ToolExecutionRequest(executionId, sessionId, toolCalls, strategy, config,
                    timeoutSeconds, maxRetries, dependencies, conditions);
        }
    }
}
