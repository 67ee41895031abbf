package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context passed to every tool call: session, user, requesting model, caller role,
 * conversation turn, free-form metadata, and (within sequential chains) results of earlier
 * successful calls keyed by tool name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolExecutionContext {

    private final String sessionId;
    private final String userId;
    private final String modelId;
    private final String role;
    private final int conversationTurn;
    private final Map<String, Object> metadata;
    private final Map<String, Map<String, Object>> previousResults;

    @JsonCreator
    public ToolExecutionContext(
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("userId") String userId,
            @JsonProperty("modelId") String modelId,
            @JsonProperty("role") String role,
            @JsonProperty("conversationTurn") int conversationTurn,
            @JsonProperty("metadata") Map<String, Object> metadata,
            @JsonProperty("previousResults") Map<String, Map<String, Object>> previousResults) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.modelId = modelId;
        this.role = role;
        this.conversationTurn = conversationTurn;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.previousResults = previousResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(previousResults))
                : Collections.emptyMap();
    }

    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    /** Copy carrying the given accumulated results of earlier calls. */
    public ToolExecutionContext withPreviousResults(Map<String, Map<String, Object>> results) {
        return new ToolExecutionContext(sessionId, userId, modelId, role, conversationTurn, metadata, results);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getModelId() {
        return modelId;
    }

    public String getRole() {
        return role;
    }

    public int getConversationTurn() {
        return conversationTurn;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Map<String, Object>> getPreviousResults() {
        return previousResults;
    }

    public static final class Builder {
        private final String sessionId;
        private String userId;
        private String modelId;
        private String role;
        private int conversationTurn;
        private Map<String, Object> metadata;

        private Builder(String sessionId) {
            this.sessionId = sessionId;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder conversationTurn(int conversationTurn) {
            this.conversationTurn = conversationTurn;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ToolExecutionContext build() {
            return new ToolExecutionContext(sessionId, userId, modelId, role, conversationTurn, metadata, null);
        }
    }
}
