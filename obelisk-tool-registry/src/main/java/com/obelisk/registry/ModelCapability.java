package com.obelisk.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Capability of a language model as reported by a {@link ModelCapabilityResolver}.
 *
 * @param modelId           provider model id (e.g. "openai/gpt-4o")
 * @param name              display name
 * @param supportsToolCalls whether the model supports native tool calling
 * @param contextLength     context window in tokens
 */
public record ModelCapability(
        @JsonProperty("modelId") String modelId,
        @JsonProperty("name") String name,
        @JsonProperty("supportsToolCalls") boolean supportsToolCalls,
        @JsonProperty("contextLength") int contextLength) {

    @JsonCreator
    public ModelCapability {
        Objects.requireNonNull(modelId, "modelId");
        name = name != null && !name.isBlank() ? name : modelId;
        if (contextLength < 0) {
            throw new IllegalArgumentException("contextLength must be >= 0");
        }
    }
}
