package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.obelisk.registry.ModelCapability;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Capability of the model active in a session.
 *
 * @param modelId            model id
 * @param supportsToolCalls  whether the model can call tools at all
 * @param capabilityLevel    coarse tool-calling level
 * @param maxToolsPerCall    tools offered to the model per request
 * @param maxParallelTools   tools the model may request in parallel
 * @param contextLength      context window in tokens
 * @param supportedToolTypes tool categories the model handles; empty means all
 */
public record ModelCapabilityInfo(
        @JsonProperty("modelId") String modelId,
        @JsonProperty("supportsToolCalls") boolean supportsToolCalls,
        @JsonProperty("capabilityLevel") CapabilityLevel capabilityLevel,
        @JsonProperty("maxToolsPerCall") int maxToolsPerCall,
        @JsonProperty("maxParallelTools") int maxParallelTools,
        @JsonProperty("contextLength") int contextLength,
        @JsonProperty("supportedToolTypes") Set<String> supportedToolTypes) {

    public static final int DEFAULT_MAX_TOOLS_PER_CALL = 10;
    public static final int DEFAULT_MAX_PARALLEL_TOOLS = 5;
    public static final int DEFAULT_CONTEXT_LENGTH = 4096;

    @JsonCreator
    public ModelCapabilityInfo {
        Objects.requireNonNull(modelId, "modelId");
        capabilityLevel = capabilityLevel != null ? capabilityLevel
                : (supportsToolCalls ? CapabilityLevel.BASIC : CapabilityLevel.NONE);
        maxToolsPerCall = maxToolsPerCall > 0 ? maxToolsPerCall : DEFAULT_MAX_TOOLS_PER_CALL;
        maxParallelTools = maxParallelTools > 0 ? maxParallelTools : DEFAULT_MAX_PARALLEL_TOOLS;
        contextLength = contextLength > 0 ? contextLength : DEFAULT_CONTEXT_LENGTH;
        supportedToolTypes = supportedToolTypes != null ? Set.copyOf(supportedToolTypes) : Set.of();
    }

    /** Capability of a model the catalog does not know: no tool calls. */
    public static ModelCapabilityInfo unknown(String modelId) {
        return new ModelCapabilityInfo(modelId, false, CapabilityLevel.NONE, 0, 0, 0, null);
    }

    /**
     * Derives session capability from a catalog entry. Tool-capable GPT-4 class models rank
     * ADVANCED, Claude 3 and Gemini models EXPERT, other tool-capable models BASIC.
     */
    public static ModelCapabilityInfo from(ModelCapability capability) {
        return new ModelCapabilityInfo(capability.modelId(), capability.supportsToolCalls(),
                levelOf(capability), 0, 0, capability.contextLength(), null);
    }

    static CapabilityLevel levelOf(ModelCapability capability) {
        if (!capability.supportsToolCalls()) {
            return CapabilityLevel.NONE;
        }
        String id = capability.modelId().toLowerCase(Locale.ROOT);
        if (id.contains("advanced") || id.contains("gpt-4")) {
            return CapabilityLevel.ADVANCED;
        }
        if (id.contains("claude-3") || id.contains("gemini")) {
            return CapabilityLevel.EXPERT;
        }
        return CapabilityLevel.BASIC;
    }

    public boolean supportsToolType(String toolType) {
        return supportedToolTypes.isEmpty() || supportedToolTypes.contains(toolType);
    }
}
