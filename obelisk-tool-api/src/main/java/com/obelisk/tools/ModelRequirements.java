package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Predicates a model must satisfy to use a tool. Evaluated by the registry against the
 * capability reported for a model id.
 *
 * @param requiresToolCalls model must support native tool calling
 * @param minContextLength  minimum context window, 0 for none
 * @param modelFamilies     allowed model id prefixes (e.g. "openai/"); empty for any
 */
public record ModelRequirements(
        @JsonProperty("requiresToolCalls") boolean requiresToolCalls,
        @JsonProperty("minContextLength") int minContextLength,
        @JsonProperty("modelFamilies") Set<String> modelFamilies) {

    private static final ModelRequirements DEFAULT = new ModelRequirements(true, 0, Set.of());

    @JsonCreator
    public ModelRequirements {
        if (minContextLength < 0) {
            throw new IllegalArgumentException("minContextLength must be >= 0");
        }
        modelFamilies = modelFamilies != null ? Set.copyOf(modelFamilies) : Set.of();
    }

    /** Requires tool-call support and nothing else. */
    public static ModelRequirements toolCalling() {
        return DEFAULT;
    }

    public boolean isSatisfiedBy(String modelId, boolean supportsToolCalls, int contextLength) {
        if (requiresToolCalls && !supportsToolCalls) return false;
        if (contextLength < minContextLength) return false;
        if (modelFamilies.isEmpty()) return true;
        String id = Objects.requireNonNullElse(modelId, "").toLowerCase(Locale.ROOT);
        for (String family : modelFamilies) {
            if (id.startsWith(family.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
