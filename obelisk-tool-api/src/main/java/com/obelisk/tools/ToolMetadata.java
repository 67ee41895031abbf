package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptive metadata of a tool: tags, category and model requirements.
 */
public record ToolMetadata(
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("category") ToolCategory category,
        @JsonProperty("modelRequirements") ModelRequirements modelRequirements) {

    @JsonCreator
    public ToolMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
        category = category != null ? category : ToolCategory.OTHER;
        modelRequirements = modelRequirements != null ? modelRequirements : ModelRequirements.toolCalling();
    }

    public static ToolMetadata of(ToolCategory category, String... tags) {
        return new ToolMetadata(List.of(tags), category, null);
    }

    public static ToolMetadata empty() {
        return new ToolMetadata(null, null, null);
    }
}
