package com.obelisk.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obelisk.tools.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders tool definitions as function-calling JSON schemas for model prompts.
 */
public final class ToolSchemaExporter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolRegistry registry;

    public ToolSchemaExporter(ToolRegistry registry) {
        this.registry = registry;
    }

    /** Schemas of enabled tools, sorted by name. */
    public List<Map<String, Object>> schemas() {
        return schemas(registry.getDefinitions(true));
    }

    public static List<Map<String, Object>> schemas(List<ToolDefinition> definitions) {
        List<Map<String, Object>> out = new ArrayList<>(definitions.size());
        for (ToolDefinition d : definitions) {
            out.add(d.toFunctionSchema());
        }
        return out;
    }

    public String toJson() {
        return toJson(registry.getDefinitions(true));
    }

    public static String toJson(List<ToolDefinition> definitions) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(schemas(definitions));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool schemas: " + e.getOriginalMessage(), e);
        }
    }
}
