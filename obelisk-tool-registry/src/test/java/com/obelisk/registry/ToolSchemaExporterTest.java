package com.obelisk.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ToolSchemaExporterTest {

    @Test
    void toJson_rendersEnabledToolsAsFunctionSchemas() throws Exception {
        ToolRegistry registry = new ToolRegistry(TestTools.models());
        registry.register(new TestTools.EchoTool("1.0.0"));
        registry.register(new TestTools.SlowTool());
        registry.disable("slow");

        JsonNode schemas = new ObjectMapper().readTree(new ToolSchemaExporter(registry).toJson());

        assertEquals(1, schemas.size());
        JsonNode function = schemas.get(0).get("function");
        assertEquals("function", schemas.get(0).get("type").asText());
        assertEquals("echo", function.get("name").asText());
        assertEquals("string", function.at("/parameters/properties/text/type").asText());
        assertEquals("text", function.at("/parameters/required/0").asText());
    }

    @Test
    void schemas_emptyRegistryGivesEmptyList() {
        List<Map<String, Object>> schemas = new ToolSchemaExporter(new ToolRegistry(TestTools.models())).schemas();

        assertEquals(List.of(), schemas);
    }
}
