package com.obelisk.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolDefinitionTest {

    @Test
    void builder_appliesDefaults() {
        ToolDefinition definition = ToolDefinition.builder("echo_text").description("Echo").build();

        assertEquals("1.0.0", definition.getVersion());
        assertEquals(30.0, definition.getTimeoutSeconds());
        assertEquals(PermissionLevel.PUBLIC, definition.getPermissions().getLevel());
        assertTrue(definition.getMetadata().modelRequirements().requiresToolCalls());
    }

    @Test
    void constructor_rejectsInvalidIdentifierName() {
        assertThrows(ToolConfigurationException.class, () -> ToolDefinition.builder("bad-name").build());
        assertThrows(ToolConfigurationException.class, () -> ToolDefinition.builder("1tool").build());
    }

    @Test
    void constructor_rejectsNonSemanticVersion() {
        assertThrows(ToolConfigurationException.class,
                () -> ToolDefinition.builder("tool").version("1.0").build());
        assertTrue(ToolDefinition.isSemanticVersion("2.10.3-beta.1"));
    }

    @Test
    void parameter_defaultMustMatchType() {
        assertThrows(ToolConfigurationException.class,
                () -> ToolParameter.builder("count", ParameterType.INTEGER).defaultValue("three").build());
        assertThrows(ToolConfigurationException.class,
                () -> ToolParameter.builder("flag", ParameterType.BOOLEAN).defaultValue(1).build());
    }

    @Test
    void parameter_nullEnumValueNamesParameter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToolParameter.builder("mode", ParameterType.STRING).enumValues("fast", null).build());

        assertEquals("Enum values of parameter 'mode' must not contain null", e.getMessage());
    }

    @Test
    void toFunctionSchema_listsRequiredParameters() {
        ToolDefinition definition = ToolDefinition.builder("calc")
                .description("Calc")
                .parameter(ToolParameter.builder("a", ParameterType.NUMBER).required(true).build())
                .parameter(ToolParameter.builder("b", ParameterType.NUMBER).build())
                .build();

        Map<String, Object> schema = definition.toFunctionSchema();

        assertEquals("function", schema.get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> function = (Map<String, Object>) schema.get("function");
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) function.get("parameters");
        assertEquals(List.of("a"), params.get("required"));
    }

    @Test
    void json_roundTripPreservesEquality() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ToolDefinition definition = ToolDefinition.builder("weather_lookup")
                .description("Weather")
                .version("2.1.0")
                .timeoutSeconds(5)
                .parameter(ToolParameter.builder("units", ParameterType.STRING)
                        .enumValues("celsius", "fahrenheit").defaultValue("celsius").build())
                .permissions(ToolPermissions.builder().maxCallsPerSession(2).build())
                .metadata(ToolMetadata.of(ToolCategory.INFORMATION, "weather"))
                .build();

        ToolDefinition copy = mapper.readValue(mapper.writeValueAsString(definition), ToolDefinition.class);

        assertEquals(definition, copy);
        assertFalse(copy.getParameters().get(0).isRequired());
    }
}
