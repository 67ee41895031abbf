package com.obelisk.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterValidatorTest {

    private static final ToolDefinition DEFINITION = ToolDefinition.builder("lookup")
            .description("Test tool")
            .parameter(ToolParameter.builder("query", ParameterType.STRING).required(true).length(2, 10).build())
            .parameter(ToolParameter.builder("limit", ParameterType.INTEGER).range(1.0, 50.0).defaultValue(5).build())
            .parameter(ToolParameter.builder("mode", ParameterType.STRING).enumValues("fast", "full").defaultValue("fast").build())
            .parameter(ToolParameter.builder("code", ParameterType.STRING).pattern("[A-Z]{3}").build())
            .parameter(ToolParameter.builder("ids", ParameterType.ARRAY).length(1, 3).build())
            .parameter(ToolParameter.builder("verbose", ParameterType.BOOLEAN).build())
            .build();

    @Test
    void validate_appliesDefaultsForUnsetOptionalParameters() {
        Map<String, Object> validated = ParameterValidator.validate(DEFINITION, Map.of("query", "abc"));

        assertEquals("abc", validated.get("query"));
        assertEquals(5, validated.get("limit"));
        assertEquals("fast", validated.get("mode"));
        assertFalse(validated.containsKey("code"));
        assertFalse(validated.containsKey("verbose"));
    }

    @Test
    void validate_missingRequiredParameterFails() {
        ToolValidationException e = assertThrows(ToolValidationException.class,
                () -> ParameterValidator.validate(DEFINITION, Map.of("limit", 3)));

        assertTrue(e.getErrors().containsKey("query"));
        assertEquals(ToolErrorKind.VALIDATION, e.getKind());
    }

    @Test
    void validate_collectsEveryViolation() {
        ToolValidationException e = assertThrows(ToolValidationException.class,
                () -> ParameterValidator.validate(DEFINITION, Map.of(
                        "query", "x",
                        "limit", 100,
                        "mode", "slow",
                        "code", "ab",
                        "ids", List.of(),
                        "bogus", 1)));

        assertEquals(6, e.getErrors().size());
        assertEquals("Unknown parameter 'bogus'", e.getErrors().get("bogus"));
        assertEquals("String too short (min: 2)", e.getErrors().get("query"));
        assertEquals("Value too large (max: 50)", e.getErrors().get("limit"));
        assertEquals("Array too short (min: 1)", e.getErrors().get("ids"));
    }

    @Test
    void validate_rejectsWrongTypes() {
        ToolValidationException e = assertThrows(ToolValidationException.class,
                () -> ParameterValidator.validate(DEFINITION, Map.of(
                        "query", 12,
                        "limit", 2.5,
                        "verbose", "yes")));

        assertEquals("Expected string, got Integer", e.getErrors().get("query"));
        assertEquals("Expected integer, got Double", e.getErrors().get("limit"));
        assertEquals("Expected boolean, got String", e.getErrors().get("verbose"));
    }

    @Test
    void validate_patternMatchesFromStartOfValue() {
        Map<String, Object> validated = ParameterValidator.validate(DEFINITION,
                Map.of("query", "abc", "code", "ABCdef", "ids", List.of(1, 2), "verbose", true));

        assertEquals("ABCdef", validated.get("code"));
        assertEquals(List.of(1, 2), validated.get("ids"));
    }

    @Test
    void numberParameter_acceptsIntegersButNotBooleans() {
        ToolParameter number = ToolParameter.builder("a", ParameterType.NUMBER).build();

        assertTrue(number.check(3).isEmpty());
        assertTrue(number.check(3.5).isEmpty());
        assertTrue(number.check(true).isPresent());
    }
}
