package com.obelisk.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validates and normalizes call parameters against a {@link ToolDefinition}.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    /**
     * Type-checks every supplied parameter, enforces its constraints, rejects unknown names and
     * missing required parameters, and fills declared defaults for unset optional parameters.
     * All violations are collected before failing.
     *
     * @param definition tool definition
     * @param parameters supplied parameters (null treated as empty)
     * @return normalized parameters in definition order
     * @throws ToolValidationException with one entry per offending parameter
     */
    public static Map<String, Object> validate(ToolDefinition definition, Map<String, Object> parameters) {
        Map<String, Object> supplied = parameters != null ? parameters : Map.of();
        Map<String, String> errors = new LinkedHashMap<>();
        Map<String, Object> validated = new LinkedHashMap<>();

        for (String required : definition.requiredParameterNames()) {
            if (!supplied.containsKey(required)) {
                errors.put(required, String.format("Required parameter '%s' is missing", required));
            }
        }
        for (Map.Entry<String, Object> e : supplied.entrySet()) {
            Optional<ToolParameter> declared = definition.parameter(e.getKey());
            if (declared.isEmpty()) {
                errors.put(e.getKey(), String.format("Unknown parameter '%s'", e.getKey()));
                continue;
            }
            Optional<String> violation = declared.get().check(e.getValue());
            if (violation.isPresent()) {
                errors.put(e.getKey(), violation.get());
            }
        }
        if (!errors.isEmpty()) {
            throw new ToolValidationException(
                    String.format("Parameter validation failed for tool '%s'", definition.getName()),
                    definition.getName(), errors);
        }
        for (ToolParameter p : definition.getParameters()) {
            if (supplied.containsKey(p.getName())) {
                validated.put(p.getName(), supplied.get(p.getName()));
            } else if (!p.isRequired() && p.getDefaultValue() != null) {
                validated.put(p.getName(), p.getDefaultValue());
            }
        }
        return validated;
    }
}
