package com.obelisk.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters or execution context failed validation. {@link #getErrors()} maps parameter
 * name to the violation message.
 */
public final class ToolValidationException extends ToolException {

    private final Map<String, String> errors;

    public ToolValidationException(String message, String toolName) {
        this(message, toolName, Collections.emptyMap());
    }

    public ToolValidationException(String message, String toolName, Map<String, String> errors) {
        super(message, toolName, errors.isEmpty() ? null : Map.of("validation_errors", new LinkedHashMap<>(errors)));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    @Override
    public ToolErrorKind getKind() {
        return ToolErrorKind.VALIDATION;
    }
}
