package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One declared parameter of a tool: name, type, required flag, optional default and
 * type-specific constraints (value range for numbers, length for strings and arrays,
 * regex pattern for strings, allowed values for any type).
 * <p>
 * The default value, when present, must satisfy the declared type; construction fails otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolParameter {

    private final String name;
    private final ParameterType type;
    private final String description;
    private final boolean required;
    private final Object defaultValue;
    private final List<Object> enumValues;
    private final Double minValue;
    private final Double maxValue;
    private final Integer minLength;
    private final Integer maxLength;
    private final String pattern;
    @JsonIgnore
    private final Pattern compiledPattern;

    @JsonCreator
    public ToolParameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") ParameterType type,
            @JsonProperty("description") String description,
            @JsonProperty("required") boolean required,
            @JsonProperty("default") Object defaultValue,
            @JsonProperty("enum") List<Object> enumValues,
            @JsonProperty("minValue") Double minValue,
            @JsonProperty("maxValue") Double maxValue,
            @JsonProperty("minLength") Integer minLength,
            @JsonProperty("maxLength") Integer maxLength,
            @JsonProperty("pattern") String pattern) {
        this.name = Objects.requireNonNull(name, "name").trim();
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name must be non-blank");
        }
        this.type = Objects.requireNonNull(type, "type");
        this.description = description != null ? description : "";
        this.required = required;
        if (enumValues != null && enumValues.contains(null)) {
            throw new IllegalArgumentException(
                    String.format("Enum values of parameter '%s' must not contain null", this.name));
        }
        this.enumValues = enumValues != null ? Collections.unmodifiableList(List.copyOf(enumValues)) : null;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pattern = pattern;
        try {
            this.compiledPattern = pattern != null && !pattern.isEmpty() ? Pattern.compile(pattern) : null;
        } catch (PatternSyntaxException e) {
            throw new ToolConfigurationException(
                    String.format("Invalid pattern for parameter '%s': %s", this.name, e.getDescription()), null);
        }
        if (defaultValue != null && !type.accepts(defaultValue)) {
            throw new ToolConfigurationException(
                    String.format("Default value for parameter '%s' must be of type %s", this.name, type.wireName()), null);
        }
        this.defaultValue = defaultValue;
    }

    public static Builder builder(String name, ParameterType type) {
        return new Builder(name, type);
    }

    /**
     * Checks a supplied value against the declared type and constraints.
     *
     * @param value supplied value (never null for a present parameter)
     * @return the violation message, or empty when the value is acceptable
     */
    public Optional<String> check(Object value) {
        if (!type.accepts(value)) {
            String actual = value == null ? "null" : value.getClass().getSimpleName();
            return Optional.of(String.format("Expected %s, got %s", type.wireName(), actual));
        }
        switch (type) {
            case STRING -> {
                String s = (String) value;
                if (minLength != null && s.length() < minLength) {
                    return Optional.of("String too short (min: " + minLength + ")");
                }
                if (maxLength != null && s.length() > maxLength) {
                    return Optional.of("String too long (max: " + maxLength + ")");
                }
                if (compiledPattern != null && !compiledPattern.matcher(s).lookingAt()) {
                    return Optional.of("String does not match pattern: " + pattern);
                }
            }
            case INTEGER, NUMBER -> {
                double d = ((Number) value).doubleValue();
                if (minValue != null && d < minValue) {
                    return Optional.of("Value too small (min: " + formatBound(minValue) + ")");
                }
                if (maxValue != null && d > maxValue) {
                    return Optional.of("Value too large (max: " + formatBound(maxValue) + ")");
                }
            }
            case ARRAY -> {
                int size = ((List<?>) value).size();
                if (minLength != null && size < minLength) {
                    return Optional.of("Array too short (min: " + minLength + ")");
                }
                if (maxLength != null && size > maxLength) {
                    return Optional.of("Array too long (max: " + maxLength + ")");
                }
            }
            default -> {
                // BOOLEAN and OBJECT carry no constraints beyond type
            }
        }
        if (enumValues != null && !enumValues.isEmpty() && !containsEnumValue(value)) {
            return Optional.of("Value must be one of " + enumValues);
        }
        return Optional.empty();
    }

    private boolean containsEnumValue(Object value) {
        for (Object allowed : enumValues) {
            if (Objects.equals(allowed, value)) return true;
            if (allowed instanceof Number a && value instanceof Number v
                    && Double.compare(a.doubleValue(), v.doubleValue()) == 0) {
                return true;
            }
        }
        return false;
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }

    /** JSON-schema fragment for this parameter, as used in function-calling tool lists. */
    public Map<String, Object> toSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.wireName());
        schema.put("description", description);
        if (enumValues != null && !enumValues.isEmpty()) schema.put("enum", enumValues);
        if (minValue != null) schema.put("minimum", minValue);
        if (maxValue != null) schema.put("maximum", maxValue);
        if (minLength != null) schema.put("minLength", minLength);
        if (maxLength != null) schema.put("maxLength", maxLength);
        if (pattern != null) schema.put("pattern", pattern);
        return schema;
    }

    public String getName() {
        return name;
    }

    public ParameterType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRequired() {
        return required;
    }

    @JsonProperty("default")
    public Object getDefaultValue() {
        return defaultValue;
    }

    @JsonProperty("enum")
    public List<Object> getEnumValues() {
        return enumValues;
    }

    public Double getMinValue() {
        return minValue;
    }

    public Double getMaxValue() {
        return maxValue;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolParameter that)) return false;
        return required == that.required
                && name.equals(that.name)
                && type == that.type
                && description.equals(that.description)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(enumValues, that.enumValues)
                && Objects.equals(minValue, that.minValue)
                && Objects.equals(maxValue, that.maxValue)
                && Objects.equals(minLength, that.minLength)
                && Objects.equals(maxLength, that.maxLength)
                && Objects.equals(pattern, that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, defaultValue, enumValues);
    }

    @Override
    public String toString() {
        return "ToolParameter{" + name + ":" + type.wireName() + (required ? ", required" : "") + "}";
    }

    public static final class Builder {
        private final String name;
        private final ParameterType type;
        private String description;
        private boolean required;
        private Object defaultValue;
        private List<Object> enumValues;
        private Double minValue;
        private Double maxValue;
        private Integer minLength;
        private Integer maxLength;
        private String pattern;

        private Builder(String name, ParameterType type) {
            this.name = name;
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder enumValues(Object... values) {
            this.enumValues = Arrays.asList(values);
            return this;
        }

        public Builder range(Double min, Double max) {
            this.minValue = min;
            this.maxValue = max;
            return this;
        }

        public Builder length(Integer min, Integer max) {
            this.minLength = min;
            this.maxLength = max;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public ToolParameter build() {
            return new ToolParameter(name, type, description, required, defaultValue, enumValues,
                    minValue, maxValue, minLength, maxLength, pattern);
        }
    }
}
