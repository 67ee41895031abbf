package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative definition of a tool: unique identifier-style name, description, ordered
 * parameters, timeout, semantic version, permission spec and metadata.
 * <p>
 * Immutable. Construction validates the name and version formats and rejects duplicate
 * parameter names with a {@link ToolConfigurationException}.
 */
public final class ToolDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final double DEFAULT_TIMEOUT_SECONDS = 30.0;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SEMVER = Pattern.compile(
            "(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(-[0-9A-Za-z.-]+)?(\\+[0-9A-Za-z.-]+)?");

    private final String name;
    private final String description;
    private final List<ToolParameter> parameters;
    private final String version;
    private final double timeoutSeconds;
    private final ToolPermissions permissions;
    private final ToolMetadata metadata;

    @JsonCreator
    public ToolDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("parameters") List<ToolParameter> parameters,
            @JsonProperty("version") String version,
            @JsonProperty("timeoutSeconds") Double timeoutSeconds,
            @JsonProperty("permissions") ToolPermissions permissions,
            @JsonProperty("metadata") ToolMetadata metadata) {
        if (!isValidName(name)) {
            throw new ToolConfigurationException(
                    String.format("Tool name must be a valid identifier: '%s'", name), name);
        }
        this.name = name;
        this.description = description != null ? description : "";
        this.version = version != null ? version : DEFAULT_VERSION;
        if (!isSemanticVersion(this.version)) {
            throw new ToolConfigurationException(
                    String.format("Tool version must be semantic (MAJOR.MINOR.PATCH): '%s'", this.version), name);
        }
        this.timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        if (this.timeoutSeconds <= 0) {
            throw new ToolConfigurationException("Tool timeout must be positive", name);
        }
        List<ToolParameter> params = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ToolParameter p : params) {
            if (!seen.add(p.getName())) {
                throw new ToolConfigurationException(
                        String.format("Duplicate parameter '%s' in tool '%s'", p.getName(), name), name);
            }
        }
        this.parameters = Collections.unmodifiableList(params);
        this.permissions = permissions != null ? permissions : ToolPermissions.publicAccess();
        this.metadata = metadata != null ? metadata : ToolMetadata.empty();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static boolean isValidName(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static boolean isSemanticVersion(String version) {
        return version != null && SEMVER.matcher(version).matches();
    }

    public List<String> requiredParameterNames() {
        List<String> names = new ArrayList<>();
        for (ToolParameter p : parameters) {
            if (p.isRequired()) names.add(p.getName());
        }
        return names;
    }

    public Optional<ToolParameter> parameter(String name) {
        for (ToolParameter p : parameters) {
            if (p.getName().equals(name)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /**
     * Function-calling schema: {@code {"type":"function","function":{name, description, parameters}}}.
     */
    public Map<String, Object> toFunctionSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter p : parameters) {
            properties.put(p.getName(), p.toSchema());
        }
        Map<String, Object> paramsSchema = new LinkedHashMap<>();
        paramsSchema.put("type", "object");
        paramsSchema.put("properties", properties);
        paramsSchema.put("required", requiredParameterNames());
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", paramsSchema);
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "function");
        schema.put("function", function);
        return schema;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ToolParameter> getParameters() {
        return parameters;
    }

    public String getVersion() {
        return version;
    }

    public double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public ToolPermissions getPermissions() {
        return permissions;
    }

    public ToolMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolDefinition that)) return false;
        return Double.compare(that.timeoutSeconds, timeoutSeconds) == 0
                && name.equals(that.name)
                && description.equals(that.description)
                && parameters.equals(that.parameters)
                && version.equals(that.version)
                && permissions.equals(that.permissions)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, parameters);
    }

    @Override
    public String toString() {
        return "ToolDefinition{" + name + "@" + version + ", params=" + parameters.size() + "}";
    }

    public static final class Builder {
        private final String name;
        private String description;
        private final List<ToolParameter> parameters = new ArrayList<>();
        private String version = DEFAULT_VERSION;
        private double timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private ToolPermissions permissions;
        private ToolMetadata metadata;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(ToolParameter parameter) {
            this.parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder timeoutSeconds(double timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder permissions(ToolPermissions permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder metadata(ToolMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public ToolDefinition build() {
            return new ToolDefinition(name, description, parameters, version, timeoutSeconds, permissions, metadata);
        }
    }
}
