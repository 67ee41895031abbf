package com.obelisk.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Set;

/**
 * Permission spec of a tool: level, role allow/deny lists, allowed models and rate limits.
 * Empty allow lists mean "no restriction"; null limits mean unlimited.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolPermissions {

    private static final ToolPermissions PUBLIC = builder().build();

    private final PermissionLevel level;
    private final Set<String> allowedRoles;
    private final Set<String> deniedRoles;
    private final Set<String> allowedModels;
    private final Integer maxCallsPerHour;
    private final Integer maxCallsPerSession;

    @JsonCreator
    public ToolPermissions(
            @JsonProperty("level") PermissionLevel level,
            @JsonProperty("allowedRoles") Set<String> allowedRoles,
            @JsonProperty("deniedRoles") Set<String> deniedRoles,
            @JsonProperty("allowedModels") Set<String> allowedModels,
            @JsonProperty("maxCallsPerHour") Integer maxCallsPerHour,
            @JsonProperty("maxCallsPerSession") Integer maxCallsPerSession) {
        this.level = level != null ? level : PermissionLevel.PUBLIC;
        this.allowedRoles = allowedRoles != null ? Set.copyOf(allowedRoles) : Set.of();
        this.deniedRoles = deniedRoles != null ? Set.copyOf(deniedRoles) : Set.of();
        this.allowedModels = allowedModels != null ? Set.copyOf(allowedModels) : Set.of();
        if (maxCallsPerHour != null && maxCallsPerHour < 0) {
            throw new IllegalArgumentException("maxCallsPerHour must be >= 0");
        }
        if (maxCallsPerSession != null && maxCallsPerSession < 0) {
            throw new IllegalArgumentException("maxCallsPerSession must be >= 0");
        }
        this.maxCallsPerHour = maxCallsPerHour;
        this.maxCallsPerSession = maxCallsPerSession;
    }

    /** Unrestricted permissions. */
    public static ToolPermissions publicAccess() {
        return PUBLIC;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PermissionLevel getLevel() {
        return level;
    }

    public Set<String> getAllowedRoles() {
        return allowedRoles;
    }

    public Set<String> getDeniedRoles() {
        return deniedRoles;
    }

    public Set<String> getAllowedModels() {
        return allowedModels;
    }

    public Integer getMaxCallsPerHour() {
        return maxCallsPerHour;
    }

    public Integer getMaxCallsPerSession() {
        return maxCallsPerSession;
    }

    public boolean hasRateLimits() {
        return maxCallsPerHour != null || maxCallsPerSession != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolPermissions that)) return false;
        return level == that.level && allowedRoles.equals(that.allowedRoles)
                && deniedRoles.equals(that.deniedRoles) && allowedModels.equals(that.allowedModels)
                && Objects.equals(maxCallsPerHour, that.maxCallsPerHour)
                && Objects.equals(maxCallsPerSession, that.maxCallsPerSession);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, allowedRoles, deniedRoles, allowedModels, maxCallsPerHour, maxCallsPerSession);
    }

    public static final class Builder {
        private PermissionLevel level = PermissionLevel.PUBLIC;
        private Set<String> allowedRoles;
        private Set<String> deniedRoles;
        private Set<String> allowedModels;
        private Integer maxCallsPerHour;
        private Integer maxCallsPerSession;

        private Builder() {
        }

        public Builder level(PermissionLevel level) {
            this.level = level;
            return this;
        }

        public Builder allowedRoles(String... roles) {
            this.allowedRoles = Set.of(roles);
            return this;
        }

        public Builder deniedRoles(String... roles) {
            this.deniedRoles = Set.of(roles);
            return this;
        }

        public Builder allowedModels(String... models) {
            this.allowedModels = Set.of(models);
            return this;
        }

        public Builder maxCallsPerHour(Integer maxCallsPerHour) {
            this.maxCallsPerHour = maxCallsPerHour;
            return this;
        }

        public Builder maxCallsPerSession(Integer maxCallsPerSession) {
            this.maxCallsPerSession = maxCallsPerSession;
            return this;
        }

        public ToolPermissions build() {
            return new ToolPermissions(level, allowedRoles, deniedRoles, allowedModels,
                    maxCallsPerHour, maxCallsPerSession);
        }
    }
}
