package com.obelisk.registry;

import com.obelisk.tools.ModelRequirements;
import com.obelisk.tools.ParameterValidator;
import com.obelisk.tools.Tool;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolException;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolNotFoundException;
import com.obelisk.tools.ToolPermissionException;
import com.obelisk.tools.ToolPermissions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central store of registered tools. Enforces model compatibility and permission/rate-limit
 * checks and exposes the gated call pipeline {@link #executeToolCall}.
 * <p>
 * One instance is constructed at startup and passed to its collaborators; there is no global
 * instance. Registrations live in a {@link ConcurrentHashMap} and are mutated through
 * {@code compute}, so changes to one tool name are serialized while other names proceed.
 * Usage counters are guarded per (session, tool).
 */
public final class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolRegistration> registrations = new ConcurrentHashMap<>();
    private final Map<PermissionCacheKey, PermissionCheck> permissionCache = new ConcurrentHashMap<>();
    private final ModelCapabilityResolver capabilityResolver;
    private final ToolCallMetrics metrics;
    private final Clock clock;

    public ToolRegistry(ModelCapabilityResolver capabilityResolver) {
        this(capabilityResolver, new ToolCallMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    public ToolRegistry(ModelCapabilityResolver capabilityResolver, ToolCallMetrics metrics, Clock clock) {
        this.capabilityResolver = Objects.requireNonNull(capabilityResolver, "capabilityResolver");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a tool. The definition was validated when it was built (identifier name,
     * semantic version). If the name is already bound to the same version and
     * {@code forceUpdate} is false, this is a no-op that keeps usage stats and caches.
     * Otherwise the tool becomes the current binding and its version is appended to the history.
     *
     * @param tool        implementation
     * @param forceUpdate replace even when the version is unchanged
     * @return true when the binding changed
     */
    public boolean register(Tool tool, boolean forceUpdate) {
        Objects.requireNonNull(tool, "tool");
        ToolDefinition definition = Objects.requireNonNull(tool.definition(), "definition");
        String name = definition.getName();
        long now = clock.millis();
        boolean[] changed = {false};
        registrations.compute(name, (k, existing) -> {
            if (existing == null) {
                changed[0] = true;
                return new ToolRegistration(tool, now);
            }
            if (existing.definition().getVersion().equals(definition.getVersion()) && !forceUpdate) {
                return existing;
            }
            existing.bind(tool, now);
            changed[0] = true;
            return existing;
        });
        if (changed[0]) {
            clearPermissionCache(name);
            log.info("Registered tool {} (version={})", name, definition.getVersion());
        } else {
            log.warn("Tool {} version {} already registered; use forceUpdate to replace", name, definition.getVersion());
        }
        return changed[0];
    }

    public boolean register(Tool tool) {
        return register(tool, false);
    }

    /**
     * Removes a tool. Without a version, drops the binding and its entire history; with a
     * version, drops only that history entry (the newest remaining version becomes current
     * when the removed one was current). Caches touching the tool are cleared either way.
     *
     * @return true when something was removed
     */
    public boolean unregister(String name, String version) {
        Objects.requireNonNull(name, "name");
        boolean[] removed = {false};
        registrations.computeIfPresent(name, (k, existing) -> {
            if (version == null) {
                removed[0] = true;
                return null;
            }
            if (existing.version(version).isEmpty()) {
                return existing;
            }
            removed[0] = true;
            return existing.removeVersion(version) ? existing : null;
        });
        if (removed[0]) {
            clearPermissionCache(name);
            log.info("Unregistered tool {}{}", name, version != null ? " version " + version : "");
        }
        return removed[0];
    }

    public boolean unregister(String name) {
        return unregister(name, null);
    }

    /**
     * Returns the implementation bound to the name (or the given historical version).
     *
     * @throws ToolNotFoundException when the name or version is absent, or the tool is disabled
     */
    public Tool get(String name, String version) {
        ToolRegistration registration = registrations.get(name);
        if (registration == null) {
            throw new ToolNotFoundException(name);
        }
        if (!registration.isEnabled()) {
            throw new ToolNotFoundException(name, "tool is disabled");
        }
        if (version == null) {
            return registration.tool();
        }
        return registration.version(version)
                .orElseThrow(() -> new ToolNotFoundException(name, "version " + version + " not registered"));
    }

    public Tool get(String name) {
        return get(name, null);
    }

    public boolean has(String name) {
        return registrations.containsKey(name);
    }

    public void enable(String name) {
        requireRegistration(name).setEnabled(true);
        log.info("Enabled tool {}", name);
    }

    public void disable(String name) {
        requireRegistration(name).setEnabled(false);
        clearPermissionCache(name);
        log.info("Disabled tool {}", name);
    }

    /** Sorted tool names, optionally only the enabled ones. */
    public List<String> listTools(boolean enabledOnly) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, ToolRegistration> e : registrations.entrySet()) {
            if (!enabledOnly || e.getValue().isEnabled()) {
                names.add(e.getKey());
            }
        }
        Collections.sort(names);
        return names;
    }

    public List<ToolDefinition> getDefinitions(boolean enabledOnly) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : listTools(enabledOnly)) {
            ToolRegistration r = registrations.get(name);
            if (r != null) definitions.add(r.definition());
        }
        return definitions;
    }

    public ToolInfo getToolInfo(String name) {
        ToolRegistration r = requireRegistration(name);
        List<String> versions = new ArrayList<>();
        for (ToolVersion v : r.versionHistory()) {
            versions.add(v.version());
        }
        return new ToolInfo(r.definition(), r.isEnabled(), versions, r.usageCount(), r.lastUsed(),
                r.tool().getClass().getName());
    }

    public RegistryStatus getRegistryStatus() {
        int enabled = 0;
        long usage = 0;
        for (ToolRegistration r : registrations.values()) {
            if (r.isEnabled()) enabled++;
            usage += r.usageCount();
        }
        int total = registrations.size();
        return new RegistryStatus(total, enabled, total - enabled, usage, listTools(false));
    }

    /**
     * Whether the model satisfies the tool's model requirements. Cached per tool and model;
     * a miss resolves the model through the capability resolver. Unknown models are incompatible.
     */
    public boolean isModelCompatible(String name, String modelId) {
        ToolRegistration registration = requireRegistration(name);
        if (modelId == null) {
            return false;
        }
        return registration.modelCompatibility().computeIfAbsent(modelId, id -> {
            ModelRequirements requirements = registration.definition().getMetadata().modelRequirements();
            boolean compatible = capabilityResolver.resolve(id)
                    .map(c -> requirements.isSatisfiedBy(c.modelId(), c.supportsToolCalls(), c.contextLength()))
                    .orElse(false);
            log.debug("Model compatibility {} / {} = {}", name, id, compatible);
            return compatible;
        });
    }

    /**
     * Evaluates permission level, role allow/deny lists, allowed models and rate limits.
     * The role/model part is cached per (session, tool, role, model); rate limits are
     * evaluated against live usage on every check.
     */
    public PermissionCheck checkPermission(String name, String sessionId, String role, String modelId) {
        ToolRegistration registration = requireRegistration(name);
        ToolPermissions permissions = registration.definition().getPermissions();
        PermissionCacheKey key = new PermissionCacheKey(sessionId, name, role, modelId);
        PermissionCheck policy = permissionCache.computeIfAbsent(key, k -> evaluatePolicy(permissions, role, modelId));
        if (!policy.allowed() || !permissions.hasRateLimits() || sessionId == null) {
            return policy;
        }
        String exceeded = registration.usage(sessionId)
                .exceededLimit(clock.millis(), permissions.getMaxCallsPerHour(), permissions.getMaxCallsPerSession());
        return exceeded != null ? PermissionCheck.deny(exceeded) : policy;
    }

    private static PermissionCheck evaluatePolicy(ToolPermissions permissions, String role, String modelId) {
        if (!permissions.getLevel().permits(role)) {
            return PermissionCheck.deny(String.format("role '%s' does not satisfy level %s", role, permissions.getLevel()));
        }
        if (role != null && permissions.getDeniedRoles().contains(role)) {
            return PermissionCheck.deny(String.format("role '%s' is denied", role));
        }
        if (!permissions.getAllowedRoles().isEmpty() && (role == null || !permissions.getAllowedRoles().contains(role))) {
            return PermissionCheck.deny(String.format("role '%s' is not in the allowed roles", role));
        }
        if (!permissions.getAllowedModels().isEmpty() && (modelId == null || !permissions.getAllowedModels().contains(modelId))) {
            return PermissionCheck.deny(String.format("model '%s' is not in the allowed models", modelId));
        }
        return PermissionCheck.allow();
    }

    /**
     * Gated call pipeline: existence → model compatibility → permission and rate limit →
     * parameter validation → usage recording → timed execution → metrics. A failed gate returns
     * a result carrying the typed error without invoking the tool. Never throws for tool failures.
     * <p>
     * Model compatibility is checked only when the context names a model.
     */
    public ToolCallResult executeToolCall(ToolCall call, ToolExecutionContext context) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(context, "context");
        String name = call.getToolName();
        ToolCallResult result;
        try {
            Tool tool = get(name);
            ToolRegistration registration = requireRegistration(name);
            ToolDefinition definition = tool.definition();
            String modelId = context.getModelId();
            if (modelId != null && !isModelCompatible(name, modelId)) {
                throw new ToolPermissionException(name, String.format("model '%s' is not compatible", modelId));
            }
            PermissionCheck permission = checkPermission(name, context.getSessionId(), context.getRole(), modelId);
            if (!permission.allowed()) {
                throw new ToolPermissionException(name, permission.reason());
            }
            Map<String, Object> parameters = ParameterValidator.validate(definition, call.getParameters());
            long now = clock.millis();
            if (context.getSessionId() != null) {
                ToolPermissions permissions = definition.getPermissions();
                String exceeded = registration.usage(context.getSessionId())
                        .tryRecord(now, permissions.getMaxCallsPerHour(), permissions.getMaxCallsPerSession());
                if (exceeded != null) {
                    throw new ToolPermissionException(name, exceeded);
                }
            }
            registration.markUsed(now);
            result = tool.call(call.withParameters(parameters), context);
        } catch (ToolException e) {
            log.info("Tool call {} ({}) rejected: {}", call.getId(), name, e.getMessage());
            metrics.recordDenied(name, e.getKind());
            result = ToolCallResult.failed(call.getId(), name, ToolError.from(e), 0.0, null);
        }
        metrics.recordExecution(result);
        return result;
    }

    /** Session usage counts for a tool: calls in the last hour and total calls. */
    public Map<String, Integer> getSessionUsage(String name, String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionUsage usage = requireRegistration(name).usage(sessionId);
        long now = clock.millis();
        return Map.of("calls_last_hour", usage.callsInLastHour(now), "session_calls", usage.sessionCalls());
    }

    /** Drops usage stats and permission cache entries of a finished session. */
    public void forgetSession(String sessionId) {
        for (ToolRegistration r : registrations.values()) {
            r.forgetSession(sessionId);
        }
        permissionCache.keySet().removeIf(k -> Objects.equals(k.sessionId(), sessionId));
    }

    public Optional<ModelCapability> resolveModel(String modelId) {
        return capabilityResolver.resolve(modelId);
    }

    public ModelCapabilityResolver getCapabilityResolver() {
        return capabilityResolver;
    }

    private ToolRegistration requireRegistration(String name) {
        ToolRegistration registration = registrations.get(name);
        if (registration == null) {
            throw new ToolNotFoundException(name);
        }
        return registration;
    }

    private void clearPermissionCache(String name) {
        permissionCache.keySet().removeIf(k -> k.toolName().equals(name));
    }
}
