package com.obelisk.session;

import com.obelisk.config.ObeliskConfig;
import com.obelisk.registry.ToolRegistry;
import com.obelisk.tools.ToolCategory;
import com.obelisk.tools.ToolNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Store of {@link SessionToolState} objects, one per active session.
 * <p>
 * Sessions are held in a {@link ConcurrentHashMap}; every mutation of one session runs under
 * that session's monitor, so updates to different sessions never contend. Availability of a
 * tool for a session is decided by the session's model capability and the registry's model
 * compatibility check.
 */
public final class SessionStateManager {

    private static final Logger log = LoggerFactory.getLogger(SessionStateManager.class);
    private static final Duration ACTIVE_WINDOW = Duration.ofHours(1);

    private final Map<String, SessionToolState> sessions = new ConcurrentHashMap<>();
    private final ToolRegistry registry;
    private final ObeliskConfig config;
    private final Clock clock;
    private volatile long lastCleanup;

    public SessionStateManager(ToolRegistry registry) {
        this(registry, ObeliskConfig.defaults(), Clock.systemUTC());
    }

    public SessionStateManager(ToolRegistry registry, ObeliskConfig config, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastCleanup = clock.millis();
    }

    /**
     * Creates (or replaces) the state of a session. Without a configuration, the session gets
     * the defaults derived from the worker configuration.
     */
    public SessionToolState createState(String sessionId, String modelId, ModelCapabilityInfo modelInfo,
                                        SessionConfiguration configuration) {
        long now = clock.millis();
        SessionConfiguration effective = configuration != null
                ? configuration.forSession(sessionId, now)
                : SessionConfiguration.fromConfig(sessionId, config);
        SessionToolState state = new SessionToolState(sessionId, modelId, modelInfo, effective, now);
        SessionToolState previous = sessions.put(sessionId, state);
        if (previous != null) {
            log.warn("Replaced existing tool state of session {}", sessionId);
        }
        log.info("Created tool state for session {} (model={}, level={})",
                sessionId, modelId, modelInfo.capabilityLevel());
        return state;
    }

    public SessionToolState createState(String sessionId, String modelId, ModelCapabilityInfo modelInfo) {
        return createState(sessionId, modelId, modelInfo, null);
    }

    public Optional<SessionToolState> getState(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Switches the session's model: every availability entry becomes EXPIRED so the next refresh
     * re-checks it, the switch counter is incremented and the change is returned as an event
     * whose "after" set is the projection of the current registry onto the new model.
     *
     * @return the change event, or empty when the session is unknown
     */
    public Optional<ModelChangeEvent> updateModel(String sessionId, String newModelId, ModelCapabilityInfo newModelInfo) {
        return mutate(sessionId, state -> updateModelLocked(state, newModelId, newModelInfo, clock.millis()));
    }

    ModelChangeEvent updateModelLocked(SessionToolState state, String newModelId, ModelCapabilityInfo newModelInfo,
                                       long now) {
        String oldModel = state.getCurrentModel();
        Set<String> before = state.getAvailableTools(now);
        Set<String> after = projectAvailability(newModelId, newModelInfo, state.getConfiguration());
        state.applyModel(newModelId, newModelInfo, now);
        log.info("Updated model for session {}: {} -> {}", state.getSessionId(), oldModel, newModelId);
        return ModelChangeEvent.create(state.getSessionId(), oldModel, newModelId, now, before, after);
    }

    /**
     * Sets a tool's availability for a session, valid for {@code ttl} (the session's cache
     * duration when null).
     *
     * @return false when the session is unknown
     */
    public boolean updateToolAvailability(String sessionId, String toolName, boolean available,
                                          String errorMessage, Duration ttl) {
        return mutate(sessionId, state -> {
            long now = clock.millis();
            Duration validity = ttl != null ? ttl : cacheDuration(state);
            ToolAvailabilityInfo current = state.getToolInfo(toolName)
                    .orElseGet(() -> ToolAvailabilityInfo.loading(toolName, now));
            state.putAvailability(current.withAvailability(
                    available ? ToolAvailabilityState.AVAILABLE : ToolAvailabilityState.UNAVAILABLE,
                    errorMessage, now + validity.toMillis(), now));
            return true;
        }).orElse(false);
    }

    public boolean updateToolAvailability(String sessionId, String toolName, boolean available) {
        return updateToolAvailability(sessionId, toolName, available, null, null);
    }

    /**
     * Re-checks every enabled registry tool against the session's model. Entries that are still
     * valid count as cache hits and are kept (AVAILABLE becomes CACHED); the rest count as misses
     * and are recomputed. Entries for tools no longer registered are dropped.
     *
     * @return the session's available tools after the refresh, empty when the session is unknown
     */
    public SortedSet<String> refreshToolAvailability(String sessionId) {
        return mutate(sessionId, state -> refreshLocked(state, clock.millis())).orElseGet(TreeSet::new);
    }

    SortedSet<String> refreshLocked(SessionToolState state, long now) {
        List<String> registered = registry.listTools(true);
        Set<String> current = new HashSet<>(registered);
        for (String name : state.toolNames()) {
            if (!current.contains(name)) {
                state.removeTool(name);
            }
        }
        long expiry = now + cacheDuration(state).toMillis();
        for (String name : registered) {
            Optional<ToolAvailabilityInfo> cached = state.getToolInfo(name);
            if (cached.isPresent() && !state.needsRefresh(name, now)) {
                state.markCacheHit(now);
                if (cached.get().state() == ToolAvailabilityState.AVAILABLE) {
                    state.putAvailability(cached.get().withState(ToolAvailabilityState.CACHED, now));
                }
                continue;
            }
            state.markCacheMiss(now);
            ToolAvailabilityInfo base = cached.orElseGet(() -> ToolAvailabilityInfo.loading(name, now));
            try {
                String reason = unavailabilityReason(name, state.getCurrentModel(), state.getModelInfo());
                ToolAvailabilityState next = reason == null ? ToolAvailabilityState.AVAILABLE : ToolAvailabilityState.UNAVAILABLE;
                state.putAvailability(base.withAvailability(next, reason, expiry, now));
            } catch (ToolNotFoundException e) {
                log.debug("Tool {} disappeared during refresh of session {}", name, state.getSessionId());
                state.removeTool(name);
            } catch (RuntimeException e) {
                log.warn("Availability check of tool {} for session {} failed: {}", name, state.getSessionId(), e.getMessage());
                state.putAvailability(base.withAvailability(ToolAvailabilityState.ERROR, e.getMessage(), expiry, now));
            }
        }
        state.markRefreshed(now, now + config.getToolSnapshotTtlMinutes() * 60_000L);
        return state.getAvailableTools(now);
    }

    /** Tools the given model could use under the given configuration, per the current registry. */
    SortedSet<String> projectAvailability(String modelId, ModelCapabilityInfo modelInfo, SessionConfiguration configuration) {
        SortedSet<String> tools = new TreeSet<>();
        if (!configuration.isEnableTools()) {
            return tools;
        }
        for (String name : registry.listTools(true)) {
            if (!configuration.isToolAllowed(name)) {
                continue;
            }
            try {
                if (unavailabilityReason(name, modelId, modelInfo) == null) {
                    tools.add(name);
                }
            } catch (ToolNotFoundException e) {
                log.debug("Tool {} disappeared while projecting availability for {}", name, modelId);
            }
        }
        return tools;
    }

    /** Null when the tool is usable by the model, otherwise why it is not. */
    private String unavailabilityReason(String toolName, String modelId, ModelCapabilityInfo modelInfo) {
        if (!modelInfo.supportsToolCalls()) {
            return String.format("model '%s' does not support tool calls", modelId);
        }
        ToolCategory category = registry.get(toolName).definition().getMetadata().category();
        if (!modelInfo.supportsToolType(category.name().toLowerCase(Locale.ROOT))) {
            return String.format("model '%s' does not handle %s tools", modelId, category);
        }
        if (!registry.isModelCompatible(toolName, modelId)) {
            return String.format("tool '%s' is not compatible with model '%s'", toolName, modelId);
        }
        return null;
    }

    /** Available tools of a session; empty when the session is unknown. */
    public SortedSet<String> getAvailableTools(String sessionId) {
        SessionToolState state = sessions.get(sessionId);
        return state != null ? state.getAvailableTools(clock.millis()) : new TreeSet<>();
    }

    /**
     * Records a finished call: session counters and the tool's success count and latency average.
     *
     * @return false when the session is unknown
     */
    public boolean recordExecution(String sessionId, String toolName, boolean success, double durationMs) {
        return mutate(sessionId, state -> {
            state.recordExecution(toolName, success, durationMs, clock.millis());
            return true;
        }).orElse(false);
    }

    public boolean updateConfiguration(String sessionId, SessionConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        return mutate(sessionId, state -> {
            long now = clock.millis();
            state.setConfiguration(configuration.forSession(sessionId, now), now);
            log.info("Updated tool configuration of session {}", sessionId);
            return true;
        }).orElse(false);
    }

    public boolean markCacheHit(String sessionId) {
        return mutate(sessionId, state -> {
            state.markCacheHit(clock.millis());
            return true;
        }).orElse(false);
    }

    public boolean markCacheMiss(String sessionId) {
        return mutate(sessionId, state -> {
            state.markCacheMiss(clock.millis());
            return true;
        }).orElse(false);
    }

    public Optional<SessionStatistics> getStatistics(String sessionId) {
        return mutate(sessionId, state -> {
            long now = clock.millis();
            SessionConfiguration configuration = state.getConfiguration();
            return new SessionStatistics(
                    sessionId,
                    state.getCurrentModel(),
                    state.getModelInfo().capabilityLevel(),
                    state.getModelInfo().supportsToolCalls(),
                    new ArrayList<>(state.getAvailableTools(now)),
                    state.getTotalToolCalls(),
                    state.getSuccessfulToolCalls(),
                    state.getFailedToolCalls(),
                    state.getSuccessRate(),
                    state.getCacheHitRate(),
                    state.getModelSwitchCount(),
                    state.getLastModelChange(),
                    (now - state.getCreatedAt()) / 3_600_000.0,
                    SessionStatistics.ConfigurationSummary.of(configuration));
        });
    }

    public SessionStoreStatistics getAllSessionStats() {
        long now = clock.millis();
        Collection<SessionToolState> states = sessions.values();
        int total = 0;
        int active = 0;
        long calls = 0;
        long successful = 0;
        for (SessionToolState state : states) {
            total++;
            if (now - state.getUpdatedAt() < ACTIVE_WINDOW.toMillis()) {
                active++;
            }
            calls += state.getTotalToolCalls();
            successful += state.getSuccessfulToolCalls();
        }
        double rate = calls == 0 ? 0.0 : (successful * 100.0) / calls;
        return new SessionStoreStatistics(total, active, calls, successful, rate, lastCleanup);
    }

    /**
     * Removes sessions whose last update is older than {@code maxAgeHours}.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired(int maxAgeHours) {
        long now = clock.millis();
        long cutoff = now - Duration.ofHours(maxAgeHours).toMillis();
        int removed = 0;
        for (Map.Entry<String, SessionToolState> entry : sessions.entrySet()) {
            SessionToolState state = entry.getValue();
            synchronized (state) {
                if (state.getUpdatedAt() < cutoff && sessions.remove(entry.getKey(), state)) {
                    removed++;
                }
            }
        }
        lastCleanup = now;
        log.info("Cleaned up {} expired session states", removed);
        return removed;
    }

    public int cleanupExpired() {
        return cleanupExpired(config.getSessionMaxAgeHours());
    }

    public boolean removeSession(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Removed session state for {}", sessionId);
        }
        return removed;
    }

    /**
     * Runs {@code action} under the session's monitor; empty when the session is unknown or was
     * removed or replaced before the monitor was acquired.
     */
    <T> Optional<T> mutate(String sessionId, Function<SessionToolState, T> action) {
        SessionToolState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            if (sessions.get(sessionId) != state) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.apply(state));
        }
    }

    long now() {
        return clock.millis();
    }

    private static Duration cacheDuration(SessionToolState state) {
        return Duration.ofMinutes(state.getConfiguration().getCacheDurationMinutes());
    }
}
