package com.obelisk.session;

import com.obelisk.registry.ModelCapability;
import com.obelisk.registry.ModelCapabilityResolver;
import com.obelisk.registry.ToolRegistry;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps each session's tool set in step with its active model. Registering a session snapshots
 * the tools its model can use; switching models recomputes the snapshot under the session's
 * monitor and appends a {@link ModelChangeEvent} to the history.
 */
public final class DynamicToolCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DynamicToolCoordinator.class);

    private final ToolRegistry registry;
    private final SessionStateManager stateManager;
    private final List<ModelChangeEvent> history = new CopyOnWriteArrayList<>();

    public DynamicToolCoordinator(ToolRegistry registry, SessionStateManager stateManager) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.stateManager = Objects.requireNonNull(stateManager, "stateManager");
    }

    /**
     * Registers a session with its initial model and computes its tool snapshot. A model the
     * catalog does not know, or one without tool-call support, yields an empty snapshot.
     */
    public SessionToolState registerSession(String sessionId, String modelId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(modelId, "modelId");
        SessionToolState state = stateManager.createState(sessionId, modelId, capabilityOf(modelId));
        SortedSet<String> tools = stateManager.refreshToolAvailability(sessionId);
        log.info("Registered session {} with model {}, available tools: {}", sessionId, modelId, tools);
        return state;
    }

    /**
     * Switches the session to a new model. The state update and the re-check of every tool
     * happen under the session's monitor, so readers see either the old or the new tool set.
     *
     * @throws SessionNotFoundException when the session is not registered
     */
    public ModelChangeEvent switchModel(String sessionId, String newModelId) {
        Objects.requireNonNull(newModelId, "newModelId");
        ModelCapabilityInfo info = capabilityOf(newModelId);
        ModelChangeEvent event = stateManager.mutate(sessionId, state -> {
            long now = stateManager.now();
            ModelChangeEvent change = stateManager.updateModelLocked(state, newModelId, info, now);
            stateManager.refreshLocked(state, now);
            return change;
        }).orElseThrow(() -> new SessionNotFoundException(sessionId));
        history.add(event);
        log.info("Model switch for session {}: {} -> {} (added={}, removed={})",
                sessionId, event.oldModel(), event.newModel(), event.toolsAdded(), event.toolsRemoved());
        return event;
    }

    /**
     * Definitions of the tools the session can use. The snapshot is recomputed when
     * {@code refresh} is set, its TTL has passed or one of its entries has expired.
     *
     * @throws SessionNotFoundException when the session is not registered
     */
    public List<ToolDefinition> getAvailableTools(String sessionId, boolean refresh) {
        SortedSet<String> names = snapshot(sessionId, refresh)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        List<ToolDefinition> definitions = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                definitions.add(registry.get(name).definition());
            } catch (ToolNotFoundException e) {
                log.warn("Tool {} listed for session {} is no longer registered", name, sessionId);
            }
        }
        return definitions;
    }

    public List<ToolDefinition> getAvailableTools(String sessionId) {
        return getAvailableTools(sessionId, false);
    }

    private Optional<SortedSet<String>> snapshot(String sessionId, boolean refresh) {
        return stateManager.mutate(sessionId, state -> {
            long now = stateManager.now();
            if (refresh || now > state.getSnapshotExpiry() || state.hasStaleEntries(now)) {
                log.debug("Refreshing tool snapshot of session {}", sessionId);
                return stateManager.refreshLocked(state, now);
            }
            return state.getAvailableTools(now);
        });
    }

    /**
     * Checks whether the session may call the tool, distinguishing an unknown session, a tool
     * the registry does not know, and a known tool unavailable under the current model.
     */
    public ToolCallValidation validateToolCall(String sessionId, String toolName) {
        Optional<SessionToolState> state = stateManager.getState(sessionId);
        Optional<SortedSet<String>> available = snapshot(sessionId, false);
        if (state.isEmpty() || available.isEmpty()) {
            return ToolCallValidation.rejected(String.format("Session %s not registered", sessionId));
        }
        if (available.get().contains(toolName)) {
            return ToolCallValidation.ok();
        }
        if (registry.listTools(false).contains(toolName)) {
            return ToolCallValidation.rejected(String.format("Tool '%s' not available for model '%s'",
                    toolName, state.get().getCurrentModel()));
        }
        return ToolCallValidation.rejected(String.format("Tool '%s' does not exist", toolName));
    }

    /**
     * For every catalog model and every enabled tool: AVAILABLE when the model supports tool
     * calls, UNAVAILABLE otherwise.
     */
    public Map<String, Map<String, ToolAvailabilityState>> compatibilityMatrix() {
        List<String> tools = registry.listTools(true);
        Map<String, Map<String, ToolAvailabilityState>> matrix = new TreeMap<>();
        for (ModelCapability model : resolver().allModels()) {
            ToolAvailabilityState status = model.supportsToolCalls()
                    ? ToolAvailabilityState.AVAILABLE
                    : ToolAvailabilityState.UNAVAILABLE;
            Map<String, ToolAvailabilityState> row = new LinkedHashMap<>();
            for (String tool : tools) {
                row.put(tool, status);
            }
            matrix.put(model.modelId(), row);
        }
        return matrix;
    }

    /** Tool-capable models other than {@code currentModel}, largest context first. */
    public List<ModelCapability> fallbackModels(String currentModel) {
        List<ModelCapability> candidates = new ArrayList<>();
        for (ModelCapability model : resolver().toolCapableModels()) {
            if (!model.modelId().equals(currentModel)) {
                candidates.add(model);
            }
        }
        candidates.sort(Comparator.comparingInt(ModelCapability::contextLength).reversed());
        return candidates;
    }

    /**
     * Suggests a model that could serve the required tools. Empty when the session already has
     * all of them (or is unknown); otherwise the tool-capable model with the largest context.
     */
    public Optional<ModelCapability> suggestSwitch(String sessionId, Set<String> requiredTools) {
        Optional<SessionToolState> state = stateManager.getState(sessionId);
        Optional<SortedSet<String>> snapshot = snapshot(sessionId, false);
        if (state.isEmpty() || snapshot.isEmpty()) {
            return Optional.empty();
        }
        Set<String> available = snapshot.get();
        if (available.containsAll(requiredTools)) {
            return Optional.empty();
        }
        Set<String> missing = new TreeSet<>(requiredTools);
        missing.removeAll(available);
        List<ModelCapability> fallbacks = fallbackModels(state.get().getCurrentModel());
        if (fallbacks.isEmpty()) {
            log.info("No model can provide missing tools {} for session {}", missing, sessionId);
            return Optional.empty();
        }
        ModelCapability suggestion = fallbacks.get(0);
        log.info("Suggesting model switch for session {}: missing tools {}, suggested model: {}",
                sessionId, missing, suggestion.modelId());
        return Optional.of(suggestion);
    }

    public Optional<SessionToolState> getSessionState(String sessionId) {
        return stateManager.getState(sessionId);
    }

    /** Model changes in order, optionally only those of one session. */
    public List<ModelChangeEvent> getModelChangeHistory(String sessionId) {
        if (sessionId == null) {
            return List.copyOf(history);
        }
        List<ModelChangeEvent> events = new ArrayList<>();
        for (ModelChangeEvent event : history) {
            if (event.sessionId().equals(sessionId)) {
                events.add(event);
            }
        }
        return events;
    }

    /** Drops the session's state and its registry usage statistics. */
    public boolean cleanupSession(String sessionId) {
        boolean removed = stateManager.removeSession(sessionId);
        registry.forgetSession(sessionId);
        if (removed) {
            log.info("Cleaned up session {}", sessionId);
        }
        return removed;
    }

    public SessionStateManager getStateManager() {
        return stateManager;
    }

    private ModelCapabilityInfo capabilityOf(String modelId) {
        return resolver().resolve(modelId)
                .map(ModelCapabilityInfo::from)
                .orElseGet(() -> {
                    log.warn("No capability information found for model {}", modelId);
                    return ModelCapabilityInfo.unknown(modelId);
                });
    }

    private ModelCapabilityResolver resolver() {
        return registry.getCapabilityResolver();
    }
}
