package com.obelisk.worker.service;

import com.obelisk.config.ObeliskConfig;
import com.obelisk.registry.ToolExecutor;
import com.obelisk.registry.ToolRegistry;
import com.obelisk.registry.ToolSchemaExporter;
import com.obelisk.session.DynamicToolCoordinator;
import com.obelisk.session.ModelChangeEvent;
import com.obelisk.session.SessionToolState;
import com.obelisk.session.ToolAvailabilityState;
import com.obelisk.session.ToolCallValidation;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.chain.ChainConfig;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolExecutionRequest;
import com.obelisk.worker.gateway.ToolChainGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the request-handling layer: single calls, chains, session tool sets and
 * model switches.
 */
public final class ToolService {

    private static final Logger log = LoggerFactory.getLogger(ToolService.class);

    private final ToolRegistry registry;
    private final ToolExecutor executor;
    private final DynamicToolCoordinator coordinator;
    private final ToolChainGateway gateway;
    private final ObeliskConfig config;

    public ToolService(ToolRegistry registry, ToolExecutor executor, DynamicToolCoordinator coordinator,
                       ToolChainGateway gateway, ObeliskConfig config) {
        this.registry = registry;
        this.executor = executor;
        this.coordinator = coordinator;
        this.gateway = gateway;
        this.config = config;
    }

    public SessionToolState registerSession(String sessionId, String modelId) {
        return coordinator.registerSession(sessionId, modelId);
    }

    /**
     * Executes one call with retry. For a registered session the call is first checked against
     * the session's tool snapshot, and the session's model is used when the context names none.
     */
    public ToolCallResult submitCall(ToolCall call, ToolExecutionContext context) {
        ToolExecutionContext effective = context;
        Optional<SessionToolState> state = context.getSessionId() != null
                ? coordinator.getSessionState(context.getSessionId())
                : Optional.empty();
        if (state.isPresent()) {
            ToolCallValidation validation = coordinator.validateToolCall(context.getSessionId(), call.getToolName());
            if (!validation.valid()) {
                ToolErrorKind kind = registry.has(call.getToolName()) ? ToolErrorKind.PERMISSION : ToolErrorKind.NOT_FOUND;
                log.info("Call {} to {} rejected for session {}: {}", call.getId(), call.getToolName(),
                        context.getSessionId(), validation.reason());
                return ToolCallResult.failed(call, ToolError.of(kind, validation.reason()));
            }
            if (context.getModelId() == null) {
                effective = ToolExecutionContext.builder(context.getSessionId())
                        .userId(context.getUserId())
                        .modelId(state.get().getCurrentModel())
                        .role(context.getRole())
                        .conversationTurn(context.getConversationTurn())
                        .metadata(context.getMetadata())
                        .build()
                        .withPreviousResults(context.getPreviousResults());
            }
        }
        ToolCallResult result = executor.executeWithRetry(call, effective, config.getChainMaxRetries(),
                Duration.ofMillis(config.getRetryInitialIntervalMs()));
        state.ifPresent(s -> coordinator.getStateManager().recordExecution(s.getSessionId(), result.getToolName(),
                result.isSuccess(), result.getExecutionTimeMs()));
        return result;
    }

    /** Request builder preset with the worker's chain timeout and retry count. */
    public ToolExecutionRequest.Builder newChain(String sessionId) {
        return ToolExecutionRequest.builder(sessionId)
                .timeoutSeconds(config.getChainTimeoutSeconds())
                .maxRetries(config.getChainMaxRetries());
    }

    /**
     * Submits a chain. Worker defaults fill the configuration keys the request leaves unset, and
     * the session's current model is used when no model is configured.
     */
    public String submitChain(ToolExecutionRequest request) {
        Map<String, Object> merged = new LinkedHashMap<>(ChainConfig.defaultsFrom(config));
        coordinator.getSessionState(request.getSessionId())
                .ifPresent(s -> merged.put(ChainConfig.MODEL, s.getCurrentModel()));
        merged.putAll(request.getConfig());
        ToolExecutionRequest effective = new ToolExecutionRequest(request.getExecutionId(), request.getSessionId(),
                request.getToolCalls(), request.getStrategy(), merged, request.getTimeoutSeconds(),
                request.getMaxRetries(), request.getDependencies(), request.getConditions());
        return gateway.submit(effective);
    }

    public void cancelChain(String executionId) {
        gateway.cancel(executionId);
    }

    public void updateChainConfig(String executionId, Map<String, Object> updates) {
        gateway.updateConfig(executionId, updates);
    }

    public ChainStatusSnapshot chainStatus(String executionId) {
        return gateway.status(executionId);
    }

    public List<ToolCallResult> chainResults(String executionId) {
        return gateway.results(executionId);
    }

    public Optional<ChainExecutionResult> awaitChain(String executionId, Duration timeout) {
        return gateway.await(executionId, timeout);
    }

    public List<ToolDefinition> availableTools(String sessionId, boolean refresh) {
        return coordinator.getAvailableTools(sessionId, refresh);
    }

    /** Function-calling schemas of the session's available tools, for the model request. */
    public List<Map<String, Object>> toolSchemas(String sessionId) {
        return ToolSchemaExporter.schemas(coordinator.getAvailableTools(sessionId, false));
    }

    public ModelChangeEvent switchModel(String sessionId, String modelId) {
        return coordinator.switchModel(sessionId, modelId);
    }

    public Map<String, Map<String, ToolAvailabilityState>> compatibilityMatrix() {
        return coordinator.compatibilityMatrix();
    }

    public boolean endSession(String sessionId) {
        return coordinator.cleanupSession(sessionId);
    }
}
