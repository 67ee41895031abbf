package com.obelisk.worker.chain;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolCallStatus;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.port.DurableExecutionPort;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs one {@link ToolExecutionRequest} under its strategy on a {@link DurableExecutionPort}.
 * <p>
 * One instance per execution. {@link #run} drives the chain on a single logical thread;
 * {@link #cancel}, {@link #updateConfig}, {@link #getStatus} and {@link #getResults} may be
 * called concurrently with it. Cancellation is checked before every step and before every
 * retry attempt; a call already dispatched is not interrupted. The chain deadline
 * ({@code timeoutSeconds}) is checked before every step.
 */
public final class ToolChainOrchestrator {

    private final DurableExecutionPort port;
    private final Logger log;
    private final ChainConfig baseConfig;
    private final Object lock = new Object();

    private boolean started;
    private String executionId;
    private ChainStrategy strategy;
    private ChainStatus status = ChainStatus.PENDING;
    private ChainConfig config;
    private final Map<String, Object> configUpdates = new LinkedHashMap<>();
    private boolean cancelRequested;
    private int currentStep;
    private int totalTools;
    private final List<ToolCallResult> results = new ArrayList<>();
    private Long startedAt;
    private Long finishedAt;

    public ToolChainOrchestrator(DurableExecutionPort port) {
        this(port, Map.of());
    }

    /**
     * @param configDefaults chain configuration used for keys the request does not set
     */
    public ToolChainOrchestrator(DurableExecutionPort port, Map<String, Object> configDefaults) {
        this.port = port;
        this.log = port.logger(ToolChainOrchestrator.class);
        this.baseConfig = new ChainConfig(configDefaults);
        this.config = baseConfig;
    }

    public ChainExecutionResult run(ToolExecutionRequest request) {
        long start = port.now();
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Orchestrator already ran execution " + executionId);
            }
            started = true;
            executionId = request.getExecutionId();
            strategy = request.getStrategy();
            totalTools = request.getToolCalls().size();
            startedAt = start;
            config = baseConfig.merge(request.getConfig()).merge(configUpdates);
            if (!cancelRequested) {
                status = ChainStatus.RUNNING;
            }
        }
        log.info("Starting chain {} with {} tool(s), strategy={}", executionId, totalTools, strategy.wireName());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", request.getSessionId());
        metadata.put("timeoutSeconds", request.getTimeoutSeconds());
        metadata.put("maxRetries", request.getMaxRetries());
        long deadline = start + request.getTimeoutSeconds() * 1000L;

        ChainStatus finalStatus;
        ToolError error = null;
        try {
            switch (strategy) {
                case PARALLEL -> runParallel(request, deadline);
                case SEQUENTIAL -> runSequential(request, deadline);
                case CONDITIONAL -> runConditional(request, deadline);
                case DEPENDENCY_BASED -> runDependencyBased(request, deadline, metadata);
                default -> throw new IllegalStateException("Unsupported strategy: " + strategy);
            }
            finalStatus = isCancelRequested() ? ChainStatus.CANCELLED : ChainStatus.COMPLETED;
        } catch (ChainAbortedException e) {
            finalStatus = e.status();
            error = e.error();
        } catch (CancellationException e) {
            finalStatus = ChainStatus.CANCELLED;
        } catch (RuntimeException e) {
            log.error("Chain {} failed: {}", executionId, e.getMessage(), e);
            finalStatus = ChainStatus.FAILED;
            error = ToolError.of(ToolErrorKind.EXECUTION, e.getClass().getSimpleName(),
                    "Chain execution failed: " + e.getMessage(), null);
        }
        if (finalStatus == ChainStatus.CANCELLED && error == null) {
            error = ToolError.of(ToolErrorKind.CANCELLED, "Execution was cancelled");
        }

        List<ToolCallResult> snapshot;
        ChainConfig finalConfig;
        synchronized (lock) {
            status = finalStatus;
            finishedAt = port.now();
            snapshot = List.copyOf(results);
            finalConfig = config;
            metadata.put("startedAt", startedAt);
            metadata.put("finishedAt", finishedAt);
        }
        metadata.put("config", finalConfig.asMap());
        ChainExecutionSummary summary = ChainExecutionSummary.of(snapshot);
        if (finalStatus == ChainStatus.COMPLETED) {
            log.info("Chain {} completed: {}/{} succeeded", executionId, summary.successfulTools(), summary.totalTools());
        } else {
            log.warn("Chain {} ended {}: {}", executionId, finalStatus.wireName(), error != null ? error.getMessage() : "");
        }
        return new ChainExecutionResult(executionId, strategy, finalStatus, snapshot, summary, error, metadata);
    }

    private void runParallel(ToolExecutionRequest request, long deadline) {
        List<ToolCall> calls = request.getToolCalls();
        if (calls.isEmpty() || !beforeStep(deadline)) {
            return;
        }
        int step = nextStep();
        ChainConfig cfg = config();
        ToolExecutionContext context = context(request, step, Map.of("parallelExecution", true));
        log.info("Executing {} tool(s) in parallel (maxConcurrent={})", calls.size(), cfg.maxConcurrent());
        List<ToolCallResult> batch = port.executeBatch(calls, context, cfg.maxConcurrent(), cfg.timeoutPerToolSeconds());
        port.recordOutcomes(context, batch);
        synchronized (lock) {
            results.addAll(batch);
        }
    }

    private void runSequential(ToolExecutionRequest request, long deadline) {
        List<ToolCall> calls = request.getToolCalls();
        Map<String, Map<String, Object>> accumulator = new LinkedHashMap<>();
        for (int i = 0; i < calls.size(); i++) {
            if (!beforeStep(deadline)) {
                return;
            }
            ToolCall call = calls.get(i);
            int step = nextStep();
            log.info("Executing tool {}/{}: {}", i + 1, calls.size(), call.getToolName());
            ToolExecutionContext context = context(request, step,
                    Map.of("sequentialExecution", true, "totalSteps", calls.size()))
                    .withPreviousResults(accumulator);
            ToolCallResult result = executeWithRetries(call, context, request.getMaxRetries());
            append(result);
            if (result.isSuccess()) {
                accumulator.put(result.getToolName(), result.getResult());
            } else if (!result.isCancelled() && config().failFast()) {
                log.warn("Sequential chain {} stopped by failure at step {}", executionId, i + 1);
                throw new ChainAbortedException(ChainStatus.FAILED, ToolError.of(ToolErrorKind.EXECUTION, "FailFast",
                        String.format("Tool '%s' failed at step %d: %s", call.getToolName(), i + 1,
                                result.getError().getMessage()), null));
            }
        }
    }

    private void runConditional(ToolExecutionRequest request, long deadline) {
        List<ToolCall> calls = request.getToolCalls();
        Map<String, Map<String, Object>> accumulator = new LinkedHashMap<>();
        for (int i = 0; i < calls.size(); i++) {
            if (!beforeStep(deadline)) {
                return;
            }
            ToolCall call = calls.get(i);
            ChainCondition condition = request.conditionFor(call.getId());
            if (!condition.evaluate(accumulator, log)) {
                log.info("Skipping tool {} ({}) due to condition {}", i + 1, call.getToolName(), condition);
                continue;
            }
            int step = nextStep();
            ToolExecutionContext context = context(request, step,
                    Map.of("conditionalExecution", true, "condition", condition.getType()))
                    .withPreviousResults(accumulator);
            ToolCallResult result = executeWithRetries(call, context, request.getMaxRetries());
            append(result);
            if (result.isSuccess()) {
                accumulator.put(result.getToolName(), result.getResult());
            }
        }
    }

    private void runDependencyBased(ToolExecutionRequest request, long deadline, Map<String, Object> metadata) {
        Map<String, ToolCall> byId = new LinkedHashMap<>();
        for (ToolCall call : request.getToolCalls()) {
            if (byId.putIfAbsent(call.getId(), call) != null) {
                throw new ChainAbortedException(ChainStatus.FAILED, ToolError.of(ToolErrorKind.CONFIGURATION,
                        "DuplicateCallId", "Duplicate call id in dependency chain: " + call.getId(), null));
            }
        }
        DependencyPlan plan = DependencyResolver.resolve(new ArrayList<>(byId.keySet()), request.getDependencies());
        metadata.put("batches", plan.batches());
        metadata.put("cycleDetected", plan.cycleDetected());
        if (plan.cycleDetected()) {
            if (config().failOnDependencyCycle()) {
                throw new ChainAbortedException(ChainStatus.FAILED, ToolError.of(ToolErrorKind.CONFIGURATION,
                        "DependencyCycle", "Circular dependency detected at " + plan.cycleBreaks(), null));
            }
            log.warn("Circular dependency detected in chain {}, breaking cycle at {}", executionId, plan.cycleBreaks());
        }

        Map<String, Map<String, Object>> accumulator = new LinkedHashMap<>();
        for (List<String> batch : plan.batches()) {
            for (String id : batch) {
                if (!beforeStep(deadline)) {
                    return;
                }
                ToolCall call = byId.get(id);
                int step = nextStep();
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put("dependencyBasedExecution", true);
                extra.put("toolId", id);
                extra.put("dependencies", request.getDependencies().getOrDefault(id, List.of()));
                ToolExecutionContext context = context(request, step, extra).withPreviousResults(accumulator);
                ToolCallResult result = executeWithRetries(call, context, request.getMaxRetries());
                append(result);
                if (result.isSuccess()) {
                    accumulator.put(id, result.getResult());
                }
            }
        }
    }

    /**
     * Up to {@code maxRetries + 1} attempts with exponential backoff between them. Non-retryable
     * errors end the loop at once. The returned result carries the attempt count in its metadata;
     * the step's final outcome is recorded once, whatever the number of attempts.
     */
    private ToolCallResult executeWithRetries(ToolCall call, ToolExecutionContext context, int maxRetries) {
        ChainConfig cfg = config();
        long delayMs = cfg.retryInitialIntervalMs();
        ToolCallResult last = null;
        int attempt = 0;
        while (attempt <= maxRetries) {
            if (isCancelRequested()) {
                if (last != null) {
                    port.recordOutcomes(context, List.of(last));
                }
                return cancelledResult(call, attempt);
            }
            attempt++;
            cfg = config();
            log.info("Executing {} (attempt {}/{})", call.getToolName(), attempt, maxRetries + 1);
            ToolCallResult result = port.executeStep(call, context, cfg.timeoutPerToolSeconds());
            if (result.isSuccess()) {
                port.recordOutcomes(context, List.of(result));
                return withAttempts(result, attempt);
            }
            last = result;
            if (!result.getError().isRetryable() || attempt > maxRetries) {
                break;
            }
            log.warn("Tool {} failed on attempt {}, retrying in {} ms: {}",
                    call.getToolName(), attempt, delayMs, result.getError().getMessage());
            port.sleep(Duration.ofMillis(delayMs));
            delayMs = Math.min((long) (delayMs * cfg.retryBackoff()), cfg.retryMaxIntervalMs());
        }
        port.recordOutcomes(context, List.of(last));
        if (last.getError().isRetryable()) {
            log.error("Tool {} failed after {} attempts: {}", call.getToolName(), attempt, last.getError().getMessage());
        }
        return withAttempts(last, attempt);
    }

    private boolean beforeStep(long deadline) {
        if (isCancelRequested()) {
            log.info("Chain {} cancelled; skipping remaining steps", executionId);
            return false;
        }
        if (port.now() > deadline) {
            throw new ChainAbortedException(ChainStatus.FAILED, ToolError.of(ToolErrorKind.TIMEOUT, "ChainTimeout",
                    "Chain execution exceeded its deadline", null));
        }
        return true;
    }

    private ToolExecutionContext context(ToolExecutionRequest request, int step, Map<String, Object> extra) {
        ChainConfig cfg = config();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("executionId", request.getExecutionId());
        metadata.put("stepNumber", step);
        metadata.put("strategy", request.getStrategy().wireName());
        metadata.putAll(extra);
        return ToolExecutionContext.builder(request.getSessionId())
                .modelId(cfg.model())
                .role(cfg.role())
                .metadata(metadata)
                .build();
    }

    private ToolCallResult cancelledResult(ToolCall call, int attempts) {
        return new ToolCallResult(call.getId(), call.getToolName(), ToolCallStatus.CANCELLED, null,
                ToolError.of(ToolErrorKind.CANCELLED, "Tool execution was cancelled"), 0.0, port.now(),
                Map.of("attempts", attempts));
    }

    private static ToolCallResult withAttempts(ToolCallResult result, int attempts) {
        Map<String, Object> metadata = new LinkedHashMap<>(result.getMetadata());
        metadata.put("attempts", attempts);
        ToolError error = result.getError() != null ? result.getError().withDetail("attempts", attempts) : null;
        return new ToolCallResult(result.getCallId(), result.getToolName(), result.getStatus(), result.getResult(),
                error, result.getExecutionTimeMs(), result.getTimestamp(), metadata);
    }

    private int nextStep() {
        synchronized (lock) {
            return ++currentStep;
        }
    }

    private void append(ToolCallResult result) {
        synchronized (lock) {
            results.add(result);
        }
    }

    private ChainConfig config() {
        synchronized (lock) {
            return config;
        }
    }

    private boolean isCancelRequested() {
        synchronized (lock) {
            return cancelRequested;
        }
    }

    /** Requests cooperative cancellation. Ignored once the chain has finished. */
    public void cancel() {
        synchronized (lock) {
            if (status.isTerminal() && finishedAt != null) {
                log.info("Chain {} already finished; cancel ignored", executionId);
                return;
            }
            cancelRequested = true;
            status = ChainStatus.CANCELLED;
        }
        log.info("Cancellation requested for chain {}", executionId);
    }

    /** Merges values into the live configuration; later steps see them. */
    public void updateConfig(Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) return;
        synchronized (lock) {
            configUpdates.putAll(updates);
            config = config.merge(updates);
        }
        log.info("Configuration updated for chain {}: {}", executionId, updates.keySet());
    }

    public ChainStatusSnapshot getStatus() {
        synchronized (lock) {
            int completed = 0;
            int failed = 0;
            for (ToolCallResult r : results) {
                if (r.isSuccess()) completed++;
                else if (!r.isCancelled()) failed++;
            }
            return new ChainStatusSnapshot(executionId, status, strategy, currentStep, totalTools,
                    completed, failed, results.size(), cancelRequested, startedAt, finishedAt);
        }
    }

    public List<ToolCallResult> getResults() {
        synchronized (lock) {
            return List.copyOf(results);
        }
    }
}
