package com.obelisk.registry;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Runs registry calls with call middleware, result processors, retry with exponential
 * backoff, and bounded-concurrency batches. Keeps {@link ToolMetrics} per tool name.
 */
public final class ToolExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final ToolRegistry registry;
    private final Backoff backoff;
    private final ExecutorService pool;
    private final List<BiFunction<ToolCall, ToolExecutionContext, ToolCall>> middleware = new CopyOnWriteArrayList<>();
    private final List<UnaryOperator<ToolCallResult>> resultProcessors = new CopyOnWriteArrayList<>();
    private final Map<String, ToolMetrics> metrics = new ConcurrentHashMap<>();

    public ToolExecutor(ToolRegistry registry) {
        this(registry, Backoff.SLEEP);
    }

    public ToolExecutor(ToolRegistry registry, Backoff backoff) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "obelisk-executor-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Adds a step that may rewrite a call before execution; returning null keeps the call unchanged. */
    public void addMiddleware(BiFunction<ToolCall, ToolExecutionContext, ToolCall> step) {
        middleware.add(Objects.requireNonNull(step, "step"));
    }

    /** Adds a step applied to every result after execution. */
    public void addResultProcessor(UnaryOperator<ToolCallResult> processor) {
        resultProcessors.add(Objects.requireNonNull(processor, "processor"));
    }

    /** One attempt through middleware, the registry pipeline and result processors. */
    public ToolCallResult execute(ToolCall call, ToolExecutionContext context) {
        ToolCall processed = call;
        for (BiFunction<ToolCall, ToolExecutionContext, ToolCall> step : middleware) {
            ToolCall rewritten = step.apply(processed, context);
            if (rewritten != null) processed = rewritten;
        }
        ToolCallResult result = registry.executeToolCall(processed, context);
        for (UnaryOperator<ToolCallResult> processor : resultProcessors) {
            result = processor.apply(result);
        }
        return result;
    }

    /**
     * Attempts the call up to {@code maxRetries + 1} times, doubling the delay after each failed
     * attempt. Errors whose kind is not retryable (validation, configuration, permission, not found)
     * or that are marked terminal end the loop immediately.
     *
     * @return the first successful result, or the last failed one
     */
    public ToolCallResult executeWithRetry(ToolCall call, ToolExecutionContext context,
                                           int maxRetries, Duration initialDelay) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        Duration delay = Objects.requireNonNull(initialDelay, "initialDelay");
        ToolCallResult last = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            ToolCallResult result;
            try {
                result = execute(call, context);
            } catch (RuntimeException e) {
                log.error("Unexpected error executing {} (attempt {}): {}", call.getToolName(), attempt, e.getMessage(), e);
                result = ToolCallResult.failed(call, ToolError.of(ToolErrorKind.EXECUTION,
                        e.getClass().getSimpleName(), "Unexpected error: " + e.getMessage(), null));
            }
            metricsFor(call.getToolName()).record(result);
            if (result.isSuccess()) {
                return result;
            }
            last = result;
            if (!result.getError().isRetryable() || attempt > maxRetries) {
                break;
            }
            log.warn("Tool '{}' failed (attempt {}/{}), retrying in {} ms",
                    call.getToolName(), attempt, maxRetries + 1, delay.toMillis());
            try {
                backoff.await(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            delay = delay.multipliedBy(2);
        }
        return last;
    }

    /**
     * Runs independent calls with at most {@code maxConcurrent} in flight. A call that throws
     * yields a failed result rather than aborting the batch. Result order matches input order.
     */
    public List<ToolCallResult> executeParallel(List<ToolCall> calls, ToolExecutionContext context, int maxConcurrent) {
        if (maxConcurrent <= 0) throw new IllegalArgumentException("maxConcurrent must be positive");
        Semaphore gate = new Semaphore(maxConcurrent);
        List<Future<ToolCallResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(pool.submit(() -> {
                gate.acquire();
                try {
                    ToolCallResult r = execute(call, context);
                    metricsFor(call.getToolName()).record(r);
                    return r;
                } finally {
                    gate.release();
                }
            }));
        }
        List<ToolCallResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Parallel execution of {} failed: {}", call.getToolName(), cause.getMessage(), cause);
                results.add(ToolCallResult.failed(call, ToolError.of(ToolErrorKind.EXECUTION,
                        cause.getClass().getSimpleName(), "Parallel execution error: " + cause.getMessage(), null)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(ToolCallResult.failed(call, ToolError.of(ToolErrorKind.CANCELLED,
                        "Interrupted while waiting for parallel batch")));
            }
        }
        return results;
    }

    public ToolMetrics getToolMetrics(String toolName) {
        return metricsFor(toolName);
    }

    public Map<String, Map<String, Object>> getAllMetrics() {
        Map<String, Map<String, Object>> all = new TreeMap<>();
        metrics.forEach((name, m) -> all.put(name, m.toMap()));
        return all;
    }

    public void resetMetrics(String toolName) {
        if (toolName == null) {
            metrics.clear();
        } else {
            metrics.remove(toolName);
        }
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    private ToolMetrics metricsFor(String toolName) {
        return metrics.computeIfAbsent(toolName, k -> new ToolMetrics());
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
