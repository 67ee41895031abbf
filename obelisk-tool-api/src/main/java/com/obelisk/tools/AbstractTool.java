package com.obelisk.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base tool with the call state machine: pending → (name, context, parameter checks) →
 * running → execute under timeout → completed | failed | timeout.
 * <p>
 * Subclasses provide {@link #definition()} and {@link #execute}; they may override
 * {@link #validateContext}, {@link #preExecute} and {@link #postExecute}.
 * Metrics are recorded for every call, whatever the outcome.
 */
public abstract class AbstractTool implements Tool {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "obelisk-tool-" + THREAD_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    protected final Logger log = LoggerFactory.getLogger(getClass());
    private final ToolMetrics metrics = new ToolMetrics();

    /** Requires a non-blank session id. */
    protected void validateContext(ToolExecutionContext context) {
        if (context == null || context.getSessionId() == null || context.getSessionId().isBlank()) {
            throw new ToolValidationException(
                    String.format("Session ID is required for tool '%s'", definition().getName()),
                    definition().getName());
        }
    }

    /** Called before execution with validated parameters. Throw a {@link ToolException} to abort. */
    protected void preExecute(Map<String, Object> parameters, ToolExecutionContext context) {
    }

    /** Called after execution returned, whether it reported success or failure. */
    protected void postExecute(ToolResult result, Map<String, Object> parameters, ToolExecutionContext context) {
    }

    public ToolMetrics getMetrics() {
        return metrics;
    }

    @Override
    public final ToolCallResult call(ToolCall call, ToolExecutionContext context) {
        long start = System.nanoTime();
        ToolDefinition definition = definition();
        ToolCallResult result;
        try {
            if (!definition.getName().equals(call.getToolName())) {
                throw new ToolConfigurationException(
                        String.format("Tool name mismatch: expected '%s', got '%s'",
                                definition.getName(), call.getToolName()),
                        definition.getName());
            }
            validateContext(context);
            Map<String, Object> parameters = ParameterValidator.validate(definition, call.getParameters());
            preExecute(parameters, context);
            double timeoutSeconds = call.getTimeoutSeconds() != null
                    ? call.getTimeoutSeconds()
                    : definition.getTimeoutSeconds();
            ToolResult out = executeWithTimeout(parameters, context, timeoutSeconds);
            postExecute(out, parameters, context);
            double elapsed = elapsedMs(start);
            if (out.isSuccess()) {
                result = ToolCallResult.completed(call.getId(), definition.getName(), out.getData(),
                        elapsed, out.getMetadata());
            } else {
                ToolError error = ToolError.of(ToolErrorKind.EXECUTION, out.getError());
                result = ToolCallResult.failed(call.getId(), definition.getName(), error, elapsed, out.getMetadata());
            }
        } catch (ToolException e) {
            log.debug("Tool {} call {} failed: {}", definition.getName(), call.getId(), e.getMessage());
            result = ToolCallResult.failed(call.getId(), definition.getName(), ToolError.from(e),
                    elapsedMs(start), null);
        } catch (RuntimeException e) {
            log.error("Unexpected error in tool '{}': {}", definition.getName(), e.getMessage(), e);
            ToolError error = ToolError.of(ToolErrorKind.EXECUTION, e.getClass().getSimpleName(),
                    "Unexpected error: " + e.getMessage(), Map.of("exception", e.getClass().getName()));
            result = ToolCallResult.failed(call.getId(), definition.getName(), error, elapsedMs(start), null);
        }
        metrics.record(result);
        return result;
    }

    private ToolResult executeWithTimeout(Map<String, Object> parameters, ToolExecutionContext context,
                                          double timeoutSeconds) {
        String name = definition().getName();
        Future<ToolResult> future = EXECUTOR.submit(() -> execute(parameters, context));
        try {
            ToolResult out = future.get((long) (timeoutSeconds * 1000), TimeUnit.MILLISECONDS);
            if (out == null) {
                throw new ToolExecutionException("Tool returned no result", name);
            }
            return out;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolTimeoutException(name, timeoutSeconds);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolException te) {
                throw te;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ToolExecutionException("Tool execution failed: " + cause.getMessage(), name, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for tool", name, e);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(name='" + definition().getName() + "')";
    }
}
