package com.obelisk.worker.port;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolExecutionContext;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Substrate the chain orchestrator runs on: one attempt of a tool call, one bounded-concurrency
 * batch, step bookkeeping, timers, time and logging. Implementations never throw for a failed call; failures come
 * back as failed {@link ToolCallResult}s.
 */
public interface DurableExecutionPort {

    /** One attempt of a call, bounded by {@code timeoutSeconds}. */
    ToolCallResult executeStep(ToolCall call, ToolExecutionContext context, double timeoutSeconds);

    /** All calls with at most {@code maxConcurrent} in flight; results in input order. */
    List<ToolCallResult> executeBatch(List<ToolCall> calls, ToolExecutionContext context,
                                      int maxConcurrent, double timeoutSeconds);

    /** Feeds finished steps, one result per step, into the session's statistics. */
    void recordOutcomes(ToolExecutionContext context, List<ToolCallResult> results);

    /**
     * Waits before a retry.
     *
     * @throws java.util.concurrent.CancellationException when the wait is interrupted
     */
    void sleep(Duration duration);

    /** Current time in epoch milliseconds. */
    long now();

    Logger logger(Class<?> type);
}
