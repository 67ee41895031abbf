package com.obelisk.worker.port;

import com.obelisk.registry.Backoff;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/** Runs chains on the calling thread with the executor's worker pool; no durability. */
public final class InProcessExecutionPort implements DurableExecutionPort {

    private final ToolStepRunner runner;
    private final Clock clock;
    private final Backoff backoff;

    public InProcessExecutionPort(ToolStepRunner runner) {
        this(runner, Clock.systemUTC(), Backoff.SLEEP);
    }

    public InProcessExecutionPort(ToolStepRunner runner, Clock clock, Backoff backoff) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    @Override
    public ToolCallResult executeStep(ToolCall call, ToolExecutionContext context, double timeoutSeconds) {
        return runner.run(call, context, timeoutSeconds);
    }

    @Override
    public List<ToolCallResult> executeBatch(List<ToolCall> calls, ToolExecutionContext context,
                                             int maxConcurrent, double timeoutSeconds) {
        return runner.runBatch(calls, context, maxConcurrent, timeoutSeconds);
    }

    @Override
    public void recordOutcomes(ToolExecutionContext context, List<ToolCallResult> results) {
        runner.record(context, results);
    }

    @Override
    public void sleep(Duration duration) {
        try {
            backoff.await(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted during retry backoff");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    @Override
    public long now() {
        return clock.millis();
    }

    @Override
    public Logger logger(Class<?> type) {
        return LoggerFactory.getLogger(type);
    }
}
