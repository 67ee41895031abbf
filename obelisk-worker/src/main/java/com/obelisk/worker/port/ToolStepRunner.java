package com.obelisk.worker.port;

import com.obelisk.registry.ToolExecutor;
import com.obelisk.session.SessionStateManager;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes chain steps against the executor and feeds finished steps into the session's
 * statistics. A call's own timeout override wins; otherwise the tighter of the tool
 * definition's timeout and the chain's per-tool timeout applies.
 */
public final class ToolStepRunner {

    private final ToolExecutor executor;
    private final SessionStateManager sessions;

    public ToolStepRunner(ToolExecutor executor, SessionStateManager sessions) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    /** One attempt of a call; session statistics are left to {@link #record}. */
    public ToolCallResult run(ToolCall call, ToolExecutionContext context, double timeoutSeconds) {
        return executor.execute(withTimeout(call, timeoutSeconds), context);
    }

    public List<ToolCallResult> runBatch(List<ToolCall> calls, ToolExecutionContext context,
                                         int maxConcurrent, double timeoutSeconds) {
        List<ToolCall> bounded = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            bounded.add(withTimeout(call, timeoutSeconds));
        }
        return executor.executeParallel(bounded, context, maxConcurrent);
    }

    /** Counts each finished step once in its session's statistics. */
    public void record(ToolExecutionContext context, List<ToolCallResult> results) {
        if (context.getSessionId() == null) {
            return;
        }
        for (ToolCallResult result : results) {
            sessions.recordExecution(context.getSessionId(), result.getToolName(), result.isSuccess(),
                    result.getExecutionTimeMs());
        }
    }

    private ToolCall withTimeout(ToolCall call, double timeoutSeconds) {
        if (call.getTimeoutSeconds() != null) {
            return call;
        }
        try {
            double definitionTimeout = executor.getRegistry().get(call.getToolName()).definition().getTimeoutSeconds();
            return call.withTimeoutSeconds(Math.min(timeoutSeconds, definitionTimeout));
        } catch (ToolNotFoundException e) {
            // unknown or disabled; the executor reports it as the step's result
            return call.withTimeoutSeconds(timeoutSeconds);
        }
    }
}
