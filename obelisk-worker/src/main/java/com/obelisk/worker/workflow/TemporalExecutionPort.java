package com.obelisk.worker.workflow;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolCallStatus;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.activity.ToolActivities;
import com.obelisk.worker.port.DurableExecutionPort;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.CanceledFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.Workflow;
import io.temporal.workflow.WorkflowInfo;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Port backed by the Temporal workflow runtime. Must only be used from workflow code.
 * Activities are scheduled with a single attempt since the orchestrator owns retries; on
 * a {@code -debug} task queue activity timeouts are effectively disabled.
 */
final class TemporalExecutionPort implements DurableExecutionPort {

    private static final Duration TIMEOUT_GRACE = Duration.ofSeconds(5);
    private static final Duration ACTIVITY_NO_TIMEOUT_DEBUG = Duration.ofDays(365);
    private static final Duration RECORD_TIMEOUT = Duration.ofSeconds(10);

    private final boolean debugQueue;

    TemporalExecutionPort() {
        WorkflowInfo info = Workflow.getInfo();
        this.debugQueue = info.getTaskQueue() != null && info.getTaskQueue().endsWith("-debug");
    }

    @Override
    public ToolCallResult executeStep(ToolCall call, ToolExecutionContext context, double timeoutSeconds) {
        double bound = call.getTimeoutSeconds() != null ? call.getTimeoutSeconds() : timeoutSeconds;
        ToolActivities activities = activities(Duration.ofMillis((long) (bound * 1000)));
        try {
            return activities.executeToolCall(call, context, timeoutSeconds);
        } catch (ActivityFailure e) {
            return failedResult(call, e);
        }
    }

    @Override
    public List<ToolCallResult> executeBatch(List<ToolCall> calls, ToolExecutionContext context,
                                             int maxConcurrent, double timeoutSeconds) {
        int waves = (calls.size() + maxConcurrent - 1) / maxConcurrent;
        ToolActivities activities = activities(Duration.ofMillis((long) (timeoutSeconds * 1000 * Math.max(1, waves))));
        try {
            return activities.executeToolCalls(calls, context, maxConcurrent, timeoutSeconds);
        } catch (ActivityFailure e) {
            List<ToolCallResult> failed = new ArrayList<>(calls.size());
            for (ToolCall call : calls) {
                failed.add(failedResult(call, e));
            }
            return failed;
        }
    }

    @Override
    public void recordOutcomes(ToolExecutionContext context, List<ToolCallResult> results) {
        if (context.getSessionId() == null || results.isEmpty()) {
            return;
        }
        try {
            activities(RECORD_TIMEOUT).recordToolOutcomes(context, results);
        } catch (ActivityFailure e) {
            if (e.getCause() instanceof CanceledFailure canceled) {
                throw cancelled(canceled);
            }
            Workflow.getLogger(TemporalExecutionPort.class).warn("Could not record {} step outcome(s) for session {}: {}",
                    results.size(), context.getSessionId(), e.getMessage());
        }
    }

    @Override
    public void sleep(Duration duration) {
        try {
            Workflow.sleep(duration);
        } catch (CanceledFailure e) {
            throw cancelled(e);
        }
    }

    @Override
    public long now() {
        return Workflow.currentTimeMillis();
    }

    @Override
    public Logger logger(Class<?> type) {
        return Workflow.getLogger(type);
    }

    private ToolActivities activities(Duration toolTimeout) {
        Duration startToClose = debugQueue ? ACTIVITY_NO_TIMEOUT_DEBUG : toolTimeout.plus(TIMEOUT_GRACE);
        return Workflow.newActivityStub(ToolActivities.class, ActivityOptions.newBuilder()
                .setStartToCloseTimeout(startToClose)
                .setRetryOptions(RetryOptions.newBuilder().setMaximumAttempts(1).build())
                .build());
    }

    private ToolCallResult failedResult(ToolCall call, ActivityFailure failure) {
        Throwable cause = failure.getCause();
        if (cause instanceof CanceledFailure canceled) {
            throw cancelled(canceled);
        }
        ToolError error = cause instanceof TimeoutFailure
                ? ToolError.of(ToolErrorKind.TIMEOUT, "Tool activity timed out: " + cause.getMessage())
                : ToolError.of(ToolErrorKind.EXECUTION, "ActivityFailure",
                        "Tool activity failed: " + (cause != null ? cause.getMessage() : failure.getMessage()),
                        Map.of("activityType", failure.getActivityType()));
        ToolCallStatus status = error.getKind() == ToolErrorKind.TIMEOUT ? ToolCallStatus.TIMEOUT : ToolCallStatus.FAILED;
        return new ToolCallResult(call.getId(), call.getToolName(), status, null, error, 0.0, now(), null);
    }

    private static CancellationException cancelled(CanceledFailure cause) {
        CancellationException e = new CancellationException("Workflow cancelled: " + cause.getMessage());
        e.initCause(cause);
        return e;
    }
}
