package com.obelisk.worker.activity;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.port.ToolStepRunner;
import io.temporal.activity.Activity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Runs tool calls for the chain workflow on the worker's registry and session store. */
public class ToolActivitiesImpl implements ToolActivities {

    private static final Logger log = LoggerFactory.getLogger(ToolActivitiesImpl.class);

    private final ToolStepRunner runner;

    public ToolActivitiesImpl(ToolStepRunner runner) {
        this.runner = runner;
    }

    @Override
    public ToolCallResult executeToolCall(ToolCall call, ToolExecutionContext context, double timeoutSeconds) {
        log.debug("Executing tool {} (call={}, session={}, activityAttempt={})", call.getToolName(), call.getId(),
                context.getSessionId(), Activity.getExecutionContext().getInfo().getAttempt());
        ToolCallResult result = runner.run(call, context, timeoutSeconds);
        log.info("Tool {} finished with status {} in {} ms", call.getToolName(), result.getStatus().wireName(),
                Math.round(result.getExecutionTimeMs()));
        return result;
    }

    @Override
    public List<ToolCallResult> executeToolCalls(List<ToolCall> calls, ToolExecutionContext context,
                                                 int maxConcurrent, double timeoutSeconds) {
        log.info("Executing {} tool call(s) with maxConcurrent={} for session {}", calls.size(), maxConcurrent,
                context.getSessionId());
        return runner.runBatch(calls, context, maxConcurrent, timeoutSeconds);
    }

    @Override
    public void recordToolOutcomes(ToolExecutionContext context, List<ToolCallResult> results) {
        runner.record(context, results);
    }
}
