package com.obelisk.worker.activity;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolExecutionContext;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

import java.util.List;

/** Tool execution activities. Failed calls are returned as results, never thrown. */
@ActivityInterface
public interface ToolActivities {

    /**
     * One attempt of a tool call through the registry pipeline.
     *
     * @param call           call to execute
     * @param context        session, model and chain metadata
     * @param timeoutSeconds per-tool timeout, used unless the call carries its own
     * @return completed or failed result
     */
    @ActivityMethod(name = "ExecuteToolCall")
    ToolCallResult executeToolCall(ToolCall call, ToolExecutionContext context, double timeoutSeconds);

    /**
     * Independent calls with at most {@code maxConcurrent} in flight, results in input order.
     */
    @ActivityMethod(name = "ExecuteToolCalls")
    List<ToolCallResult> executeToolCalls(List<ToolCall> calls, ToolExecutionContext context,
                                          int maxConcurrent, double timeoutSeconds);

    /** Records finished chain steps in the session's statistics. */
    @ActivityMethod(name = "RecordToolOutcomes")
    void recordToolOutcomes(ToolExecutionContext context, List<ToolCallResult> results);
}
