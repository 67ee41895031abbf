package com.obelisk.worker.chain;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolError;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.port.DurableExecutionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Port double: each tool answers with its scripted errors, one per attempt, then succeeds with
 * its parameters echoed back. Time advances by {@code stepCostMs} per step.
 */
final class ScriptedPort implements DurableExecutionPort {

    final List<String> executed = new ArrayList<>();
    final Map<String, ToolExecutionContext> contexts = new LinkedHashMap<>();
    final List<Duration> sleeps = new ArrayList<>();
    final List<Integer> batchLimits = new ArrayList<>();
    final List<Double> timeouts = new ArrayList<>();
    final List<ToolCallResult> recorded = new ArrayList<>();
    long clockMs;
    long stepCostMs;
    Consumer<ToolCall> afterStep = call -> { };

    private final Map<String, Deque<ToolError>> scripted = new HashMap<>();
    private final Map<String, ToolError> permanent = new HashMap<>();

    ScriptedPort failFirst(String toolName, ToolError... errors) {
        scripted.put(toolName, new ArrayDeque<>(List.of(errors)));
        return this;
    }

    ScriptedPort failAlways(String toolName, ToolError error) {
        permanent.put(toolName, error);
        return this;
    }

    @Override
    public ToolCallResult executeStep(ToolCall call, ToolExecutionContext context, double timeoutSeconds) {
        executed.add(call.getId());
        contexts.put(call.getId(), context);
        timeouts.add(timeoutSeconds);
        clockMs += stepCostMs;
        ToolCallResult result = answer(call);
        afterStep.accept(call);
        return result;
    }

    @Override
    public List<ToolCallResult> executeBatch(List<ToolCall> calls, ToolExecutionContext context,
                                             int maxConcurrent, double timeoutSeconds) {
        batchLimits.add(maxConcurrent);
        List<ToolCallResult> out = new ArrayList<>();
        for (ToolCall call : calls) {
            executed.add(call.getId());
            contexts.put(call.getId(), context);
            out.add(answer(call));
        }
        clockMs += stepCostMs;
        return out;
    }

    private ToolCallResult answer(ToolCall call) {
        ToolError error = permanent.get(call.getToolName());
        Deque<ToolError> queue = scripted.get(call.getToolName());
        if (error == null && queue != null && !queue.isEmpty()) {
            error = queue.poll();
        }
        if (error != null) {
            return ToolCallResult.failed(call.getId(), call.getToolName(), error, 2.0, null);
        }
        Map<String, Object> data = new LinkedHashMap<>(call.getParameters());
        data.put("tool", call.getToolName());
        return ToolCallResult.completed(call.getId(), call.getToolName(), data, 10.0, null);
    }

    @Override
    public void recordOutcomes(ToolExecutionContext context, List<ToolCallResult> results) {
        recorded.addAll(results);
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        clockMs += duration.toMillis();
    }

    @Override
    public long now() {
        return clockMs;
    }

    @Override
    public Logger logger(Class<?> type) {
        return LoggerFactory.getLogger(type);
    }
}
