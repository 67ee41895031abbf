package com.obelisk.worker.chain;

import com.obelisk.tools.ToolCallResult;

import java.util.List;

/** Aggregates over a chain's results; rates and averages are 0 when there are no results. */
public record ChainExecutionSummary(
        int totalTools,
        int successfulTools,
        int failedTools,
        int cancelledTools,
        double successRate,
        double totalExecutionTimeMs,
        double averageExecutionTimeMs) {

    public static ChainExecutionSummary of(List<ToolCallResult> results) {
        int total = results.size();
        int successful = 0;
        int cancelled = 0;
        double totalTime = 0.0;
        for (ToolCallResult r : results) {
            if (r.isSuccess()) successful++;
            else if (r.isCancelled()) cancelled++;
            totalTime += r.getExecutionTimeMs();
        }
        return new ChainExecutionSummary(
                total,
                successful,
                total - successful - cancelled,
                cancelled,
                total > 0 ? (double) successful / total : 0.0,
                totalTime,
                total > 0 ? totalTime / total : 0.0);
    }
}
