package com.obelisk.tools;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running execution statistics of one tool: counts per outcome, min/max/average time,
 * average of the last {@value #RECENT_WINDOW} executions, and failure counts per error type.
 * Thread-safe.
 */
public final class ToolMetrics {

    static final int RECENT_WINDOW = 10;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long timeoutCalls;
    private long cancelledCalls;
    private double totalExecutionTimeMs;
    private double minExecutionTimeMs = Double.POSITIVE_INFINITY;
    private double maxExecutionTimeMs;
    private final Deque<Double> recentExecutions = new ArrayDeque<>();
    private final Map<String, Long> errorCounts = new LinkedHashMap<>();

    public synchronized void record(ToolCallResult result) {
        totalCalls++;
        double t = result.getExecutionTimeMs();
        totalExecutionTimeMs += t;
        minExecutionTimeMs = Math.min(minExecutionTimeMs, t);
        maxExecutionTimeMs = Math.max(maxExecutionTimeMs, t);
        recentExecutions.addLast(t);
        if (recentExecutions.size() > RECENT_WINDOW) {
            recentExecutions.removeFirst();
        }
        switch (result.getStatus()) {
            case COMPLETED -> successfulCalls++;
            case FAILED -> {
                failedCalls++;
                String type = result.getError() != null ? result.getError().getType() : "Unknown";
                errorCounts.merge(type, 1L, Long::sum);
            }
            case TIMEOUT -> timeoutCalls++;
            case CANCELLED -> cancelledCalls++;
            default -> {
                // non-terminal statuses never reach a result
            }
        }
    }

    public synchronized long getTotalCalls() {
        return totalCalls;
    }

    public synchronized long getSuccessfulCalls() {
        return successfulCalls;
    }

    public synchronized long getFailedCalls() {
        return failedCalls;
    }

    public synchronized long getTimeoutCalls() {
        return timeoutCalls;
    }

    public synchronized long getCancelledCalls() {
        return cancelledCalls;
    }

    /** Success rate as a percentage, 0 when nothing was recorded. */
    public synchronized double getSuccessRate() {
        return totalCalls == 0 ? 0.0 : (successfulCalls * 100.0) / totalCalls;
    }

    public synchronized double getAverageExecutionTimeMs() {
        return totalCalls == 0 ? 0.0 : totalExecutionTimeMs / totalCalls;
    }

    public synchronized double getRecentAverageExecutionTimeMs() {
        if (recentExecutions.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double d : recentExecutions) sum += d;
        return sum / recentExecutions.size();
    }

    public synchronized Map<String, Long> getErrorCounts() {
        return Map.copyOf(errorCounts);
    }

    public synchronized Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total_calls", totalCalls);
        m.put("successful_calls", successfulCalls);
        m.put("failed_calls", failedCalls);
        m.put("timeout_calls", timeoutCalls);
        m.put("cancelled_calls", cancelledCalls);
        m.put("success_rate_percent", getSuccessRate());
        m.put("average_execution_time_ms", getAverageExecutionTimeMs());
        m.put("recent_average_execution_time_ms", getRecentAverageExecutionTimeMs());
        m.put("min_execution_time_ms", totalCalls == 0 ? 0.0 : minExecutionTimeMs);
        m.put("max_execution_time_ms", maxExecutionTimeMs);
        m.put("error_counts", new LinkedHashMap<>(errorCounts));
        return m;
    }
}
