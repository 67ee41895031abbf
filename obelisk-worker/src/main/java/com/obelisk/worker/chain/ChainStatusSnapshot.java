package com.obelisk.worker.chain;

/** Point-in-time view of a chain for status queries. */
public record ChainStatusSnapshot(
        String executionId,
        ChainStatus status,
        ChainStrategy strategy,
        int currentStep,
        int totalTools,
        int completedTools,
        int failedTools,
        int resultsCount,
        boolean cancellationRequested,
        Long startedAt,
        Long finishedAt) {
}
