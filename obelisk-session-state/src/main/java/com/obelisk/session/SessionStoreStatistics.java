package com.obelisk.session;

/** Totals across every session held by a {@link SessionStateManager}. */
public record SessionStoreStatistics(
        int totalSessions,
        int activeSessions,
        long totalToolCalls,
        long totalSuccessfulCalls,
        double overallSuccessRate,
        long lastCleanup) {
}
