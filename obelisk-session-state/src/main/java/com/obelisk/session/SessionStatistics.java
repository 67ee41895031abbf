package com.obelisk.session;

import java.util.List;

/**
 * Point-in-time statistics of one session.
 */
public record SessionStatistics(
        String sessionId,
        String currentModel,
        CapabilityLevel capabilityLevel,
        boolean supportsToolCalls,
        List<String> availableTools,
        long totalToolCalls,
        long successfulToolCalls,
        long failedToolCalls,
        double successRatePercent,
        double cacheHitRatePercent,
        int modelSwitchCount,
        Long lastModelChange,
        double sessionAgeHours,
        ConfigurationSummary configuration) {

    public int availableToolsCount() {
        return availableTools.size();
    }

    /** The configuration fields worth reporting; allowedToolsCount is null when every tool is allowed. */
    public record ConfigurationSummary(
            boolean enableTools,
            int maxConcurrentTools,
            double toolTimeoutSeconds,
            int cacheDurationMinutes,
            Integer allowedToolsCount,
            int blockedToolsCount) {

        static ConfigurationSummary of(SessionConfiguration config) {
            return new ConfigurationSummary(config.isEnableTools(), config.getMaxConcurrentTools(),
                    config.getToolTimeoutSeconds(), config.getCacheDurationMinutes(),
                    config.getAllowedTools() != null ? config.getAllowedTools().size() : null,
                    config.getBlockedTools().size());
        }
    }
}
