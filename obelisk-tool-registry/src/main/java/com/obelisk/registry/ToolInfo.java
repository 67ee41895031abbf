package com.obelisk.registry;

import com.obelisk.tools.ToolDefinition;

import java.util.List;

/**
 * Read-only view of one registration.
 */
public record ToolInfo(
        ToolDefinition definition,
        boolean enabled,
        List<String> versionHistory,
        long usageCount,
        long lastUsed,
        String implementation) {
}
