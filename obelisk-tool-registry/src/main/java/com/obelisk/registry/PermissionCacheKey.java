package com.obelisk.registry;

/** Cache key for role/model permission decisions. */
record PermissionCacheKey(String sessionId, String toolName, String role, String modelId) {
}
