package com.obelisk.registry;

import com.obelisk.tools.Tool;
import com.obelisk.tools.ToolDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry-owned state of one tool name: current binding, enabled flag, bounded version
 * history, per-session usage, model-compatibility cache, usage count and last-used time.
 * <p>
 * Binding and history mutations happen only inside the registry's per-name
 * {@code compute}, which serializes them per tool name.
 */
final class ToolRegistration {

    static final int MAX_VERSION_HISTORY = 10;

    private volatile Tool tool;
    private volatile boolean enabled = true;
    private final Deque<ToolVersion> versionHistory = new ArrayDeque<>();
    private final Map<String, SessionUsage> sessionUsage = new ConcurrentHashMap<>();
    private final Map<String, Boolean> modelCompatibility = new ConcurrentHashMap<>();
    private final AtomicLong usageCount = new AtomicLong();
    private volatile long lastUsed;

    ToolRegistration(Tool tool, long now) {
        bind(tool, now);
    }

    Tool tool() {
        return tool;
    }

    ToolDefinition definition() {
        return tool.definition();
    }

    boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /** Makes the tool the current binding and appends its version, evicting the oldest beyond the bound. */
    void bind(Tool newTool, long now) {
        String version = newTool.definition().getVersion();
        synchronized (versionHistory) {
            versionHistory.removeIf(v -> v.version().equals(version));
            versionHistory.addLast(new ToolVersion(version, newTool, now));
            while (versionHistory.size() > MAX_VERSION_HISTORY) {
                versionHistory.removeFirst();
            }
        }
        this.tool = newTool;
        modelCompatibility.clear();
    }

    /**
     * Removes one historical version. When it was the current binding, the newest remaining
     * version becomes current.
     *
     * @return false when no versions remain and the registration should be dropped
     */
    boolean removeVersion(String version) {
        synchronized (versionHistory) {
            versionHistory.removeIf(v -> v.version().equals(version));
            if (versionHistory.isEmpty()) {
                return false;
            }
            if (tool.definition().getVersion().equals(version)) {
                tool = versionHistory.peekLast().tool();
                modelCompatibility.clear();
            }
            return true;
        }
    }

    Optional<Tool> version(String version) {
        synchronized (versionHistory) {
            for (ToolVersion v : versionHistory) {
                if (v.version().equals(version)) return Optional.of(v.tool());
            }
        }
        return Optional.empty();
    }

    List<ToolVersion> versionHistory() {
        synchronized (versionHistory) {
            return List.copyOf(new ArrayList<>(versionHistory));
        }
    }

    SessionUsage usage(String sessionId) {
        return sessionUsage.computeIfAbsent(sessionId, k -> new SessionUsage());
    }

    void forgetSession(String sessionId) {
        sessionUsage.remove(sessionId);
    }

    Map<String, Boolean> modelCompatibility() {
        return modelCompatibility;
    }

    void markUsed(long now) {
        usageCount.incrementAndGet();
        lastUsed = now;
    }

    long usageCount() {
        return usageCount.get();
    }

    long lastUsed() {
        return lastUsed;
    }
}
