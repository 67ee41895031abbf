package com.obelisk.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tool state of one session: active model, per-tool availability, configuration and call statistics.
 * <p>
 * All access goes through this object's monitor. {@link SessionStateManager} performs compound
 * updates (such as a model switch followed by a re-check) while holding it, so readers never
 * observe a half-applied change.
 */
public final class SessionToolState {

    private final String sessionId;
    private final long createdAt;
    private final Map<String, ToolAvailabilityInfo> toolAvailability = new TreeMap<>();
    private String currentModel;
    private ModelCapabilityInfo modelInfo;
    private SessionConfiguration configuration;
    private Long lastModelChange;
    private int modelSwitchCount;
    private int cacheRefreshCount;
    private long totalToolCalls;
    private long successfulToolCalls;
    private long failedToolCalls;
    private long cacheHits;
    private long cacheMisses;
    private long snapshotExpiry;
    private long updatedAt;

    SessionToolState(String sessionId, String modelId, ModelCapabilityInfo modelInfo,
                     SessionConfiguration configuration, long now) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.currentModel = Objects.requireNonNull(modelId, "modelId");
        this.modelInfo = Objects.requireNonNull(modelInfo, "modelInfo");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.createdAt = now;
        this.updatedAt = now;
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized String getCurrentModel() {
        return currentModel;
    }

    public synchronized ModelCapabilityInfo getModelInfo() {
        return modelInfo;
    }

    public synchronized SessionConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Tools usable right now: available or cached, not past their expiry, and admitted by the
     * session configuration. Empty when the session has tools disabled.
     */
    public synchronized SortedSet<String> getAvailableTools(long now) {
        SortedSet<String> available = new TreeSet<>();
        if (!configuration.isEnableTools()) {
            return available;
        }
        for (ToolAvailabilityInfo info : toolAvailability.values()) {
            if (info.isAvailable() && !info.isExpired(now) && configuration.isToolAllowed(info.toolName())) {
                available.add(info.toolName());
            }
        }
        return available;
    }

    public synchronized Optional<ToolAvailabilityInfo> getToolInfo(String toolName) {
        return Optional.ofNullable(toolAvailability.get(toolName));
    }

    public synchronized Map<String, ToolAvailabilityInfo> getToolAvailability() {
        return Collections.unmodifiableMap(new TreeMap<>(toolAvailability));
    }

    /** True when the tool has no entry, its entry expired or was invalidated, or its last check errored. */
    public synchronized boolean needsRefresh(String toolName, long now) {
        ToolAvailabilityInfo info = toolAvailability.get(toolName);
        if (info == null) {
            return true;
        }
        return info.isExpired(now)
                || info.state() == ToolAvailabilityState.EXPIRED
                || info.state() == ToolAvailabilityState.ERROR
                || info.state() == ToolAvailabilityState.LOADING;
    }

    /** True when any tool entry would be recomputed by a refresh at {@code now}. */
    public synchronized boolean hasStaleEntries(long now) {
        for (String name : toolAvailability.keySet()) {
            if (needsRefresh(name, now)) {
                return true;
            }
        }
        return false;
    }

    /** Session success rate as a percentage; 0 when no calls were recorded. */
    public synchronized double getSuccessRate() {
        return totalToolCalls == 0 ? 0.0 : (successfulToolCalls * 100.0) / totalToolCalls;
    }

    /** Cache hit rate as a percentage; 0 before the first lookup. */
    public synchronized double getCacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0 : (cacheHits * 100.0) / lookups;
    }

    public synchronized Long getLastModelChange() {
        return lastModelChange;
    }

    public synchronized int getModelSwitchCount() {
        return modelSwitchCount;
    }

    public synchronized int getCacheRefreshCount() {
        return cacheRefreshCount;
    }

    public synchronized long getTotalToolCalls() {
        return totalToolCalls;
    }

    public synchronized long getSuccessfulToolCalls() {
        return successfulToolCalls;
    }

    public synchronized long getFailedToolCalls() {
        return failedToolCalls;
    }

    public synchronized long getCacheHits() {
        return cacheHits;
    }

    public synchronized long getCacheMisses() {
        return cacheMisses;
    }

    /** Epoch millis after which the coordinator recomputes the session's tool snapshot. */
    public synchronized long getSnapshotExpiry() {
        return snapshotExpiry;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public synchronized long getUpdatedAt() {
        return updatedAt;
    }

    // Mutators; callers hold the monitor.

    synchronized List<String> toolNames() {
        return new ArrayList<>(toolAvailability.keySet());
    }

    synchronized void applyModel(String newModelId, ModelCapabilityInfo newInfo, long now) {
        currentModel = newModelId;
        modelInfo = newInfo;
        lastModelChange = now;
        modelSwitchCount++;
        toolAvailability.replaceAll((name, info) -> info.withState(ToolAvailabilityState.EXPIRED, now));
        updatedAt = now;
    }

    synchronized void putAvailability(ToolAvailabilityInfo info) {
        toolAvailability.put(info.toolName(), info);
        updatedAt = Math.max(updatedAt, info.lastChecked());
    }

    synchronized void removeTool(String toolName) {
        toolAvailability.remove(toolName);
    }

    synchronized void setConfiguration(SessionConfiguration newConfiguration, long now) {
        configuration = newConfiguration;
        updatedAt = now;
    }

    synchronized void recordExecution(String toolName, boolean success, double durationMs, long now) {
        totalToolCalls++;
        if (success) {
            successfulToolCalls++;
        } else {
            failedToolCalls++;
        }
        ToolAvailabilityInfo info = toolAvailability.get(toolName);
        if (info != null) {
            toolAvailability.put(toolName, info.withExecution(success, durationMs, now));
        }
        updatedAt = now;
    }

    synchronized void markCacheHit(long now) {
        cacheHits++;
        updatedAt = now;
    }

    synchronized void markCacheMiss(long now) {
        cacheMisses++;
        updatedAt = now;
    }

    synchronized void markRefreshed(long now, long expiry) {
        cacheRefreshCount++;
        snapshotExpiry = expiry;
        updatedAt = now;
    }

    @Override
    public synchronized String toString() {
        return "SessionToolState{sessionId='" + sessionId + "', model='" + currentModel
                + "', tools=" + toolAvailability.keySet() + ", switches=" + modelSwitchCount + '}';
    }
}
