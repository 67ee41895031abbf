package com.obelisk.registry;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per (session, tool) usage: call timestamps inside the sliding hour window and the
 * cumulative session call count. Guarded by its own monitor.
 */
final class SessionUsage {

    static final long WINDOW_MILLIS = 60L * 60L * 1000L;

    private final Deque<Long> hourlyCalls = new ArrayDeque<>();
    private int sessionCalls;
    private long lastCallAt;

    /**
     * Returns the limit that a new call would exceed, or null when the call is within limits.
     * Does not record anything.
     */
    synchronized String exceededLimit(long now, Integer maxCallsPerHour, Integer maxCallsPerSession) {
        prune(now);
        if (maxCallsPerSession != null && sessionCalls >= maxCallsPerSession) {
            return String.format("session rate limit exceeded (%d calls per session)", maxCallsPerSession);
        }
        if (maxCallsPerHour != null && hourlyCalls.size() >= maxCallsPerHour) {
            return String.format("hourly rate limit exceeded (%d calls per hour)", maxCallsPerHour);
        }
        return null;
    }

    /**
     * Records a call when it stays within the limits; check and record are atomic.
     *
     * @return null when recorded, else the exceeded limit
     */
    synchronized String tryRecord(long now, Integer maxCallsPerHour, Integer maxCallsPerSession) {
        String exceeded = exceededLimit(now, maxCallsPerHour, maxCallsPerSession);
        if (exceeded != null) {
            return exceeded;
        }
        hourlyCalls.addLast(now);
        sessionCalls++;
        lastCallAt = now;
        return null;
    }

    synchronized int callsInLastHour(long now) {
        prune(now);
        return hourlyCalls.size();
    }

    synchronized int sessionCalls() {
        return sessionCalls;
    }

    synchronized long lastCallAt() {
        return lastCallAt;
    }

    private void prune(long now) {
        long cutoff = now - WINDOW_MILLIS;
        while (!hourlyCalls.isEmpty() && hourlyCalls.peekFirst() <= cutoff) {
            hourlyCalls.removeFirst();
        }
    }
}
