package com.obelisk.session;

import com.obelisk.config.ObeliskConfig;
import com.obelisk.registry.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateManagerTest {

    private SessionFixtures.MutableClock clock;
    private SessionStateManager manager;

    @BeforeEach
    void setUp() {
        clock = new SessionFixtures.MutableClock();
        ToolRegistry registry = SessionFixtures.registry(clock);
        manager = new SessionStateManager(registry, ObeliskConfig.defaults(), clock);
    }

    private SessionToolState toolSession(String id) {
        return manager.createState(id, SessionFixtures.TOOL_MODEL,
                new ModelCapabilityInfo(SessionFixtures.TOOL_MODEL, true, CapabilityLevel.BASIC, 0, 0, 8192, null));
    }

    @Test
    void createState_appliesDefaultConfiguration() {
        SessionToolState state = toolSession("s1");

        SessionConfiguration config = state.getConfiguration();
        assertEquals("s1", config.getSessionId());
        assertTrue(config.isEnableTools());
        assertEquals(3, config.getMaxConcurrentTools());
        assertEquals(30, config.getCacheDurationMinutes());
        assertNull(config.getAllowedTools());
    }

    @Test
    void refreshToolAvailability_marksCompatibleToolsAvailable() {
        toolSession("s1");

        assertEquals(Set.of("calculator", "weather"), manager.refreshToolAvailability("s1"));
        assertEquals(Set.of("calculator", "weather"), manager.getAvailableTools("s1"));
    }

    @Test
    void refreshToolAvailability_countsCacheHitsAndMisses() {
        SessionToolState state = toolSession("s1");
        manager.refreshToolAvailability("s1");
        manager.refreshToolAvailability("s1");

        assertEquals(2, state.getCacheMisses());
        assertEquals(2, state.getCacheHits());
        assertEquals(50.0, state.getCacheHitRate());
        assertEquals(ToolAvailabilityState.CACHED, state.getToolInfo("calculator").orElseThrow().state());
        assertTrue(manager.getAvailableTools("s1").contains("calculator"));
    }

    @Test
    void updateModel_expiresEveryEntryAndReportsRemovedTools() {
        SessionToolState state = toolSession("s1");
        manager.refreshToolAvailability("s1");

        ModelChangeEvent event = manager.updateModel("s1", SessionFixtures.PLAIN_MODEL,
                ModelCapabilityInfo.unknown(SessionFixtures.PLAIN_MODEL)).orElseThrow();

        assertEquals(Set.of("calculator", "weather"), event.toolsBefore());
        assertEquals(Set.of(), event.toolsAfter());
        assertEquals(Set.of("calculator", "weather"), event.toolsRemoved());
        assertEquals(Set.of(), event.toolsAdded());
        assertEquals(ToolAvailabilityState.EXPIRED, state.getToolInfo("weather").orElseThrow().state());
        assertTrue(manager.getAvailableTools("s1").isEmpty());
        assertEquals(1, state.getModelSwitchCount());
        assertEquals(SessionFixtures.PLAIN_MODEL, state.getCurrentModel());
    }

    @Test
    void updateModel_unknownSessionIsEmpty() {
        assertEquals(Optional.empty(), manager.updateModel("nope", SessionFixtures.TOOL_MODEL,
                ModelCapabilityInfo.unknown(SessionFixtures.TOOL_MODEL)));
    }

    @Test
    void updateToolAvailability_expiresAfterTtl() {
        toolSession("s1");
        manager.updateToolAvailability("s1", "calculator", true, null, Duration.ofMinutes(5));

        assertTrue(manager.getAvailableTools("s1").contains("calculator"));
        clock.advance(Duration.ofMinutes(6));

        assertFalse(manager.getAvailableTools("s1").contains("calculator"));
        assertTrue(manager.getState("s1").orElseThrow().needsRefresh("calculator", clock.millis()));
    }

    @Test
    void getAvailableTools_honoursAllowAndBlockLists() {
        toolSession("s1");
        manager.refreshToolAvailability("s1");

        manager.updateConfiguration("s1", SessionConfiguration.builder("ignored")
                .blockedTools(Set.of("weather"))
                .build());
        assertEquals(Set.of("calculator"), manager.getAvailableTools("s1"));

        manager.updateConfiguration("s1", SessionConfiguration.builder("s1")
                .allowedTools(Set.of("weather"))
                .build());
        assertEquals(Set.of("weather"), manager.getAvailableTools("s1"));

        manager.updateConfiguration("s1", SessionConfiguration.builder("s1").enableTools(false).build());
        assertTrue(manager.getAvailableTools("s1").isEmpty());
    }

    @Test
    void recordExecution_blendsLatencyAfterFirstSample() {
        toolSession("s1");
        manager.updateToolAvailability("s1", "calculator", true);

        manager.recordExecution("s1", "calculator", true, 100.0);
        ToolAvailabilityInfo first = manager.getState("s1").orElseThrow().getToolInfo("calculator").orElseThrow();
        assertEquals(100.0, first.averageExecutionTimeMs(), 1e-9);

        manager.recordExecution("s1", "calculator", false, 200.0);
        ToolAvailabilityInfo second = manager.getState("s1").orElseThrow().getToolInfo("calculator").orElseThrow();
        assertEquals(130.0, second.averageExecutionTimeMs(), 1e-9);
        assertEquals(2, second.executionCount());
        assertEquals(50.0, second.getSuccessRate());
    }

    @Test
    void getStatistics_reportsSessionCounters() {
        toolSession("s1");
        manager.refreshToolAvailability("s1");
        manager.recordExecution("s1", "calculator", true, 10.0);
        manager.recordExecution("s1", "weather", false, 20.0);

        SessionStatistics stats = manager.getStatistics("s1").orElseThrow();

        assertEquals(2, stats.totalToolCalls());
        assertEquals(50.0, stats.successRatePercent());
        assertEquals(2, stats.availableToolsCount());
        assertNull(stats.configuration().allowedToolsCount());
        assertEquals(0.0, stats.sessionAgeHours());
    }

    @Test
    void getStatistics_zeroCallsGiveZeroRates() {
        toolSession("s1");

        SessionStatistics stats = manager.getStatistics("s1").orElseThrow();

        assertEquals(0.0, stats.successRatePercent());
        assertEquals(0.0, stats.cacheHitRatePercent());
        assertEquals(0.0, manager.getAllSessionStats().overallSuccessRate());
    }

    @Test
    void cleanupExpired_removesOnlyStaleSessions() {
        toolSession("old");
        clock.advance(Duration.ofHours(25));
        toolSession("fresh");

        assertEquals(1, manager.cleanupExpired(24));

        assertTrue(manager.getState("old").isEmpty());
        assertTrue(manager.getState("fresh").isPresent());
        assertEquals(1, manager.getAllSessionStats().totalSessions());
    }

    @Test
    void recordExecution_blockedDuringCleanupDoesNotTouchEvictedState() throws Exception {
        SessionToolState state = toolSession("old");
        clock.advance(Duration.ofHours(25));
        ExecutorService recorder = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> recorded;
            synchronized (state) {
                AtomicReference<Thread> worker = new AtomicReference<>();
                recorded = recorder.submit(() -> {
                    worker.set(Thread.currentThread());
                    return manager.recordExecution("old", "calculator", true, 5.0);
                });
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
                while ((worker.get() == null || worker.get().getState() != Thread.State.BLOCKED)
                        && System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
                assertEquals(1, manager.cleanupExpired(24));
            }

            assertFalse(recorded.get(10, TimeUnit.SECONDS));
            assertEquals(0, state.getTotalToolCalls());
        } finally {
            recorder.shutdownNow();
        }
    }

    @Test
    void recordExecution_afterCleanupReportsUnknownSession() {
        toolSession("old");
        clock.advance(Duration.ofHours(25));

        assertEquals(1, manager.cleanupExpired(24));

        assertFalse(manager.recordExecution("old", "calculator", true, 5.0));
        assertEquals(0, manager.getAllSessionStats().totalToolCalls());
    }
}
