package com.obelisk.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ObeliskConfigTest {

    @Test
    void fromMap_emptyUsesDefaults() {
        ObeliskConfig config = ObeliskConfig.fromMap(Map.of());

        assertEquals(List.of("obelisk-task-queue"), config.getTaskQueues());
        assertFalse(config.isDebugQueueEnabled());
        assertEquals("localhost:7233", config.getTemporalTarget());
        assertEquals("default", config.getTemporalNamespace());
        assertEquals(3, config.getMaxConcurrentTools());
        assertEquals(30, config.getToolTimeoutSeconds());
        assertEquals(30, config.getCacheDurationMinutes());
        assertEquals(24, config.getSessionMaxAgeHours());
        assertEquals(60, config.getToolSnapshotTtlMinutes());
        assertEquals(300, config.getChainTimeoutSeconds());
        assertEquals(3, config.getChainMaxRetries());
        assertEquals(1000L, config.getRetryInitialIntervalMs());
        assertNull(config.getModelsFile());
    }

    @Test
    void fromMap_debugAddsQueueVariants() {
        ObeliskConfig config = ObeliskConfig.fromMap(Map.of(
                "OBELISK_TASK_QUEUE", "tools-a, tools-b",
                "OBELISK_IS_DEBUG_ENABLED", "true"));

        assertEquals(List.of("tools-a", "tools-b", "tools-a-debug", "tools-b-debug"), config.getTaskQueues());
    }

    @Test
    void fromMap_parsesNumbersAndIgnoresGarbage() {
        ObeliskConfig config = ObeliskConfig.fromMap(Map.of(
                "OBELISK_MAX_CONCURRENT_TOOLS", "8",
                "OBELISK_CHAIN_MAX_RETRIES", "not-a-number",
                "OBELISK_MODELS_FILE", " /etc/obelisk/models.json "));

        assertEquals(8, config.getMaxConcurrentTools());
        assertEquals(3, config.getChainMaxRetries());
        assertEquals("/etc/obelisk/models.json", config.getModelsFile());
    }

    @Test
    void build_rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> ObeliskConfig.builder().maxConcurrentTools(0).build());
    }
}
