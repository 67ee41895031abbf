package com.obelisk.registry;

import com.obelisk.tools.PermissionLevel;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolCallStatus;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolNotFoundException;
import com.obelisk.tools.ToolPermissions;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    private TestTools.MutableClock clock;
    private SimpleMeterRegistry meters;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new TestTools.MutableClock();
        meters = new SimpleMeterRegistry();
        registry = new ToolRegistry(TestTools.models(), new ToolCallMetrics(meters), clock);
    }

    @Test
    void register_thenGetReturnsSameDefinition() {
        TestTools.EchoTool tool = new TestTools.EchoTool("1.0.0");

        assertTrue(registry.register(tool));

        assertSame(tool, registry.get("echo"));
        assertEquals(tool.definition(), registry.get("echo").definition());
    }

    @Test
    void register_sameVersionTwiceKeepsUsageAndCaches() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        registry.executeToolCall(ToolCall.of("echo", Map.of("text", "hi")), TestTools.context("s1"));
        assertTrue(registry.isModelCompatible("echo", TestTools.TOOL_MODEL));

        assertFalse(registry.register(new TestTools.EchoTool("1.0.0")));

        ToolInfo info = registry.getToolInfo("echo");
        assertEquals(1, info.usageCount());
        assertEquals(List.of("1.0.0"), info.versionHistory());
        assertEquals(1, registry.getSessionUsage("echo", "s1").get("session_calls"));
    }

    @Test
    void getSessionUsage_nullSessionIsRejected() {
        registry.register(new TestTools.EchoTool("1.0.0"));

        NullPointerException e = assertThrows(NullPointerException.class, () -> registry.getSessionUsage("echo", null));
        assertEquals("sessionId", e.getMessage());
        assertEquals(0, registry.getSessionUsage("echo", "fresh").get("session_calls"));
    }

    @Test
    void register_forceUpdateReplacesBinding() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        TestTools.EchoTool replacement = new TestTools.EchoTool("1.0.0");

        assertTrue(registry.register(replacement, true));

        assertSame(replacement, registry.get("echo"));
    }

    @Test
    void register_versionHistoryIsBoundedAndDropsOldest() {
        for (int minor = 0; minor <= 11; minor++) {
            registry.register(new TestTools.EchoTool("1." + minor + ".0"));
        }

        List<String> history = registry.getToolInfo("echo").versionHistory();

        assertEquals(10, history.size());
        assertEquals("1.2.0", history.get(0));
        assertEquals("1.11.0", history.get(9));
        assertEquals("1.11.0", registry.get("echo").definition().getVersion());
        assertThrows(ToolNotFoundException.class, () -> registry.get("echo", "1.0.0"));
        assertEquals("1.5.0", registry.get("echo", "1.5.0").definition().getVersion());
    }

    @Test
    void unregister_versionRemovesOnlyThatEntry() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        registry.register(new TestTools.EchoTool("2.0.0"));

        assertTrue(registry.unregister("echo", "2.0.0"));

        assertEquals(List.of("1.0.0"), registry.getToolInfo("echo").versionHistory());
        assertEquals("1.0.0", registry.get("echo").definition().getVersion());
    }

    @Test
    void unregister_withoutVersionRemovesEverything() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        registry.register(new TestTools.EchoTool("2.0.0"));

        assertTrue(registry.unregister("echo"));

        assertFalse(registry.has("echo"));
        assertThrows(ToolNotFoundException.class, () -> registry.get("echo"));
    }

    @Test
    void get_disabledToolIsNotFound() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        registry.disable("echo");

        assertThrows(ToolNotFoundException.class, () -> registry.get("echo"));
        assertEquals(List.of(), registry.listTools(true));
        assertEquals(List.of("echo"), registry.listTools(false));
        assertEquals(1, registry.getRegistryStatus().disabledTools());
    }

    @Test
    void isModelCompatible_requiresToolCallingModel() {
        registry.register(new TestTools.EchoTool("1.0.0"));

        assertTrue(registry.isModelCompatible("echo", TestTools.TOOL_MODEL));
        assertFalse(registry.isModelCompatible("echo", TestTools.PLAIN_MODEL));
        assertFalse(registry.isModelCompatible("echo", "unknown/model"));
    }

    @Test
    void executeToolCall_completesThroughAllGates() {
        registry.register(new TestTools.EchoTool("1.0.0"));

        ToolCallResult result = registry.executeToolCall(ToolCall.of("echo", Map.of("text", "hello")),
                TestTools.context("s1"));

        assertEquals(ToolCallStatus.COMPLETED, result.getStatus());
        assertEquals("hello", result.getResult().get("echo"));
        assertNotNull(meters.find("obelisk.tool.execution").tag("tool", "echo").tag("status", "completed").timer());
    }

    @Test
    void executeToolCall_unknownToolIsNotFound() {
        ToolCallResult result = registry.executeToolCall(ToolCall.of("missing", Map.of()), TestTools.context("s1"));

        assertEquals(ToolErrorKind.NOT_FOUND, result.getError().getKind());
        assertEquals(ToolCallStatus.FAILED, result.getStatus());
    }

    @Test
    void executeToolCall_incompatibleModelIsPermissionError() {
        registry.register(new TestTools.EchoTool("1.0.0"));
        ToolExecutionContext context = ToolExecutionContext.builder("s1").modelId(TestTools.PLAIN_MODEL).build();

        ToolCallResult result = registry.executeToolCall(ToolCall.of("echo", Map.of("text", "x")), context);

        assertEquals(ToolErrorKind.PERMISSION, result.getError().getKind());
    }

    @Test
    void executeToolCall_thirdCallExceedsSessionLimit() {
        registry.register(new TestTools.EchoTool("1.0.0", ToolPermissions.builder().maxCallsPerSession(2).build()));
        ToolCall call = ToolCall.of("echo", Map.of("text", "x"));

        assertTrue(registry.executeToolCall(call, TestTools.context("s1")).isSuccess());
        assertTrue(registry.executeToolCall(call, TestTools.context("s1")).isSuccess());
        ToolCallResult third = registry.executeToolCall(call, TestTools.context("s1"));

        assertEquals(ToolErrorKind.PERMISSION, third.getError().getKind());
        assertTrue(registry.executeToolCall(call, TestTools.context("s2")).isSuccess());
        assertEquals(1.0, meters.counter("obelisk.tool.denied", "tool", "echo", "kind", "permission").count());
    }

    @Test
    void executeToolCall_hourlyWindowSlides() {
        registry.register(new TestTools.EchoTool("1.0.0", ToolPermissions.builder().maxCallsPerHour(1).build()));
        ToolCall call = ToolCall.of("echo", Map.of("text", "x"));

        assertTrue(registry.executeToolCall(call, TestTools.context("s1")).isSuccess());
        assertFalse(registry.executeToolCall(call, TestTools.context("s1")).isSuccess());
        clock.advance(Duration.ofMinutes(61));

        assertTrue(registry.executeToolCall(call, TestTools.context("s1")).isSuccess());
    }

    @Test
    void executeToolCall_validationFailureDoesNotRecordUsage() {
        registry.register(new TestTools.EchoTool("1.0.0"));

        ToolCallResult result = registry.executeToolCall(ToolCall.of("echo", Map.of()), TestTools.context("s1"));

        assertEquals(ToolErrorKind.VALIDATION, result.getError().getKind());
        assertEquals(0, registry.getToolInfo("echo").usageCount());
    }

    @Test
    void checkPermission_evaluatesLevelAndRoleLists() {
        registry.register(new TestTools.EchoTool("1.0.0", ToolPermissions.builder()
                .level(PermissionLevel.AUTHENTICATED)
                .deniedRoles("guest")
                .build()));

        assertTrue(registry.checkPermission("echo", "s1", "user", TestTools.TOOL_MODEL).allowed());
        assertFalse(registry.checkPermission("echo", "s1", null, TestTools.TOOL_MODEL).allowed());
        assertFalse(registry.checkPermission("echo", "s1", "guest", TestTools.TOOL_MODEL).allowed());
    }

    @Test
    void checkPermission_allowedModelsRestrictsModels() {
        registry.register(new TestTools.EchoTool("1.0.0", ToolPermissions.builder()
                .allowedModels(TestTools.TOOL_MODEL)
                .build()));

        assertTrue(registry.checkPermission("echo", "s1", null, TestTools.TOOL_MODEL).allowed());
        PermissionCheck denied = registry.checkPermission("echo", "s1", null, "other/model");
        assertFalse(denied.allowed());
        assertTrue(denied.reason().contains("other/model"));
    }
}
