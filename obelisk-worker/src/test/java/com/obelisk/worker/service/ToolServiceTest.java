package com.obelisk.worker.service;

import com.obelisk.session.DynamicToolCoordinator;
import com.obelisk.session.ModelChangeEvent;
import com.obelisk.session.SessionStatistics;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.worker.WorkerFixtures;
import com.obelisk.worker.chain.ChainConfig;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatus;
import com.obelisk.worker.chain.ChainStrategy;
import com.obelisk.worker.chain.ToolExecutionRequest;
import com.obelisk.worker.gateway.ChainNotFoundException;
import com.obelisk.worker.gateway.LocalToolChainGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private WorkerFixtures fixtures;
    private LocalToolChainGateway gateway;
    private ToolService service;

    @BeforeEach
    void setUp() {
        fixtures = new WorkerFixtures();
        gateway = new LocalToolChainGateway(fixtures.port);
        service = new ToolService(fixtures.registry, fixtures.executor,
                new DynamicToolCoordinator(fixtures.registry, fixtures.sessions), gateway, fixtures.config);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
        fixtures.executor.close();
    }

    private static ToolCall add(double a, double b) {
        return ToolCall.of("calc-1", "calculator", Map.of("operation", "add", "a", a, "b", b));
    }

    @Test
    void submitCall_calculatorAddsForRegisteredSession() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);

        ToolCallResult result = service.submitCall(add(2, 3), ToolExecutionContext.builder("s1").build());

        assertTrue(result.isSuccess());
        assertEquals(5.0, result.getResult().get("result"));
        assertEquals("2.0 + 3.0", result.getResult().get("expression"));
        SessionStatistics stats = fixtures.sessions.getStatistics("s1").orElseThrow();
        assertEquals(1, stats.totalToolCalls());
        assertEquals(1, stats.successfulToolCalls());
    }

    @Test
    void submitCall_toolUnavailableForSessionModelIsPermissionError() {
        service.registerSession("s1", WorkerFixtures.PLAIN_MODEL);

        ToolCallResult result = service.submitCall(add(1, 1), ToolExecutionContext.builder("s1").build());

        assertEquals(ToolErrorKind.PERMISSION, result.getError().getKind());
        assertEquals("Tool 'calculator' not available for model 'acme/plain-model'", result.getError().getMessage());
    }

    @Test
    void submitCall_unknownToolForSessionIsNotFound() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);

        ToolCallResult result = service.submitCall(ToolCall.of("translator", Map.of()),
                ToolExecutionContext.builder("s1").build());

        assertEquals(ToolErrorKind.NOT_FOUND, result.getError().getKind());
    }

    @Test
    void submitCall_withoutRegisteredSessionGoesStraightToRegistry() {
        ToolCallResult result = service.submitCall(ToolCall.of("calculator", Map.of("operation", "sqrt", "a", 16)),
                ToolExecutionContext.builder("anonymous").build());

        assertEquals(4.0, result.getResult().get("result"));
    }

    @Test
    void submitCall_validationFailureIsNotRetried() {
        ToolCallResult result = service.submitCall(ToolCall.of("calculator", Map.of("operation", "divide", "a", 1, "b", 0)),
                ToolExecutionContext.builder("anonymous").build());

        assertEquals(ToolErrorKind.VALIDATION, result.getError().getKind());
        assertEquals("Division by zero is not allowed", result.getError().getMessage());
    }

    @Test
    void submitChain_usesSessionModelAndWorkerDefaults() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);
        ToolExecutionRequest request = service.newChain("s1")
                .strategy(ChainStrategy.SEQUENTIAL)
                .call(add(2, 3))
                .build();

        String id = service.submitChain(request);
        ChainExecutionResult result = service.awaitChain(id, WAIT).orElseThrow();

        assertEquals(ChainStatus.COMPLETED, result.status());
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) result.metadata().get("config");
        assertEquals(WorkerFixtures.TOOL_MODEL, config.get(ChainConfig.MODEL));
        assertEquals(10L, config.get(ChainConfig.RETRY_INITIAL_INTERVAL_MS));
        assertEquals(fixtures.config.getChainTimeoutSeconds(), result.metadata().get("timeoutSeconds"));
        assertEquals(1, result.metadata().get("maxRetries"));
        assertEquals(1, service.chainResults(id).size());
    }

    @Test
    void submitChain_requestConfigWinsOverDefaults() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);
        ToolExecutionRequest request = ToolExecutionRequest.builder("s1")
                .config(ChainConfig.MODEL, "acme/other-model")
                .config(ChainConfig.MAX_CONCURRENT, 2)
                .build();

        ChainExecutionResult result = service.awaitChain(service.submitChain(request), WAIT).orElseThrow();

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) result.metadata().get("config");
        assertEquals("acme/other-model", config.get(ChainConfig.MODEL));
        assertEquals(2, config.get(ChainConfig.MAX_CONCURRENT));
    }

    @Test
    void submitChain_incompatibleModelFailsCallsNotChain() {
        service.registerSession("s1", WorkerFixtures.PLAIN_MODEL);
        ToolExecutionRequest request = service.newChain("s1").maxRetries(0).call(add(1, 2)).build();

        ChainExecutionResult result = service.awaitChain(service.submitChain(request), WAIT).orElseThrow();

        assertEquals(ChainStatus.COMPLETED, result.status());
        assertNull(result.error());
        assertEquals(ToolErrorKind.PERMISSION, result.results().get(0).getError().getKind());
        assertEquals(1, result.summary().failedTools());
    }

    @Test
    void toolSchemas_listsFunctionSchemasOfAvailableTools() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);

        List<Map<String, Object>> schemas = service.toolSchemas("s1");

        assertEquals(2, schemas.size());
        @SuppressWarnings("unchecked")
        Map<String, Object> function = (Map<String, Object>) schemas.get(0).get("function");
        assertEquals("calculator", function.get("name"));
        assertEquals("function", schemas.get(0).get("type"));
    }

    @Test
    void switchModel_toPlainModelRemovesTools() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);

        ModelChangeEvent event = service.switchModel("s1", WorkerFixtures.PLAIN_MODEL);

        assertEquals(Set.of("calculator", "weather"), event.toolsRemoved());
        assertTrue(service.availableTools("s1", false).isEmpty());
        assertTrue(service.toolSchemas("s1").isEmpty());
    }

    @Test
    void endSession_dropsSessionState() {
        service.registerSession("s1", WorkerFixtures.TOOL_MODEL);

        assertTrue(service.endSession("s1"));
        assertTrue(fixtures.sessions.getState("s1").isEmpty());
    }

    @Test
    void cancelChain_unknownExecutionThrows() {
        assertThrows(ChainNotFoundException.class, () -> service.cancelChain("exec_missing"));
    }
}
