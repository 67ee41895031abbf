package com.obelisk.worker.workflow;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.worker.WorkerFixtures;
import com.obelisk.worker.activity.ToolActivitiesImpl;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatus;
import com.obelisk.worker.chain.ChainStrategy;
import com.obelisk.worker.chain.ToolExecutionRequest;
import com.obelisk.worker.gateway.TemporalToolChainGateway;
import com.obelisk.worker.port.ToolStepRunner;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolExecutionWorkflowTest {

    private static final String TASK_QUEUE = "obelisk-test-queue";
    private static final Duration WAIT = Duration.ofSeconds(30);

    private TestWorkflowEnvironment env;
    private WorkerFixtures fixtures;
    private TemporalToolChainGateway gateway;

    @BeforeEach
    void setUp() {
        fixtures = new WorkerFixtures();
        env = TestWorkflowEnvironment.newInstance();
        Worker worker = env.newWorker(TASK_QUEUE);
        worker.registerWorkflowImplementationTypes(ToolExecutionWorkflowImpl.class);
        worker.registerActivitiesImplementations(
                new ToolActivitiesImpl(new ToolStepRunner(fixtures.executor, fixtures.sessions)));
        env.start();
        gateway = new TemporalToolChainGateway(env.getWorkflowClient(), TASK_QUEUE);
    }

    @AfterEach
    void tearDown() {
        env.close();
        fixtures.executor.close();
    }

    @Test
    void run_sequentialChainExecutesEachCallAsActivity() {
        ToolExecutionRequest request = ToolExecutionRequest.builder("s1")
                .strategy(ChainStrategy.SEQUENTIAL)
                .call(ToolCall.of("1", "calculator", Map.of("operation", "multiply", "a", 6, "b", 7)))
                .call(ToolCall.of("2", "weather", Map.of("location", "Lisbon")))
                .build();

        String id = gateway.submit(request);
        ChainExecutionResult result = gateway.await(id, WAIT).orElseThrow();

        assertEquals(ChainStatus.COMPLETED, result.status());
        assertEquals(2, result.summary().successfulTools());
        assertEquals(42.0, result.results().get(0).getResult().get("result"));
        assertTrue(result.results().get(1).isSuccess());
    }

    @Test
    void run_parallelChainReturnsResultsInInputOrder() {
        ToolExecutionRequest request = ToolExecutionRequest.builder("s1")
                .strategy(ChainStrategy.PARALLEL)
                .call(ToolCall.of("1", "calculator", Map.of("operation", "add", "a", 1, "b", 1)))
                .call(ToolCall.of("2", "calculator", Map.of("operation", "add", "a", 2, "b", 2)))
                .call(ToolCall.of("3", "calculator", Map.of("operation", "add", "a", 3, "b", 3)))
                .build();

        ChainExecutionResult result = gateway.await(gateway.submit(request), WAIT).orElseThrow();

        assertEquals(3, result.results().size());
        assertEquals("3", result.results().get(2).getCallId());
        assertEquals(6.0, result.results().get(2).getResult().get("result"));
    }

    @Test
    void run_validationFailureIsNotRetried() {
        ToolExecutionRequest request = ToolExecutionRequest.builder("s1")
                .maxRetries(3)
                .call(ToolCall.of("1", "calculator", Map.of("operation", "divide", "a", 1, "b", 0)))
                .build();

        ChainExecutionResult result = gateway.await(gateway.submit(request), WAIT).orElseThrow();

        assertEquals(ChainStatus.COMPLETED, result.status());
        assertEquals(ToolErrorKind.VALIDATION, result.results().get(0).getError().getKind());
        assertEquals(1, ((Number) result.results().get(0).getMetadata().get("attempts")).intValue());
    }

    @Test
    void getExecutionStatus_reportsFinishedChain() {
        ToolExecutionRequest request = ToolExecutionRequest.builder("s1")
                .call(ToolCall.of("1", "calculator", Map.of("operation", "sqrt", "a", 81)))
                .build();
        String id = gateway.submit(request);
        gateway.await(id, WAIT).orElseThrow();

        assertEquals(ChainStatus.COMPLETED, gateway.status(id).status());
        assertEquals(1, gateway.results(id).size());
    }
}
