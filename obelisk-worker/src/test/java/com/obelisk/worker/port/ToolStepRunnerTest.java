package com.obelisk.worker.port;

import com.obelisk.session.DynamicToolCoordinator;
import com.obelisk.session.SessionStatistics;
import com.obelisk.tools.AbstractTool;
import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolCallStatus;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolResult;
import com.obelisk.worker.WorkerFixtures;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatus;
import com.obelisk.worker.chain.ChainStrategy;
import com.obelisk.worker.chain.ToolChainOrchestrator;
import com.obelisk.worker.chain.ToolExecutionRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolStepRunnerTest {

    private WorkerFixtures fixtures;
    private ToolStepRunner runner;

    @BeforeEach
    void setUp() {
        fixtures = new WorkerFixtures();
        fixtures.registry.register(new SleepyTool(0.2, 800));
        runner = new ToolStepRunner(fixtures.executor, fixtures.sessions);
    }

    @AfterEach
    void tearDown() {
        fixtures.executor.close();
    }

    @Test
    void run_definitionTimeoutAppliesUnderLongerChainTimeout() {
        ToolCallResult result = runner.run(ToolCall.of("1", "sleepy", Map.of()),
                ToolExecutionContext.builder("s1").build(), 60.0);

        assertEquals(ToolCallStatus.TIMEOUT, result.getStatus());
        assertEquals(ToolErrorKind.TIMEOUT, result.getError().getKind());
    }

    @Test
    void run_callOverrideWinsOverDefinitionTimeout() {
        ToolCall call = ToolCall.of("1", "sleepy", Map.of()).withTimeoutSeconds(5.0);

        ToolCallResult result = runner.run(call, ToolExecutionContext.builder("s1").build(), 60.0);

        assertTrue(result.isSuccess());
    }

    @Test
    void run_chainTimeoutAppliesWhenTighterThanDefinition() {
        fixtures.registry.register(new SleepyTool(30.0, 800), true);

        ToolCallResult result = runner.run(ToolCall.of("1", "sleepy", Map.of()),
                ToolExecutionContext.builder("s1").build(), 0.2);

        assertEquals(ToolCallStatus.TIMEOUT, result.getStatus());
    }

    @Test
    void chain_definitionTimeoutEndsSequentialStep() {
        ToolChainOrchestrator orchestrator = new ToolChainOrchestrator(fixtures.port);

        ChainExecutionResult result = orchestrator.run(ToolExecutionRequest.builder("s1")
                .strategy(ChainStrategy.SEQUENTIAL)
                .maxRetries(0)
                .call(ToolCall.of("1", "sleepy", Map.of()))
                .build());

        assertEquals(ToolCallStatus.TIMEOUT, result.results().get(0).getStatus());
        assertEquals(1, result.summary().failedTools());
    }

    @Test
    void chain_retriedStepCountsOnceInSessionStatistics() {
        FlakyTool flaky = new FlakyTool(2);
        fixtures.registry.register(flaky);
        new DynamicToolCoordinator(fixtures.registry, fixtures.sessions).registerSession("s1", WorkerFixtures.TOOL_MODEL);
        ToolChainOrchestrator orchestrator = new ToolChainOrchestrator(fixtures.port);

        ChainExecutionResult result = orchestrator.run(ToolExecutionRequest.builder("s1")
                .strategy(ChainStrategy.SEQUENTIAL)
                .maxRetries(2)
                .call(ToolCall.of("1", "flaky", Map.of()))
                .build());

        assertEquals(ChainStatus.COMPLETED, result.status());
        assertEquals(2, flaky.attempts.get());
        SessionStatistics stats = fixtures.sessions.getStatistics("s1").orElseThrow();
        assertEquals(1, stats.totalToolCalls());
        assertEquals(1, stats.successfulToolCalls());
        assertEquals(0, stats.failedToolCalls());
    }

    @Test
    void record_skipsCallsWithoutSession() {
        ToolCallResult ok = ToolCallResult.completed("1", "calculator", Map.of("result", 1.0), 1.0, null);

        runner.record(ToolExecutionContext.builder(null).build(), List.of(ok));

        assertEquals(0, fixtures.sessions.getAllSessionStats().totalToolCalls());
    }

    private static final class SleepyTool extends AbstractTool {
        private final ToolDefinition definition;
        private final long sleepMs;

        SleepyTool(double timeoutSeconds, long sleepMs) {
            this.definition = ToolDefinition.builder("sleepy").timeoutSeconds(timeoutSeconds).build();
            this.sleepMs = sleepMs;
        }

        @Override
        public ToolDefinition definition() {
            return definition;
        }

        @Override
        public ToolResult execute(Map<String, Object> parameters, ToolExecutionContext context) throws Exception {
            Thread.sleep(sleepMs);
            return ToolResult.success(Map.of("sleptMs", sleepMs));
        }
    }

    private static final class FlakyTool extends AbstractTool {
        private final ToolDefinition definition = ToolDefinition.builder("flaky").build();
        private final int succeedOnAttempt;
        final AtomicInteger attempts = new AtomicInteger();

        FlakyTool(int succeedOnAttempt) {
            this.succeedOnAttempt = succeedOnAttempt;
        }

        @Override
        public ToolDefinition definition() {
            return definition;
        }

        @Override
        public ToolResult execute(Map<String, Object> parameters, ToolExecutionContext context) {
            int n = attempts.incrementAndGet();
            return n >= succeedOnAttempt
                    ? ToolResult.success(Map.of("attempt", n))
                    : ToolResult.failure("not yet (attempt " + n + ")");
        }
    }
}
