package com.obelisk.worker.gateway;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolExecutionRequest;
import com.obelisk.worker.workflow.ToolExecutionWorkflow;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowNotFoundException;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs chains as {@link ToolExecutionWorkflow} executions. Cancel and config updates are
 * signals; status and results are queries against the running workflow.
 */
public final class TemporalToolChainGateway implements ToolChainGateway {

    private static final Logger log = LoggerFactory.getLogger(TemporalToolChainGateway.class);
    private static final Duration RUN_TIMEOUT_GRACE = Duration.ofMinutes(1);

    private final WorkflowClient client;
    private final String taskQueue;

    public TemporalToolChainGateway(WorkflowClient client, String taskQueue) {
        this.client = client;
        this.taskQueue = taskQueue;
    }

    @Override
    public String submit(ToolExecutionRequest request) {
        ToolExecutionWorkflow workflow = client.newWorkflowStub(ToolExecutionWorkflow.class,
                WorkflowOptions.newBuilder()
                        .setTaskQueue(taskQueue)
                        .setWorkflowId(request.getExecutionId())
                        .setWorkflowRunTimeout(Duration.ofSeconds(request.getTimeoutSeconds()).plus(RUN_TIMEOUT_GRACE))
                        .build());
        WorkflowClient.start(workflow::run, request);
        log.info("Submitted chain {} to task queue {}", request.getExecutionId(), taskQueue);
        return request.getExecutionId();
    }

    @Override
    public void cancel(String executionId) {
        onWorkflow(executionId, w -> {
            w.cancelExecution();
            return null;
        });
    }

    @Override
    public void updateConfig(String executionId, Map<String, Object> config) {
        onWorkflow(executionId, w -> {
            w.updateConfig(config);
            return null;
        });
    }

    @Override
    public ChainStatusSnapshot status(String executionId) {
        return onWorkflow(executionId, ToolExecutionWorkflow::getExecutionStatus);
    }

    @Override
    public List<ToolCallResult> results(String executionId) {
        return onWorkflow(executionId, ToolExecutionWorkflow::getToolResults);
    }

    @Override
    public Optional<ChainExecutionResult> await(String executionId, Duration timeout) {
        WorkflowStub stub = client.newUntypedWorkflowStub(executionId, Optional.empty(), Optional.empty());
        try {
            return Optional.of(stub.getResult(timeout.toMillis(), TimeUnit.MILLISECONDS, ChainExecutionResult.class));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (WorkflowNotFoundException e) {
            throw new ChainNotFoundException(executionId, e);
        }
    }

    private <T> T onWorkflow(String executionId, Function<ToolExecutionWorkflow, T> action) {
        ToolExecutionWorkflow workflow = client.newWorkflowStub(ToolExecutionWorkflow.class, executionId);
        try {
            return action.apply(workflow);
        } catch (WorkflowNotFoundException e) {
            throw new ChainNotFoundException(executionId, e);
        }
    }
}
