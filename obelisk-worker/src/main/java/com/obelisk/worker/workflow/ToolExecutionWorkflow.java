package com.obelisk.worker.workflow;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolExecutionRequest;
import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.SignalMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

import java.util.List;
import java.util.Map;

/**
 * Durable tool chain. The workflow id is the execution id of the request.
 */
@WorkflowInterface
public interface ToolExecutionWorkflow {

    @WorkflowMethod
    ChainExecutionResult run(ToolExecutionRequest request);

    /** Cooperative cancel: steps not yet started are skipped. */
    @SignalMethod
    void cancelExecution();

    /** Merges values into the chain configuration for subsequent steps. */
    @SignalMethod
    void updateConfig(Map<String, Object> config);

    @QueryMethod
    ChainStatusSnapshot getExecutionStatus();

    @QueryMethod
    List<ToolCallResult> getToolResults();
}
