package com.obelisk.worker.workflow;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolChainOrchestrator;
import com.obelisk.worker.chain.ToolExecutionRequest;

import java.util.List;
import java.util.Map;

/**
 * Chain workflow: the orchestrator runs on {@link TemporalExecutionPort}, so each tool attempt
 * is an activity, retry backoff is a durable timer, and signals and queries reach the live
 * orchestrator state.
 */
public class ToolExecutionWorkflowImpl implements ToolExecutionWorkflow {

    private final ToolChainOrchestrator orchestrator = new ToolChainOrchestrator(new TemporalExecutionPort());

    @Override
    public ChainExecutionResult run(ToolExecutionRequest request) {
        return orchestrator.run(request);
    }

    @Override
    public void cancelExecution() {
        orchestrator.cancel();
    }

    @Override
    public void updateConfig(Map<String, Object> config) {
        orchestrator.updateConfig(config);
    }

    @Override
    public ChainStatusSnapshot getExecutionStatus() {
        return orchestrator.getStatus();
    }

    @Override
    public List<ToolCallResult> getToolResults() {
        return orchestrator.getResults();
    }
}
