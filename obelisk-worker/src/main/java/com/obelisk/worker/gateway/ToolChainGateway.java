package com.obelisk.worker.gateway;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.worker.chain.ChainExecutionResult;
import com.obelisk.worker.chain.ChainStatusSnapshot;
import com.obelisk.worker.chain.ToolExecutionRequest;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Submits chains and controls running ones by execution id. Operations on an unknown id throw
 * {@link ChainNotFoundException}.
 */
public interface ToolChainGateway {

    /** Starts the chain asynchronously and returns its execution id. */
    String submit(ToolExecutionRequest request);

    void cancel(String executionId);

    void updateConfig(String executionId, Map<String, Object> config);

    ChainStatusSnapshot status(String executionId);

    List<ToolCallResult> results(String executionId);

    /** Waits up to {@code timeout} for the chain to finish; empty if it is still running. */
    Optional<ChainExecutionResult> await(String executionId, Duration timeout);
}
