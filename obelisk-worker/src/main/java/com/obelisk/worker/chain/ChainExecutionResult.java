package com.obelisk.worker.chain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a chain run. {@code results} holds every call that produced a result, in execution
 * order; skipped calls have no entry. {@code error} is set when the chain did not complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainExecutionResult(
        String executionId,
        ChainStrategy strategy,
        ChainStatus status,
        List<ToolCallResult> results,
        ChainExecutionSummary summary,
        ToolError error,
        Map<String, Object> metadata) {

    public ChainExecutionResult {
        results = results != null ? List.copyOf(results) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ChainStatus.COMPLETED;
    }
}
