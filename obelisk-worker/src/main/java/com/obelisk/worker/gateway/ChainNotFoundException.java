package com.obelisk.worker.gateway;

public class ChainNotFoundException extends RuntimeException {

    private final String executionId;

    public ChainNotFoundException(String executionId) {
        super(String.format("Chain execution '%s' not found", executionId));
        this.executionId = executionId;
    }

    public ChainNotFoundException(String executionId, Throwable cause) {
        super(String.format("Chain execution '%s' not found", executionId), cause);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
