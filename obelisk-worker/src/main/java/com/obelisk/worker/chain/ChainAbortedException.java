package com.obelisk.worker.chain;

import com.obelisk.tools.ToolError;

/** Stops a chain run with a terminal status and the error reported on the result. */
final class ChainAbortedException extends RuntimeException {

    private final ChainStatus status;
    private final ToolError error;

    ChainAbortedException(ChainStatus status, ToolError error) {
        super(error.getMessage());
        this.status = status;
        this.error = error;
    }

    ChainStatus status() {
        return status;
    }

    ToolError error() {
        return error;
    }
}
