package com.obelisk.registry;

import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolErrorKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instruments for registry calls: an {@code obelisk.tool.execution} timer per
 * tool and status, and an {@code obelisk.tool.denied} counter per tool and gate error kind.
 */
public final class ToolCallMetrics {

    static final String EXECUTION_TIMER = "obelisk.tool.execution";
    static final String DENIED_COUNTER = "obelisk.tool.denied";

    private final MeterRegistry registry;

    public ToolCallMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    void recordExecution(ToolCallResult result) {
        Timer.builder(EXECUTION_TIMER)
                .tag("tool", result.getToolName())
                .tag("status", result.getStatus().wireName())
                .register(registry)
                .record((long) (result.getExecutionTimeMs() * 1000), TimeUnit.MICROSECONDS);
    }

    void recordDenied(String toolName, ToolErrorKind kind) {
        registry.counter(DENIED_COUNTER,
                "tool", toolName,
                "kind", kind.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
