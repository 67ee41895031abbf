package com.obelisk.worker.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How the calls of a chain are scheduled. */
public enum ChainStrategy {

    /** One bounded-concurrency batch; results in input order. */
    PARALLEL,

    /** One call at a time; each call sees the results of earlier successful calls. */
    SEQUENTIAL,

    /** Sequential, skipping calls whose condition does not hold. */
    CONDITIONAL,

    /** Topologically ordered batches of a prerequisite graph. */
    DEPENDENCY_BASED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChainStrategy fromWire(String value) {
        return ChainStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
