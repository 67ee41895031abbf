package com.obelisk.worker.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChainConditionTest {

    private static final Logger log = LoggerFactory.getLogger(ChainConditionTest.class);

    private final Map<String, Map<String, Object>> accumulator = Map.of(
            "calculator", Map.of("result", 5, "calculation_metadata", Map.of("operation_type", "binary")));

    @Test
    void evaluate_successAndFailureCheckAccumulator() {
        assertTrue(ChainCondition.succeeded("calculator").evaluate(accumulator, log));
        assertFalse(ChainCondition.succeeded("weather").evaluate(accumulator, log));
        assertTrue(ChainCondition.failed("weather").evaluate(accumulator, log));
        assertFalse(ChainCondition.failed("calculator").evaluate(accumulator, log));
    }

    @Test
    void evaluate_valueEqualsFollowsDotPath() {
        assertTrue(ChainCondition.valueEquals("calculator", "calculation_metadata.operation_type", "binary")
                .evaluate(accumulator, log));
        assertTrue(ChainCondition.valueEquals("calculator", "result", 5.0).evaluate(accumulator, log));
        assertFalse(ChainCondition.valueEquals("calculator", "result", 6).evaluate(accumulator, log));
        assertFalse(ChainCondition.valueEquals("calculator", "missing.path", null).evaluate(Map.of(), log));
    }

    @Test
    void evaluate_unknownTypeRuns() {
        assertTrue(new ChainCondition("sometimes", null, null, null).evaluate(accumulator, log));
        assertFalse(ChainCondition.never().evaluate(accumulator, log));
    }

    @Test
    void lookup_missingSegmentIsNull() {
        assertNull(ChainCondition.lookup(Map.of("a", Map.of("b", 1)), "a.c"));
        assertEquals(1, ChainCondition.lookup(Map.of("a", Map.of("b", 1)), "a.b"));
    }

    @Test
    void json_readsValueEqualsCondition() throws Exception {
        ChainCondition c = new ObjectMapper().readValue("""
                {"type": "value_equals", "tool": "calculator", "path": "result", "value": 5}
                """, ChainCondition.class);

        assertEquals(ChainCondition.valueEquals("calculator", "result", 5), c);
    }
}
