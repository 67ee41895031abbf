package com.obelisk.tool.calculator;

import com.obelisk.tools.ToolCategory;
import com.obelisk.tools.ToolProvider;

import java.util.List;
import java.util.Map;

/**
 * Provider for the built-in calculator tool.
 */
public final class CalculatorToolProvider implements ToolProvider {

    private final CalculatorTool tool = new CalculatorTool();

    @Override
    public String getToolId() {
        return CalculatorTool.NAME;
    }

    @Override
    public CalculatorTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Basic arithmetic: add, subtract, multiply, divide, power and square root with configurable precision.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.MATH;
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("operations", List.of(Operation.wireNames()));
    }
}
