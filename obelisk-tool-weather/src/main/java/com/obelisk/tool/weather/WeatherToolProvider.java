package com.obelisk.tool.weather;

import com.obelisk.tools.ToolCategory;
import com.obelisk.tools.ToolProvider;

import java.util.List;
import java.util.Map;

/**
 * Provider for the built-in mock weather tool.
 */
public final class WeatherToolProvider implements ToolProvider {

    private final WeatherTool tool = new WeatherTool();

    @Override
    public String getToolId() {
        return WeatherTool.NAME;
    }

    @Override
    public WeatherTool getTool() {
        return tool;
    }

    @Override
    public String getDescription() {
        return "Mock weather for any location: current conditions, optional 5-day forecast and alerts.";
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.INFORMATION;
    }

    @Override
    public Map<String, Object> getCapabilityMetadata() {
        return Map.of("units", List.of("celsius", "fahrenheit", "kelvin"), "mock", true);
    }
}
