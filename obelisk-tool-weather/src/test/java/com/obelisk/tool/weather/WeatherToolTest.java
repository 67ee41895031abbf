package com.obelisk.tool.weather;

import com.obelisk.tools.ToolCall;
import com.obelisk.tools.ToolCallResult;
import com.obelisk.tools.ToolCallStatus;
import com.obelisk.tools.ToolErrorKind;
import com.obelisk.tools.ToolExecutionContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherToolTest {

    private final WeatherTool tool = new WeatherTool(Clock.fixed(Instant.parse("2026-07-15T12:00:00Z"), ZoneOffset.UTC));
    private final ToolExecutionContext context = ToolExecutionContext.builder("session-1").build();

    private ToolCallResult call(Map<String, Object> parameters) {
        return tool.call(ToolCall.of(WeatherTool.NAME, parameters), context);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> current(ToolCallResult result) {
        return (Map<String, Object>) result.getResult().get("current_weather");
    }

    @Test
    void call_sameLocationYieldsSameWeather() {
        ToolCallResult first = call(Map.of("location", "Lisbon"));
        ToolCallResult second = call(Map.of("location", "Lisbon"));

        assertEquals(ToolCallStatus.COMPLETED, first.getStatus());
        assertEquals(current(first), current(second));
        assertEquals("continental", first.getResult().get("climate_zone"));
        assertEquals("2026-07-15T12:00:00Z", first.getResult().get("timestamp"));
    }

    @Test
    void call_convertsTemperatureUnits() {
        double celsius = (Double) current(call(Map.of("location", "Lisbon"))).get("temperature");
        double fahrenheit = (Double) current(call(Map.of("location", "Lisbon", "units", "fahrenheit"))).get("temperature");
        double kelvin = (Double) current(call(Map.of("location", "Lisbon", "units", "kelvin"))).get("temperature");

        assertEquals(WeatherTool.convert(celsius, "fahrenheit"), fahrenheit);
        assertEquals(WeatherTool.convert(celsius, "kelvin"), kelvin);
    }

    @Test
    void call_forecastCoversFiveFollowingDays() {
        ToolCallResult result = call(Map.of("location", "Lisbon", "include_forecast", true));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> forecast = (List<Map<String, Object>>) result.getResult().get("forecast");
        assertEquals(5, forecast.size());
        assertEquals("2026-07-16", forecast.get(0).get("date"));
        assertEquals("Thursday", forecast.get(0).get("day_name"));
        assertEquals("2026-07-20", forecast.get(4).get("date"));
    }

    @Test
    void call_withoutForecastOmitsIt() {
        ToolCallResult result = call(Map.of("location", "Lisbon"));

        assertFalse(result.getResult().containsKey("forecast"));
        @SuppressWarnings("unchecked")
        Map<String, Object> meta = (Map<String, Object>) result.getResult().get("metadata");
        assertEquals(false, meta.get("forecast_included"));
        assertEquals(WeatherTool.md5Hex("Lisbon").substring(0, 8), meta.get("location_hash"));
    }

    @Test
    void call_detectsClimateZoneFromLocation() {
        assertEquals("desert", call(Map.of("location", "Dubai, UAE")).getResult().get("climate_zone"));
        assertEquals("polar", call(Map.of("location", "Toronto, Canada")).getResult().get("climate_zone"));
        assertEquals("tropical", call(Map.of("location", "Dubai", "climate_zone", "tropical"))
                .getResult().get("climate_zone"));
    }

    @Test
    void call_rejectsMarkupInLocation() {
        ToolCallResult result = call(Map.of("location", "<script>alert(1)</script>"));

        assertEquals(ToolErrorKind.VALIDATION, result.getError().getKind());
        assertEquals("Location contains invalid characters", result.getError().getMessage());
    }

    @Test
    void call_rejectsLocationThatIsTooShortOnceTrimmed() {
        ToolCallResult result = call(Map.of("location", " a "));

        assertEquals(ToolErrorKind.VALIDATION, result.getError().getKind());
        assertEquals("Location name too short", result.getError().getMessage());
    }

    @Test
    void call_rejectsUnknownUnits() {
        ToolCallResult result = call(Map.of("location", "Lisbon", "units", "rankine"));

        assertEquals(ToolErrorKind.VALIDATION, result.getError().getKind());
    }

    @Test
    void provider_reportsInformationCategory() {
        WeatherToolProvider provider = new WeatherToolProvider();

        assertEquals("weather", provider.getToolId());
        assertTrue(provider.getTool().definition().getTimeoutSeconds() <= 5.0);
    }
}
