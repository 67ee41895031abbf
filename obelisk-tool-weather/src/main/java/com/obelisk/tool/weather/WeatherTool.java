package com.obelisk.tool.weather;

import com.obelisk.tools.AbstractTool;
import com.obelisk.tools.ParameterType;
import com.obelisk.tools.ToolCategory;
import com.obelisk.tools.ToolDefinition;
import com.obelisk.tools.ToolExecutionContext;
import com.obelisk.tools.ToolMetadata;
import com.obelisk.tools.ToolParameter;
import com.obelisk.tools.ToolResult;
import com.obelisk.tools.ToolValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Mock weather service. Output is derived from a hash of the location, so the same location
 * always yields the same conditions; only dates and timestamps follow the clock.
 */
public final class WeatherTool extends AbstractTool {

    public static final String NAME = "weather";

    static final String KEY_LOCATION = "location";
    static final String KEY_UNITS = "units";
    static final String KEY_INCLUDE_FORECAST = "include_forecast";
    static final String KEY_CLIMATE_ZONE = "climate_zone";
    static final int FORECAST_DAYS = 5;

    private static final String INVALID_CHARACTERS = "<>&\"'";

    private static final ToolDefinition DEFINITION = ToolDefinition.builder(NAME)
            .description("Get mock weather information for any location including current conditions, "
                    + "temperature, humidity, and optional forecast")
            .version("1.0.0")
            .timeoutSeconds(5.0)
            .parameter(ToolParameter.builder(KEY_LOCATION, ParameterType.STRING)
                    .description("Location name (city, country, or coordinates)")
                    .required(true)
                    .length(2, 100)
                    .build())
            .parameter(ToolParameter.builder(KEY_UNITS, ParameterType.STRING)
                    .description("Temperature units")
                    .defaultValue("celsius")
                    .enumValues("celsius", "fahrenheit", "kelvin")
                    .build())
            .parameter(ToolParameter.builder(KEY_INCLUDE_FORECAST, ParameterType.BOOLEAN)
                    .description("Include 5-day weather forecast")
                    .defaultValue(false)
                    .build())
            .parameter(ToolParameter.builder(KEY_CLIMATE_ZONE, ParameterType.STRING)
                    .description("Climate zone for more realistic data")
                    .defaultValue(ClimateZone.AUTO)
                    .enumValues(ClimateZone.wireNamesWithAuto())
                    .build())
            .metadata(ToolMetadata.of(ToolCategory.INFORMATION, "weather", "mock"))
            .build();

    private final Clock clock;

    public WeatherTool() {
        this(Clock.systemUTC());
    }

    public WeatherTool(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ToolDefinition definition() {
        return DEFINITION;
    }

    @Override
    protected void preExecute(Map<String, Object> parameters, ToolExecutionContext context) {
        String location = ((String) parameters.get(KEY_LOCATION)).trim();
        if (location.isEmpty()) {
            throw new ToolValidationException("Location cannot be empty", NAME,
                    Map.of(KEY_LOCATION, "Must provide a valid location name"));
        }
        if (location.length() < 2) {
            throw new ToolValidationException("Location name too short", NAME,
                    Map.of(KEY_LOCATION, "Location name must be at least 2 characters"));
        }
        for (char c : location.toCharArray()) {
            if (INVALID_CHARACTERS.indexOf(c) >= 0) {
                throw new ToolValidationException("Location contains invalid characters", NAME,
                        Map.of(KEY_LOCATION, "Location cannot contain HTML/script characters"));
            }
        }
        log.debug("Weather request validated for location: {}", location);
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolExecutionContext context) {
        String location = ((String) parameters.get(KEY_LOCATION)).trim();
        String units = (String) parameters.get(KEY_UNITS);
        boolean includeForecast = Boolean.TRUE.equals(parameters.get(KEY_INCLUDE_FORECAST));
        ClimateZone zone = ClimateZone.resolve((String) parameters.get(KEY_CLIMATE_ZONE), location);
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        String timestamp = clock.instant().toString();

        Conditions current = conditions(location, zone, today.getMonth());

        Map<String, Object> unitNames = new LinkedHashMap<>();
        unitNames.put("temperature", units);
        unitNames.put("wind_speed", "km/h");
        unitNames.put("pressure", "hPa");
        unitNames.put("visibility", "km");

        Map<String, Object> currentWeather = new LinkedHashMap<>();
        currentWeather.put("condition", current.condition.code);
        currentWeather.put("description", current.condition.description);
        currentWeather.put("icon", current.condition.icon);
        currentWeather.put("temperature", convert(current.temperatureC, units));
        currentWeather.put("humidity", current.humidity);
        currentWeather.put("wind_speed", current.windSpeed);
        currentWeather.put("atmospheric_pressure", current.pressure);
        currentWeather.put("visibility", current.visibility);
        currentWeather.put("uv_index", current.uvIndex);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("location", location);
        data.put("climate_zone", zone.wireName());
        data.put("timestamp", timestamp);
        data.put("units", unitNames);
        data.put("current_weather", currentWeather);
        data.put("data_source", "mock_weather_service");
        data.put("session_id", context.getSessionId());
        if (includeForecast) {
            data.put("forecast", forecast(location, current, units, today));
        }
        List<Map<String, Object>> alerts = alerts(current);
        if (!alerts.isEmpty()) {
            data.put("alerts", alerts);
        }

        Map<String, Object> generation = new LinkedHashMap<>();
        generation.put("is_mock_data", true);
        generation.put("generated_at", timestamp);
        generation.put("location_hash", md5Hex(location).substring(0, 8));
        generation.put("climate_zone_detected", zone.wireName());
        generation.put("forecast_included", includeForecast);
        generation.put("alert_count", alerts.size());
        data.put("metadata", generation);

        log.info("Weather data generated for {} ({} climate)", location, zone.wireName());
        return ToolResult.success(data, Map.of(
                "tool_version", DEFINITION.getVersion(),
                "location", location,
                "units", units,
                "forecast_included", includeForecast));
    }

    private static Conditions conditions(String location, ClimateZone zone, Month month) {
        Random random = seeded(location);
        WeatherCondition condition = pick(random);
        double seasonal = switch (month) {
            case DECEMBER, JANUARY, FEBRUARY -> 0.8;
            case JUNE, JULY, AUGUST -> 1.2;
            default -> 1.0;
        };
        double daily = uniform(random, -zone.variation / 2, zone.variation / 2);
        double temperatureC = zone.baseTemp * seasonal * condition.tempModifier + daily;
        int humidity = clamp(zone.humidity + random.nextInt(41) - 20, 10, 100);
        return new Conditions(condition,
                round1(temperatureC),
                humidity,
                round1(uniform(random, 0, 25)),
                round1(uniform(random, 980, 1030)),
                round1(uniform(random, 5, 30)),
                round1(uniform(random, 0, 8)));
    }

    private static List<Map<String, Object>> forecast(String location, Conditions base, String units, LocalDate today) {
        List<Map<String, Object>> days = new ArrayList<>(FORECAST_DAYS);
        for (int day = 1; day <= FORECAST_DAYS; day++) {
            Random random = seeded(location + "_" + day);
            WeatherCondition condition = pick(random);
            double temperatureC = base.temperatureC + uniform(random, -5, 5);
            LocalDate date = today.plusDays(day);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("date", date.toString());
            entry.put("day_name", date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
            entry.put("condition", condition.code);
            entry.put("description", condition.description);
            entry.put("icon", condition.icon);
            entry.put("temperature", convert(temperatureC, units));
            entry.put("humidity", clamp(base.humidity + random.nextInt(31) - 15, 20, 90));
            entry.put("wind_speed", round1(Math.max(0, base.windSpeed + uniform(random, -5, 5))));
            days.add(entry);
        }
        return days;
    }

    private static List<Map<String, Object>> alerts(Conditions current) {
        List<Map<String, Object>> alerts = new ArrayList<>();
        if (current.windSpeed > 20) {
            alerts.add(alert("wind", "moderate", "High wind speeds expected. Secure outdoor objects."));
        }
        if (current.condition.isSevere()) {
            alerts.add(alert("severe_weather", "high", "Severe weather conditions. Avoid outdoor activities."));
        }
        if (current.temperatureC > 35) {
            alerts.add(alert("heat", "moderate",
                    "High temperature warning. Stay hydrated and avoid prolonged sun exposure."));
        } else if (current.temperatureC < -10) {
            alerts.add(alert("cold", "moderate",
                    "Freezing temperatures. Dress warmly and check on vulnerable individuals."));
        }
        if (current.uvIndex > 7) {
            alerts.add(alert("uv", "moderate", "High UV index. Use sunscreen and limit midday sun exposure."));
        }
        return alerts;
    }

    private static Map<String, Object> alert(String type, String severity, String message) {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("type", type);
        alert.put("severity", severity);
        alert.put("message", message);
        return alert;
    }

    static double convert(double celsius, String units) {
        return switch (units) {
            case "fahrenheit" -> round1(celsius * 9 / 5 + 32);
            case "kelvin" -> round1(celsius + 273.15);
            default -> round1(celsius);
        };
    }

    private static Random seeded(String key) {
        return new Random(Long.parseLong(md5Hex(key).substring(0, 8), 16));
    }

    private static WeatherCondition pick(Random random) {
        WeatherCondition[] all = WeatherCondition.values();
        return all[random.nextInt(all.length)];
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    static String md5Hex(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private record Conditions(WeatherCondition condition, double temperatureC, int humidity, double windSpeed,
                              double pressure, double visibility, double uvIndex) {
    }
}
