package com.obelisk.tool.weather;

/** Sky conditions the mock service reports, with their effect on temperature. */
enum WeatherCondition {

    CLEAR("clear", "Clear sky", "☀️", 1.0),
    PARTLY_CLOUDY("partly-cloudy", "Partly cloudy", "⛅", 0.95),
    CLOUDY("cloudy", "Cloudy", "☁️", 0.9),
    OVERCAST("overcast", "Overcast", "☁️", 0.85),
    LIGHT_RAIN("light-rain", "Light rain", "🌧️", 0.8),
    RAIN("rain", "Rain", "🌧️", 0.75),
    HEAVY_RAIN("heavy-rain", "Heavy rain", "⛈️", 0.7),
    THUNDERSTORM("thunderstorm", "Thunderstorm", "⛈️", 0.65),
    SNOW("snow", "Snow", "❄️", 0.4),
    FOG("fog", "Fog", "🌫️", 0.8),
    WINDY("windy", "Windy", "💨", 0.9);

    final String code;
    final String description;
    final String icon;
    final double tempModifier;

    WeatherCondition(String code, String description, String icon, double tempModifier) {
        this.code = code;
        this.description = description;
        this.icon = icon;
        this.tempModifier = tempModifier;
    }

    boolean isSevere() {
        return this == THUNDERSTORM || this == HEAVY_RAIN;
    }
}
