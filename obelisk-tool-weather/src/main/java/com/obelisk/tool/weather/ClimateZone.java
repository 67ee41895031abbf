package com.obelisk.tool.weather;

import java.util.List;
import java.util.Locale;

/** Climate zones with base temperature, humidity and daily temperature swing. */
enum ClimateZone {

    TROPICAL(28, 80, 8, List.of("thailand", "brazil", "india", "philippines", "tropical")),
    TEMPERATE(18, 60, 15, List.of("europe", "china", "japan", "temperate")),
    CONTINENTAL(10, 50, 25, List.of()),
    POLAR(-10, 70, 20, List.of("canada", "russia", "alaska", "siberia", "greenland")),
    DESERT(25, 20, 20, List.of("sahara", "nevada", "arizona", "dubai", "riyadh"));

    static final String AUTO = "auto";

    final double baseTemp;
    final int humidity;
    final double variation;
    private final List<String> keywords;

    ClimateZone(double baseTemp, int humidity, double variation, List<String> keywords) {
        this.baseTemp = baseTemp;
        this.humidity = humidity;
        this.variation = variation;
        this.keywords = keywords;
    }

    String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Explicit zone name, or a keyword guess from the location for "auto" (continental when nothing matches). */
    static ClimateZone resolve(String requested, String location) {
        if (!AUTO.equals(requested)) {
            return ClimateZone.valueOf(requested.toUpperCase(Locale.ROOT));
        }
        String lower = location.toLowerCase(Locale.ROOT);
        for (ClimateZone zone : new ClimateZone[]{POLAR, DESERT, TROPICAL, TEMPERATE}) {
            for (String keyword : zone.keywords) {
                if (lower.contains(keyword)) {
                    return zone;
                }
            }
        }
        return CONTINENTAL;
    }

    static Object[] wireNamesWithAuto() {
        ClimateZone[] zones = values();
        Object[] names = new Object[zones.length + 1];
        for (int i = 0; i < zones.length; i++) {
            names[i] = zones[i].wireName();
        }
        names[zones.length] = AUTO;
        return names;
    }
}
