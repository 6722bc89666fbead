package org.rescuenet.routing.cost;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Default speeds in km/h per road class, used when an edge carries no speed limit.
 */
@UtilityClass
public class RoadClassSpeeds {
    public static final double FALLBACK_SPEED_KMH = 30.0d;

    private static final Map<String, Double> DEFAULTS = Map.ofEntries(
            Map.entry("motorway", 120.0d),
            Map.entry("motorway_link", 60.0d),
            Map.entry("trunk", 100.0d),
            Map.entry("trunk_link", 50.0d),
            Map.entry("primary", 80.0d),
            Map.entry("primary_link", 40.0d),
            Map.entry("secondary", 60.0d),
            Map.entry("secondary_link", 30.0d),
            Map.entry("tertiary", 40.0d),
            Map.entry("tertiary_link", 25.0d),
            Map.entry("residential", 30.0d),
            Map.entry("living_street", 20.0d),
            Map.entry("service", 20.0d),
            Map.entry("unclassified", 30.0d),
            Map.entry("track", 20.0d),
            Map.entry("path", 10.0d),
            Map.entry("footway", 5.0d)
    );

    public static double defaultSpeedKmh(String roadClass) {
        if (roadClass == null) {
            return FALLBACK_SPEED_KMH;
        }
        return DEFAULTS.getOrDefault(roadClass, FALLBACK_SPEED_KMH);
    }
}
