package org.rescuenet.routing.vehicle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable lookup table of road-class speed factors keyed by vehicle class code.
 *
 * <p>Unregistered classes and road classes resolve to a neutral factor of {@code 1.0}.</p>
 */
public final class VehicleClassCatalog {
    public static final String CLASS_DEFAULT = "default";
    public static final String CLASS_LIGHT = "light";
    public static final String CLASS_HEAVY = "heavy";
    public static final String CLASS_ALL_TERRAIN = "all_terrain";

    private final Map<String, Map<String, Double>> factorsByClass;

    private VehicleClassCatalog(Map<String, Map<String, Double>> factorsByClass) {
        this.factorsByClass = factorsByClass;
    }

    /**
     * Built-in classes. Heavy vehicles crawl on narrow and unpaved roads, light ones lose less.
     */
    public static VehicleClassCatalog defaultCatalog() {
        return builder()
                .vehicleClass(CLASS_DEFAULT, Map.of())
                .vehicleClass(CLASS_LIGHT, Map.of(
                        "track", 0.8d,
                        "path", 0.5d))
                .vehicleClass(CLASS_HEAVY, Map.of(
                        "residential", 0.9d,
                        "living_street", 0.7d,
                        "service", 0.8d,
                        "track", 0.6d,
                        "path", 0.3d))
                .vehicleClass(CLASS_ALL_TERRAIN, Map.of(
                        "track", 1.0d,
                        "path", 0.8d))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Speed factor of a road class for a vehicle class.
     */
    public double speedFactor(String vehicleClass, String roadClass) {
        if (vehicleClass == null || roadClass == null) {
            return 1.0d;
        }
        Map<String, Double> factors = factorsByClass.get(vehicleClass);
        if (factors == null) {
            return 1.0d;
        }
        return factors.getOrDefault(roadClass, 1.0d);
    }

    public Set<String> vehicleClasses() {
        return factorsByClass.keySet();
    }

    public static final class Builder {
        private final LinkedHashMap<String, Map<String, Double>> factorsByClass = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers or replaces the road-class factors of one vehicle class.
         */
        public Builder vehicleClass(String vehicleClass, Map<String, Double> roadClassFactors) {
            Objects.requireNonNull(vehicleClass, "vehicleClass");
            Objects.requireNonNull(roadClassFactors, "roadClassFactors");
            for (Map.Entry<String, Double> entry : roadClassFactors.entrySet()) {
                double factor = entry.getValue();
                if (!Double.isFinite(factor) || factor < 0.0d) {
                    throw new IllegalArgumentException(
                            "speed factor for " + vehicleClass + "/" + entry.getKey() + " must be finite and >= 0");
                }
            }
            factorsByClass.put(vehicleClass, Map.copyOf(roadClassFactors));
            return this;
        }

        public VehicleClassCatalog build() {
            return new VehicleClassCatalog(Map.copyOf(factorsByClass));
        }
    }
}
