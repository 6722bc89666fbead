package org.rescuenet.routing.vehicle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Capability record of one vehicle.
 *
 * <p>Hard limits ({@code maxGradientPercent}, {@code maxWadingDepthMeters}, dimensions, terrain set) exclude
 * edges. Cost overrides scale the cost of edges that stay feasible. Nullable limits mean "unrestricted".</p>
 */
@Value
@Builder(toBuilder = true)
public class VehicleCapability {
    /** Terrain types every vehicle may use regardless of its allowed set. */
    public static final Set<String> UNRESTRICTED_TERRAINS = Set.of("urban", "suburban", "unknown");
    public static final String DEFAULT_CODE = "DEFAULT";
    public static final double DEFAULT_SPEED_KMH = 40.0d;

    long id;
    String code;
    /** Lookup key into {@link VehicleClassCatalog}. */
    @Builder.Default
    String vehicleClass = VehicleClassCatalog.CLASS_DEFAULT;
    @Builder.Default
    double maxSpeedKmh = DEFAULT_SPEED_KMH;
    boolean allTerrain;
    @Singular
    Set<String> allowedTerrains;
    /** Multiplicative cost factor per terrain type, replacing the edge's own terrain factor. */
    @Singular
    Map<String, Double> terrainCostOverrides;
    /** Multiplicative cost factor replacing the edge's gradient factor. */
    Double gradientCostOverride;
    Double maxGradientPercent;
    Double maxWadingDepthMeters;
    Double widthMeters;
    Double heightMeters;
    /** Laden weight in kilograms. */
    Double weightKg;

    /**
     * Vehicle used when a request names none: 40 km/h on the default class, no dimensions.
     */
    public static VehicleCapability defaultVehicle() {
        return VehicleCapability.builder()
                .code(DEFAULT_CODE)
                .build();
    }

    /**
     * Returns whether this vehicle may drive on the given terrain type. Unknown terrain is always allowed.
     */
    public boolean permitsTerrain(String terrainType) {
        if (allTerrain || terrainType == null) {
            return true;
        }
        String terrain = terrainType.toLowerCase(Locale.ROOT);
        if (UNRESTRICTED_TERRAINS.contains(terrain)) {
            return true;
        }
        for (String allowed : allowedTerrains) {
            if (allowed.equalsIgnoreCase(terrain)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the per-vehicle terrain cost override, or {@code null} when the edge's factor applies.
     */
    public Double terrainCostOverride(String terrainType) {
        if (terrainType == null) {
            return null;
        }
        Double exact = terrainCostOverrides.get(terrainType);
        return exact != null ? exact : terrainCostOverrides.get(terrainType.toLowerCase(Locale.ROOT));
    }

    /**
     * Identifiers a hazard zone may list to exempt this vehicle: its code and its class.
     */
    public boolean matchesVehicleType(String type) {
        if (type == null) {
            return false;
        }
        return type.equalsIgnoreCase(code) || type.equalsIgnoreCase(vehicleClass);
    }
}
