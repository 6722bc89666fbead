package org.rescuenet.routing.core;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.ConfigProperties;
import org.rescuenet.routing.cost.CostModelConfig;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.util.Properties;

/**
 * Single-route planner configuration.
 *
 * <p>Attempt {@code k} (0-based) searches within {@code initialRadiusMeters * (1 + 0.5 * k)}, capped at
 * {@code maxRadiusMeters}. Attempts from {@code relaxPolicyFromAttempt} on run under the relaxed risk policy.</p>
 */
@Value
@Builder(toBuilder = true)
public class RoutingConfig {
    public static final String PROPERTY_INITIAL_RADIUS = "rescuenet.routing.initialRadiusMeters";
    public static final String PROPERTY_MAX_RADIUS = "rescuenet.routing.maxRadiusMeters";
    public static final String PROPERTY_MAX_ATTEMPTS = "rescuenet.routing.maxAttempts";
    public static final String PROPERTY_RELAX_FROM = "rescuenet.routing.relaxPolicyFromAttempt";
    public static final String PROPERTY_MAX_SNAP = "rescuenet.routing.maxSnapDistanceMeters";
    public static final String PROPERTY_FALLBACK_SPEED = "rescuenet.routing.fallbackSpeedKmh";

    @Builder.Default
    double initialRadiusMeters = 80_000.0d;
    @Builder.Default
    double maxRadiusMeters = 200_000.0d;
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    int relaxPolicyFromAttempt = 1;
    @Builder.Default
    double maxSnapDistanceMeters = 5_000.0d;
    /** Speed of the straight-line estimate when no vehicle is known. */
    @Builder.Default
    double fallbackSpeedKmh = VehicleCapability.DEFAULT_SPEED_KMH;
    @Builder.Default
    CostModelConfig costModel = CostModelConfig.defaults();

    public static RoutingConfig defaults() {
        return RoutingConfig.builder().build();
    }

    /**
     * Reads {@code rescuenet.routing.*} and {@code rescuenet.cost.*} keys, keeping defaults for missing ones.
     */
    public static RoutingConfig fromProperties(Properties properties) {
        RoutingConfig defaults = defaults();
        return RoutingConfig.builder()
                .initialRadiusMeters(ConfigProperties.doubleValue(properties, PROPERTY_INITIAL_RADIUS, defaults.initialRadiusMeters))
                .maxRadiusMeters(ConfigProperties.doubleValue(properties, PROPERTY_MAX_RADIUS, defaults.maxRadiusMeters))
                .maxAttempts(ConfigProperties.intValue(properties, PROPERTY_MAX_ATTEMPTS, defaults.maxAttempts))
                .relaxPolicyFromAttempt(ConfigProperties.intValue(properties, PROPERTY_RELAX_FROM, defaults.relaxPolicyFromAttempt))
                .maxSnapDistanceMeters(ConfigProperties.doubleValue(properties, PROPERTY_MAX_SNAP, defaults.maxSnapDistanceMeters))
                .fallbackSpeedKmh(ConfigProperties.doubleValue(properties, PROPERTY_FALLBACK_SPEED, defaults.fallbackSpeedKmh))
                .costModel(CostModelConfig.fromProperties(properties))
                .build()
                .validate();
    }

    /**
     * Validates ranges and returns this instance.
     */
    public RoutingConfig validate() {
        requirePositive("initialRadiusMeters", initialRadiusMeters);
        requirePositive("maxRadiusMeters", maxRadiusMeters);
        if (maxRadiusMeters < initialRadiusMeters) {
            throw new IllegalArgumentException("maxRadiusMeters must be >= initialRadiusMeters");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (relaxPolicyFromAttempt < 0) {
            throw new IllegalArgumentException("relaxPolicyFromAttempt must be >= 0, got " + relaxPolicyFromAttempt);
        }
        requirePositive("maxSnapDistanceMeters", maxSnapDistanceMeters);
        requirePositive("fallbackSpeedKmh", fallbackSpeedKmh);
        if (costModel == null) {
            throw new IllegalArgumentException("costModel must be provided");
        }
        costModel.validate();
        return this;
    }

    /**
     * Search radius of a 0-based attempt.
     */
    public double radiusForAttempt(double initialRadius, int attempt) {
        return Math.min(initialRadius * (1.0d + 0.5d * attempt), maxRadiusMeters);
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }
}
