package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.ConfigProperties;
import org.rescuenet.routing.hazard.RiskPolicy;

import java.time.Duration;
import java.util.Properties;

/**
 * Solve-wide options of the multi-vehicle planner.
 */
@Value
@Builder(toBuilder = true)
public class VrpConstraints {
    public static final String PROPERTY_TIME_LIMIT_MILLIS = "rescuenet.vrp.timeLimitMillis";
    public static final String PROPERTY_MAX_ITERATIONS = "rescuenet.vrp.maxIterations";
    public static final String PROPERTY_SEED = "rescuenet.vrp.seed";
    public static final String PROPERTY_USE_TIME_WINDOWS = "rescuenet.vrp.useTimeWindows";

    /** Wall-clock budget of the improvement search. */
    @Builder.Default
    Duration timeLimit = Duration.ofSeconds(30);
    @Builder.Default
    boolean useTimeWindows = false;
    /** Cost per kilometer driven. */
    @Builder.Default
    double distanceWeight = 1.0d;
    /** Cost per minute of route duration. */
    @Builder.Default
    double timeWeight = 0.0d;
    /** Upper bound on improvement iterations regardless of time left. */
    @Builder.Default
    int maxIterations = 2_000;
    @Builder.Default
    long seed = 42L;
    @Builder.Default
    TravelMode travelMode = TravelMode.GREAT_CIRCLE;
    @Builder.Default
    boolean returnToDepot = true;
    /** Hazard scenario for road-network distances. */
    String scenarioId;
    @Builder.Default
    RiskPolicy policy = RiskPolicy.STRICT;

    public static VrpConstraints defaults() {
        return VrpConstraints.builder().build();
    }

    /**
     * Reads {@code rescuenet.vrp.*} keys, keeping defaults for missing ones.
     */
    public static VrpConstraints fromProperties(Properties properties) {
        VrpConstraints defaults = defaults();
        return VrpConstraints.builder()
                .timeLimit(Duration.ofMillis(ConfigProperties.longValue(
                        properties, PROPERTY_TIME_LIMIT_MILLIS, defaults.timeLimit.toMillis())))
                .maxIterations(ConfigProperties.intValue(properties, PROPERTY_MAX_ITERATIONS, defaults.maxIterations))
                .seed(ConfigProperties.longValue(properties, PROPERTY_SEED, defaults.seed))
                .useTimeWindows(ConfigProperties.booleanValue(properties, PROPERTY_USE_TIME_WINDOWS, defaults.useTimeWindows))
                .build();
    }
}
