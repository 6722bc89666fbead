package org.rescuenet.routing.cost;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.ConfigProperties;

import java.util.Properties;

/**
 * Tunables of {@link CostModel}.
 */
@Value
@Builder(toBuilder = true)
public class CostModelConfig {
    public static final String PROPERTY_RISK_THRESHOLD = "rescuenet.cost.riskThreshold";
    public static final String PROPERTY_HIGH_RISK_PENALTY = "rescuenet.cost.highRiskPenalty";
    public static final String PROPERTY_RECONNAISSANCE_PENALTY = "rescuenet.cost.reconnaissancePenalty";
    public static final String PROPERTY_MIN_SPEED_KMH = "rescuenet.cost.minSpeedKmh";
    public static final String PROPERTY_SPEED_FACTOR = "rescuenet.cost.speedFactor";

    /** Zones with a risk level strictly above this multiply edge cost by {@link #highRiskPenalty}. */
    @Builder.Default
    int riskThreshold = 7;
    @Builder.Default
    double highRiskPenalty = 5.0d;
    /** Cost multiplier for traversable zones still awaiting reconnaissance. */
    @Builder.Default
    double reconnaissancePenalty = 3.0d;
    /** Floor for effective speed once the edge is feasible. */
    @Builder.Default
    double minSpeedKmh = 5.0d;
    /** Global speed multiplier, e.g. to model night driving or convoy pace. */
    @Builder.Default
    double speedFactor = 1.0d;

    public static CostModelConfig defaults() {
        return CostModelConfig.builder().build();
    }

    /**
     * Reads {@code rescuenet.cost.*} keys, keeping defaults for missing ones.
     */
    public static CostModelConfig fromProperties(Properties properties) {
        CostModelConfig defaults = defaults();
        return CostModelConfig.builder()
                .riskThreshold(ConfigProperties.intValue(properties, PROPERTY_RISK_THRESHOLD, defaults.riskThreshold))
                .highRiskPenalty(ConfigProperties.doubleValue(properties, PROPERTY_HIGH_RISK_PENALTY, defaults.highRiskPenalty))
                .reconnaissancePenalty(ConfigProperties.doubleValue(
                        properties, PROPERTY_RECONNAISSANCE_PENALTY, defaults.reconnaissancePenalty))
                .minSpeedKmh(ConfigProperties.doubleValue(properties, PROPERTY_MIN_SPEED_KMH, defaults.minSpeedKmh))
                .speedFactor(ConfigProperties.doubleValue(properties, PROPERTY_SPEED_FACTOR, defaults.speedFactor))
                .build()
                .validate();
    }

    /**
     * Validates ranges and returns this instance.
     */
    public CostModelConfig validate() {
        if (riskThreshold < 0 || riskThreshold > 10) {
            throw new IllegalArgumentException("riskThreshold must be within [0, 10], got " + riskThreshold);
        }
        requireAtLeastOne("highRiskPenalty", highRiskPenalty);
        requireAtLeastOne("reconnaissancePenalty", reconnaissancePenalty);
        if (!Double.isFinite(minSpeedKmh) || minSpeedKmh <= 0.0d) {
            throw new IllegalArgumentException("minSpeedKmh must be finite and > 0, got " + minSpeedKmh);
        }
        if (!Double.isFinite(speedFactor) || speedFactor <= 0.0d) {
            throw new IllegalArgumentException("speedFactor must be finite and > 0, got " + speedFactor);
        }
        return this;
    }

    private static void requireAtLeastOne(String name, double value) {
        if (!Double.isFinite(value) || value < 1.0d) {
            throw new IllegalArgumentException(name + " must be finite and >= 1.0, got " + value);
        }
    }
}
