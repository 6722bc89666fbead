package org.rescuenet.routing.topology;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.ConfigProperties;

import java.util.Properties;

/**
 * Tolerances and batch defaults of {@link TopologyRepairJob}.
 */
@Value
@Builder(toBuilder = true)
public class RepairConfig {
    public static final String PROPERTY_SNAP_TOLERANCE_METERS = "rescuenet.repair.snapToleranceMeters";
    public static final String PROPERTY_ASSOCIATE_TOLERANCE_METERS = "rescuenet.repair.associateToleranceMeters";
    public static final String PROPERTY_MIN_SPLIT_FRACTION = "rescuenet.repair.minSplitFraction";
    public static final String PROPERTY_MAX_SPLIT_FRACTION = "rescuenet.repair.maxSplitFraction";
    public static final String PROPERTY_BATCH_SIZE = "rescuenet.repair.batchSize";
    public static final String PROPERTY_MAX_BATCHES = "rescuenet.repair.maxBatches";

    /** An existing node this close to a crossing is reused instead of creating one. */
    @Builder.Default
    double snapToleranceMeters = 10.0d;
    /** Radius in which a crossing is tied to its nearest node. */
    @Builder.Default
    double associateToleranceMeters = 15.0d;
    @Builder.Default
    double minSplitFraction = 0.01d;
    @Builder.Default
    double maxSplitFraction = 0.99d;
    @Builder.Default
    int batchSize = 10_000;
    @Builder.Default
    int maxBatches = 100;

    public static RepairConfig defaults() {
        return RepairConfig.builder().build();
    }

    /**
     * Reads {@code rescuenet.repair.*} keys, keeping defaults for missing ones.
     */
    public static RepairConfig fromProperties(Properties properties) {
        RepairConfig defaults = defaults();
        return RepairConfig.builder()
                .snapToleranceMeters(ConfigProperties.doubleValue(
                        properties, PROPERTY_SNAP_TOLERANCE_METERS, defaults.snapToleranceMeters))
                .associateToleranceMeters(ConfigProperties.doubleValue(
                        properties, PROPERTY_ASSOCIATE_TOLERANCE_METERS, defaults.associateToleranceMeters))
                .minSplitFraction(ConfigProperties.doubleValue(properties, PROPERTY_MIN_SPLIT_FRACTION, defaults.minSplitFraction))
                .maxSplitFraction(ConfigProperties.doubleValue(properties, PROPERTY_MAX_SPLIT_FRACTION, defaults.maxSplitFraction))
                .batchSize(ConfigProperties.intValue(properties, PROPERTY_BATCH_SIZE, defaults.batchSize))
                .maxBatches(ConfigProperties.intValue(properties, PROPERTY_MAX_BATCHES, defaults.maxBatches))
                .build()
                .validate();
    }

    public RepairConfig validate() {
        if (!Double.isFinite(snapToleranceMeters) || snapToleranceMeters < 0.0d) {
            throw new IllegalArgumentException("snapToleranceMeters must be finite and >= 0, got " + snapToleranceMeters);
        }
        if (!Double.isFinite(associateToleranceMeters) || associateToleranceMeters < snapToleranceMeters) {
            throw new IllegalArgumentException("associateToleranceMeters must be >= snapToleranceMeters, got "
                    + associateToleranceMeters);
        }
        if (!(minSplitFraction > 0.0d) || !(maxSplitFraction < 1.0d) || minSplitFraction >= maxSplitFraction) {
            throw new IllegalArgumentException("split fractions must satisfy 0 < min < max < 1, got ["
                    + minSplitFraction + ", " + maxSplitFraction + "]");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
        if (maxBatches <= 0) {
            throw new IllegalArgumentException("maxBatches must be > 0, got " + maxBatches);
        }
        return this;
    }
}
