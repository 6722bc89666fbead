package org.rescuenet.routing.hazard;

/**
 * Combined effect of all non-blocking, non-clear zones overlapping one edge.
 *
 * @param speedReductionPercent largest speed reduction among the zones, {@code [0, 100]}.
 * @param maxRiskLevel highest risk level among the zones, 0 when none.
 * @param unverified whether any zone still awaits reconnaissance.
 */
public record HazardExposure(int speedReductionPercent, int maxRiskLevel, boolean unverified) {
    public static final HazardExposure NONE = new HazardExposure(0, 0, false);

    public HazardExposure {
        if (speedReductionPercent < 0 || speedReductionPercent > 100) {
            throw new IllegalArgumentException("speedReductionPercent must be within [0, 100], got " + speedReductionPercent);
        }
        if (maxRiskLevel < 0) {
            throw new IllegalArgumentException("maxRiskLevel must be >= 0");
        }
    }

    public static HazardExposure of(HazardZone zone) {
        int reduction = Math.max(0, Math.min(100, zone.getSpeedReductionPercent()));
        return new HazardExposure(reduction, Math.max(0, zone.getRiskLevel()), zone.isUnverified());
    }

    public HazardExposure merge(HazardExposure other) {
        return new HazardExposure(
                Math.max(speedReductionPercent, other.speedReductionPercent),
                Math.max(maxRiskLevel, other.maxRiskLevel),
                unverified || other.unverified
        );
    }

    public boolean isNone() {
        return speedReductionPercent == 0 && maxRiskLevel == 0 && !unverified;
    }
}
