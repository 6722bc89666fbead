package org.rescuenet.routing.hazard;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.locationtech.jts.geom.Geometry;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.time.Instant;
import java.util.Set;

/**
 * Scenario-scoped hazard polygon as published by the hazard subsystem.
 *
 * <p>Read-only here: status transitions happen outside the routing engine.</p>
 */
@Value
@Builder(toBuilder = true)
public class HazardZone {
    long id;
    String scenarioId;
    /** Polygonal footprint in lon/lat degrees. */
    Geometry area;
    /** 1 (negligible) to 10 (extreme). */
    int riskLevel;
    @Builder.Default
    boolean passable = true;
    /** Vehicle codes or classes allowed through despite the zone. */
    @Singular
    Set<String> passableVehicleTypes;
    int speedReductionPercent;
    @Builder.Default
    PassageStatus passageStatus = PassageStatus.UNKNOWN;
    boolean reconnaissanceRequired;
    String verifiedBy;
    Instant verifiedAt;
    /** End of the zone's validity; {@code null} means open-ended. */
    Instant estimatedEndAt;

    public boolean isActiveAt(Instant now) {
        return estimatedEndAt == null || estimatedEndAt.isAfter(now);
    }

    /**
     * Returns whether edges overlapping this zone are excluded for the vehicle under the given policy.
     *
     * <p>Confirmed-blocked zones block every vehicle. Other blocking statuses spare vehicles listed in
     * {@link #getPassableVehicleTypes()}.</p>
     */
    public boolean blocks(RiskPolicy policy, VehicleCapability vehicle) {
        switch (passageStatus) {
            case CONFIRMED_BLOCKED:
                return true;
            case NEEDS_RECONNAISSANCE:
                return policy == RiskPolicy.STRICT && !exempts(vehicle);
            case UNKNOWN:
                return !passable && !exempts(vehicle);
            default:
                return false;
        }
    }

    /**
     * True when the zone requires reconnaissance before regular traffic.
     */
    public boolean isUnverified() {
        return passageStatus == PassageStatus.NEEDS_RECONNAISSANCE || reconnaissanceRequired;
    }

    private boolean exempts(VehicleCapability vehicle) {
        if (vehicle == null) {
            return false;
        }
        for (String type : passableVehicleTypes) {
            if (vehicle.matchesVehicleType(type)) {
                return true;
            }
        }
        return false;
    }
}
