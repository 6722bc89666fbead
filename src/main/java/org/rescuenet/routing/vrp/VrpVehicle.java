package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.vehicle.VehicleCapability;

/**
 * Fleet member available to the multi-vehicle planner.
 */
@Value
@Builder
public class VrpVehicle {
    String id;
    String name;
    String depotId;
    @Builder.Default
    int capacity = 10;
    @Builder.Default
    double speedKmh = 40.0d;
    @Builder.Default
    double maxDistanceKm = 200.0d;
    @Builder.Default
    double maxTimeMinutes = 480.0d;
    /** Capability used for road-network travel distances; the default vehicle when absent. */
    VehicleCapability capability;
}
