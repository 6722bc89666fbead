package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered stops of one vehicle with its totals.
 */
@Value
@Builder
public class VehicleRoute {
    String vehicleId;
    String depotId;
    @Singular
    List<RouteStop> stops;
    double totalDistanceKm;
    double totalDurationMinutes;
    int totalLoad;
    double cost;

    public boolean isUsed() {
        return !stops.isEmpty();
    }
}
