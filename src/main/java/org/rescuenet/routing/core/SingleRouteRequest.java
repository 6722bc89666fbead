package org.rescuenet.routing.core;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.hazard.RiskPolicy;
import org.rescuenet.routing.vehicle.VehicleCapability;

/**
 * Point-to-point route request.
 *
 * <p>The vehicle is either given inline or looked up by {@code vehicleId}; with neither, the default
 * 40 km/h vehicle is used.</p>
 */
@Value
@Builder(toBuilder = true)
public class SingleRouteRequest {
    GeoPoint start;
    GeoPoint end;
    /** Vehicle id resolved through the capability provider. */
    Long vehicleId;
    /** Inline capability, wins over {@link #vehicleId}. */
    VehicleCapability vehicle;
    /** Hazard scenario, {@code null} for none. */
    String scenarioId;
    @Builder.Default
    RiskPolicy policy = RiskPolicy.STRICT;
    /** Overrides the configured initial search radius. */
    Double initialRadiusMeters;
}
