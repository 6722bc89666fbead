package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;

/**
 * One task visit on a vehicle route. Times are minutes after departure from the depot.
 */
@Value
@Builder
public class RouteStop {
    int sequence;
    String taskId;
    GeoPoint location;
    int demand;
    double arrivalMinute;
    /** Service start, later than arrival when the vehicle waits for the window to open. */
    double serviceStartMinute;
    double departureMinute;
    /** Load delivered so far, including this stop. */
    int cumulativeLoad;
    double legDistanceKm;
}
