package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;

/**
 * Point to visit: rescue site, supply drop, evacuation pickup.
 */
@Value
@Builder
public class VrpTask {
    String id;
    GeoPoint location;
    @Builder.Default
    int demand = 1;
    /** Higher is more urgent. Coverage of higher priorities is never traded for lower ones. */
    @Builder.Default
    int priority = 1;
    /** Optional service window, honored when the constraints enable time windows. */
    TimeWindow timeWindow;
    @Builder.Default
    double serviceMinutes = 15.0d;
}
