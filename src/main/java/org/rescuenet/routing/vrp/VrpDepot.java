package org.rescuenet.routing.vrp;

import lombok.Builder;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;

/**
 * Vehicle start and return point.
 */
@Value
@Builder
public class VrpDepot {
    String id;
    GeoPoint location;
    String name;
}
