package org.rescuenet.routing.topology;

import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.RoadEdge;

/**
 * Two accessible edges crossing at one interior point without a shared endpoint.
 *
 * @param first edge with the lower id.
 * @param second edge with the higher id.
 * @param point crossing point in lon/lat.
 */
public record EdgeCrossing(RoadEdge first, RoadEdge second, GeoPoint point) {
}
