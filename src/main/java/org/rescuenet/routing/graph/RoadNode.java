package org.rescuenet.routing.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.Map;

/**
 * Persisted road node. Nodes are never deleted, only marked inaccessible.
 */
@Value
@Builder(toBuilder = true)
public class RoadNode {
    long id;
    double lon;
    double lat;
    /** Elevation in meters, {@code null} when unknown. */
    Double elevation;
    @Builder.Default
    NodeType nodeType = NodeType.WAYPOINT;
    int edgeCount;
    @Builder.Default
    boolean accessible = true;
    @Singular
    Map<String, String> properties;

    public GeoPoint point() {
        return new GeoPoint(lon, lat);
    }
}
