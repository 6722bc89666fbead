package org.rescuenet.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.hazard.RiskPolicy;

import java.util.List;

/**
 * Planned route.
 *
 * <p>When {@code estimated=true} the route is a straight-line estimate with no road data behind it and
 * {@link #WARNING_NO_ROAD_NETWORK} is always among the warnings.</p>
 */
@Value
@Builder
public class RouteResult {
    public static final String WARNING_NO_ROAD_NETWORK = "no road network data";

    /** Ordered polyline from start to end. */
    @Singular("pathPoint")
    List<GeoPoint> path;
    /** Persisted node ids along the route, empty for estimates. */
    @Singular("pathNodeId")
    List<Long> nodeIds;
    @Singular
    List<RouteSegment> segments;
    double totalDistanceMeters;
    double totalDurationSeconds;
    double totalCost;
    /** Normalized route risk in {@code [0, 1]}. */
    double riskScore;
    @Singular
    List<String> warnings;
    boolean estimated;
    /** Attempts consumed, 1-based. */
    int attempts;
    double radiusMeters;
    RiskPolicy policy;
    int settledNodes;

    public double totalDurationMinutes() {
        return totalDurationSeconds / 60.0d;
    }

    public double totalDistanceKm() {
        return totalDistanceMeters / 1000.0d;
    }
}
