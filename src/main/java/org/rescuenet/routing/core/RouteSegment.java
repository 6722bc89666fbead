package org.rescuenet.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * One traversed edge of a route, in travel direction.
 */
@Value
@Builder
public class RouteSegment {
    long edgeId;
    long fromNodeId;
    long toNodeId;
    double distanceMeters;
    double durationSeconds;
    /** Effective speed after vehicle, road-class and hazard factors. */
    double speedKmh;
    double cost;
    String roadClass;
    String terrainType;
    /** Highest risk level of the hazard zones overlapping the edge, 0 when none. */
    int maxRiskLevel;
    /** Whether an overlapping zone still awaits reconnaissance. */
    boolean unverifiedHazard;
}
