package org.rescuenet.routing.vrp;

/**
 * How travel distances between stops are obtained.
 */
public enum TravelMode {
    /** Haversine distance between locations. */
    GREAT_CIRCLE,
    /** Road distance from the single-route planner, one call per location pair. */
    ROAD_NETWORK
}
