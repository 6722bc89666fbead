package org.rescuenet.routing.cost;

/**
 * Why a vehicle cannot traverse an edge.
 */
public enum Infeasibility {
    EDGE_INACCESSIBLE,
    GRADIENT_EXCEEDED,
    WATER_TOO_DEEP,
    TOO_WIDE,
    TOO_TALL,
    TOO_HEAVY,
    TERRAIN_NOT_SUPPORTED,
    ROAD_CLASS_PROHIBITED
}
