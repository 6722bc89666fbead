package org.rescuenet.routing.vrp;

/**
 * Why a task was left out of every route.
 */
public enum UnservedReason {
    /** No vehicle can drive there and back within its limits, or no road connects it. */
    UNREACHABLE,
    /** Demand exceeds the capacity of every vehicle. */
    EXCEEDS_CAPACITY,
    /** No vehicle can arrive inside the task's time window. */
    TIME_WINDOW,
    /** Individually servable, but the fleet ran out of capacity, distance or time. */
    FLEET_EXHAUSTED
}
