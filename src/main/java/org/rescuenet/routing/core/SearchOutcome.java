package org.rescuenet.routing.core;

/**
 * Internal A* output.
 *
 * @param reachable whether the target was settled.
 * @param totalCost path cost, {@code +INF} when unreachable.
 * @param settledNodes nodes settled during the search.
 * @param arcPath arcs from source to target, empty when unreachable or source equals target.
 */
record SearchOutcome(boolean reachable, double totalCost, int settledNodes, int[] arcPath) {

    static SearchOutcome unreachable(int settledNodes) {
        return new SearchOutcome(false, Double.POSITIVE_INFINITY, settledNodes, new int[0]);
    }
}
