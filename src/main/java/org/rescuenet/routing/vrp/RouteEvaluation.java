package org.rescuenet.routing.vrp;

/**
 * Totals of one vehicle's stop sequence.
 */
record RouteEvaluation(boolean feasible, double distanceKm, double durationMinutes, int load, double cost) {
    static final RouteEvaluation EMPTY = new RouteEvaluation(true, 0.0d, 0.0d, 0, 0.0d);
    static final RouteEvaluation INFEASIBLE =
            new RouteEvaluation(false, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0, Double.POSITIVE_INFINITY);
}
