package org.rescuenet.routing.cost;

/**
 * Outcome of costing one edge for one vehicle.
 *
 * @param cost search weight, strictly positive when feasible.
 * @param etaSeconds expected traversal time.
 * @param speedKmh effective speed after all factors.
 * @param infeasibility reason when the edge is excluded, {@code null} when feasible.
 */
public record EdgeCost(double cost, double etaSeconds, double speedKmh, Infeasibility infeasibility) {

    public static EdgeCost feasible(double cost, double etaSeconds, double speedKmh) {
        return new EdgeCost(cost, etaSeconds, speedKmh, null);
    }

    public static EdgeCost infeasible(Infeasibility reason) {
        return new EdgeCost(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0.0d, reason);
    }

    public boolean isFeasible() {
        return infeasibility == null;
    }
}
