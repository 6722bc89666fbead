package org.rescuenet.routing.heuristic;

import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Admissibility calibration for the great-circle heuristic.
 *
 * <p>cost_per_meter = min over traversable arcs of arc_cost / great_circle(arc endpoints).
 * Every path from a node to the goal then costs at least cost_per_meter times their great-circle
 * distance, because the chords of the path can never be shorter than that distance.</p>
 *
 * <p>Calibrated per planning call, since arc costs depend on vehicle and hazards.</p>
 */
public final class LowerBoundModel {
    private static final LowerBoundModel ZERO = new LowerBoundModel(0.0d);

    private final double costPerMeter;

    private LowerBoundModel(double costPerMeter) {
        this.costPerMeter = costPerMeter;
    }

    public double costPerMeter() {
        return costPerMeter;
    }

    /**
     * Model that estimates zero everywhere; A* then degrades to Dijkstra.
     */
    public static LowerBoundModel zero() {
        return ZERO;
    }

    /**
     * @param graph loaded subgraph.
     * @param arcCosts cost per arc index; non-finite entries mark arcs that cannot be used.
     */
    public static LowerBoundModel calibrate(RoadGraph graph, double[] arcCosts) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(arcCosts, "arcCosts");
        if (arcCosts.length != graph.arcCount()) {
            throw new IllegalArgumentException(
                    "arcCosts length " + arcCosts.length + " does not match arc count " + graph.arcCount());
        }

        double bestRatio = Double.POSITIVE_INFINITY;
        RoadGraph.ArcIterator arcs = graph.iterator();
        for (int node = 0; node < graph.nodeCount(); node++) {
            arcs.resetForNode(node);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                double cost = arcCosts[arc];
                if (!Double.isFinite(cost)) {
                    continue;
                }
                int target = graph.arcTarget(arc);
                double chord = GeoDistance.greatCircleMeters(
                        graph.lon(node), graph.lat(node), graph.lon(target), graph.lat(target));
                if (chord <= 0.0d) {
                    continue;
                }
                double ratio = cost / chord;
                if (ratio < bestRatio) {
                    bestRatio = ratio;
                }
            }
        }
        if (!Double.isFinite(bestRatio) || bestRatio <= 0.0d) {
            return ZERO;
        }
        return new LowerBoundModel(bestRatio);
    }
}
