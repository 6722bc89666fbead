package org.rescuenet.routing.heuristic;

import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.graph.RoadGraph;

import java.util.Objects;

/**
 * Great-circle heuristic scaled by a calibrated {@link LowerBoundModel}.
 */
public final class GreatCircleHeuristic {
    private final RoadGraph graph;
    private final double costPerMeter;

    public GreatCircleHeuristic(RoadGraph graph, LowerBoundModel lowerBoundModel) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.costPerMeter = Objects.requireNonNull(lowerBoundModel, "lowerBoundModel").costPerMeter();
    }

    /**
     * Binds the heuristic to one goal node and returns a reusable estimator.
     *
     * @param goalNodeIndex target node index in the loaded subgraph.
     */
    public GoalBoundHeuristic bindGoal(int goalNodeIndex) {
        if (goalNodeIndex < 0 || goalNodeIndex >= graph.nodeCount()) {
            throw new IllegalArgumentException(
                    "goalNodeIndex out of bounds: " + goalNodeIndex + " [0, " + graph.nodeCount() + ")");
        }
        if (costPerMeter == 0.0d) {
            return nodeIndex -> 0.0d;
        }
        double goalLon = graph.lon(goalNodeIndex);
        double goalLat = graph.lat(goalNodeIndex);
        return nodeIndex -> costPerMeter
                * GeoDistance.greatCircleMeters(graph.lon(nodeIndex), graph.lat(nodeIndex), goalLon, goalLat);
    }
}
