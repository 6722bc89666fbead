package org.rescuenet.routing.vrp;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.rescuenet.routing.core.InfeasiblePathException;
import org.rescuenet.routing.core.RouteResult;
import org.rescuenet.routing.core.SingleRoutePlanner;
import org.rescuenet.routing.core.SingleRouteRequest;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.hazard.RiskPolicy;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.util.List;
import java.util.Objects;

/**
 * Road distances from the single-route planner, one plan per ordered location pair.
 *
 * <p>Pairs the planner proves unreachable become {@link Double#POSITIVE_INFINITY}. Straight-line
 * estimates are kept and counted in {@link #estimatedPairs()}. Once the solve deadline passes no more
 * plans are started and the remaining pairs take great-circle distances, counted in
 * {@link #greatCirclePairs()}.</p>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class RoadNetworkTravelMatrix implements TravelMatrix {
    @Getter(AccessLevel.NONE)
    private final double[][] meters;
    private final int estimatedPairs;
    private final int unreachablePairs;
    private final int greatCirclePairs;

    private RoadNetworkTravelMatrix(double[][] meters, int estimatedPairs, int unreachablePairs, int greatCirclePairs) {
        this.meters = meters;
        this.estimatedPairs = estimatedPairs;
        this.unreachablePairs = unreachablePairs;
        this.greatCirclePairs = greatCirclePairs;
    }

    /**
     * Plans every ordered pair of distinct locations until the budget's deadline.
     *
     * @param locations indexed locations.
     * @param planner single-route planner.
     * @param vehicle capability to plan for, the default vehicle when {@code null}.
     * @param scenarioId hazard scenario or {@code null}.
     * @param policy hazard policy of the first attempt.
     * @param budget solve budget; only its deadline and interruption are checked here.
     * @return road distance matrix.
     */
    static RoadNetworkTravelMatrix build(
            List<GeoPoint> locations,
            SingleRoutePlanner planner,
            VehicleCapability vehicle,
            String scenarioId,
            RiskPolicy policy,
            SolveBudget budget
    ) {
        Objects.requireNonNull(locations, "locations");
        Objects.requireNonNull(planner, "planner");
        Objects.requireNonNull(budget, "budget");
        VehicleCapability capability = vehicle == null ? VehicleCapability.defaultVehicle() : vehicle;
        int n = locations.size();
        double[][] meters = new double[n][n];
        int estimated = 0;
        int unreachable = 0;
        int greatCircle = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                if (budget.deadlinePassed()) {
                    meters[i][j] = GeoDistance.greatCircleMeters(locations.get(i), locations.get(j));
                    greatCircle++;
                    continue;
                }
                SingleRouteRequest request = SingleRouteRequest.builder()
                        .start(locations.get(i))
                        .end(locations.get(j))
                        .vehicle(capability)
                        .scenarioId(scenarioId)
                        .policy(policy == null ? RiskPolicy.STRICT : policy)
                        .build();
                try {
                    RouteResult route = planner.plan(request);
                    meters[i][j] = route.getTotalDistanceMeters();
                    if (route.isEstimated()) {
                        estimated++;
                    }
                } catch (InfeasiblePathException ex) {
                    meters[i][j] = Double.POSITIVE_INFINITY;
                    unreachable++;
                }
            }
        }
        if (greatCircle > 0) {
            log.warn("Solve deadline reached while building the road travel matrix, {} of {} pairs use great-circle distances",
                    greatCircle, n * (n - 1));
        }
        if (unreachable > 0 || estimated > 0) {
            log.info("Road travel matrix over {} locations: {} unreachable pairs, {} estimated pairs",
                    n, unreachable, estimated);
        }
        return new RoadNetworkTravelMatrix(meters, estimated, unreachable, greatCircle);
    }

    @Override
    public int size() {
        return meters.length;
    }

    @Override
    public double distanceMeters(int from, int to) {
        return meters[from][to];
    }
}
