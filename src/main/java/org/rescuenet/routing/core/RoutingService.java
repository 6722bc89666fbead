package org.rescuenet.routing.core;

import org.rescuenet.routing.topology.ConnectivityReport;
import org.rescuenet.routing.topology.RepairStats;
import org.rescuenet.routing.vrp.VrpProblem;
import org.rescuenet.routing.vrp.VrpSolution;

/**
 * Public routing contract of the disaster-response engine.
 *
 * <p>Implementations validate input deterministically and throw reason-coded runtime exceptions for
 * contract failures.</p>
 */
public interface RoutingService {

    /**
     * Plans one point-to-point route.
     *
     * @param request start, end, vehicle and hazard scenario.
     * @return planned route, or a flagged straight-line estimate when no road data exists.
     * @throws InfeasiblePathException when no path exists after every retry.
     */
    RouteResult planSingleRoute(SingleRouteRequest request);

    /**
     * Assigns and sequences tasks across a fleet.
     *
     * @param problem depots, tasks, vehicles and solve constraints.
     * @return best solution within the time budget; unservable tasks are reported, never thrown.
     */
    VrpSolution planMultiVehicle(VrpProblem problem);

    /**
     * Splits crossing roads at a shared node, batch by batch.
     *
     * @param batchSize maximum crossings per batch.
     * @param maxBatches maximum number of batches.
     * @param dryRun only count.
     * @return run statistics.
     */
    RepairStats repairTopology(int batchSize, int maxBatches, boolean dryRun);

    /**
     * Reports connected components of the accessible road network.
     *
     * @param scenarioId when set, edges blocked by that scenario under the strict policy are excluded.
     * @return component statistics.
     */
    ConnectivityReport verifyConnectivity(String scenarioId);
}
