package org.rescuenet.routing.core;

import lombok.Builder;
import org.rescuenet.routing.cost.CostModel;
import org.rescuenet.routing.graph.GraphStore;
import org.rescuenet.routing.graph.GraphStoreLoader;
import org.rescuenet.routing.hazard.HazardFilter;
import org.rescuenet.routing.hazard.HazardZoneProvider;
import org.rescuenet.routing.topology.ConnectivityReport;
import org.rescuenet.routing.topology.ConnectivityVerifier;
import org.rescuenet.routing.topology.RepairConfig;
import org.rescuenet.routing.topology.RepairStats;
import org.rescuenet.routing.topology.TopologyRepairJob;
import org.rescuenet.routing.vehicle.VehicleCapabilityProvider;
import org.rescuenet.routing.vehicle.VehicleClassCatalog;
import org.rescuenet.routing.vrp.VehicleRoutingPlanner;
import org.rescuenet.routing.vrp.VrpProblem;
import org.rescuenet.routing.vrp.VrpSolution;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires store, hazard provider and fleet into the planners and the repair job.
 *
 * <p>One instance owns one {@link TopologyRepairJob}, so concurrent repair requests through the same
 * service are rejected while planning calls keep running.</p>
 */
public final class RescueRoutingService implements RoutingService {
    private final SingleRoutePlanner singleRoutePlanner;
    private final VehicleRoutingPlanner vehicleRoutingPlanner;
    private final TopologyRepairJob repairJob;
    private final ConnectivityVerifier connectivityVerifier;

    /**
     * Creates the service.
     *
     * @param graphStore persisted road network.
     * @param hazardZones hazard zone source, read on every call.
     * @param vehicles capability lookup for vehicle ids.
     * @param routingConfig planner settings, defaults when {@code null}.
     * @param repairConfig repair settings, defaults when {@code null}.
     * @param classCatalog vehicle class speed table, the default table when {@code null}.
     * @param clock clock for hazard expiry, system UTC when {@code null}.
     */
    @Builder
    public RescueRoutingService(
            GraphStore graphStore,
            HazardZoneProvider hazardZones,
            VehicleCapabilityProvider vehicles,
            RoutingConfig routingConfig,
            RepairConfig repairConfig,
            VehicleClassCatalog classCatalog,
            Clock clock
    ) {
        Objects.requireNonNull(graphStore, "graphStore");
        Objects.requireNonNull(hazardZones, "hazardZones");
        Objects.requireNonNull(vehicles, "vehicles");
        RoutingConfig routing = routingConfig == null ? RoutingConfig.defaults() : routingConfig;
        HazardFilter hazardFilter = new HazardFilter(hazardZones, clock == null ? Clock.systemUTC() : clock);
        CostModel costModel = new CostModel(
                routing.getCostModel(),
                classCatalog == null ? VehicleClassCatalog.defaultCatalog() : classCatalog);
        this.singleRoutePlanner = new SingleRoutePlanner(
                new GraphStoreLoader(graphStore), hazardFilter, costModel, vehicles, routing);
        this.vehicleRoutingPlanner = new VehicleRoutingPlanner(singleRoutePlanner);
        this.repairJob = new TopologyRepairJob(graphStore, repairConfig == null ? RepairConfig.defaults() : repairConfig);
        this.connectivityVerifier = new ConnectivityVerifier(graphStore, hazardFilter);
    }

    @Override
    public RouteResult planSingleRoute(SingleRouteRequest request) {
        return singleRoutePlanner.plan(request);
    }

    @Override
    public VrpSolution planMultiVehicle(VrpProblem problem) {
        return vehicleRoutingPlanner.solve(problem);
    }

    @Override
    public RepairStats repairTopology(int batchSize, int maxBatches, boolean dryRun) {
        return repairJob.run(batchSize, maxBatches, dryRun);
    }

    @Override
    public ConnectivityReport verifyConnectivity(String scenarioId) {
        return connectivityVerifier.verify(scenarioId);
    }

    public SingleRoutePlanner singleRoutePlanner() {
        return singleRoutePlanner;
    }

    public TopologyRepairJob repairJob() {
        return repairJob;
    }
}
