package org.rescuenet.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.InMemoryGraphStore;
import org.rescuenet.routing.hazard.InMemoryHazardZoneProvider;
import org.rescuenet.routing.hazard.PassageStatus;
import org.rescuenet.routing.testutil.RoutingFixtures;
import org.rescuenet.routing.topology.ConnectivityReport;
import org.rescuenet.routing.topology.RepairStats;
import org.rescuenet.routing.vehicle.InMemoryVehicleCapabilityProvider;
import org.rescuenet.routing.vehicle.VehicleCapability;
import org.rescuenet.routing.vrp.VrpConstraints;
import org.rescuenet.routing.vrp.VrpDepot;
import org.rescuenet.routing.vrp.VrpProblem;
import org.rescuenet.routing.vrp.VrpSolution;
import org.rescuenet.routing.vrp.VrpTask;
import org.rescuenet.routing.vrp.VrpVehicle;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.rescuenet.routing.testutil.RoutingFixtures.FIXED_CLOCK;
import static org.rescuenet.routing.testutil.RoutingFixtures.SCENARIO;
import static org.rescuenet.routing.testutil.RoutingFixtures.zone;

@DisplayName("Rescue Routing Service Tests")
class RescueRoutingServiceTest {

    private static RescueRoutingService service(InMemoryGraphStore store, InMemoryHazardZoneProvider zones) {
        return RescueRoutingService.builder()
                .graphStore(store)
                .hazardZones(zones)
                .vehicles(new InMemoryVehicleCapabilityProvider(List.of(VehicleCapability.defaultVehicle())))
                .clock(FIXED_CLOCK)
                .build();
    }

    @Test
    @DisplayName("Plans a road route with default configuration")
    void testPlanSingleRoute() {
        RescueRoutingService service = service(
                RoutingFixtures.grid(3, 103.80d, 31.60d, 0.01d).store(), new InMemoryHazardZoneProvider());

        RouteResult route = service.planSingleRoute(SingleRouteRequest.builder()
                .start(GeoPoint.of(103.80d, 31.60d))
                .end(GeoPoint.of(103.82d, 31.62d))
                .build());

        assertFalse(route.isEstimated());
        assertEquals(1L, route.getNodeIds().get(0));
        assertEquals(9L, route.getNodeIds().get(route.getNodeIds().size() - 1));
        assertEquals(4, route.getSegments().size());
        assertEquals(RoutingConfig.defaults().getInitialRadiusMeters(), route.getRadiusMeters());
    }

    @Test
    @DisplayName("Plans a fleet over the same network")
    void testPlanMultiVehicle() {
        RescueRoutingService service = service(
                RoutingFixtures.grid(3, 103.80d, 31.60d, 0.01d).store(), new InMemoryHazardZoneProvider());

        VrpSolution solution = service.planMultiVehicle(VrpProblem.builder()
                .depot(VrpDepot.builder().id("D1").location(GeoPoint.of(103.80d, 31.60d)).build())
                .task(VrpTask.builder().id("t1").location(GeoPoint.of(103.82d, 31.60d)).build())
                .task(VrpTask.builder().id("t2").location(GeoPoint.of(103.82d, 31.62d)).priority(3).build())
                .vehicle(VrpVehicle.builder().id("v1").depotId("D1").capacity(5).build())
                .constraints(VrpConstraints.builder().timeLimit(Duration.ofSeconds(10)).maxIterations(50).build())
                .build());

        assertEquals(2, solution.getServedTasks());
        assertEquals(1.0d, solution.getCoverageRate());
        assertTrue(solution.getUnserved().isEmpty());
    }

    @Test
    @DisplayName("Repair and connectivity checks run through the service")
    void testRepairAndConnectivity() {
        InMemoryGraphStore store = RoutingFixtures.crossingPair().store();
        RescueRoutingService service = service(store, new InMemoryHazardZoneProvider());

        assertEquals(2, service.verifyConnectivity(null).getComponentCount());
        RepairStats stats = service.repairTopology(100, 5, false);

        assertEquals(1, stats.getIntersectionsFound());
        assertEquals(1, service.verifyConnectivity(null).getComponentCount());
        assertFalse(service.repairJob().isRunning());
    }

    @Test
    @DisplayName("Scenario connectivity uses the configured hazard zones")
    void testScenarioConnectivity() {
        InMemoryHazardZoneProvider zones = new InMemoryHazardZoneProvider(List.of(
                zone(1L, 103.8095d, 31.5990d, 103.8105d, 31.6010d)
                        .passageStatus(PassageStatus.CONFIRMED_BLOCKED)
                        .build()));
        RescueRoutingService service = service(RoutingFixtures.grid(3, 103.80d, 31.60d, 0.01d).store(), zones);

        ConnectivityReport report = service.verifyConnectivity(SCENARIO);

        assertEquals(SCENARIO, report.getScenarioId());
        assertTrue(report.getEdgeCount() < 12);
        assertEquals(1, report.getComponentCount());
    }

    @Test
    @DisplayName("Missing collaborators are rejected")
    void testRequiredCollaborators() {
        assertThrows(NullPointerException.class, () -> RescueRoutingService.builder()
                .hazardZones(new InMemoryHazardZoneProvider())
                .vehicles(new InMemoryVehicleCapabilityProvider(List.of()))
                .build());
        assertThrows(NullPointerException.class, () -> RescueRoutingService.builder()
                .graphStore(RoutingFixtures.crossingPair().store())
                .vehicles(new InMemoryVehicleCapabilityProvider(List.of()))
                .build());
    }
}
