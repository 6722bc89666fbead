package org.rescuenet.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rescuenet.routing.RoutingException;
import org.rescuenet.routing.cost.CostModel;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.GraphStoreLoader;
import org.rescuenet.routing.graph.InMemoryGraphStore;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;
import org.rescuenet.routing.hazard.HazardExposure;
import org.rescuenet.routing.hazard.HazardZone;
import org.rescuenet.routing.hazard.PassageStatus;
import org.rescuenet.routing.hazard.RiskPolicy;
import org.rescuenet.routing.testutil.RoutingFixtures;
import org.rescuenet.routing.vehicle.InMemoryVehicleCapabilityProvider;
import org.rescuenet.routing.vehicle.VehicleCapability;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.rescuenet.routing.testutil.RoutingFixtures.SCENARIO;
import static org.rescuenet.routing.testutil.RoutingFixtures.edge;
import static org.rescuenet.routing.testutil.RoutingFixtures.hazardFilter;
import static org.rescuenet.routing.testutil.RoutingFixtures.node;
import static org.rescuenet.routing.testutil.RoutingFixtures.planner;
import static org.rescuenet.routing.testutil.RoutingFixtures.zone;

@DisplayName("Single Route Planner Tests")
class SingleRoutePlannerTest {
    private static final RoutingConfig TIGHT_SNAP = RoutingConfig.builder()
            .maxSnapDistanceMeters(200.0d)
            .build();

    private static SingleRouteRequest request(RoadNode from, RoadNode to) {
        return SingleRouteRequest.builder()
                .start(from.point())
                .end(to.point())
                .build();
    }

    /**
     * Cheapest simple path by exhaustive enumeration, {@code +inf} when none exists.
     */
    private static double bruteForceCost(RoutingFixtures.Network network, long source, long target) {
        CostModel model = CostModel.defaults();
        VehicleCapability car = VehicleCapability.defaultVehicle();
        Map<Long, List<long[]>> adjacency = new HashMap<>();
        Map<Long, Double> costs = new HashMap<>();
        for (RoadEdge edge : network.edges()) {
            costs.put(edge.getId(), model.evaluate(edge, car, HazardExposure.NONE).cost());
            adjacency.computeIfAbsent(edge.getFromNodeId(), k -> new ArrayList<>())
                    .add(new long[]{edge.getToNodeId(), edge.getId()});
            if (!edge.isOneway()) {
                adjacency.computeIfAbsent(edge.getToNodeId(), k -> new ArrayList<>())
                        .add(new long[]{edge.getFromNodeId(), edge.getId()});
            }
        }
        double[] best = {Double.POSITIVE_INFINITY};
        Set<Long> visited = new HashSet<>();
        visited.add(source);
        enumerate(source, target, 0.0d, adjacency, costs, visited, best);
        return best[0];
    }

    private static void enumerate(
            long node,
            long target,
            double cost,
            Map<Long, List<long[]>> adjacency,
            Map<Long, Double> costs,
            Set<Long> visited,
            double[] best
    ) {
        if (cost >= best[0]) {
            return;
        }
        if (node == target) {
            best[0] = cost;
            return;
        }
        for (long[] next : adjacency.getOrDefault(node, List.of())) {
            if (visited.add(next[0])) {
                enumerate(next[0], target, cost + costs.get(next[1]), adjacency, costs, visited, best);
                visited.remove(next[0]);
            }
        }
    }

    /**
     * Corridor A - B - C along the equator, about 1.1 km per edge.
     */
    private static RoutingFixtures.Network corridor() {
        RoadNode a = node(1L, 0.00d, 0.0d);
        RoadNode b = node(2L, 0.01d, 0.0d);
        RoadNode c = node(3L, 0.02d, 0.0d);
        return new RoutingFixtures.Network(List.of(a, b, c), List.of(edge(1L, a, b), edge(2L, b, c)));
    }

    private static HazardZone.HazardZoneBuilder overSecondCorridorEdge() {
        return zone(1L, 0.013d, -0.005d, 0.017d, 0.005d);
    }

    @Nested
    @DisplayName("1. Optimality and Determinism")
    class OptimalityTests {

        @Test
        @DisplayName("A* matches exhaustive enumeration on random grids")
        void testOptimalAgainstEnumeration() {
            for (long seed = 1L; seed <= 6L; seed++) {
                RoutingFixtures.Network network = RoutingFixtures.randomizedGrid(5, seed);
                SingleRoutePlanner planner = planner(network.store(), hazardFilter(), TIGHT_SNAP);
                RoadNode source = network.nodes().get(0);
                for (RoadNode target : List.of(network.nodes().get(24), network.nodes().get(12), network.nodes().get(4))) {
                    double expected = bruteForceCost(network, source.getId(), target.getId());
                    if (Double.isInfinite(expected)) {
                        assertThrows(InfeasiblePathException.class, () -> planner.plan(request(source, target)));
                        continue;
                    }
                    RouteResult route = planner.plan(request(source, target));
                    assertFalse(route.isEstimated());
                    assertEquals(expected, route.getTotalCost(), expected * 1e-9,
                            "seed " + seed + " target " + target.getId());
                    assertEquals(source.getId(), route.getNodeIds().get(0));
                    assertEquals(target.getId(), route.getNodeIds().get(route.getNodeIds().size() - 1));
                }
            }
        }

        @Test
        @DisplayName("Segments chain node to node and sum to the totals")
        void testSegmentsConsistent() {
            RoutingFixtures.Network network = RoutingFixtures.grid(4, 103.85d, 31.67d, 0.01d);
            RouteResult route = planner(network.store())
                    .plan(request(network.nodes().get(0), network.nodes().get(15)));

            assertEquals(6, route.getSegments().size());
            assertEquals(route.getSegments().size() + 1, route.getNodeIds().size());
            double distance = 0.0d;
            double cost = 0.0d;
            for (int i = 0; i < route.getSegments().size(); i++) {
                RouteSegment segment = route.getSegments().get(i);
                assertEquals(route.getNodeIds().get(i), segment.getFromNodeId());
                assertEquals(route.getNodeIds().get(i + 1), segment.getToNodeId());
                assertTrue(segment.getSpeedKmh() > 0.0d);
                assertTrue(segment.getSpeedKmh() <= VehicleCapability.defaultVehicle().getMaxSpeedKmh() + 1e-9);
                distance += segment.getDistanceMeters();
                cost += segment.getCost();
            }
            assertEquals(distance, route.getTotalDistanceMeters(), 1e-6);
            assertEquals(cost, route.getTotalCost(), 1e-6);
            assertEquals(0.0d, route.getRiskScore());
            assertTrue(route.getWarnings().isEmpty());
            assertEquals(network.nodes().get(0).point(), route.getPath().get(0));
        }

        @Test
        @DisplayName("Repeated requests return identical routes")
        void testDeterministic() {
            // uniform grid has many equal-cost shortest paths
            RoutingFixtures.Network network = RoutingFixtures.grid(5, 103.85d, 31.67d, 0.01d);
            SingleRoutePlanner planner = planner(network.store());
            SingleRouteRequest request = request(network.nodes().get(0), network.nodes().get(24));

            RouteResult first = planner.plan(request);
            for (int i = 0; i < 5; i++) {
                RouteResult again = planner.plan(request);
                assertEquals(first.getNodeIds(), again.getNodeIds());
                assertEquals(first.getTotalCost(), again.getTotalCost());
            }
        }

        @Test
        @DisplayName("Same start and end yields an empty route")
        void testSamePoint() {
            RoutingFixtures.Network network = corridor();
            RouteResult route = planner(network.store())
                    .plan(request(network.nodes().get(1), network.nodes().get(1)));

            assertTrue(route.getSegments().isEmpty());
            assertEquals(0.0d, route.getTotalDistanceMeters());
            assertEquals(List.of(2L), route.getNodeIds());
        }
    }

    @Nested
    @DisplayName("2. Hazards and Retries")
    class HazardTests {

        @Test
        @DisplayName("Confirmed block forces a detour")
        void testDetourAroundBlock() {
            RoutingFixtures.Network network = RoutingFixtures.grid(3, 0.0d, 0.0d, 0.01d);
            // covers the centre node and every edge touching it
            HazardZone block = zone(1L, 0.008d, 0.008d, 0.012d, 0.012d)
                    .passageStatus(PassageStatus.CONFIRMED_BLOCKED)
                    .build();
            SingleRouteRequest request = request(network.nodes().get(3), network.nodes().get(5)).toBuilder()
                    .scenarioId(SCENARIO)
                    .build();
            RouteResult route = planner(network.store(), hazardFilter(block), TIGHT_SNAP).plan(request);

            assertFalse(route.getNodeIds().contains(5L));
            assertEquals(5, route.getNodeIds().size());
            assertEquals(RiskPolicy.STRICT, route.getPolicy());
            assertEquals(1, route.getAttempts());
        }

        @Test
        @DisplayName("Unverified corridor is used after relaxing the policy")
        void testPolicyRelaxation() {
            RoutingFixtures.Network network = corridor();
            HazardZone recon = overSecondCorridorEdge()
                    .passageStatus(PassageStatus.NEEDS_RECONNAISSANCE)
                    .riskLevel(6)
                    .build();
            SingleRouteRequest request = request(network.nodes().get(0), network.nodes().get(2)).toBuilder()
                    .scenarioId(SCENARIO)
                    .build();

            RouteResult route = planner(network.store(), hazardFilter(recon), TIGHT_SNAP).plan(request);

            assertEquals(2, route.getAttempts());
            assertEquals(RiskPolicy.RELAXED, route.getPolicy());
            assertEquals(List.of(1L, 2L, 3L), route.getNodeIds());
            assertTrue(route.getWarnings().stream().anyMatch(w -> w.startsWith(SingleRoutePlanner.WARNING_POLICY_RELAXED)));
            assertTrue(route.getWarnings().contains(SingleRoutePlanner.WARNING_UNVERIFIED_ZONE));
            assertEquals(0.6d, route.getRiskScore(), 1e-12);
            assertTrue(route.getSegments().get(1).isUnverifiedHazard());
        }

        @Test
        @DisplayName("High-risk zone raises cost and warns")
        void testHighRiskWarning() {
            RoutingFixtures.Network network = corridor();
            HazardZone risky = overSecondCorridorEdge().riskLevel(9).build();
            SingleRouteRequest request = request(network.nodes().get(0), network.nodes().get(2));
            SingleRoutePlanner planner = planner(network.store(), hazardFilter(risky), TIGHT_SNAP);

            RouteResult plain = planner.plan(request);
            RouteResult exposed = planner.plan(request.toBuilder().scenarioId(SCENARIO).build());

            assertTrue(exposed.getWarnings().contains(SingleRoutePlanner.WARNING_HIGH_RISK_ZONE));
            assertEquals(0.9d, exposed.getRiskScore(), 1e-12);
            assertTrue(exposed.getTotalCost() > plain.getTotalCost());
            assertEquals(9, exposed.getSegments().get(1).getMaxRiskLevel());
        }

        @Test
        @DisplayName("Permanent block exhausts every attempt")
        void testInfeasible() {
            RoutingFixtures.Network network = corridor();
            HazardZone block = overSecondCorridorEdge().passageStatus(PassageStatus.CONFIRMED_BLOCKED).build();
            SingleRouteRequest request = request(network.nodes().get(0), network.nodes().get(2)).toBuilder()
                    .scenarioId(SCENARIO)
                    .build();

            InfeasiblePathException ex = assertThrows(InfeasiblePathException.class,
                    () -> planner(network.store(), hazardFilter(block), TIGHT_SNAP).plan(request));
            assertEquals(3, ex.getAttempts());
            assertEquals(InfeasiblePathException.REASON_CODE, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[INFEASIBLE_PATH]"));
        }

        @Test
        @DisplayName("Oversized vehicle avoids a narrow bridge")
        void testVehicleDimensions() {
            RoadNode a = node(1L, 0.00d, 0.00d);
            RoadNode b = node(2L, 0.02d, 0.00d);
            RoadNode detour = node(3L, 0.01d, 0.01d);
            RoadEdge bridge = RoutingFixtures.edgeBuilder(1L, a, b).widthMeters(2.0d).build();
            InMemoryGraphStore store = InMemoryGraphStore.of(
                    List.of(a, b, detour),
                    List.of(bridge, edge(2L, a, detour), edge(3L, detour, b)));
            VehicleCapability truck = VehicleCapability.builder().id(7L).code("TRUCK").widthMeters(2.6d).build();
            SingleRoutePlanner planner = new SingleRoutePlanner(
                    new GraphStoreLoader(store),
                    hazardFilter(),
                    CostModel.defaults(),
                    new InMemoryVehicleCapabilityProvider(List.of(truck)),
                    TIGHT_SNAP);

            RouteResult byCar = planner.plan(request(a, b));
            RouteResult byTruck = planner.plan(request(a, b).toBuilder().vehicleId(7L).build());

            assertEquals(List.of(1L, 2L), byCar.getNodeIds());
            assertEquals(List.of(1L, 3L, 2L), byTruck.getNodeIds());

            RoutingException unknown = assertThrows(RoutingException.class,
                    () -> planner.plan(request(a, b).toBuilder().vehicleId(99L).build()));
            assertEquals(SingleRoutePlanner.REASON_UNKNOWN_VEHICLE, unknown.getReasonCode());
        }
    }

    @Nested
    @DisplayName("3. Radius and Fallback")
    class FallbackTests {

        @Test
        @DisplayName("Empty store yields a flagged straight-line estimate")
        void testStraightLineEstimate() {
            GeoPoint start = GeoPoint.of(103.8537d, 31.6815d);
            GeoPoint end = GeoPoint.of(103.8720d, 31.6580d);
            RouteResult route = planner(new InMemoryGraphStore())
                    .plan(SingleRouteRequest.builder().start(start).end(end).build());

            double km = GeoDistance.greatCircleMeters(start, end) / 1000.0d;
            assertTrue(route.isEstimated());
            assertTrue(route.getWarnings().contains(RouteResult.WARNING_NO_ROAD_NETWORK));
            assertEquals(km / 40.0d * 60.0d, route.totalDurationMinutes(), 1e-9);
            assertEquals(km, route.totalDistanceKm(), 1e-9);
            assertEquals(List.of(start, end), route.getPath());
            assertTrue(route.getNodeIds().isEmpty());
            assertEquals(SingleRoutePlanner.ESTIMATE_RISK_SCORE, route.getRiskScore());
        }

        @Test
        @DisplayName("Empty initial radius escalates straight to the maximum")
        void testRadiusEscalation() {
            RoadNode a = node(1L, 0.00d, 0.02d);
            RoadNode b = node(2L, 0.01d, 0.02d);
            InMemoryGraphStore store = InMemoryGraphStore.of(List.of(a, b), List.of(edge(1L, a, b)));
            SingleRouteRequest request = SingleRouteRequest.builder()
                    .start(GeoPoint.of(0.0d, 0.0d))
                    .end(GeoPoint.of(0.01d, 0.0d))
                    .initialRadiusMeters(500.0d)
                    .build();

            RouteResult route = planner(store).plan(request);

            assertFalse(route.isEstimated());
            assertEquals(RoutingConfig.defaults().getMaxRadiusMeters(), route.getRadiusMeters());
            assertEquals(List.of(1L, 2L), route.getNodeIds());
        }

        @Test
        @DisplayName("Invalid requests are rejected")
        void testValidation() {
            SingleRoutePlanner planner = planner(new InMemoryGraphStore());
            assertThrows(NullPointerException.class,
                    () -> planner.plan(SingleRouteRequest.builder().start(GeoPoint.of(0.0d, 0.0d)).build()));
            assertThrows(IllegalArgumentException.class, () -> planner.plan(SingleRouteRequest.builder()
                    .start(GeoPoint.of(0.0d, 0.0d))
                    .end(GeoPoint.of(0.0d, 0.0d))
                    .initialRadiusMeters(-5.0d)
                    .build()));
        }
    }

    @Test
    @DisplayName("Routing configuration is read from properties")
    void testConfigFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(RoutingConfig.PROPERTY_MAX_ATTEMPTS, "5");
        properties.setProperty(RoutingConfig.PROPERTY_INITIAL_RADIUS, "1000");

        RoutingConfig config = RoutingConfig.fromProperties(properties);
        assertEquals(5, config.getMaxAttempts());
        assertEquals(1_500.0d, config.radiusForAttempt(1_000.0d, 1));
        assertEquals(config.getMaxRadiusMeters(), config.radiusForAttempt(150_000.0d, 2));

        properties.setProperty(RoutingConfig.PROPERTY_MAX_RADIUS, "10");
        assertThrows(IllegalArgumentException.class, () -> RoutingConfig.fromProperties(properties));
    }
}
