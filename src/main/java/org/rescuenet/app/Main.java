package org.rescuenet.app;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.LineString;
import org.rescuenet.routing.core.RescueRoutingService;
import org.rescuenet.routing.core.RouteResult;
import org.rescuenet.routing.core.RoutingConfig;
import org.rescuenet.routing.core.SingleRouteRequest;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.geo.Geometries;
import org.rescuenet.routing.graph.InMemoryGraphStore;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;
import org.rescuenet.routing.hazard.InMemoryHazardZoneProvider;
import org.rescuenet.routing.topology.ConnectivityReport;
import org.rescuenet.routing.topology.RepairConfig;
import org.rescuenet.routing.topology.RepairStats;
import org.rescuenet.routing.vehicle.InMemoryVehicleCapabilityProvider;
import org.rescuenet.routing.vehicle.VehicleCapability;
import org.rescuenet.routing.vrp.VrpConstraints;
import org.rescuenet.routing.vrp.VrpDepot;
import org.rescuenet.routing.vrp.VrpProblem;
import org.rescuenet.routing.vrp.VrpSolution;
import org.rescuenet.routing.vrp.VrpTask;
import org.rescuenet.routing.vrp.VrpVehicle;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Properties;

/**
 * Smoke run over a small synthetic network: repair, route, estimate and fleet plan.
 */
@Slf4j
public class Main {
    private static final String CONFIG_RESOURCE = "rescuenet.properties";

    /**
     * Launches the smoke run.
     *
     * @param args command-line arguments, unused.
     */
    public static void main(String[] args) {
        Properties properties = loadProperties();
        InMemoryGraphStore store = InMemoryGraphStore.of(demoNodes(), demoEdges());
        RepairConfig repairConfig = RepairConfig.fromProperties(properties);
        RescueRoutingService service = RescueRoutingService.builder()
                .graphStore(store)
                .hazardZones(new InMemoryHazardZoneProvider())
                .vehicles(new InMemoryVehicleCapabilityProvider(List.of(VehicleCapability.defaultVehicle())))
                .routingConfig(RoutingConfig.fromProperties(properties))
                .repairConfig(repairConfig)
                .build();

        ConnectivityReport before = service.verifyConnectivity(null);
        log.info("Before repair: {} components over {} nodes", before.getComponentCount(), before.getNodeCount());
        RepairStats repair = service.repairTopology(repairConfig.getBatchSize(), repairConfig.getMaxBatches(), false);
        log.info("Repair: {} crossings, {} nodes created, {} edges created, {} edges disabled",
                repair.getIntersectionsFound(), repair.getNodesCreated(), repair.getEdgesCreated(), repair.getEdgesDisabled());

        RouteResult route = service.planSingleRoute(SingleRouteRequest.builder()
                .start(GeoPoint.of(103.850d, 31.670d))
                .end(GeoPoint.of(103.880d, 31.670d))
                .build());
        log.info("Route: {} km, {} min, {} segments, warnings {}",
                String.format("%.2f", route.totalDistanceKm()), String.format("%.1f", route.totalDurationMinutes()),
                route.getSegments().size(), route.getWarnings());

        RouteResult estimate = service.planSingleRoute(SingleRouteRequest.builder()
                .start(GeoPoint.of(110.0d, 20.0d))
                .end(GeoPoint.of(110.05d, 20.05d))
                .build());
        log.info("Estimate: {} km, {} min, estimated={}, warnings {}",
                String.format("%.2f", estimate.totalDistanceKm()), String.format("%.1f", estimate.totalDurationMinutes()),
                estimate.isEstimated(), estimate.getWarnings());

        VrpSolution fleet = service.planMultiVehicle(VrpProblem.builder()
                .depot(VrpDepot.builder().id("depot").name("staging area").location(GeoPoint.of(103.850d, 31.670d)).build())
                .task(VrpTask.builder().id("t1").location(GeoPoint.of(103.870d, 31.690d)).priority(3).build())
                .task(VrpTask.builder().id("t2").location(GeoPoint.of(103.850d, 31.690d)).build())
                .task(VrpTask.builder().id("t3").location(GeoPoint.of(103.880d, 31.670d)).demand(2).build())
                .task(VrpTask.builder().id("t4").location(GeoPoint.of(103.880d, 31.690d)).priority(2).build())
                .vehicle(VrpVehicle.builder().id("truck-1").depotId("depot").capacity(3).build())
                .vehicle(VrpVehicle.builder().id("truck-2").depotId("depot").capacity(3).build())
                .constraints(VrpConstraints.fromProperties(properties))
                .build());
        log.info("Fleet plan: {}/{} tasks served, {} vehicles used, {} km",
                fleet.getServedTasks(), fleet.getTotalTasks(), fleet.getVehiclesUsed(),
                String.format("%.2f", fleet.getTotalDistanceKm()));
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read " + CONFIG_RESOURCE, ex);
        }
        return properties;
    }

    private static List<RoadNode> demoNodes() {
        return List.of(
                node(1L, 103.850d, 31.670d),
                node(2L, 103.870d, 31.690d),
                node(3L, 103.850d, 31.690d),
                node(4L, 103.870d, 31.670d),
                node(5L, 103.880d, 31.690d),
                node(6L, 103.880d, 31.670d));
    }

    private static List<RoadEdge> demoEdges() {
        return List.of(
                edge(1L, 1L, 2L, 103.850d, 31.670d, 103.870d, 31.690d),
                edge(2L, 3L, 4L, 103.850d, 31.690d, 103.870d, 31.670d),
                edge(3L, 2L, 5L, 103.870d, 31.690d, 103.880d, 31.690d),
                edge(4L, 4L, 6L, 103.870d, 31.670d, 103.880d, 31.670d),
                edge(5L, 5L, 6L, 103.880d, 31.690d, 103.880d, 31.670d));
    }

    private static RoadNode node(long id, double lon, double lat) {
        return RoadNode.builder().id(id).lon(lon).lat(lat).build();
    }

    private static RoadEdge edge(long id, long from, long to, double... lonLat) {
        LineString geometry = Geometries.line(lonLat);
        return RoadEdge.builder()
                .id(id)
                .fromNodeId(from)
                .toNodeId(to)
                .geometry(geometry)
                .roadClass("secondary")
                .lengthMeters(GeoDistance.lineLengthMeters(geometry))
                .build();
    }
}
