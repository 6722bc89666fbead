package org.rescuenet.routing.core;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.rescuenet.routing.RoutingException;
import org.rescuenet.routing.cost.CostModel;
import org.rescuenet.routing.cost.EdgeCost;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.GraphEmptyException;
import org.rescuenet.routing.graph.GraphStoreLoader;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadGraph;
import org.rescuenet.routing.hazard.HazardContext;
import org.rescuenet.routing.hazard.HazardExposure;
import org.rescuenet.routing.hazard.HazardFilter;
import org.rescuenet.routing.hazard.RiskPolicy;
import org.rescuenet.routing.heuristic.GreatCircleHeuristic;
import org.rescuenet.routing.heuristic.LowerBoundModel;
import org.rescuenet.routing.vehicle.VehicleCapability;
import org.rescuenet.routing.vehicle.VehicleCapabilityProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hazard-aware single-route planner.
 *
 * <p>Each attempt loads its own subgraph, resolves hazards, costs every edge once and runs A*. A failed
 * attempt widens the radius and, from the configured attempt on, relaxes the risk policy. When the area
 * holds no road data at all, a flagged straight-line estimate is returned instead.</p>
 *
 * <p>Holds no per-call state; one instance may serve concurrent requests.</p>
 */
@Slf4j
public final class SingleRoutePlanner {
    public static final String REASON_UNKNOWN_VEHICLE = "UNKNOWN_VEHICLE";
    public static final String WARNING_POLICY_RELAXED = "risk policy relaxed to RELAXED";
    public static final String WARNING_UNVERIFIED_ZONE = "route crosses hazard zones awaiting reconnaissance";
    public static final String WARNING_HIGH_RISK_ZONE = "route crosses high-risk hazard zones";

    /** Risk score reported for straight-line estimates, which know nothing about the terrain. */
    static final double ESTIMATE_RISK_SCORE = 0.5d;
    private static final double MAX_RISK_LEVEL = 10.0d;

    private final GraphStoreLoader loader;
    private final HazardFilter hazardFilter;
    private final CostModel costModel;
    private final VehicleCapabilityProvider vehicles;
    private final RoutingConfig config;

    public SingleRoutePlanner(
            GraphStoreLoader loader,
            HazardFilter hazardFilter,
            CostModel costModel,
            VehicleCapabilityProvider vehicles,
            RoutingConfig config
    ) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.hazardFilter = Objects.requireNonNull(hazardFilter, "hazardFilter");
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.vehicles = Objects.requireNonNull(vehicles, "vehicles");
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Plans one route.
     *
     * @throws InfeasiblePathException when every attempt failed.
     * @throws RoutingException with {@link #REASON_UNKNOWN_VEHICLE} when the vehicle id is not known.
     */
    public RouteResult plan(SingleRouteRequest request) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(request.getStart(), "start");
        Objects.requireNonNull(request.getEnd(), "end");
        VehicleCapability vehicle = resolveVehicle(request);
        RiskPolicy requestedPolicy = request.getPolicy() == null ? RiskPolicy.STRICT : request.getPolicy();
        double initialRadius = request.getInitialRadiusMeters() == null
                ? config.getInitialRadiusMeters()
                : request.getInitialRadiusMeters();
        if (!Double.isFinite(initialRadius) || initialRadius <= 0.0d) {
            throw new IllegalArgumentException("initialRadiusMeters must be finite and > 0, got " + initialRadius);
        }
        List<GeoPoint> endpoints = List.of(request.getStart(), request.getEnd());

        log.info("Planning route {} -> {} vehicle={} scenario={} policy={}",
                request.getStart(), request.getEnd(), vehicle.getCode(), request.getScenarioId(), requestedPolicy);

        String lastFailure = "no attempt made";
        for (int attempt = 0; attempt < config.getMaxAttempts(); attempt++) {
            double radius = config.radiusForAttempt(initialRadius, attempt);
            RiskPolicy policy = attempt >= config.getRelaxPolicyFromAttempt() ? RiskPolicy.RELAXED : requestedPolicy;

            RoadGraph graph = loader.load(endpoints, radius);
            if (graph.isEmpty()) {
                try {
                    graph = loader.loadWithinMaximum(endpoints, radius, config.getMaxRadiusMeters());
                    radius = config.getMaxRadiusMeters();
                } catch (GraphEmptyException ex) {
                    log.warn("No road network around {} -> {}, returning straight-line estimate: {}",
                            request.getStart(), request.getEnd(), ex.getMessage());
                    return straightLineEstimate(request, vehicle, attempt + 1, requestedPolicy);
                }
            }

            AttemptResult result = attempt(graph, request, vehicle, policy);
            if (result.route != null) {
                RouteResult route = finish(result, request, requestedPolicy, policy, attempt + 1, radius);
                log.info("Route found on attempt {}: {} km, {} min, {} settled",
                        attempt + 1,
                        String.format("%.2f", route.totalDistanceKm()),
                        String.format("%.1f", route.totalDurationMinutes()),
                        route.getSettledNodes());
                return route;
            }
            lastFailure = result.failure;
            log.debug("Attempt {} failed at radius {} m under {}: {}", attempt + 1, radius, policy, lastFailure);
        }
        throw new InfeasiblePathException(
                "no feasible path from " + request.getStart() + " to " + request.getEnd()
                        + " after " + config.getMaxAttempts() + " attempt(s): " + lastFailure,
                config.getMaxAttempts());
    }

    private VehicleCapability resolveVehicle(SingleRouteRequest request) {
        if (request.getVehicle() != null) {
            return request.getVehicle();
        }
        if (request.getVehicleId() != null) {
            return vehicles.findById(request.getVehicleId())
                    .orElseThrow(() -> new RoutingException(
                            REASON_UNKNOWN_VEHICLE, "vehicle " + request.getVehicleId() + " is not known"));
        }
        return VehicleCapability.defaultVehicle();
    }

    private AttemptResult attempt(RoadGraph graph, SingleRouteRequest request, VehicleCapability vehicle, RiskPolicy policy) {
        HazardContext hazards = hazardFilter.resolve(request.getScenarioId(), policy, vehicle, graph.edges());

        EdgeCost[] edgeCosts = new EdgeCost[graph.edgeCount()];
        for (int e = 0; e < edgeCosts.length; e++) {
            RoadEdge edge = graph.edge(e);
            edgeCosts[e] = hazards.isBlocked(edge.getId())
                    ? null
                    : costModel.evaluate(edge, vehicle, hazards.exposure(edge.getId()));
        }
        double[] arcCosts = new double[graph.arcCount()];
        boolean[] hasOut = new boolean[graph.nodeCount()];
        boolean[] hasIn = new boolean[graph.nodeCount()];
        RoadGraph.ArcIterator arcs = graph.iterator();
        for (int node = 0; node < graph.nodeCount(); node++) {
            arcs.resetForNode(node);
            while (arcs.hasNext()) {
                int arc = arcs.next();
                EdgeCost cost = edgeCosts[graph.arcEdge(arc)];
                if (cost == null || !cost.isFeasible()) {
                    arcCosts[arc] = Double.POSITIVE_INFINITY;
                    continue;
                }
                arcCosts[arc] = cost.cost();
                hasOut[node] = true;
                hasIn[graph.arcTarget(arc)] = true;
            }
        }

        int source = nearestUsable(graph, request.getStart(), hasOut);
        if (source < 0) {
            return AttemptResult.failed("no usable road node within "
                    + config.getMaxSnapDistanceMeters() + " m of start " + request.getStart());
        }
        int target = nearestUsable(graph, request.getEnd(), hasIn);
        if (target < 0 && nearestUsable(graph, request.getEnd(), hasOut) == source) {
            // both points snap to a node without usable incoming arcs
            target = source;
        }
        if (target < 0) {
            return AttemptResult.failed("no usable road node within "
                    + config.getMaxSnapDistanceMeters() + " m of end " + request.getEnd());
        }

        LowerBoundModel lowerBound = LowerBoundModel.calibrate(graph, arcCosts);
        GreatCircleHeuristic heuristic = new GreatCircleHeuristic(graph, lowerBound);
        SearchOutcome outcome = AStarSearch.run(graph, arcCosts, heuristic.bindGoal(target), source, target);
        if (!outcome.reachable()) {
            return AttemptResult.failed("target unreachable after settling " + outcome.settledNodes() + " node(s)");
        }
        return AttemptResult.found(new FoundRoute(graph, hazards, edgeCosts, outcome, source));
    }

    private int nearestUsable(RoadGraph graph, GeoPoint point, boolean[] usable) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (!usable[node]) {
                continue;
            }
            double distance = GeoDistance.greatCircleMeters(point.lon(), point.lat(), graph.lon(node), graph.lat(node));
            if (distance <= config.getMaxSnapDistanceMeters() && distance < bestDistance) {
                best = node;
                bestDistance = distance;
            }
        }
        return best;
    }

    private RouteResult finish(
            AttemptResult result,
            SingleRouteRequest request,
            RiskPolicy requestedPolicy,
            RiskPolicy usedPolicy,
            int attempts,
            double radius
    ) {
        FoundRoute found = result.route;
        RoadGraph graph = found.graph;
        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .attempts(attempts)
                .radiusMeters(radius)
                .policy(usedPolicy)
                .settledNodes(found.outcome.settledNodes())
                .estimated(false);

        List<GeoPoint> path = new ArrayList<>();
        appendPoint(path, request.getStart());
        appendPoint(path, graph.node(found.sourceNode).point());
        builder.pathNodeId(graph.nodeId(found.sourceNode));

        double distance = 0.0d;
        double duration = 0.0d;
        double cost = 0.0d;
        int maxRisk = 0;
        boolean unverified = false;
        boolean highRisk = false;
        for (int arc : found.outcome.arcPath()) {
            int edgeIndex = graph.arcEdge(arc);
            RoadEdge edge = graph.edge(edgeIndex);
            EdgeCost edgeCost = found.edgeCosts[edgeIndex];
            HazardExposure exposure = found.hazards.exposure(edge.getId());
            int target = graph.arcTarget(arc);
            long fromId = graph.arcReversed(arc) ? edge.getToNodeId() : edge.getFromNodeId();
            builder.segment(RouteSegment.builder()
                    .edgeId(edge.getId())
                    .fromNodeId(fromId)
                    .toNodeId(graph.nodeId(target))
                    .distanceMeters(edge.getLengthMeters())
                    .durationSeconds(edgeCost.etaSeconds())
                    .speedKmh(edgeCost.speedKmh())
                    .cost(edgeCost.cost())
                    .roadClass(edge.getRoadClass())
                    .terrainType(edge.getTerrainType())
                    .maxRiskLevel(exposure.maxRiskLevel())
                    .unverifiedHazard(exposure.unverified())
                    .build());
            builder.pathNodeId(graph.nodeId(target));
            LineString geometry = graph.arcGeometry(arc);
            for (Coordinate coordinate : geometry.getCoordinates()) {
                appendPoint(path, GeoPoint.of(coordinate));
            }
            distance += edge.getLengthMeters();
            duration += edgeCost.etaSeconds();
            cost += edgeCost.cost();
            maxRisk = Math.max(maxRisk, exposure.maxRiskLevel());
            unverified |= exposure.unverified();
            highRisk |= exposure.maxRiskLevel() > costModel.config().getRiskThreshold();
        }
        appendPoint(path, request.getEnd());

        if (usedPolicy != requestedPolicy) {
            builder.warning(WARNING_POLICY_RELAXED + " after " + (attempts - 1) + " failed attempt(s)");
        }
        if (unverified) {
            builder.warning(WARNING_UNVERIFIED_ZONE);
        }
        if (highRisk) {
            builder.warning(WARNING_HIGH_RISK_ZONE);
        }
        return builder
                .path(path)
                .totalDistanceMeters(distance)
                .totalDurationSeconds(duration)
                .totalCost(cost)
                .riskScore(maxRisk / MAX_RISK_LEVEL)
                .build();
    }

    private RouteResult straightLineEstimate(
            SingleRouteRequest request,
            VehicleCapability vehicle,
            int attempts,
            RiskPolicy policy
    ) {
        double distance = GeoDistance.greatCircleMeters(request.getStart(), request.getEnd());
        double speedKmh = vehicle.getMaxSpeedKmh() > 0.0d ? vehicle.getMaxSpeedKmh() : config.getFallbackSpeedKmh();
        double durationSeconds = distance / (speedKmh / 3.6d);
        return RouteResult.builder()
                .pathPoint(request.getStart())
                .pathPoint(request.getEnd())
                .totalDistanceMeters(distance)
                .totalDurationSeconds(durationSeconds)
                .totalCost(durationSeconds)
                .riskScore(ESTIMATE_RISK_SCORE)
                .warning(RouteResult.WARNING_NO_ROAD_NETWORK)
                .estimated(true)
                .attempts(attempts)
                .radiusMeters(config.getMaxRadiusMeters())
                .policy(policy)
                .settledNodes(0)
                .build();
    }

    private static void appendPoint(List<GeoPoint> path, GeoPoint point) {
        if (path.isEmpty() || !path.get(path.size() - 1).equals(point)) {
            path.add(point);
        }
    }

    private static final class FoundRoute {
        private final RoadGraph graph;
        private final HazardContext hazards;
        private final EdgeCost[] edgeCosts;
        private final SearchOutcome outcome;
        private final int sourceNode;

        private FoundRoute(RoadGraph graph, HazardContext hazards, EdgeCost[] edgeCosts, SearchOutcome outcome, int sourceNode) {
            this.graph = graph;
            this.hazards = hazards;
            this.edgeCosts = edgeCosts;
            this.outcome = outcome;
            this.sourceNode = sourceNode;
        }
    }

    private static final class AttemptResult {
        private final FoundRoute route;
        private final String failure;

        private AttemptResult(FoundRoute route, String failure) {
            this.route = route;
            this.failure = failure;
        }

        static AttemptResult found(FoundRoute route) {
            return new AttemptResult(route, null);
        }

        static AttemptResult failed(String failure) {
            return new AttemptResult(null, failure);
        }
    }
}
