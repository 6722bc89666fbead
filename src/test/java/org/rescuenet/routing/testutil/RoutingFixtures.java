package org.rescuenet.routing.testutil;

import org.locationtech.jts.geom.LineString;
import org.rescuenet.routing.core.RoutingConfig;
import org.rescuenet.routing.core.SingleRoutePlanner;
import org.rescuenet.routing.cost.CostModel;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.Geometries;
import org.rescuenet.routing.graph.GraphStore;
import org.rescuenet.routing.graph.GraphStoreLoader;
import org.rescuenet.routing.graph.InMemoryGraphStore;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;
import org.rescuenet.routing.hazard.HazardFilter;
import org.rescuenet.routing.hazard.HazardZone;
import org.rescuenet.routing.hazard.HazardZoneProvider;
import org.rescuenet.routing.hazard.InMemoryHazardZoneProvider;
import org.rescuenet.routing.hazard.PassageStatus;
import org.rescuenet.routing.vehicle.InMemoryVehicleCapabilityProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared test fixture factory for routing tests.
 */
public final class RoutingFixtures {
    /** Instant all hazard fixtures are evaluated at. */
    public static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final String SCENARIO = "quake-2024";

    private RoutingFixtures() {
    }

    /**
     * Node and edge rows of a test network.
     */
    public record Network(List<RoadNode> nodes, List<RoadEdge> edges) {
        public InMemoryGraphStore store() {
            return InMemoryGraphStore.of(nodes, edges);
        }
    }

    public static RoadNode node(long id, double lon, double lat) {
        return RoadNode.builder()
                .id(id)
                .lon(lon)
                .lat(lat)
                .build();
    }

    /**
     * Straight two-way secondary road between two nodes, length from the geometry.
     */
    public static RoadEdge edge(long id, RoadNode from, RoadNode to) {
        return edgeBuilder(id, from, to).build();
    }

    public static RoadEdge.RoadEdgeBuilder edgeBuilder(long id, RoadNode from, RoadNode to) {
        LineString geometry = Geometries.line(from.getLon(), from.getLat(), to.getLon(), to.getLat());
        return RoadEdge.builder()
                .id(id)
                .fromNodeId(from.getId())
                .toNodeId(to.getId())
                .geometry(geometry)
                .roadClass("secondary")
                .lengthMeters(GeoDistance.lineLengthMeters(geometry));
    }

    /**
     * Square grid of {@code size x size} nodes spaced {@code stepDegrees} apart, ids row-major from 1.
     * Horizontal and vertical neighbours are joined by two-way edges.
     */
    public static Network grid(int size, double originLon, double originLat, double stepDegrees) {
        List<RoadNode> nodes = new ArrayList<>(size * size);
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                nodes.add(node(row * size + col + 1L, originLon + col * stepDegrees, originLat + row * stepDegrees));
            }
        }
        List<RoadEdge> edges = new ArrayList<>();
        long edgeId = 1L;
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                RoadNode here = nodes.get(row * size + col);
                if (col + 1 < size) {
                    edges.add(edge(edgeId++, here, nodes.get(row * size + col + 1)));
                }
                if (row + 1 < size) {
                    edges.add(edge(edgeId++, here, nodes.get((row + 1) * size + col)));
                }
            }
        }
        return new Network(nodes, edges);
    }

    /**
     * Grid whose edges get random road classes and speed limits, seeded for repeatability.
     */
    public static Network randomizedGrid(int size, long seed) {
        String[] classes = {"primary", "secondary", "tertiary", "residential", "track"};
        Random random = new Random(seed);
        Network base = grid(size, 103.80d, 31.60d, 0.01d);
        List<RoadEdge> edges = new ArrayList<>(base.edges().size());
        for (RoadEdge edge : base.edges()) {
            RoadEdge.RoadEdgeBuilder builder = edge.toBuilder()
                    .roadClass(classes[random.nextInt(classes.length)])
                    .oneway(random.nextInt(6) == 0);
            if (random.nextBoolean()) {
                builder.maxSpeedKmh(20.0d + random.nextInt(80));
            }
            edges.add(builder.build());
        }
        return new Network(base.nodes(), edges);
    }

    /**
     * Two diagonals of the square (0,0)-(2,2) crossing at (1,1) without a shared node.
     */
    public static Network crossingPair() {
        RoadNode a1 = node(1L, 0.0d, 0.0d);
        RoadNode a2 = node(2L, 2.0d, 2.0d);
        RoadNode b1 = node(3L, 0.0d, 2.0d);
        RoadNode b2 = node(4L, 2.0d, 0.0d);
        return new Network(
                List.of(a1, a2, b1, b2),
                List.of(edge(1L, a1, a2), edge(2L, b1, b2))
        );
    }

    public static HazardZone.HazardZoneBuilder zone(long id, double minLon, double minLat, double maxLon, double maxLat) {
        return HazardZone.builder()
                .id(id)
                .scenarioId(SCENARIO)
                .area(Geometries.rectangle(minLon, minLat, maxLon, maxLat))
                .riskLevel(5)
                .passageStatus(PassageStatus.PASSABLE_WITH_CAUTION);
    }

    public static HazardFilter hazardFilter(HazardZone... zones) {
        return new HazardFilter(new InMemoryHazardZoneProvider(List.of(zones)), FIXED_CLOCK);
    }

    public static HazardFilter hazardFilter(HazardZoneProvider provider) {
        return new HazardFilter(provider, FIXED_CLOCK);
    }

    public static SingleRoutePlanner planner(GraphStore store, HazardFilter hazardFilter, RoutingConfig config) {
        return new SingleRoutePlanner(
                new GraphStoreLoader(store),
                hazardFilter,
                CostModel.defaults(),
                new InMemoryVehicleCapabilityProvider(List.of()),
                config
        );
    }

    public static SingleRoutePlanner planner(GraphStore store, HazardZone... zones) {
        return planner(store, hazardFilter(zones), RoutingConfig.defaults());
    }
}
