package org.rescuenet.routing.graph;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Loads radius-bounded subgraphs from a {@link GraphStore}.
 *
 * <p>Each call reads fresh rows and builds a private {@link RoadGraph}; nothing is cached between calls.</p>
 */
@Slf4j
public final class GraphStoreLoader {
    private final GraphStore store;

    public GraphStoreLoader(GraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Loads every traversable edge intersecting the envelope of {@code points} grown by
     * {@code radiusMeters}, together with its endpoint nodes.
     *
     * @return loaded subgraph, possibly empty.
     */
    public RoadGraph load(Collection<GeoPoint> points, double radiusMeters) {
        Envelope area = GeoDistance.expandedEnvelope(points, radiusMeters);
        List<RoadEdge> edges = store.findEdgesIntersecting(area);
        if (edges.isEmpty()) {
            log.debug("No edges within {} m of {} point(s)", radiusMeters, points.size());
            return RoadGraph.empty();
        }
        LongOpenHashSet nodeIds = new LongOpenHashSet(edges.size() * 2);
        for (RoadEdge edge : edges) {
            nodeIds.add(edge.getFromNodeId());
            nodeIds.add(edge.getToNodeId());
        }
        Long2ObjectMap<RoadNode> nodes = store.findNodes(nodeIds);
        RoadGraph graph = RoadGraph.build(nodes.values(), edges);
        log.debug("Loaded {} within {} m", graph, radiusMeters);
        return graph;
    }

    /**
     * Loads at {@code radiusMeters} and, when that yields nothing, once more at {@code maxRadiusMeters}.
     *
     * @throws GraphEmptyException when the maximum radius still holds no traversable edge.
     */
    public RoadGraph loadWithinMaximum(Collection<GeoPoint> points, double radiusMeters, double maxRadiusMeters) {
        if (maxRadiusMeters < radiusMeters) {
            throw new IllegalArgumentException("maxRadiusMeters must be >= radiusMeters");
        }
        RoadGraph graph = load(points, radiusMeters);
        if (graph.isEmpty() && maxRadiusMeters > radiusMeters) {
            graph = load(points, maxRadiusMeters);
        }
        if (graph.isEmpty()) {
            throw new GraphEmptyException("no traversable road edges within " + maxRadiusMeters + " m of " + points);
        }
        return graph;
    }
}
