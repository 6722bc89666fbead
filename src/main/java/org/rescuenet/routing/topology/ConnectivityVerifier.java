package org.rescuenet.routing.topology;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.rescuenet.routing.graph.GraphStore;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;
import org.rescuenet.routing.hazard.HazardContext;
import org.rescuenet.routing.hazard.HazardFilter;
import org.rescuenet.routing.hazard.RiskPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Counts connected components of the accessible road network.
 *
 * <p>An edge counts only when it and both of its end nodes are accessible, the same rule the route
 * planner applies when it loads a graph.</p>
 */
@Slf4j
public class ConnectivityVerifier {
    private final GraphStore store;
    private final HazardFilter hazardFilter;

    /**
     * @param store graph to inspect.
     * @param hazardFilter used for scenario-scoped checks, may be {@code null}.
     */
    public ConnectivityVerifier(GraphStore store, HazardFilter hazardFilter) {
        this.store = Objects.requireNonNull(store, "store");
        this.hazardFilter = hazardFilter;
    }

    public ConnectivityReport verify() {
        return verify(null);
    }

    /**
     * Computes components over accessible edges. With a scenario, edges blocked under
     * {@link RiskPolicy#STRICT} are left out.
     *
     * @param scenarioId hazard scenario or {@code null}.
     */
    public ConnectivityReport verify(String scenarioId) {
        List<RoadEdge> edges = withAccessibleEnds(store.findAccessibleEdges());
        if (scenarioId != null) {
            if (hazardFilter == null) {
                throw new IllegalStateException("scenario connectivity requires a hazard filter");
            }
            HazardContext hazards = hazardFilter.resolve(scenarioId, RiskPolicy.STRICT, null, edges);
            List<RoadEdge> open = new ArrayList<>(edges.size());
            for (RoadEdge edge : edges) {
                if (!hazards.isBlocked(edge.getId())) {
                    open.add(edge);
                }
            }
            edges = open;
        }

        Long2IntOpenHashMap index = new Long2IntOpenHashMap(edges.size() * 2);
        index.defaultReturnValue(-1);
        for (RoadEdge edge : edges) {
            index.putIfAbsent(edge.getFromNodeId(), index.size());
            index.putIfAbsent(edge.getToNodeId(), index.size());
        }
        DisjointSets sets = new DisjointSets(index.size());
        for (RoadEdge edge : edges) {
            sets.union(index.get(edge.getFromNodeId()), index.get(edge.getToNodeId()));
        }

        int nodes = index.size();
        int largest = sets.largest();
        ConnectivityReport report = ConnectivityReport.builder()
                .nodeCount(nodes)
                .edgeCount(edges.size())
                .componentCount(sets.components())
                .largestComponentSize(largest)
                .largestComponentFraction(nodes == 0 ? 0.0d : (double) largest / nodes)
                .scenarioId(scenarioId)
                .build();
        log.debug("Connectivity: {} components over {} nodes, largest {}", report.getComponentCount(), nodes, largest);
        return report;
    }

    private List<RoadEdge> withAccessibleEnds(List<RoadEdge> edges) {
        LongOpenHashSet nodeIds = new LongOpenHashSet(edges.size() * 2);
        for (RoadEdge edge : edges) {
            nodeIds.add(edge.getFromNodeId());
            nodeIds.add(edge.getToNodeId());
        }
        Long2ObjectMap<RoadNode> nodes = store.findNodes(nodeIds);
        List<RoadEdge> kept = new ArrayList<>(edges.size());
        for (RoadEdge edge : edges) {
            RoadNode from = nodes.get(edge.getFromNodeId());
            RoadNode to = nodes.get(edge.getToNodeId());
            if (from != null && to != null && from.isAccessible() && to.isAccessible()) {
                kept.add(edge);
            }
        }
        return kept;
    }
}
