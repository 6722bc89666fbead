package org.rescuenet.routing.graph;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongRBTreeSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.locationtech.jts.geom.LineString;
import org.rescuenet.core.id.IDMapper;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable arena for one loaded subgraph.
 *
 * <p>Layout:</p>
 * <ul>
 * <li>Nodes get dense indices in ascending persisted-id order, so index comparisons equal id comparisons.</li>
 * <li>Edges are kept in ascending persisted-id order.</li>
 * <li>Adjacency is CSR: {@code firstArc[node]..firstArc[node+1]} lists outgoing arcs, each arc pointing at an
 * edge index and flagged when it runs against the edge geometry. Arcs of a node are ordered by edge id.</li>
 * </ul>
 *
 * <p>Only traversable edges are admitted: accessible edges whose endpoints are both present and accessible.
 * Non-oneway edges produce one arc per direction.</p>
 */
public final class RoadGraph {
    private static final RoadGraph EMPTY = build(List.of(), List.of());

    private final IDMapper nodeIds;
    private final RoadNode[] nodes;
    private final RoadEdge[] edges;
    private final int[] firstArc;
    private final int[] arcTarget;
    private final int[] arcEdge;
    private final boolean[] arcReversed;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    @Getter
    @Accessors(fluent = true)
    private final int arcCount;

    private RoadGraph(
            IDMapper nodeIds,
            RoadNode[] nodes,
            RoadEdge[] edges,
            int[] firstArc,
            int[] arcTarget,
            int[] arcEdge,
            boolean[] arcReversed
    ) {
        this.nodeIds = nodeIds;
        this.nodes = nodes;
        this.edges = edges;
        this.firstArc = firstArc;
        this.arcTarget = arcTarget;
        this.arcEdge = arcEdge;
        this.arcReversed = arcReversed;
        this.nodeCount = nodes.length;
        this.edgeCount = edges.length;
        this.arcCount = arcTarget.length;
    }

    public static RoadGraph empty() {
        return EMPTY;
    }

    /**
     * Builds an arena from raw store rows. Non-traversable edges and nodes not touched by any
     * traversable edge are dropped.
     */
    public static RoadGraph build(Collection<RoadNode> nodeRows, Collection<RoadEdge> edgeRows) {
        Long2ObjectOpenHashMap<RoadNode> nodeById = new Long2ObjectOpenHashMap<>(nodeRows.size());
        for (RoadNode node : nodeRows) {
            nodeById.put(node.getId(), node);
        }

        List<RoadEdge> kept = new ArrayList<>(edgeRows.size());
        LongRBTreeSet usedNodeIds = new LongRBTreeSet();
        for (RoadEdge edge : edgeRows) {
            if (!isTraversable(edge, nodeById)) {
                continue;
            }
            kept.add(edge);
            usedNodeIds.add(edge.getFromNodeId());
            usedNodeIds.add(edge.getToNodeId());
        }
        kept.sort(Comparator.comparingLong(RoadEdge::getId));

        IDMapper mapper = IDMapper.sortedOf(usedNodeIds.toLongArray());
        RoadNode[] nodes = new RoadNode[mapper.size()];
        for (int i = 0; i < nodes.length; i++) {
            nodes[i] = nodeById.get(mapper.toExternal(i));
        }
        RoadEdge[] edges = kept.toArray(new RoadEdge[0]);

        // counting sort of arcs by source node; edge order is preserved inside each bucket
        int[] firstArc = new int[nodes.length + 1];
        for (RoadEdge edge : edges) {
            firstArc[mapper.toInternal(edge.getFromNodeId()) + 1]++;
            if (!edge.isOneway()) {
                firstArc[mapper.toInternal(edge.getToNodeId()) + 1]++;
            }
        }
        for (int i = 0; i < nodes.length; i++) {
            firstArc[i + 1] += firstArc[i];
        }
        int arcTotal = firstArc[nodes.length];
        int[] arcTarget = new int[arcTotal];
        int[] arcEdge = new int[arcTotal];
        boolean[] arcReversed = new boolean[arcTotal];
        int[] cursor = firstArc.clone();
        for (int e = 0; e < edges.length; e++) {
            RoadEdge edge = edges[e];
            int from = mapper.toInternal(edge.getFromNodeId());
            int to = mapper.toInternal(edge.getToNodeId());
            int slot = cursor[from]++;
            arcTarget[slot] = to;
            arcEdge[slot] = e;
            if (!edge.isOneway()) {
                slot = cursor[to]++;
                arcTarget[slot] = from;
                arcEdge[slot] = e;
                arcReversed[slot] = true;
            }
        }
        return new RoadGraph(mapper, nodes, edges, firstArc, arcTarget, arcEdge, arcReversed);
    }

    private static boolean isTraversable(RoadEdge edge, Long2ObjectMap<RoadNode> nodeById) {
        if (!edge.isAccessible()) {
            return false;
        }
        RoadNode from = nodeById.get(edge.getFromNodeId());
        RoadNode to = nodeById.get(edge.getToNodeId());
        return from != null && to != null && from.isAccessible() && to.isAccessible();
    }

    public boolean isEmpty() {
        return edgeCount == 0;
    }

    /**
     * Returns the dense index of a persisted node id, or {@code -1} when the node is not part of this subgraph.
     */
    public int nodeIndex(long nodeId) {
        return nodeIds.containsExternal(nodeId) ? nodeIds.toInternal(nodeId) : -1;
    }

    public long nodeId(int nodeIndex) {
        return nodeIds.toExternal(nodeIndex);
    }

    public RoadNode node(int nodeIndex) {
        return nodes[nodeIndex];
    }

    public double lon(int nodeIndex) {
        return nodes[nodeIndex].getLon();
    }

    public double lat(int nodeIndex) {
        return nodes[nodeIndex].getLat();
    }

    public RoadEdge edge(int edgeIndex) {
        return edges[edgeIndex];
    }

    public List<RoadEdge> edges() {
        return List.of(edges);
    }

    public int arcTarget(int arc) {
        return arcTarget[arc];
    }

    public int arcEdge(int arc) {
        return arcEdge[arc];
    }

    /**
     * True when the arc traverses its edge from {@code toNodeId} to {@code fromNodeId}.
     */
    public boolean arcReversed(int arc) {
        return arcReversed[arc];
    }

    /**
     * Edge geometry oriented along the arc direction.
     */
    public LineString arcGeometry(int arc) {
        LineString geometry = edges[arcEdge[arc]].getGeometry();
        return arcReversed[arc] ? (LineString) geometry.reverse() : geometry;
    }

    public int degree(int nodeIndex) {
        return firstArc[nodeIndex + 1] - firstArc[nodeIndex];
    }

    /**
     * Nearest node within {@code maxDistanceMeters}, smallest id on ties; {@code -1} when none qualifies.
     */
    public int nearestNode(GeoPoint point, double maxDistanceMeters) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < nodes.length; i++) {
            double distance = GeoDistance.greatCircleMeters(point.lon(), point.lat(), nodes[i].getLon(), nodes[i].getLat());
            if (distance <= maxDistanceMeters && distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }

    public ArcIterator iterator() {
        return new ArcIterator(this);
    }

    @Override
    public String toString() {
        return String.format("RoadGraph[nodes=%d, edges=%d, arcs=%d]", nodeCount, edgeCount, arcCount);
    }

    /**
     * Reusable outgoing-arc cursor.
     */
    public static final class ArcIterator {
        private final RoadGraph graph;
        private int current;
        private int end;

        ArcIterator(RoadGraph graph) {
            this.graph = graph;
        }

        public ArcIterator resetForNode(int nodeIndex) {
            this.current = graph.firstArc[nodeIndex];
            this.end = graph.firstArc[nodeIndex + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            return current++;
        }
    }
}
