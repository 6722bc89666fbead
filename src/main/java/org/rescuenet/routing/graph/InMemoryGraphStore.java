package org.rescuenet.routing.graph;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.longs.LongCollection;
import it.unimi.dsi.fastutil.longs.LongIterator;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.geo.Geometries;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-process graph store.
 *
 * <ul>
 * <li>Concurrent readers share a read lock; commits take the write lock.</li>
 * <li>Transactions stage privately and publish atomically.</li>
 * <li>{@link #refresh(Collection, Collection)} replaces the whole network (explicit reload).</li>
 * <li>Accessible edges and all nodes sit in STRtree envelope indexes, rebuilt on refresh and commit.</li>
 * </ul>
 */
@Slf4j
public final class InMemoryGraphStore implements GraphStore {
    private static final double ENVELOPE_SLACK = 1.01d;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Long2ObjectRBTreeMap<RoadNode> nodes = new Long2ObjectRBTreeMap<>();
    private final Long2ObjectRBTreeMap<RoadEdge> edges = new Long2ObjectRBTreeMap<>();
    private final AtomicLong nextNodeId = new AtomicLong(1L);
    private final AtomicLong nextEdgeId = new AtomicLong(1L);
    private final AtomicLong version = new AtomicLong();
    private final ReentrantLock repairLock = new ReentrantLock();
    /** Guarded by the write lock; replaced, never mutated, once built. */
    private STRtree edgeIndex = new STRtree();
    private STRtree nodeIndex = new STRtree();

    public InMemoryGraphStore() {
    }

    public static InMemoryGraphStore of(Collection<RoadNode> nodes, Collection<RoadEdge> edges) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        store.refresh(nodes, edges);
        return store;
    }

    /**
     * Replaces the stored network with a fresh snapshot.
     */
    public void refresh(Collection<RoadNode> newNodes, Collection<RoadEdge> newEdges) {
        Objects.requireNonNull(newNodes, "newNodes");
        Objects.requireNonNull(newEdges, "newEdges");
        lock.writeLock().lock();
        try {
            nodes.clear();
            edges.clear();
            long maxNode = 0L;
            long maxEdge = 0L;
            for (RoadNode node : newNodes) {
                if (nodes.put(node.getId(), node) != null) {
                    throw new IllegalArgumentException("duplicate node id " + node.getId());
                }
                maxNode = Math.max(maxNode, node.getId());
            }
            for (RoadEdge edge : newEdges) {
                validateEdge(edge);
                if (edges.put(edge.getId(), edge) != null) {
                    throw new IllegalArgumentException("duplicate edge id " + edge.getId());
                }
                maxEdge = Math.max(maxEdge, edge.getId());
            }
            nextNodeId.set(maxNode + 1L);
            nextEdgeId.set(maxEdge + 1L);
            reindex();
            version.incrementAndGet();
            log.info("Graph store refreshed: {} nodes, {} edges", nodes.size(), edges.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RoadEdge> findEdgesIntersecting(Envelope area) {
        Objects.requireNonNull(area, "area");
        Geometry areaGeometry = Geometries.factory().toGeometry(area);
        lock.readLock().lock();
        try {
            @SuppressWarnings("unchecked")
            List<RoadEdge> candidates = edgeIndex.query(area);
            List<RoadEdge> result = new ArrayList<>(candidates.size());
            for (RoadEdge edge : candidates) {
                if (edge.getGeometry().intersects(areaGeometry)) {
                    result.add(edge);
                }
            }
            result.sort(Comparator.comparingLong(RoadEdge::getId));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RoadEdge> findAccessibleEdges() {
        lock.readLock().lock();
        try {
            List<RoadEdge> result = new ArrayList<>(edges.size());
            for (RoadEdge edge : edges.values()) {
                if (edge.isAccessible()) {
                    result.add(edge);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<RoadEdge> findEdge(long edgeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(edges.get(edgeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<RoadNode> findNode(long nodeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Long2ObjectMap<RoadNode> findNodes(LongCollection nodeIds) {
        Objects.requireNonNull(nodeIds, "nodeIds");
        lock.readLock().lock();
        try {
            Long2ObjectOpenHashMap<RoadNode> result = new Long2ObjectOpenHashMap<>(nodeIds.size());
            LongIterator iterator = nodeIds.iterator();
            while (iterator.hasNext()) {
                long id = iterator.nextLong();
                RoadNode node = nodes.get(id);
                if (node != null) {
                    result.put(id, node);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RoadNode> findNodesWithin(GeoPoint point, double toleranceMeters) {
        Objects.requireNonNull(point, "point");
        lock.readLock().lock();
        try {
            return nodesWithin(point, toleranceMeters);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long version() {
        return version.get();
    }

    @Override
    public GraphTransaction beginTransaction() {
        return new StagedTransaction();
    }

    @Override
    public ReentrantLock repairLock() {
        return repairLock;
    }

    public int nodeCount() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int edgeCount() {
        lock.readLock().lock();
        try {
            return edges.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<RoadNode> nodesWithin(GeoPoint point, double toleranceMeters) {
        if (!Double.isFinite(toleranceMeters) || toleranceMeters < 0.0d) {
            throw new IllegalArgumentException("toleranceMeters must be finite and >= 0, got " + toleranceMeters);
        }
        record Hit(RoadNode node, double distance) {
        }
        // planar degrees understate the great-circle reach slightly, so search a little wider
        Envelope search = GeoDistance.expandedEnvelope(List.of(point), toleranceMeters * ENVELOPE_SLACK + 1.0d);
        @SuppressWarnings("unchecked")
        List<RoadNode> candidates = nodeIndex.query(search);
        List<Hit> hits = new ArrayList<>();
        for (RoadNode node : candidates) {
            if (!node.isAccessible()) {
                continue;
            }
            double distance = GeoDistance.greatCircleMeters(point.lon(), point.lat(), node.getLon(), node.getLat());
            if (distance <= toleranceMeters) {
                hits.add(new Hit(node, distance));
            }
        }
        hits.sort(Comparator.comparingDouble(Hit::distance).thenComparingLong(hit -> hit.node().getId()));
        List<RoadNode> result = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            result.add(hit.node());
        }
        return result;
    }

    /**
     * Rebuilds both envelope indexes. Caller holds the write lock.
     */
    private void reindex() {
        STRtree edgesTree = new STRtree();
        for (RoadEdge edge : edges.values()) {
            if (edge.isAccessible()) {
                edgesTree.insert(edge.getGeometry().getEnvelopeInternal(), edge);
            }
        }
        edgesTree.build();
        STRtree nodesTree = new STRtree();
        for (RoadNode node : nodes.values()) {
            nodesTree.insert(new Envelope(node.getLon(), node.getLon(), node.getLat(), node.getLat()), node);
        }
        nodesTree.build();
        edgeIndex = edgesTree;
        nodeIndex = nodesTree;
    }

    private static void validateEdge(RoadEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (edge.getGeometry() == null || edge.getGeometry().getNumPoints() < 2) {
            throw new IllegalArgumentException("edge " + edge.getId() + " needs a line geometry with >= 2 points");
        }
        if (!Double.isFinite(edge.getLengthMeters()) || edge.getLengthMeters() < 0.0d) {
            throw new IllegalArgumentException("edge " + edge.getId() + " has invalid length " + edge.getLengthMeters());
        }
    }

    /**
     * Write-set buffered until commit.
     */
    private final class StagedTransaction implements GraphTransaction {
        private final List<RoadNode> stagedNodes = new ArrayList<>();
        private final List<RoadEdge> stagedEdges = new ArrayList<>();
        private final Map<Long, Map<String, String>> disabledEdges = new LinkedHashMap<>();
        private boolean finished;

        @Override
        public RoadNode addNode(RoadNode template) {
            ensureOpen();
            Objects.requireNonNull(template, "template");
            RoadNode node = template.toBuilder().id(nextNodeId.getAndIncrement()).build();
            stagedNodes.add(node);
            return node;
        }

        @Override
        public RoadEdge addEdge(RoadEdge template) {
            ensureOpen();
            Objects.requireNonNull(template, "template");
            RoadEdge edge = template.toBuilder().id(nextEdgeId.getAndIncrement()).build();
            validateEdge(edge);
            stagedEdges.add(edge);
            return edge;
        }

        @Override
        public void disableEdge(long edgeId, Map<String, String> provenance) {
            ensureOpen();
            disabledEdges.put(edgeId, provenance == null ? Map.of() : Map.copyOf(provenance));
        }

        @Override
        public List<RoadNode> stagedNodes() {
            return List.copyOf(stagedNodes);
        }

        @Override
        public void commit() {
            ensureOpen();
            lock.writeLock().lock();
            try {
                validateCommit();
                for (RoadNode node : stagedNodes) {
                    nodes.put(node.getId(), node);
                }
                for (RoadEdge edge : stagedEdges) {
                    edges.put(edge.getId(), edge);
                }
                for (Map.Entry<Long, Map<String, String>> entry : disabledEdges.entrySet()) {
                    RoadEdge current = edges.get(entry.getKey().longValue());
                    edges.put(current.getId(), current.toBuilder()
                            .accessible(false)
                            .properties(entry.getValue())
                            .build());
                }
                reindex();
                version.incrementAndGet();
            } finally {
                lock.writeLock().unlock();
                finished = true;
            }
        }

        @Override
        public void rollback() {
            if (finished) {
                return;
            }
            finished = true;
            if (!stagedNodes.isEmpty() || !stagedEdges.isEmpty() || !disabledEdges.isEmpty()) {
                log.debug("Rolled back transaction with {} nodes, {} edges, {} disables",
                        stagedNodes.size(), stagedEdges.size(), disabledEdges.size());
            }
        }

        @Override
        public void close() {
            rollback();
        }

        private void validateCommit() {
            for (Long edgeId : disabledEdges.keySet()) {
                RoadEdge current = edges.get(edgeId.longValue());
                if (current == null) {
                    throw new IllegalStateException("cannot disable unknown edge " + edgeId);
                }
                // a batch staged against a stale view must not split the same edge twice
                if (!current.isAccessible()) {
                    throw new IllegalStateException("edge " + edgeId + " is already disabled");
                }
            }
            for (RoadEdge edge : stagedEdges) {
                if (!nodeExists(edge.getFromNodeId()) || !nodeExists(edge.getToNodeId())) {
                    throw new IllegalStateException("edge " + edge.getId() + " references a missing node");
                }
            }
        }

        private boolean nodeExists(long nodeId) {
            if (nodes.containsKey(nodeId)) {
                return true;
            }
            for (RoadNode node : stagedNodes) {
                if (node.getId() == nodeId) {
                    return true;
                }
            }
            return false;
        }

        private void ensureOpen() {
            if (finished) {
                throw new IllegalStateException("transaction already finished");
            }
        }
    }
}
