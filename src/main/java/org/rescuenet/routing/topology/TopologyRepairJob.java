package org.rescuenet.routing.topology;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;
import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.GraphProperties;
import org.rescuenet.routing.graph.GraphStore;
import org.rescuenet.routing.graph.GraphTransaction;
import org.rescuenet.routing.graph.NodeType;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Offline job that gives crossing roads a shared node.
 *
 * <p>Each batch detects crossings, creates or reuses an intersection node per crossing point, splits
 * both edges there and disables the originals, all inside one {@link GraphTransaction}. A failing batch
 * is rolled back and halts the run; counts of earlier committed batches are still reported. Batches
 * repeat until none finds a crossing or the batch limit is reached, so a second run on a repaired graph
 * changes nothing.</p>
 *
 * <p>Only one run per store may be active, whichever job starts it. Planners may keep reading the
 * store meanwhile and see whole batches or nothing of them.</p>
 */
@Slf4j
public class TopologyRepairJob {
    /** Degree recorded on a materialized crossing node. */
    private static final int CROSSING_NODE_EDGE_COUNT = 4;

    private final GraphStore store;
    private final ConnectivityVerifier verifier;
    private final RepairConfig config;

    public TopologyRepairJob(GraphStore store, RepairConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.verifier = new ConnectivityVerifier(store, null);
    }

    public RepairConfig config() {
        return config;
    }

    /**
     * Runs with the configured batch size and batch limit.
     */
    public RepairStats run(boolean dryRun) {
        return run(config.getBatchSize(), config.getMaxBatches(), dryRun);
    }

    /**
     * Repairs crossings in batches.
     *
     * @param batchSize maximum crossings repaired per batch.
     * @param maxBatches maximum number of batches.
     * @param dryRun only count crossings and report connectivity.
     * @return run statistics.
     * @throws RepairAlreadyRunningException when another run is active on the same store.
     */
    public RepairStats run(int batchSize, int maxBatches, boolean dryRun) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        }
        if (maxBatches <= 0) {
            throw new IllegalArgumentException("maxBatches must be > 0, got " + maxBatches);
        }
        ReentrantLock runLock = store.repairLock();
        if (runLock.isHeldByCurrentThread() || !runLock.tryLock()) {
            throw new RepairAlreadyRunningException("a topology repair run is already active on this store");
        }
        try {
            return runLocked(batchSize, maxBatches, dryRun);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Whether any repair run, from this job or another one, is active on the store.
     */
    public boolean isRunning() {
        return store.repairLock().isLocked();
    }

    private RepairStats runLocked(int batchSize, int maxBatches, boolean dryRun) {
        long started = System.nanoTime();
        ConnectivityReport before = verifier.verify();
        int pending = CrossingDetector.countAll(store.findAccessibleEdges());
        log.info("Topology repair {}: {} crossing(s), {} component(s), largest {}%",
                dryRun ? "dry run" : "start", pending, before.getComponentCount(),
                String.format("%.1f", before.largestComponentPercent()));
        RepairStats.RepairStatsBuilder stats = RepairStats.builder()
                .dryRun(dryRun)
                .connectivityBefore(before);
        if (dryRun) {
            return stats.intersectionsFound(pending)
                    .remainingIntersections(pending)
                    .elapsedMillis(elapsedMillis(started))
                    .build();
        }

        BatchResult total = BatchResult.EMPTY;
        int committed = 0;
        String failure = null;
        for (int batch = 1; batch <= maxBatches; batch++) {
            List<EdgeCrossing> crossings = CrossingDetector.detectBatch(store.findAccessibleEdges(), batchSize);
            if (crossings.isEmpty()) {
                log.debug("Batch {}: no crossings left", batch);
                break;
            }
            try {
                BatchResult result = repairBatch(crossings);
                total = total.plus(result);
                committed++;
                log.debug("Batch {} committed: {} crossings, {} nodes created, {} reused, {} edges created, {} disabled",
                        batch, result.crossings, result.nodesCreated, result.nodesReused,
                        result.edgesCreated, result.edgesDisabled);
            } catch (RuntimeException ex) {
                failure = "batch " + batch + " rolled back: " + ex.getMessage();
                log.warn("Topology repair halted, {}", failure, ex);
                break;
            }
        }

        ConnectivityReport after = verifier.verify();
        int remaining = CrossingDetector.countAll(store.findAccessibleEdges());
        log.info("Topology repair done: {} batch(es), {} crossing(s) repaired, components {} -> {}, largest {}% -> {}%",
                committed, total.crossings, before.getComponentCount(), after.getComponentCount(),
                String.format("%.1f", before.largestComponentPercent()),
                String.format("%.1f", after.largestComponentPercent()));
        return stats.batchesCommitted(committed)
                .intersectionsFound(total.crossings)
                .nodesCreated(total.nodesCreated)
                .nodesReused(total.nodesReused)
                .edgesCreated(total.edgesCreated)
                .edgesDisabled(total.edgesDisabled)
                .remainingIntersections(remaining)
                .connectivityAfter(after)
                .failure(failure)
                .elapsedMillis(elapsedMillis(started))
                .build();
    }

    private BatchResult repairBatch(List<EdgeCrossing> crossings) {
        int nodesCreated = 0;
        int nodesReused = 0;
        int edgesCreated = 0;
        int edgesDisabled = 0;
        try (GraphTransaction tx = store.beginTransaction()) {
            for (EdgeCrossing crossing : crossings) {
                GeoPoint point = crossing.point();
                RoadNode node;
                if (hasNodeWithin(tx, point, config.getSnapToleranceMeters())) {
                    node = nearestNode(tx, point, config.getAssociateToleranceMeters());
                    nodesReused++;
                } else {
                    node = tx.addNode(RoadNode.builder()
                            .lon(point.lon())
                            .lat(point.lat())
                            .nodeType(NodeType.INTERSECTION)
                            .edgeCount(CROSSING_NODE_EDGE_COUNT)
                            .property(GraphProperties.SOURCE, GraphProperties.SOURCE_TOPOLOGY_REPAIR)
                            .build());
                    nodesCreated++;
                }
                if (node == null) {
                    throw new TopologyRepairException("no node within "
                            + config.getAssociateToleranceMeters() + " m of crossing at " + point);
                }
                for (RoadEdge edge : List.of(crossing.first(), crossing.second())) {
                    if (edge.getFromNodeId() == node.getId() || edge.getToNodeId() == node.getId()) {
                        // already ends at the reused node
                        continue;
                    }
                    RoadEdge[] halves = split(edge, node);
                    RoadEdge head = tx.addEdge(halves[0]);
                    RoadEdge tail = tx.addEdge(halves[1]);
                    tx.disableEdge(edge.getId(), Map.of(
                            GraphProperties.REPLACED_BY_SPLIT, "true",
                            GraphProperties.SPLIT_INTO, head.getId() + "," + tail.getId()));
                    edgesCreated += 2;
                    edgesDisabled++;
                }
            }
            tx.commit();
        }
        return new BatchResult(crossings.size(), nodesCreated, nodesReused, edgesCreated, edgesDisabled);
    }

    /**
     * Cuts an edge at the node's projection onto its geometry.
     *
     * @return head ({@code from -> node}) and tail ({@code node -> to}) templates.
     */
    RoadEdge[] split(RoadEdge edge, RoadNode node) {
        LineString geometry = edge.getGeometry();
        LengthIndexedLine indexed = new LengthIndexedLine(geometry);
        double length = geometry.getLength();
        if (!(length > 0.0d)) {
            throw new TopologyRepairException("edge " + edge.getId() + " has a degenerate geometry");
        }
        double projected = indexed.project(new Coordinate(node.getLon(), node.getLat())) / length;
        double fraction = Math.max(config.getMinSplitFraction(), Math.min(config.getMaxSplitFraction(), projected));
        double cut = fraction * length;
        LineString headGeometry = (LineString) indexed.extractLine(0.0d, cut);
        LineString tailGeometry = (LineString) indexed.extractLine(cut, length);

        double lengthMeters = edge.getLengthMeters() > 0.0d ? edge.getLengthMeters() : GeoDistance.lineLengthMeters(geometry);
        String origin = Long.toString(edge.getId());
        RoadEdge head = edge.toBuilder()
                .id(0L)
                .toNodeId(node.getId())
                .geometry(headGeometry)
                .lengthMeters(lengthMeters * fraction)
                .baseCost(edge.getBaseCost() * fraction)
                .elevationGainMeters(scale(edge.getElevationGainMeters(), fraction))
                .elevationLossMeters(scale(edge.getElevationLossMeters(), fraction))
                .accessible(true)
                .property(GraphProperties.SPLIT_FROM, origin)
                .property(GraphProperties.SOURCE, GraphProperties.SOURCE_TOPOLOGY_REPAIR)
                .build();
        RoadEdge tail = edge.toBuilder()
                .id(0L)
                .fromNodeId(node.getId())
                .geometry(tailGeometry)
                .lengthMeters(lengthMeters * (1.0d - fraction))
                .baseCost(edge.getBaseCost() * (1.0d - fraction))
                .elevationGainMeters(scale(edge.getElevationGainMeters(), 1.0d - fraction))
                .elevationLossMeters(scale(edge.getElevationLossMeters(), 1.0d - fraction))
                .accessible(true)
                .property(GraphProperties.SPLIT_FROM, origin)
                .property(GraphProperties.SOURCE, GraphProperties.SOURCE_TOPOLOGY_REPAIR)
                .build();
        return new RoadEdge[]{head, tail};
    }

    private boolean hasNodeWithin(GraphTransaction tx, GeoPoint point, double tolerance) {
        if (!store.findNodesWithin(point, tolerance).isEmpty()) {
            return true;
        }
        for (RoadNode staged : tx.stagedNodes()) {
            if (GeoDistance.greatCircleMeters(point, staged.point()) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    /**
     * Nearest stored or staged node within the tolerance, stored nodes first on equal distance.
     */
    private RoadNode nearestNode(GraphTransaction tx, GeoPoint point, double tolerance) {
        List<RoadNode> stored = store.findNodesWithin(point, tolerance);
        RoadNode best = stored.isEmpty() ? null : stored.get(0);
        double bestDistance = best == null ? Double.POSITIVE_INFINITY : GeoDistance.greatCircleMeters(point, best.point());
        for (RoadNode staged : tx.stagedNodes()) {
            double distance = GeoDistance.greatCircleMeters(point, staged.point());
            if (distance <= tolerance && distance < bestDistance) {
                best = staged;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static Double scale(Double value, double fraction) {
        return value == null ? null : value * fraction;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static final class BatchResult {
        private static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0, 0);

        private final int crossings;
        private final int nodesCreated;
        private final int nodesReused;
        private final int edgesCreated;
        private final int edgesDisabled;

        private BatchResult(int crossings, int nodesCreated, int nodesReused, int edgesCreated, int edgesDisabled) {
            this.crossings = crossings;
            this.nodesCreated = nodesCreated;
            this.nodesReused = nodesReused;
            this.edgesCreated = edgesCreated;
            this.edgesDisabled = edgesDisabled;
        }

        private BatchResult plus(BatchResult other) {
            return new BatchResult(
                    crossings + other.crossings,
                    nodesCreated + other.nodesCreated,
                    nodesReused + other.nodesReused,
                    edgesCreated + other.edgesCreated,
                    edgesDisabled + other.edgesDisabled);
        }
    }
}
