package org.rescuenet.routing.topology;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.rescuenet.routing.geo.GeoPoint;
import org.rescuenet.routing.graph.GraphProperties;
import org.rescuenet.routing.graph.GraphStore;
import org.rescuenet.routing.graph.GraphTransaction;
import org.rescuenet.routing.graph.InMemoryGraphStore;
import org.rescuenet.routing.graph.NodeType;
import org.rescuenet.routing.graph.RoadEdge;
import org.rescuenet.routing.graph.RoadNode;
import org.rescuenet.routing.testutil.RoutingFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;
import static org.rescuenet.routing.testutil.RoutingFixtures.edge;
import static org.rescuenet.routing.testutil.RoutingFixtures.node;

@DisplayName("Topology Repair Job Tests")
class TopologyRepairJobTest {

    /**
     * Both diagonals of the square plus a horizontal road at lat 0.5 crossing each of them.
     */
    private static InMemoryGraphStore threeCrossings() {
        RoutingFixtures.Network pair = RoutingFixtures.crossingPair();
        RoadNode west = node(5L, -1.0d, 0.5d);
        RoadNode east = node(6L, 3.0d, 0.5d);
        List<RoadNode> nodes = new ArrayList<>(pair.nodes());
        nodes.add(west);
        nodes.add(east);
        List<RoadEdge> edges = new ArrayList<>(pair.edges());
        edges.add(edge(3L, west, east));
        return InMemoryGraphStore.of(nodes, edges);
    }

    private static List<RoadEdge> halvesOf(GraphStore store, long edgeId) {
        return store.findAccessibleEdges().stream()
                .filter(e -> Long.toString(edgeId).equals(e.getProperties().get(GraphProperties.SPLIT_FROM)))
                .toList();
    }

    @Nested
    @DisplayName("1. Repairing Crossings")
    class RepairTests {

        @Test
        @DisplayName("A crossing pair gets one intersection node and four half edges")
        void testSingleCrossingRepair() {
            InMemoryGraphStore store = RoutingFixtures.crossingPair().store();
            TopologyRepairJob job = new TopologyRepairJob(store, RepairConfig.defaults());

            RepairStats stats = job.run(false);

            assertFalse(stats.isFailed());
            assertFalse(stats.isDryRun());
            assertEquals(1, stats.getBatchesCommitted());
            assertEquals(1, stats.getIntersectionsFound());
            assertEquals(1, stats.getNodesCreated());
            assertEquals(0, stats.getNodesReused());
            assertEquals(4, stats.getEdgesCreated());
            assertEquals(2, stats.getEdgesDisabled());
            assertEquals(0, stats.getRemainingIntersections());

            RoadNode created = store.findNode(5L).orElseThrow();
            assertEquals(1.0d, created.getLon(), 1e-9);
            assertEquals(1.0d, created.getLat(), 1e-9);
            assertEquals(NodeType.INTERSECTION, created.getNodeType());
            assertEquals(4, created.getEdgeCount());
            assertEquals(GraphProperties.SOURCE_TOPOLOGY_REPAIR, created.getProperties().get(GraphProperties.SOURCE));

            List<RoadEdge> accessible = store.findAccessibleEdges();
            assertEquals(List.of(3L, 4L, 5L, 6L), accessible.stream().map(RoadEdge::getId).toList());
            for (RoadEdge half : accessible) {
                assertTrue(half.getFromNodeId() == 5L || half.getToNodeId() == 5L);
                assertEquals(GraphProperties.SOURCE_TOPOLOGY_REPAIR, half.getProperties().get(GraphProperties.SOURCE));
            }
        }

        @Test
        @DisplayName("Split originals are disabled with provenance")
        void testDisabledProvenance() {
            InMemoryGraphStore store = RoutingFixtures.crossingPair().store();
            new TopologyRepairJob(store, RepairConfig.defaults()).run(false);

            RoadEdge original = store.findEdge(1L).orElseThrow();
            assertFalse(original.isAccessible());
            assertEquals("true", original.getProperties().get(GraphProperties.REPLACED_BY_SPLIT));
            List<Long> halves = halvesOf(store, 1L).stream().map(RoadEdge::getId).toList();
            assertEquals(2, halves.size());
            assertEquals(halves.get(0) + "," + halves.get(1), original.getProperties().get(GraphProperties.SPLIT_INTO));
        }

        @Test
        @DisplayName("Halves keep their parent's attributes and length")
        void testHalvesConserveLength() {
            InMemoryGraphStore store = RoutingFixtures.crossingPair().store();
            RoadEdge original = store.findEdge(1L).orElseThrow();
            new TopologyRepairJob(store, RepairConfig.defaults()).run(false);

            List<RoadEdge> halves = halvesOf(store, 1L);
            double total = halves.stream().mapToDouble(RoadEdge::getLengthMeters).sum();
            assertEquals(original.getLengthMeters(), total, original.getLengthMeters() * 0.005d);

            RoadEdge head = halves.stream().filter(e -> e.getFromNodeId() == 1L).findFirst().orElseThrow();
            RoadEdge tail = halves.stream().filter(e -> e.getToNodeId() == 2L).findFirst().orElseThrow();
            assertEquals(5L, head.getToNodeId());
            assertEquals(5L, tail.getFromNodeId());
            assertEquals(original.getRoadClass(), head.getRoadClass());
            assertEquals(original.getRoadClass(), tail.getRoadClass());
            assertEquals(0.0d, head.getGeometry().getCoordinateN(0).x, 1e-12);
            assertEquals(2.0d, tail.getGeometry().getCoordinateN(tail.getGeometry().getNumPoints() - 1).x, 1e-12);
        }

        @Test
        @DisplayName("Repair joins previously separate components")
        void testConnectivityImproves() {
            InMemoryGraphStore store = RoutingFixtures.crossingPair().store();

            RepairStats stats = new TopologyRepairJob(store, RepairConfig.defaults()).run(false);

            assertEquals(2, stats.getConnectivityBefore().getComponentCount());
            assertEquals(0.5d, stats.getConnectivityBefore().getLargestComponentFraction(), 1e-12);
            assertEquals(1, stats.getConnectivityAfter().getComponentCount());
            assertEquals(5, stats.getConnectivityAfter().getNodeCount());
            assertTrue(stats.getConnectivityAfter().isConnected());
        }

        @Test
        @DisplayName("Existing node near the crossing is reused")
        void testNodeReuse() {
            RoutingFixtures.Network pair = RoutingFixtures.crossingPair();
            List<RoadNode> nodes = new ArrayList<>(pair.nodes());
            nodes.add(node(9L, 1.0d, 1.00002d));
            InMemoryGraphStore store = InMemoryGraphStore.of(nodes, pair.edges());

            RepairStats stats = new TopologyRepairJob(store, RepairConfig.defaults()).run(false);

            assertEquals(0, stats.getNodesCreated());
            assertEquals(1, stats.getNodesReused());
            assertEquals(4, stats.getEdgesCreated());
            assertEquals(5, store.nodeCount());
            for (RoadEdge half : store.findAccessibleEdges()) {
                assertTrue(half.getFromNodeId() == 9L || half.getToNodeId() == 9L);
            }
        }

        @Test
        @DisplayName("Crossings sharing an edge are repaired over successive batches")
        void testMultipleBatches() {
            InMemoryGraphStore store = threeCrossings();

            RepairStats stats = new TopologyRepairJob(store, RepairConfig.defaults()).run(false);

            assertEquals(3, stats.getBatchesCommitted());
            assertEquals(3, stats.getIntersectionsFound());
            assertEquals(3, stats.getNodesCreated());
            assertEquals(12, stats.getEdgesCreated());
            assertEquals(6, stats.getEdgesDisabled());
            assertEquals(0, stats.getRemainingIntersections());
            assertEquals(1, stats.getConnectivityAfter().getComponentCount());
        }

        @Test
        @DisplayName("Batch limit leaves remaining crossings for a later run")
        void testBatchLimit() {
            InMemoryGraphStore store = threeCrossings();
            TopologyRepairJob job = new TopologyRepairJob(store, RepairConfig.defaults());

            RepairStats first = job.run(10, 2, false);
            assertEquals(2, first.getBatchesCommitted());
            assertEquals(1, first.getRemainingIntersections());

            RepairStats second = job.run(false);
            assertEquals(1, second.getBatchesCommitted());
            assertEquals(0, second.getRemainingIntersections());
        }

        @Test
        @DisplayName("Second run on a repaired graph changes nothing")
        void testIdempotent() {
            InMemoryGraphStore store = threeCrossings();
            TopologyRepairJob job = new TopologyRepairJob(store, RepairConfig.defaults());
            job.run(false);
            long version = store.version();
            int edges = store.edgeCount();

            RepairStats again = job.run(false);

            assertEquals(0, again.getIntersectionsFound());
            assertEquals(0, again.getBatchesCommitted());
            assertEquals(0, again.getEdgesCreated());
            assertEquals(version, store.version());
            assertEquals(edges, store.edgeCount());
        }
    }

    @Nested
    @DisplayName("2. Dry Run And Failures")
    class DryRunAndFailureTests {

        @Test
        @DisplayName("Dry run only counts crossings")
        void testDryRun() {
            InMemoryGraphStore store = threeCrossings();
            long version = store.version();

            RepairStats stats = new TopologyRepairJob(store, RepairConfig.defaults()).run(true);

            assertTrue(stats.isDryRun());
            assertEquals(3, stats.getIntersectionsFound());
            assertEquals(3, stats.getRemainingIntersections());
            assertEquals(0, stats.getEdgesCreated());
            assertNotNull(stats.getConnectivityBefore());
            assertNull(stats.getConnectivityAfter());
            assertEquals(version, store.version());
            assertEquals(3, store.findAccessibleEdges().size());
        }

        @Test
        @DisplayName("Failed commit rolls the batch back and is reported")
        void testRollbackOnFailure() {
            InMemoryGraphStore delegate = RoutingFixtures.crossingPair().store();
            long version = delegate.version();
            GraphStore failing = new DelegatingStore(delegate) {
                @Override
                public GraphTransaction beginTransaction() {
                    return new FailingCommitTransaction(delegate.beginTransaction());
                }
            };

            RepairStats stats = new TopologyRepairJob(failing, RepairConfig.defaults()).run(false);

            assertTrue(stats.isFailed());
            assertTrue(stats.getFailure().contains("batch 1 rolled back"));
            assertTrue(stats.getFailure().contains("disk full"));
            assertEquals(0, stats.getBatchesCommitted());
            assertEquals(0, stats.getEdgesCreated());
            assertEquals(1, stats.getRemainingIntersections());
            assertEquals(version, delegate.version());
            assertEquals(4, delegate.nodeCount());
            assertEquals(List.of(1L, 2L), delegate.findAccessibleEdges().stream().map(RoadEdge::getId).toList());
        }

        @Test
        @DisplayName("Concurrent run on the same job is rejected")
        void testSingleActiveRun() throws Exception {
            InMemoryGraphStore delegate = RoutingFixtures.crossingPair().store();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            GraphStore blocking = new DelegatingStore(delegate) {
                @Override
                public GraphTransaction beginTransaction() {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return delegate.beginTransaction();
                }
            };
            TopologyRepairJob job = new TopologyRepairJob(blocking, RepairConfig.defaults());

            CompletableFuture<RepairStats> first = CompletableFuture.supplyAsync(() -> job.run(false));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(job.isRunning());
            RepairAlreadyRunningException ex = assertThrows(RepairAlreadyRunningException.class, () -> job.run(true));
            assertEquals("REPAIR_ALREADY_RUNNING", ex.getReasonCode());

            release.countDown();
            RepairStats stats = first.get(10, TimeUnit.SECONDS);
            assertEquals(1, stats.getBatchesCommitted());
            assertFalse(job.isRunning());
        }

        @Test
        @DisplayName("Second job on the same store is rejected while the first runs")
        void testSingleActiveRunPerStore() throws Exception {
            InMemoryGraphStore delegate = RoutingFixtures.crossingPair().store();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            GraphStore blocking = new DelegatingStore(delegate) {
                @Override
                public GraphTransaction beginTransaction() {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return delegate.beginTransaction();
                }
            };
            TopologyRepairJob first = new TopologyRepairJob(blocking, RepairConfig.defaults());
            TopologyRepairJob second = new TopologyRepairJob(delegate, RepairConfig.defaults());

            CompletableFuture<RepairStats> running = CompletableFuture.supplyAsync(() -> first.run(false));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(second.isRunning());
            assertThrows(RepairAlreadyRunningException.class, () -> second.run(false));

            release.countDown();
            RepairStats stats = running.get(10, TimeUnit.SECONDS);
            assertEquals(1, stats.getBatchesCommitted());
            assertEquals(4, delegate.findAccessibleEdges().size());
            assertEquals(6, delegate.edgeCount());

            RepairStats again = second.run(false);
            assertEquals(0, again.getIntersectionsFound());
            assertEquals(4, delegate.findAccessibleEdges().size());
        }

        @Test
        @DisplayName("Batch staged against a stale view is rolled back instead of splitting twice")
        void testStaleBatchRolledBack() {
            InMemoryGraphStore delegate = RoutingFixtures.crossingPair().store();
            GraphStore racing = new DelegatingStore(delegate) {
                @Override
                public GraphTransaction beginTransaction() {
                    // another writer disables edge 1 after crossings were detected
                    try (GraphTransaction other = delegate.beginTransaction()) {
                        other.disableEdge(1L, Map.of());
                        other.commit();
                    }
                    return delegate.beginTransaction();
                }
            };

            RepairStats stats = new TopologyRepairJob(racing, RepairConfig.defaults()).run(1, 1, false);

            assertTrue(stats.isFailed());
            assertTrue(stats.getFailure().contains("already disabled"), stats.getFailure());
            assertEquals(0, stats.getBatchesCommitted());
            assertEquals(List.of(2L), delegate.findAccessibleEdges().stream().map(RoadEdge::getId).toList());
            assertEquals(2, delegate.edgeCount());
        }

        @Test
        @DisplayName("Invalid batch arguments are rejected")
        void testArgumentValidation() {
            TopologyRepairJob job = new TopologyRepairJob(RoutingFixtures.crossingPair().store(), RepairConfig.defaults());

            assertThrows(IllegalArgumentException.class, () -> job.run(0, 1, false));
            assertThrows(IllegalArgumentException.class, () -> job.run(1, 0, false));
            assertThrows(NullPointerException.class, () -> new TopologyRepairJob(null, RepairConfig.defaults()));
        }
    }

    @Nested
    @DisplayName("3. Configuration")
    class ConfigTests {

        @Test
        @DisplayName("Properties override defaults")
        void testFromProperties() {
            Properties properties = new Properties();
            properties.setProperty(RepairConfig.PROPERTY_SNAP_TOLERANCE_METERS, "5");
            properties.setProperty(RepairConfig.PROPERTY_BATCH_SIZE, "250");

            RepairConfig config = RepairConfig.fromProperties(properties);

            assertEquals(5.0d, config.getSnapToleranceMeters());
            assertEquals(15.0d, config.getAssociateToleranceMeters());
            assertEquals(250, config.getBatchSize());
            assertEquals(100, config.getMaxBatches());
        }

        @Test
        @DisplayName("Inconsistent tolerances and fractions are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> RepairConfig.builder().snapToleranceMeters(20.0d).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> RepairConfig.builder().minSplitFraction(0.6d).maxSplitFraction(0.4d).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> RepairConfig.builder().batchSize(0).build().validate());

            Properties bad = new Properties();
            bad.setProperty(RepairConfig.PROPERTY_MAX_BATCHES, "many");
            assertThrows(IllegalArgumentException.class, () -> RepairConfig.fromProperties(bad));
        }
    }

    private static class DelegatingStore implements GraphStore {
        private final GraphStore delegate;

        DelegatingStore(GraphStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<RoadEdge> findEdgesIntersecting(Envelope area) {
            return delegate.findEdgesIntersecting(area);
        }

        @Override
        public List<RoadEdge> findAccessibleEdges() {
            return delegate.findAccessibleEdges();
        }

        @Override
        public Optional<RoadEdge> findEdge(long edgeId) {
            return delegate.findEdge(edgeId);
        }

        @Override
        public Optional<RoadNode> findNode(long nodeId) {
            return delegate.findNode(nodeId);
        }

        @Override
        public Long2ObjectMap<RoadNode> findNodes(LongCollection nodeIds) {
            return delegate.findNodes(nodeIds);
        }

        @Override
        public List<RoadNode> findNodesWithin(GeoPoint point, double toleranceMeters) {
            return delegate.findNodesWithin(point, toleranceMeters);
        }

        @Override
        public long version() {
            return delegate.version();
        }

        @Override
        public GraphTransaction beginTransaction() {
            return delegate.beginTransaction();
        }

        @Override
        public ReentrantLock repairLock() {
            return delegate.repairLock();
        }
    }

    private static final class FailingCommitTransaction implements GraphTransaction {
        private final GraphTransaction delegate;

        private FailingCommitTransaction(GraphTransaction delegate) {
            this.delegate = delegate;
        }

        @Override
        public RoadNode addNode(RoadNode template) {
            return delegate.addNode(template);
        }

        @Override
        public RoadEdge addEdge(RoadEdge template) {
            return delegate.addEdge(template);
        }

        @Override
        public void disableEdge(long edgeId, Map<String, String> provenance) {
            delegate.disableEdge(edgeId, provenance);
        }

        @Override
        public List<RoadNode> stagedNodes() {
            return delegate.stagedNodes();
        }

        @Override
        public void commit() {
            throw new IllegalStateException("disk full");
        }

        @Override
        public void rollback() {
            delegate.rollback();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
