package org.rescuenet.routing.graph;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongCollection;
import org.locationtech.jts.geom.Envelope;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handle to the persisted road network.
 *
 * <p>Planners only read through this contract. The topology repair job is the single writer and
 * mutates exclusively through {@link GraphTransaction}, so a reader observes either a batch's full
 * effect or none of it.</p>
 */
public interface GraphStore {

    /**
     * Returns accessible edges whose geometry intersects the given lon/lat envelope,
     * ordered by edge id.
     */
    List<RoadEdge> findEdgesIntersecting(Envelope area);

    /**
     * Returns every accessible edge, ordered by edge id.
     */
    List<RoadEdge> findAccessibleEdges();

    Optional<RoadEdge> findEdge(long edgeId);

    Optional<RoadNode> findNode(long nodeId);

    /**
     * Bulk node lookup. Ids without a stored node are absent from the result.
     */
    Long2ObjectMap<RoadNode> findNodes(LongCollection nodeIds);

    /**
     * Returns accessible nodes within {@code toleranceMeters} of a point, nearest first,
     * ties broken by node id.
     */
    List<RoadNode> findNodesWithin(GeoPoint point, double toleranceMeters);

    /**
     * Monotonic counter incremented by every committed transaction.
     */
    long version();

    /**
     * Opens an isolated write transaction. Nothing is visible to readers until commit.
     */
    GraphTransaction beginTransaction();

    /**
     * Lock held for the whole of a topology repair run. Every job writing to this store shares it,
     * so at most one run is active per store.
     */
    ReentrantLock repairLock();
}
