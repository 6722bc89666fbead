package org.rescuenet.routing.graph;

import java.util.List;
import java.util.Map;

/**
 * Atomic unit of graph mutation. Either every staged change is applied on {@link #commit()} or
 * none is. Closing an uncommitted transaction rolls it back.
 */
public interface GraphTransaction extends AutoCloseable {

    /**
     * Stages a new node. The template id is ignored and a fresh id is assigned.
     *
     * @return staged node carrying its assigned id.
     */
    RoadNode addNode(RoadNode template);

    /**
     * Stages a new edge. The template id is ignored and a fresh id is assigned.
     *
     * @return staged edge carrying its assigned id.
     */
    RoadEdge addEdge(RoadEdge template);

    /**
     * Stages marking an edge inaccessible and merging provenance properties into it. The commit fails
     * when the edge is unknown or already inaccessible by then.
     */
    void disableEdge(long edgeId, Map<String, String> provenance);

    /**
     * Nodes staged so far in this transaction, in staging order.
     */
    List<RoadNode> stagedNodes();

    void commit();

    void rollback();

    @Override
    void close();
}
