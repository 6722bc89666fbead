package org.rescuenet.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Well-known provenance keys stored in node and edge property maps.
 */
@UtilityClass
public class GraphProperties {
    /** Id of the edge a split half was cut from. */
    public static final String SPLIT_FROM = "split_from";
    /** Set to {@code "true"} on an edge disabled because it was split. */
    public static final String REPLACED_BY_SPLIT = "replaced_by_split";
    /** Comma separated ids of the halves that replaced a split edge. */
    public static final String SPLIT_INTO = "split_into";
    /** Component that created a node or edge. */
    public static final String SOURCE = "source";
    public static final String SOURCE_TOPOLOGY_REPAIR = "topology_repair";
}
