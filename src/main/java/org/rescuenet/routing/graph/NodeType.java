package org.rescuenet.routing.graph;

/**
 * Structural role of a road node.
 */
public enum NodeType {
    /** Junction of two or more roads. */
    INTERSECTION,
    /** Dead end or network boundary. */
    ENDPOINT,
    /** Shape point kept as a node, degree two. */
    WAYPOINT
}
