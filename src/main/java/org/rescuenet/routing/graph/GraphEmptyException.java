package org.rescuenet.routing.graph;

import org.rescuenet.routing.RoutingException;

/**
 * Raised when no traversable edge exists around the requested points, even at the maximum radius.
 */
public class GraphEmptyException extends RoutingException {
    public static final String REASON_CODE = "GRAPH_EMPTY";

    public GraphEmptyException(String message) {
        super(REASON_CODE, message);
    }
}
