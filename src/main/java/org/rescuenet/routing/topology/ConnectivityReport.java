package org.rescuenet.routing.topology;

import lombok.Builder;
import lombok.Value;

/**
 * Connected components of the accessible-edge graph, edges treated as undirected.
 */
@Value
@Builder
public class ConnectivityReport {
    /** Nodes touched by at least one counted edge. */
    int nodeCount;
    int edgeCount;
    int componentCount;
    int largestComponentSize;
    /** {@code largestComponentSize / nodeCount}, {@code 0} for an empty graph. */
    double largestComponentFraction;
    /** Scenario whose blocked edges were excluded, {@code null} for none. */
    String scenarioId;

    public double largestComponentPercent() {
        return largestComponentFraction * 100.0d;
    }

    public boolean isConnected() {
        return componentCount <= 1;
    }
}
