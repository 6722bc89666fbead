package org.rescuenet.routing.topology;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one {@link TopologyRepairJob} run. Counts cover committed batches only.
 */
@Value
@Builder(toBuilder = true)
public class RepairStats {
    boolean dryRun;
    int batchesCommitted;
    /** Crossings repaired, or crossings found when {@link #dryRun} is set. */
    int intersectionsFound;
    int nodesCreated;
    int nodesReused;
    int edgesCreated;
    int edgesDisabled;
    /** Crossings still present when the run ended. */
    int remainingIntersections;
    ConnectivityReport connectivityBefore;
    /** {@code null} for a dry run. */
    ConnectivityReport connectivityAfter;
    /** Set when a batch rolled back and the job halted. */
    String failure;
    long elapsedMillis;

    public boolean isFailed() {
        return failure != null;
    }
}
