package org.rescuenet.routing.topology;

import org.rescuenet.routing.RoutingException;

/**
 * Failure inside a repair batch. The batch is rolled back before this propagates.
 */
public class TopologyRepairException extends RoutingException {
    public static final String REASON_CODE = "REPAIR_BATCH_FAILED";

    public TopologyRepairException(String message) {
        super(REASON_CODE, message);
    }

    public TopologyRepairException(String message, Throwable cause) {
        super(REASON_CODE, message, cause);
    }
}
