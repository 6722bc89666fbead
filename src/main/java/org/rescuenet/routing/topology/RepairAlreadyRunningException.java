package org.rescuenet.routing.topology;

import org.rescuenet.routing.RoutingException;

/**
 * Raised when a repair run starts while another one holds the job.
 */
public class RepairAlreadyRunningException extends RoutingException {
    public static final String REASON_CODE = "REPAIR_ALREADY_RUNNING";

    public RepairAlreadyRunningException(String message) {
        super(REASON_CODE, message);
    }
}
