package org.rescuenet.routing.core;

import lombok.Getter;
import org.rescuenet.routing.RoutingException;

/**
 * Raised when no path exists after every radius and policy relaxation has been tried.
 */
@Getter
public class InfeasiblePathException extends RoutingException {
    public static final String REASON_CODE = "INFEASIBLE_PATH";

    private final int attempts;

    public InfeasiblePathException(String message, int attempts) {
        super(REASON_CODE, message);
        this.attempts = attempts;
    }
}
