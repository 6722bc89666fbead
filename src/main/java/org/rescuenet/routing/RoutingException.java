package org.rescuenet.routing;

import lombok.Getter;

import java.util.Objects;

/**
 * Base routing failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON]} so logs and callers see the same code.</p>
 */
@Getter
public class RoutingException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded routing failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded routing failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoutingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
