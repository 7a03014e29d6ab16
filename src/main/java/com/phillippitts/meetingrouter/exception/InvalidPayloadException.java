package com.phillippitts.meetingrouter.exception;

/**
 * Thrown when an inbound webhook body is empty or not a JSON object.
 */
public class InvalidPayloadException extends MeetingRouterException {

    private final String reason;

    public InvalidPayloadException(String reason) {
        super("Invalid webhook payload: " + reason);
        this.reason = reason;
    }

    public InvalidPayloadException(String reason, Throwable cause) {
        super("Invalid webhook payload: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
