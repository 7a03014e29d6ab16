package com.phillippitts.meetingrouter.exception;

/**
 * Base exception for all meeting-router application errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class MeetingRouterException extends RuntimeException {

    public MeetingRouterException(String message) {
        super(message);
    }

    public MeetingRouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
