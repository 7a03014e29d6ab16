package com.phillippitts.meetingrouter.exception;

/**
 * Thrown when a call to an external service fails: non-2xx status, unreadable response or a
 * transport error. Carries the remote status (0 when no response was received) and the message
 * the remote service reported.
 */
public class RemoteServiceException extends MeetingRouterException {

    private final String serviceName;
    private final int statusCode;
    private final String remoteMessage;

    public RemoteServiceException(String message, String serviceName, int statusCode, String remoteMessage) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.remoteMessage = remoteMessage;
    }

    public RemoteServiceException(String message, String serviceName, int statusCode, String remoteMessage,
                                  Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
        this.remoteMessage = remoteMessage;
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }
}
