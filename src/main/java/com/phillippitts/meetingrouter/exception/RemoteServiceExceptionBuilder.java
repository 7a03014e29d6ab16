package com.phillippitts.meetingrouter.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link RemoteServiceException} with call context folded into the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw RemoteServiceExceptionBuilder.create("ClickUp API error")
 *         .service("clickup")
 *         .status(401)
 *         .remoteMessage("Token invalid")
 *         .metadata("taskId", taskId)
 *         .build();
 * </pre>
 * produces the message {@code ClickUp API error (401): Token invalid (taskId=abc)}.
 */
public final class RemoteServiceExceptionBuilder {

    private final String message;
    private String serviceName = "unknown";
    private int statusCode;
    private String remoteMessage;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RemoteServiceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RemoteServiceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RemoteServiceExceptionBuilder(message);
    }

    public RemoteServiceExceptionBuilder service(String serviceName) {
        if (serviceName != null) {
            this.serviceName = serviceName;
        }
        return this;
    }

    /** HTTP status of the remote response; leave unset for transport failures. */
    public RemoteServiceExceptionBuilder status(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public RemoteServiceExceptionBuilder remoteMessage(String remoteMessage) {
        this.remoteMessage = remoteMessage;
        return this;
    }

    public RemoteServiceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a context key-value pair; null keys or values are ignored.
     */
    public RemoteServiceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public RemoteServiceException build() {
        String remote = remoteMessage == null || remoteMessage.isBlank() ? "Unknown error" : remoteMessage;
        String detailed = buildDetailedMessage(remote);
        if (cause != null) {
            return new RemoteServiceException(detailed, serviceName, statusCode, remote, cause);
        }
        return new RemoteServiceException(detailed, serviceName, statusCode, remote);
    }

    private String buildDetailedMessage(String remote) {
        StringBuilder sb = new StringBuilder(message);
        if (statusCode > 0) {
            sb.append(" (").append(statusCode).append(')');
        }
        sb.append(": ").append(remote);

        if (!metadata.isEmpty()) {
            sb.append(" (");
            boolean first = true;
            for (Map.Entry<String, String> entry : metadata.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
