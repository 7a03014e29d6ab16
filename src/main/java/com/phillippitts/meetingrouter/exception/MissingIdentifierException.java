package com.phillippitts.meetingrouter.exception;

/**
 * Thrown when a service answers 2xx but the response carries no identifier for the created
 * resource.
 */
public class MissingIdentifierException extends RemoteServiceException {

    public MissingIdentifierException(String serviceName, int statusCode, String resource) {
        super(serviceName + " accepted the " + resource + " but returned no identifier (status=" + statusCode + ")",
                serviceName, statusCode, "no identifier in response");
    }
}
