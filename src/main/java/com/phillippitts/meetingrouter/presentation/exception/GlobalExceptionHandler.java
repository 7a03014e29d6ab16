package com.phillippitts.meetingrouter.presentation.exception;

import com.phillippitts.meetingrouter.exception.InvalidPayloadException;
import com.phillippitts.meetingrouter.exception.OrchestrationAbortedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Server-side failures never expose exception messages to the caller.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String INTERNAL_ERROR = "Internal server error";

    /**
     * Client error - empty or non-object webhook body (HTTP 400).
     */
    @ExceptionHandler(InvalidPayloadException.class)
    ResponseEntity<ApiError> handleInvalidPayload(InvalidPayloadException ex) {
        LOG.warn("Rejected webhook payload: {}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(false, ex.getReason(), null, Instant.now()));
    }

    /**
     * Comment post failed after a route matched (HTTP 500).
     */
    @ExceptionHandler(OrchestrationAbortedException.class)
    ResponseEntity<ApiError> handleAborted(OrchestrationAbortedException ex) {
        LOG.error("Error processing Fathom webhook: stage={}, route={}", ex.getStage(), ex.getRouteName(),
                ex.getCause());
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(false, INTERNAL_ERROR, null, Instant.now()));
    }

    /**
     * Unknown path, wrong method or media type; keeps the framework's status code.
     */
    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    ResponseEntity<ApiError> handleFrameworkError(Exception ex) {
        HttpStatusCode status = ex instanceof ErrorResponse er
                ? er.getStatusCode()
                : HttpStatus.BAD_REQUEST;
        LOG.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
        String reason = status instanceof HttpStatus known ? known.getReasonPhrase() : "Request rejected";
        return ResponseEntity
            .status(status)
            .body(new ApiError(false, reason, ex.getMessage(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(false, INTERNAL_ERROR, null, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        boolean success,
        String error,
        String message,
        Instant timestamp
    ) {}
}
