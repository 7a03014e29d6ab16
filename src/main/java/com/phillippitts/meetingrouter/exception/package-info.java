/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.meetingrouter.exception.MeetingRouterException}
 * so the web layer can map them in one place:
 * <ul>
 *   <li>{@link com.phillippitts.meetingrouter.exception.InvalidPayloadException} - empty or
 *       non-object webhook body (HTTP 400)</li>
 *   <li>{@link com.phillippitts.meetingrouter.exception.MissingCredentialException} - a mandatory
 *       token resolved to nothing</li>
 *   <li>{@link com.phillippitts.meetingrouter.exception.RemoteServiceException} - non-2xx,
 *       unreadable or unreachable external service; carries remote status and message</li>
 *   <li>{@link com.phillippitts.meetingrouter.exception.MissingIdentifierException} - 2xx
 *       response without an id</li>
 *   <li>{@link com.phillippitts.meetingrouter.exception.OrchestrationAbortedException} - the
 *       comment post failed, so the request fails (HTTP 500)</li>
 * </ul>
 *
 * @see com.phillippitts.meetingrouter.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.meetingrouter.exception;
