/**
 * Meeting-event pipeline.
 *
 * <p>{@link com.phillippitts.meetingrouter.service.orchestration.DefaultTaskOrchestrator} walks an
 * event through the {@link com.phillippitts.meetingrouter.service.orchestration.OrchestrationState}
 * machine. Only the comment post is mandatory once a route matches; extraction and task creation
 * are best-effort and never undo an earlier stage.
 */
package com.phillippitts.meetingrouter.service.orchestration;
