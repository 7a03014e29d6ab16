package com.phillippitts.meetingrouter.service.orchestration;

/**
 * Processing states of one meeting event. Transitions only move forward:
 * <pre>
 * RECEIVED → ROUTE_RESOLVED → COMMENT_POSTED → EXTRACTION_ATTEMPTED → TASK_CREATION_ATTEMPTED → COMPLETED
 *          ↘ ROUTE_UNMATCHED
 * </pre>
 */
public enum OrchestrationState {
    RECEIVED,
    ROUTE_RESOLVED,
    ROUTE_UNMATCHED,
    COMMENT_POSTED,
    EXTRACTION_ATTEMPTED,
    TASK_CREATION_ATTEMPTED,
    COMPLETED;

    /**
     * @return true if moving from this state to {@code next} is allowed
     */
    public boolean canTransitionTo(OrchestrationState next) {
        return switch (this) {
            case RECEIVED -> next == ROUTE_RESOLVED || next == ROUTE_UNMATCHED;
            case ROUTE_RESOLVED -> next == COMMENT_POSTED;
            case COMMENT_POSTED -> next == EXTRACTION_ATTEMPTED;
            case EXTRACTION_ATTEMPTED -> next == TASK_CREATION_ATTEMPTED;
            case TASK_CREATION_ATTEMPTED -> next == COMPLETED;
            case ROUTE_UNMATCHED, COMPLETED -> false;
        };
    }
}
