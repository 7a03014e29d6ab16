package com.phillippitts.meetingrouter.exception;

/**
 * Thrown when a mandatory stage fails and the whole request must be reported as a server error.
 * Only the comment post is mandatory once a route has matched.
 */
public class OrchestrationAbortedException extends MeetingRouterException {

    private final String routeName;
    private final String stage;

    public OrchestrationAbortedException(String stage, String routeName, Throwable cause) {
        super("Meeting processing aborted at stage " + stage + " (route: " + routeName + ")", cause);
        this.stage = stage;
        this.routeName = routeName;
    }

    public String getRouteName() {
        return routeName;
    }

    public String getStage() {
        return stage;
    }
}
