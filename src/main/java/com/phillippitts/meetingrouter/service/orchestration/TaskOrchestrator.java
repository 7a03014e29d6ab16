package com.phillippitts.meetingrouter.service.orchestration;

import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.OrchestrationResult;
import com.phillippitts.meetingrouter.exception.OrchestrationAbortedException;

/**
 * Runs one meeting event through routing, comment posting, extraction and task creation.
 *
 * <p>Implementations must be thread-safe; events are processed concurrently on request threads.
 */
public interface TaskOrchestrator {

    /**
     * @param event parsed meeting event
     * @return what happened; unmatched events are a normal result, not an error
     * @throws OrchestrationAbortedException if a route matched but the comment could not be posted
     */
    OrchestrationResult process(MeetingEvent event);
}
