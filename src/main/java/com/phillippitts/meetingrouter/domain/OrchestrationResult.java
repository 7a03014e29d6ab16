package com.phillippitts.meetingrouter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of processing one meeting event.
 *
 * <p>Counts are always populated, even when a stage was skipped or failed, so callers can report
 * exactly what happened without inspecting logs.
 *
 * @param outcome           terminal outcome
 * @param meetingTitle      display title of the meeting
 * @param routeName         selected route name, {@code null} when unmatched
 * @param commentTaskId     destination task id, {@code null} when unmatched
 * @param matchedKeywords   keywords that selected the route
 * @param commentPosted     whether the comment was posted
 * @param commentId         id returned for the comment, may be {@code null}
 * @param extractedCount    number of action items extracted
 * @param parentTaskId      id of the created parent task, {@code null} if none
 * @param eligibleSubtasks  number of items offered as subtask candidates
 * @param createdSubtasks   number of subtasks created
 * @param failedSubtasks    number of subtask attempts that failed
 */
public record OrchestrationResult(
        Outcome outcome,
        String meetingTitle,
        String routeName,
        String commentTaskId,
        List<String> matchedKeywords,
        boolean commentPosted,
        String commentId,
        int extractedCount,
        String parentTaskId,
        int eligibleSubtasks,
        int createdSubtasks,
        int failedSubtasks
) {

    public enum Outcome {
        /** No route and no default destination; nothing was sent anywhere. */
        UNMATCHED,
        /** The comment was posted; downstream stages ran best-effort. */
        COMPLETED
    }

    public OrchestrationResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        if (createdSubtasks > eligibleSubtasks) {
            throw new IllegalArgumentException("createdSubtasks (" + createdSubtasks
                    + ") exceeds eligibleSubtasks (" + eligibleSubtasks + ")");
        }
    }

    public static OrchestrationResult unmatched(String meetingTitle) {
        return new OrchestrationResult(Outcome.UNMATCHED, meetingTitle, null, null, List.of(),
                false, null, 0, null, 0, 0, 0);
    }

    public boolean isMatched() {
        return outcome != Outcome.UNMATCHED;
    }
}
