package com.phillippitts.meetingrouter.service.orchestration;

/**
 * Counts produced by the task-creation stage.
 *
 * @param parentTaskId id of the parent task, {@code null} if it was not created
 * @param eligible     items offered as subtask candidates
 * @param created      subtasks created
 * @param failed       subtask attempts that failed
 */
record TaskCreationSummary(String parentTaskId, int eligible, int created, int failed) {

    static final TaskCreationSummary NONE = new TaskCreationSummary(null, 0, 0, 0);
}
