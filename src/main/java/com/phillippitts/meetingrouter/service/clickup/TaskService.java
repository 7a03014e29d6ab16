package com.phillippitts.meetingrouter.service.clickup;

import com.phillippitts.meetingrouter.exception.MissingIdentifierException;
import com.phillippitts.meetingrouter.exception.RemoteServiceException;

import java.util.List;
import java.util.Objects;

/**
 * Creates tasks and subtasks in a list.
 */
public interface TaskService {

    /**
     * @param apiToken resolved token for the destination
     * @param request  task to create; a non-null parent id makes it a subtask
     * @return id of the created task, never empty
     * @throws MissingIdentifierException if the service accepted the task but returned no id
     * @throws RemoteServiceException     on non-2xx responses or transport failures
     */
    String createTask(String apiToken, CreateTaskRequest request);

    /**
     * @param listId       target list
     * @param name         task name
     * @param description  optional description
     * @param assigneeIds  assignee user ids, possibly empty
     * @param status       optional status name
     * @param parentTaskId parent task for subtasks, {@code null} for top-level tasks
     */
    record CreateTaskRequest(
            String listId,
            String name,
            String description,
            List<Long> assigneeIds,
            String status,
            String parentTaskId
    ) {

        public CreateTaskRequest {
            Objects.requireNonNull(listId, "listId must not be null");
            Objects.requireNonNull(name, "name must not be null");
            assigneeIds = assigneeIds == null ? List.of() : List.copyOf(assigneeIds);
        }

        public boolean isSubtask() {
            return parentTaskId != null && !parentTaskId.isEmpty();
        }
    }
}
