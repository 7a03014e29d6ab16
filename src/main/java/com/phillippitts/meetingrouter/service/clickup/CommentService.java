package com.phillippitts.meetingrouter.service.clickup;

import com.phillippitts.meetingrouter.domain.RichTextBlock;
import com.phillippitts.meetingrouter.exception.RemoteServiceException;

import java.util.List;
import java.util.Objects;

/**
 * Posts rich-text comments on existing tasks.
 */
public interface CommentService {

    /**
     * @param apiToken resolved token for the destination
     * @param request  comment to post
     * @return id of the created comment, or {@code null} if the service did not return one
     * @throws RemoteServiceException on non-2xx responses or transport failures
     */
    String postComment(String apiToken, CommentRequest request);

    /**
     * @param taskId    task receiving the comment
     * @param blocks    ordered rich-text blocks, never empty
     * @param notifyWatchers whether the service should notify task watchers
     */
    record CommentRequest(String taskId, List<RichTextBlock> blocks, boolean notifyWatchers) {

        public CommentRequest {
            Objects.requireNonNull(taskId, "taskId must not be null");
            if (blocks == null || blocks.isEmpty()) {
                throw new IllegalArgumentException("comment must contain at least one block");
            }
            blocks = List.copyOf(blocks);
        }
    }
}
