package com.phillippitts.meetingrouter.service.orchestration;

import com.phillippitts.meetingrouter.domain.DestinationRoute;
import com.phillippitts.meetingrouter.domain.ExtractedTaskItem;
import com.phillippitts.meetingrouter.domain.ExtractionResult;
import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.OrchestrationResult;
import com.phillippitts.meetingrouter.domain.ResolvedRoute;
import com.phillippitts.meetingrouter.exception.MeetingRouterException;
import com.phillippitts.meetingrouter.exception.OrchestrationAbortedException;
import com.phillippitts.meetingrouter.service.clickup.CommentService;
import com.phillippitts.meetingrouter.service.clickup.CommentService.CommentRequest;
import com.phillippitts.meetingrouter.service.clickup.TaskService;
import com.phillippitts.meetingrouter.service.clickup.TaskService.CreateTaskRequest;
import com.phillippitts.meetingrouter.service.extraction.ExtractionGateway;
import com.phillippitts.meetingrouter.service.format.ContentFormatter;
import com.phillippitts.meetingrouter.service.metrics.OrchestrationMetrics;
import com.phillippitts.meetingrouter.service.routing.ConfigResolutionChain;
import com.phillippitts.meetingrouter.service.routing.RouteResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of {@link TaskOrchestrator}.
 *
 * <p><b>Failure policy:</b>
 * <ul>
 *   <li>No route: terminate with an unmatched result; nothing is sent.</li>
 *   <li>Comment post fails: {@link OrchestrationAbortedException}; extraction and task creation
 *       are never attempted.</li>
 *   <li>Extraction fails: logged, counts report zero, request still succeeds.</li>
 *   <li>Parent task fails: logged, no subtasks attempted, request still succeeds.</li>
 *   <li>A subtask fails: logged and counted; remaining subtasks are still attempted.</li>
 * </ul>
 *
 * <p>Every extracted item is a subtask candidate. The resolved confidence threshold is only
 * reported in the logs, together with how many items fall below it.
 *
 * <p>All external calls are sequential; subtasks are created in extraction order. Holds no
 * mutable state, so one instance serves all request threads.
 */
public class DefaultTaskOrchestrator implements TaskOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTaskOrchestrator.class);

    static final String STAGE_COMMENT = "comment";
    static final String STAGE_EXTRACTION = "extraction";
    static final String STAGE_PARENT_TASK = "parent_task";

    private static final String MDC_ROUTE = "route";

    private final RouteResolver routeResolver;
    private final ConfigResolutionChain configChain;
    private final ContentFormatter formatter;
    private final CommentService commentService;
    private final ExtractionGateway extractionGateway;
    private final TaskService taskService;
    private final OrchestrationMetrics metrics;

    /**
     * @throws NullPointerException if any parameter is null
     */
    public DefaultTaskOrchestrator(RouteResolver routeResolver,
                                   ConfigResolutionChain configChain,
                                   ContentFormatter formatter,
                                   CommentService commentService,
                                   ExtractionGateway extractionGateway,
                                   TaskService taskService,
                                   OrchestrationMetrics metrics) {
        this.routeResolver = Objects.requireNonNull(routeResolver, "routeResolver must not be null");
        this.configChain = Objects.requireNonNull(configChain, "configChain must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.commentService = Objects.requireNonNull(commentService, "commentService must not be null");
        this.extractionGateway = Objects.requireNonNull(extractionGateway, "extractionGateway must not be null");
        this.taskService = Objects.requireNonNull(taskService, "taskService must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public OrchestrationResult process(MeetingEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        long startNanos = System.nanoTime();
        Tracker tracker = new Tracker();

        Optional<ResolvedRoute> resolved = routeResolver.resolve(event);
        if (resolved.isEmpty()) {
            tracker.moveTo(OrchestrationState.ROUTE_UNMATCHED);
            metrics.recordRouting("unmatched");
            metrics.recordLatency("unmatched", System.nanoTime() - startNanos);
            LOG.warn("No ClickUp route matched for meeting '{}'", event.displayTitle());
            return OrchestrationResult.unmatched(event.displayTitle());
        }

        ResolvedRoute route = resolved.get();
        tracker.moveTo(OrchestrationState.ROUTE_RESOLVED);
        metrics.recordRouting(route.isFallback() ? "fallback" : "matched");
        ThreadContext.put(MDC_ROUTE, route.name());
        try {
            return runMatched(event, route, tracker, startNanos);
        } finally {
            ThreadContext.remove(MDC_ROUTE);
        }
    }

    private OrchestrationResult runMatched(MeetingEvent event, ResolvedRoute route, Tracker tracker,
                                           long startNanos) {
        StageResult<String> comment = postComment(event, route);
        metrics.recordStage(STAGE_COMMENT, comment.status().tagValue());
        if (!comment.isSuccess()) {
            metrics.recordLatency("aborted", System.nanoTime() - startNanos);
            throw new OrchestrationAbortedException(STAGE_COMMENT, route.name(), comment.error());
        }
        tracker.moveTo(OrchestrationState.COMMENT_POSTED);

        StageResult<ExtractionResult> extraction = extract(event, route);
        metrics.recordStage(STAGE_EXTRACTION, extraction.status().tagValue());
        tracker.moveTo(OrchestrationState.EXTRACTION_ATTEMPTED);

        TaskCreationSummary tasks = extraction.isSuccess()
                ? createTasks(event, route.route(), extraction.value())
                : TaskCreationSummary.NONE;
        tracker.moveTo(OrchestrationState.TASK_CREATION_ATTEMPTED);

        int extractedCount = extraction.isSuccess() ? extraction.value().itemCount() : 0;
        OrchestrationResult result = new OrchestrationResult(
                OrchestrationResult.Outcome.COMPLETED,
                event.displayTitle(),
                route.name(),
                route.commentTaskId(),
                route.matchedKeywords(),
                true,
                comment.value(),
                extractedCount,
                tasks.parentTaskId(),
                tasks.eligible(),
                tasks.created(),
                tasks.failed());
        tracker.moveTo(OrchestrationState.COMPLETED);
        metrics.recordLatency("completed", System.nanoTime() - startNanos);

        LOG.info("Processed meeting '{}' via route '{}': comment={}, extracted={}, parentTask={}, "
                        + "subtasks created {}/{} (failed {})",
                event.displayTitle(), route.name(), comment.value(), extractedCount,
                tasks.parentTaskId(), tasks.created(), tasks.eligible(), tasks.failed());
        return result;
    }

    private StageResult<String> postComment(MeetingEvent event, ResolvedRoute route) {
        try {
            String token = configChain.resolveApiToken(route.route());
            CommentRequest request = new CommentRequest(route.commentTaskId(), formatter.commentBlocks(event), false);
            String commentId = commentService.postComment(token, request);
            LOG.info("Posted meeting '{}' to ClickUp task {} (route '{}', matched {}, comment {})",
                    event.displayTitle(), route.commentTaskId(), route.name(), route.matchedKeywords(), commentId);
            return StageResult.success(commentId);
        } catch (MeetingRouterException | IllegalArgumentException e) {
            LOG.error("Failed to post comment to task {} for route '{}': {}",
                    route.commentTaskId(), route.name(), e.getMessage());
            return StageResult.aborted(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error posting comment to task {} for route '{}'",
                    route.commentTaskId(), route.name(), e);
            return StageResult.aborted("unexpected error", e);
        }
    }

    private StageResult<ExtractionResult> extract(MeetingEvent event, ResolvedRoute route) {
        if (!extractionGateway.isEnabled()) {
            LOG.debug("Extraction skipped: no API key configured");
            return StageResult.skipped("extraction not configured");
        }
        String transcript = formatter.renderTranscript(event);
        if (transcript.isEmpty()) {
            LOG.info("Extraction skipped for meeting '{}': no transcript", event.displayTitle());
            return StageResult.skipped("no transcript");
        }
        try {
            ExtractionResult result = extractionGateway.extract(transcript, event.displayTitle(),
                    event.participantNames());
            return StageResult.success(result);
        } catch (MeetingRouterException e) {
            LOG.warn("Extraction failed for meeting '{}' (route '{}'): {}",
                    event.displayTitle(), route.name(), e.getMessage());
            return StageResult.isolatedFailure(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during extraction for meeting '{}' (route '{}')",
                    event.displayTitle(), route.name(), e);
            return StageResult.isolatedFailure("unexpected error", e);
        }
    }

    private TaskCreationSummary createTasks(MeetingEvent event, DestinationRoute route, ExtractionResult extraction) {
        if (!configChain.isTaskCreationEnabled(route)) {
            LOG.info("Task creation disabled for route '{}'", route.name());
            metrics.recordStage(STAGE_PARENT_TASK, StageResult.Status.SKIPPED.tagValue());
            return TaskCreationSummary.NONE;
        }
        Optional<String> listId = configChain.resolveTaskListId(route);
        if (listId.isEmpty()) {
            LOG.info("Task creation skipped for route '{}': no target list configured", route.name());
            metrics.recordStage(STAGE_PARENT_TASK, StageResult.Status.SKIPPED.tagValue());
            return TaskCreationSummary.NONE;
        }
        List<ExtractedTaskItem> items = extraction.items();

        double threshold = configChain.resolveConfidenceThreshold(route);
        long belowThreshold = items.stream().filter(item -> item.confidence() < threshold).count();
        String status = configChain.resolveTaskStatus(route);
        List<Long> assignees = configChain.resolveAssigneeIds(route);
        LOG.debug("Creating tasks in list {} (space {}, folder {}), status '{}', {} assignee(s); "
                        + "{} of {} item(s) below confidence threshold {}",
                listId.get(), configChain.resolveTaskSpaceId(route).orElse("-"),
                configChain.resolveTaskFolderId(route).orElse("-"), status, assignees.size(),
                belowThreshold, items.size(), threshold);

        StageResult<String> parent = createParent(event, route, listId.get(), status, assignees, items.size());
        metrics.recordStage(STAGE_PARENT_TASK, parent.status().tagValue());
        if (!parent.isSuccess()) {
            return new TaskCreationSummary(null, items.size(), 0, 0);
        }

        String token = configChain.resolveApiToken(route);
        int created = 0;
        int failed = 0;
        for (int i = 0; i < items.size(); i++) {
            ExtractedTaskItem item = items.get(i);
            CreateTaskRequest request = new CreateTaskRequest(listId.get(), item.task(),
                    formatter.subtaskDescription(item), assignees, status, parent.value());
            try {
                String subtaskId = taskService.createTask(token, request);
                created++;
                metrics.recordSubtask(true);
                LOG.debug("Created subtask {} ({}/{}) under {}", subtaskId, i + 1, items.size(), parent.value());
            } catch (RuntimeException e) {
                failed++;
                metrics.recordSubtask(false);
                LOG.warn("Failed to create subtask {}/{} '{}' under parent {} in list {} (route '{}'): {}",
                        i + 1, items.size(), item.task(), parent.value(), listId.get(), route.name(), e.getMessage());
            }
        }
        return new TaskCreationSummary(parent.value(), items.size(), created, failed);
    }

    private StageResult<String> createParent(MeetingEvent event, DestinationRoute route, String listId,
                                             String status, List<Long> assignees, int itemCount) {
        try {
            String token = configChain.resolveApiToken(route);
            CreateTaskRequest request = new CreateTaskRequest(listId, formatter.parentTaskName(event),
                    formatter.parentTaskDescription(event, itemCount), assignees, status, null);
            String parentId = taskService.createTask(token, request);
            LOG.info("Created parent task {} in list {} for route '{}'", parentId, listId, route.name());
            return StageResult.success(parentId);
        } catch (MeetingRouterException e) {
            LOG.warn("Failed to create parent task in list {} for route '{}': {}",
                    listId, route.name(), e.getMessage());
            return StageResult.isolatedFailure(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error creating parent task in list {} for route '{}'", listId, route.name(), e);
            return StageResult.isolatedFailure("unexpected error", e);
        }
    }

    /**
     * Per-event state holder; enforces forward-only transitions.
     */
    private static final class Tracker {

        private OrchestrationState state = OrchestrationState.RECEIVED;

        void moveTo(OrchestrationState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + state + " -> " + next);
            }
            LOG.trace("State {} -> {}", state, next);
            state = next;
        }
    }
}
