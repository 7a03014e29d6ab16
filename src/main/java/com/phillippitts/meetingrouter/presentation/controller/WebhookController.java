package com.phillippitts.meetingrouter.presentation.controller;

import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.OrchestrationResult;
import com.phillippitts.meetingrouter.service.intake.MeetingEventParser;
import com.phillippitts.meetingrouter.service.orchestration.TaskOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receives Fathom meeting webhooks.
 *
 * <p>200 when the comment was posted, 202 when no destination matched, 400 for an empty or
 * non-object body (via {@code GlobalExceptionHandler}), 500 when the comment post failed.
 */
@RestController
class WebhookController {

    private static final Logger LOG = LogManager.getLogger(WebhookController.class);

    static final String UNMATCHED_MESSAGE = "Webhook received but no ClickUp mapping matched this meeting";
    static final String POSTED_MESSAGE = "Webhook received and ClickUp comment added";

    private final TaskOrchestrator orchestrator;

    WebhookController(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/fathom")
    ResponseEntity<Map<String, Object>> fathom(@RequestBody(required = false) String body) {
        Instant receivedAt = Instant.now();
        MeetingEvent event = MeetingEventParser.parse(body);
        LOG.info("Fathom webhook received: event={}, meetingTitle='{}', shareUrl={}",
                event.eventName().isEmpty() ? "unknown" : event.eventName(), event.displayTitle(),
                event.shareUrl().isEmpty() ? null : event.shareUrl());

        OrchestrationResult result = orchestrator.process(event);
        if (!result.isMatched()) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("postedToClickUp", false);
            response.put("message", UNMATCHED_MESSAGE);
            response.put("meetingTitle", result.meetingTitle());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        }
        return ResponseEntity.ok(postedResponse(result, receivedAt));
    }

    private static Map<String, Object> postedResponse(OrchestrationResult result, Instant receivedAt) {
        Map<String, Object> route = new LinkedHashMap<>();
        route.put("name", result.routeName());
        route.put("taskId", result.commentTaskId());
        route.put("matchedKeywords", result.matchedKeywords());

        Map<String, Object> extraction = new LinkedHashMap<>();
        extraction.put("extractedCount", result.extractedCount());
        extraction.put("parentTaskId", result.parentTaskId());
        extraction.put("eligibleSubtasks", result.eligibleSubtasks());
        extraction.put("createdSubtasks", result.createdSubtasks());
        extraction.put("failedSubtasks", result.failedSubtasks());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("postedToClickUp", true);
        response.put("route", route);
        response.put("clickUpCommentId", result.commentId());
        response.put("taskExtraction", extraction);
        response.put("message", POSTED_MESSAGE);
        response.put("receivedAt", receivedAt.toString());
        return response;
    }
}
