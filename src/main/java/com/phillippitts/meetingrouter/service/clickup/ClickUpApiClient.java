package com.phillippitts.meetingrouter.service.clickup;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.domain.RichTextBlock;
import com.phillippitts.meetingrouter.exception.MissingIdentifierException;
import com.phillippitts.meetingrouter.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * ClickUp v2 REST client for comments and tasks.
 *
 * <p>ClickUp expects the personal token in the {@code Authorization} header as-is, without a
 * scheme. Error responses carry the reason in an {@code err} field.
 */
public class ClickUpApiClient implements CommentService, TaskService {

    private static final Logger LOG = LogManager.getLogger(ClickUpApiClient.class);

    static final String SERVICE = "clickup";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ClickUpApiClient(RestTemplate restTemplate, ClickUpProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.baseUrl = Objects.requireNonNull(props, "props must not be null").getApiBaseUrl();
    }

    @Override
    public String postComment(String apiToken, CommentRequest request) {
        JSONObject body = new JSONObject();
        body.put("notify_all", request.notifyWatchers());
        body.put("comment", toWire(request.blocks()));

        Reply reply = post(apiToken, baseUrl + "/task/{taskId}/comment", body,
                "ClickUp comment failed", "taskId", request.taskId());
        Object id = reply.body().opt("id");
        String commentId = id == null || JSONObject.NULL.equals(id) ? null : String.valueOf(id);
        LOG.debug("Posted comment {} on task {} ({} blocks)", commentId, request.taskId(), request.blocks().size());
        return commentId;
    }

    @Override
    public String createTask(String apiToken, CreateTaskRequest request) {
        JSONObject body = new JSONObject();
        body.put("name", request.name());
        if (!TextUtils.isBlank(request.description())) {
            body.put("description", request.description());
        }
        if (!request.assigneeIds().isEmpty()) {
            body.put("assignees", new JSONArray(request.assigneeIds()));
        }
        if (!TextUtils.isBlank(request.status())) {
            body.put("status", request.status());
        }
        if (request.isSubtask()) {
            body.put("parent", request.parentTaskId());
        }

        Reply reply = post(apiToken, baseUrl + "/list/{listId}/task", body,
                "ClickUp task creation failed", "listId", request.listId());
        Object id = reply.body().opt("id");
        String taskId = id == null || JSONObject.NULL.equals(id) ? "" : String.valueOf(id);
        if (taskId.isEmpty()) {
            throw new MissingIdentifierException(SERVICE, reply.status(), request.isSubtask() ? "subtask" : "task");
        }
        return taskId;
    }

    static JSONArray toWire(List<RichTextBlock> blocks) {
        JSONArray wire = new JSONArray();
        for (RichTextBlock block : blocks) {
            wire.put(new JSONObject()
                    .put("text", block.text())
                    .put("attributes", new JSONObject(block.attributes())));
        }
        return wire;
    }

    private Reply post(String apiToken, String urlTemplate, JSONObject body, String failureMessage,
                            String pathName, String pathValue) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, apiToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<String> entity = new HttpEntity<>(body.toString(), headers);

        try {
            ResponseEntity<String> response = restTemplate.exchange(urlTemplate, HttpMethod.POST, entity,
                    String.class, pathValue);
            int status = response.getStatusCode().value();
            return new Reply(status, parseBody(response.getBody(), status));
        } catch (RestClientResponseException e) {
            throw RemoteServiceExceptionBuilder.create(failureMessage)
                    .service(SERVICE)
                    .status(e.getStatusCode().value())
                    .remoteMessage(errorMessage(e.getResponseBodyAsString()))
                    .metadata(pathName, pathValue)
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw RemoteServiceExceptionBuilder.create("ClickUp API unreachable")
                    .service(SERVICE)
                    .remoteMessage(e.getMessage())
                    .metadata(pathName, pathValue)
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw RemoteServiceExceptionBuilder.create(failureMessage)
                    .service(SERVICE)
                    .remoteMessage(e.getMessage())
                    .metadata(pathName, pathValue)
                    .cause(e)
                    .build();
        }
    }

    private static JSONObject parseBody(String body, int status) {
        if (TextUtils.isBlank(body)) {
            return new JSONObject();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw RemoteServiceExceptionBuilder.create("Failed to parse ClickUp response JSON")
                    .service(SERVICE)
                    .status(status)
                    .remoteMessage(TextUtils.preview(body, 200))
                    .cause(e)
                    .build();
        }
    }

    private record Reply(int status, JSONObject body) {}

    /** {@code err} from an error body, or {@code null} when absent. */
    static String errorMessage(String body) {
        if (TextUtils.isBlank(body)) {
            return null;
        }
        try {
            return new JSONObject(body).optString("err", null);
        } catch (JSONException e) {
            LOG.debug("ClickUp error body is not JSON: {}", TextUtils.preview(body, 200));
            return null;
        }
    }
}
