package com.phillippitts.meetingrouter.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the ClickUp comment/task service and the global routing defaults.
 *
 * <p>The lenient tunables ({@code task-confidence-threshold}, {@code task-creation-enabled},
 * {@code task-assignee-ids}) are kept as raw strings: a malformed value must fall back to the
 * built-in default instead of failing startup, and that interpretation lives in
 * {@code ConfigResolutionChain}.
 *
 * <p>Example application.properties:
 * <pre>
 * clickup.api-token=pk_123
 * clickup.routing-json=[{"name":"OpenCables","keywords":["opencables"],"taskId":"86abc"}]
 * clickup.default-task-id=86fallback
 * clickup.list-id=901234
 * clickup.task-status=backlog
 * clickup.task-assignee-ids=101,102
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "clickup")
public class ClickUpProperties {

    static final String DEFAULT_API_BASE_URL = "https://api.clickup.com/api/v2";

    @NotBlank
    private final String apiBaseUrl;

    /** Shared API token; routes may override it. */
    private final String apiToken;

    /** JSON array describing destination routes. */
    private final String routingJson;

    /** Task that receives comments when no route keyword matches. */
    private final String defaultTaskId;

    /** Global list id for task creation. */
    private final String listId;

    private final String taskStatus;
    private final String taskAssigneeIds;

    /** Legacy single-assignee variable, read when {@code task-assignee-ids} is empty. */
    private final String taskAssigneeId;

    private final String taskConfidenceThreshold;
    private final String taskCreationEnabled;

    @NotNull
    private final Duration connectTimeout;

    @NotNull
    private final Duration readTimeout;

    @ConstructorBinding
    public ClickUpProperties(String apiBaseUrl, String apiToken, String routingJson, String defaultTaskId,
                             String listId, String taskStatus, String taskAssigneeIds, String taskAssigneeId,
                             String taskConfidenceThreshold, String taskCreationEnabled,
                             Duration connectTimeout, Duration readTimeout) {
        this.apiBaseUrl = isBlank(apiBaseUrl) ? DEFAULT_API_BASE_URL : stripTrailingSlash(apiBaseUrl.trim());
        this.apiToken = trimToNull(apiToken);
        this.routingJson = trimToNull(routingJson);
        this.defaultTaskId = trimToNull(defaultTaskId);
        this.listId = trimToNull(listId);
        this.taskStatus = trimToNull(taskStatus);
        this.taskAssigneeIds = trimToNull(taskAssigneeIds);
        this.taskAssigneeId = trimToNull(taskAssigneeId);
        this.taskConfidenceThreshold = trimToNull(taskConfidenceThreshold);
        this.taskCreationEnabled = trimToNull(taskCreationEnabled);
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    }

    /**
     * Creates properties with only the fields the routing core reads; everything else defaults.
     */
    public static ClickUpProperties of(String apiToken, String routingJson, String defaultTaskId, String listId) {
        return new ClickUpProperties(null, apiToken, routingJson, defaultTaskId, listId,
                null, null, null, null, null, null, null);
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public String getRoutingJson() {
        return routingJson;
    }

    public String getDefaultTaskId() {
        return defaultTaskId;
    }

    public String getListId() {
        return listId;
    }

    public String getTaskStatus() {
        return taskStatus;
    }

    public String getTaskAssigneeIds() {
        return taskAssigneeIds;
    }

    public String getTaskAssigneeId() {
        return taskAssigneeId;
    }

    public String getTaskConfidenceThreshold() {
        return taskConfidenceThreshold;
    }

    public String getTaskCreationEnabled() {
        return taskCreationEnabled;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
