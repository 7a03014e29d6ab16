package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.domain.DestinationRoute;
import com.phillippitts.meetingrouter.domain.DestinationRoute.TaskRouting;
import com.phillippitts.meetingrouter.exception.MissingCredentialException;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the effective value of every per-destination tunable.
 *
 * <p>Each value is taken from the route-level override when present, then from the global
 * configuration, then from a built-in default:
 * <pre>
 * token                : route apiToken     → clickup.api-token                  → error
 * task list            : taskCreation.list  → route listId → clickup.list-id      → none (skip)
 * status               : taskCreation.status → clickup.task-status               → "backlog"
 * assignees            : taskCreation.ids   → clickup.task-assignee-ids → clickup.task-assignee-id
 * confidence threshold : taskCreation value → clickup.task-confidence-threshold → 0.5, clamped [0,1]
 * creation enabled     : taskCreation flag  → clickup.task-creation-enabled     → true
 * </pre>
 *
 * <p>Global values are interpreted once at construction; instances are immutable and thread-safe.
 */
public class ConfigResolutionChain {

    private static final Logger LOG = LogManager.getLogger(ConfigResolutionChain.class);

    public static final String DEFAULT_STATUS = "backlog";
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;

    private static final Set<String> DISABLED_VALUES = Set.of("false", "0", "no", "off");

    private final String globalToken;
    private final String globalListId;
    private final String globalStatus;
    private final List<Long> globalAssignees;
    private final double globalThreshold;
    private final boolean globalTaskCreationEnabled;

    public ConfigResolutionChain(ClickUpProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        this.globalToken = props.getApiToken();
        this.globalListId = props.getListId();
        this.globalStatus = props.getTaskStatus();
        this.globalAssignees = parseGlobalAssignees(props.getTaskAssigneeIds(), props.getTaskAssigneeId());
        this.globalThreshold = parseThreshold(props.getTaskConfidenceThreshold());
        this.globalTaskCreationEnabled = parseEnabledFlag(props.getTaskCreationEnabled());
    }

    /**
     * @throws MissingCredentialException when neither the route nor the global config has a token
     */
    public String resolveApiToken(DestinationRoute route) {
        String token = TextUtils.firstNonBlank(route.apiToken(), globalToken);
        if (token == null) {
            throw new MissingCredentialException("ClickUp API token", route.name());
        }
        return token;
    }

    /**
     * @return list for created tasks, or empty when task creation must be skipped
     */
    public Optional<String> resolveTaskListId(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        return Optional.ofNullable(TextUtils.firstNonBlank(
                tr == null ? null : tr.listId(),
                route.listId(),
                globalListId));
    }

    public Optional<String> resolveTaskSpaceId(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        return Optional.ofNullable(TextUtils.firstNonBlank(tr == null ? null : tr.spaceId(), route.spaceId()));
    }

    public Optional<String> resolveTaskFolderId(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        return Optional.ofNullable(TextUtils.firstNonBlank(tr == null ? null : tr.folderId(), route.folderId()));
    }

    public String resolveTaskStatus(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        String status = TextUtils.firstNonBlank(tr == null ? null : tr.status(), globalStatus);
        return status == null ? DEFAULT_STATUS : status;
    }

    /**
     * @return positive assignee ids; possibly empty
     */
    public List<Long> resolveAssigneeIds(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        if (tr != null) {
            List<Long> routeIds = tr.assigneeIds().stream().filter(id -> id != null && id > 0).toList();
            if (!routeIds.isEmpty()) {
                return routeIds;
            }
        }
        return globalAssignees;
    }

    /**
     * @return threshold in [0,1]
     */
    public double resolveConfidenceThreshold(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        if (tr != null && tr.confidenceThreshold() != null && Double.isFinite(tr.confidenceThreshold())) {
            return clamp(tr.confidenceThreshold());
        }
        return globalThreshold;
    }

    public boolean isTaskCreationEnabled(DestinationRoute route) {
        TaskRouting tr = route.taskRouting();
        if (tr != null && tr.enabled() != null) {
            return tr.enabled();
        }
        return globalTaskCreationEnabled;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double parseThreshold(String raw) {
        if (TextUtils.isBlank(raw)) {
            return DEFAULT_CONFIDENCE_THRESHOLD;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            if (!Double.isFinite(parsed)) {
                return DEFAULT_CONFIDENCE_THRESHOLD;
            }
            return clamp(parsed);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric task confidence threshold '{}', using {}", raw,
                    DEFAULT_CONFIDENCE_THRESHOLD);
            return DEFAULT_CONFIDENCE_THRESHOLD;
        }
    }

    static boolean parseEnabledFlag(String raw) {
        if (TextUtils.isBlank(raw)) {
            return true;
        }
        return !DISABLED_VALUES.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    static List<Long> parseGlobalAssignees(String csv, String legacySingle) {
        String source = TextUtils.firstNonBlank(csv, legacySingle);
        if (source == null) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>();
        for (String part : source.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                long id = Long.parseLong(trimmed);
                if (id > 0) {
                    ids.add(id);
                }
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring invalid assignee id '{}'", trimmed);
            }
        }
        return List.copyOf(ids);
    }
}
