package com.phillippitts.meetingrouter.domain;

import com.phillippitts.meetingrouter.util.TextUtils;

import java.util.List;
import java.util.Objects;

/**
 * A validated entry of the destination routing table.
 *
 * <p>Instances are normally produced by the route table parser (or as the synthetic default
 * route). Keywords are normalized on construction (lower-cased, trimmed, de-duplicated in
 * order) and blank entries are dropped, so a directly built route matches the same way.
 *
 * @param name          route name used in logs and responses
 * @param keywords      normalized match keywords; empty only for the synthetic default route
 * @param commentTaskId id of the task that receives meeting comments
 * @param apiToken      per-route API token override, or {@code null}
 * @param spaceId       optional space id, or {@code null}
 * @param folderId      optional folder id, or {@code null}
 * @param listId        optional list id, or {@code null}
 * @param taskRouting   optional task-creation overrides, or {@code null}
 */
public record DestinationRoute(
        String name,
        List<String> keywords,
        String commentTaskId,
        String apiToken,
        String spaceId,
        String folderId,
        String listId,
        TaskRouting taskRouting
) {

    /** Name of the route synthesized from the configured fallback destination. */
    public static final String DEFAULT_ROUTE_NAME = "default";

    public DestinationRoute {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(commentTaskId, "commentTaskId must not be null");
        keywords = keywords == null ? List.of() : keywords.stream()
                .map(TextUtils::normalize)
                .filter(keyword -> !keyword.isEmpty())
                .distinct()
                .toList();
    }

    /**
     * Builds the fallback route that carries no keywords and no overrides.
     *
     * @param fallbackTaskId configured default destination id
     * @return synthetic route named {@value #DEFAULT_ROUTE_NAME}
     */
    public static DestinationRoute fallback(String fallbackTaskId) {
        return new DestinationRoute(DEFAULT_ROUTE_NAME, List.of(), fallbackTaskId,
                null, null, null, null, null);
    }

    /**
     * Task-creation overrides attached to a route. Every field is optional ({@code null} when
     * absent) so the resolution chain can fall through to global defaults.
     *
     * @param enabled             explicit enable/disable of task creation
     * @param listId              target list for created tasks
     * @param spaceId             target space, informational
     * @param folderId            target folder, informational
     * @param status              status for created tasks
     * @param assigneeIds         assignee ids; empty means "not overridden"
     * @param confidenceThreshold raw threshold override, clamped on resolution
     */
    public record TaskRouting(
            Boolean enabled,
            String listId,
            String spaceId,
            String folderId,
            String status,
            List<Long> assigneeIds,
            Double confidenceThreshold
    ) {
        public TaskRouting {
            assigneeIds = assigneeIds == null ? List.of() : List.copyOf(assigneeIds);
        }
    }
}
