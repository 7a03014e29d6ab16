package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.domain.DestinationRoute;
import com.phillippitts.meetingrouter.domain.DestinationRoute.TaskRouting;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the routing table JSON into strict {@link DestinationRoute} records.
 *
 * <p>Never throws on bad input: a malformed document yields an empty table and each invalid entry
 * is discarded with a reason that is logged and kept in {@link RouteTable#rejections()}.
 *
 * <p>Entry format:
 * <pre>
 * {
 *   "name": "OpenCables",
 *   "keywords": ["opencables", "sunil"],
 *   "taskId": "86abc",
 *   "apiToken": "pk_optional_override",
 *   "spaceId": "...", "folderId": "...", "listId": "...",
 *   "taskCreation": {
 *     "enabled": true, "listId": "...", "spaceId": "...", "folderId": "...",
 *     "status": "to do", "assigneeIds": [101, 102], "confidenceThreshold": 0.6
 *   }
 * }
 * </pre>
 */
public final class RouteTableParser {

    private static final Logger LOG = LogManager.getLogger(RouteTableParser.class);

    private RouteTableParser() {}

    /**
     * @param json routing table JSON, may be null or blank
     * @return parsed table; empty when the document is missing or malformed
     */
    public static RouteTable parse(String json) {
        if (TextUtils.isBlank(json)) {
            return RouteTable.empty();
        }

        Object root;
        try {
            root = new JSONTokener(json).nextValue();
        } catch (JSONException e) {
            LOG.error("Invalid routing table JSON, treating as empty: {}", e.getMessage());
            return RouteTable.empty();
        }
        if (!(root instanceof JSONArray array)) {
            LOG.warn("Routing table must be a JSON array, treating as empty");
            return RouteTable.empty();
        }

        List<DestinationRoute> routes = new ArrayList<>();
        List<RouteParseOutcome> rejections = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            RouteParseOutcome outcome = parseEntry(i, array.opt(i));
            if (outcome.isAccepted()) {
                routes.add(outcome.route());
            } else {
                LOG.warn("Skipping routing entry {}: {}", i, outcome.rejectionReason());
                rejections.add(outcome);
            }
        }
        LOG.info("Loaded {} destination route(s), {} rejected", routes.size(), rejections.size());
        return new RouteTable(routes, rejections);
    }

    static RouteParseOutcome parseEntry(int index, Object entry) {
        if (!(entry instanceof JSONObject obj)) {
            return RouteParseOutcome.rejected(index, "entry is not a JSON object");
        }

        String name = optTrimmedString(obj, "name");
        String taskId = optId(obj, "taskId");
        List<String> keywords = parseKeywords(obj.optJSONArray("keywords"));

        List<String> missing = new ArrayList<>();
        if (name == null) {
            missing.add("name");
        }
        if (taskId == null) {
            missing.add("taskId");
        }
        if (keywords.isEmpty()) {
            missing.add("keywords");
        }
        if (!missing.isEmpty()) {
            return RouteParseOutcome.rejected(index, "missing required field(s) " + missing);
        }

        DestinationRoute route = new DestinationRoute(
                name,
                keywords,
                taskId,
                optTrimmedString(obj, "apiToken"),
                optId(obj, "spaceId"),
                optId(obj, "folderId"),
                optId(obj, "listId"),
                parseTaskRouting(obj.optJSONObject("taskCreation")));
        return RouteParseOutcome.accepted(index, route);
    }

    private static List<String> parseKeywords(JSONArray raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        for (int i = 0; i < raw.length(); i++) {
            if (raw.opt(i) instanceof String keyword) {
                String normalized = TextUtils.normalize(keyword);
                if (!normalized.isEmpty()) {
                    keywords.add(normalized);
                }
            }
        }
        return List.copyOf(keywords);
    }

    private static TaskRouting parseTaskRouting(JSONObject obj) {
        if (obj == null) {
            return null;
        }
        Boolean enabled = obj.opt("enabled") instanceof Boolean b ? b : null;
        Double threshold = obj.opt("confidenceThreshold") instanceof Number n ? n.doubleValue() : null;
        return new TaskRouting(
                enabled,
                optId(obj, "listId"),
                optId(obj, "spaceId"),
                optId(obj, "folderId"),
                optTrimmedString(obj, "status"),
                parseAssigneeIds(obj.optJSONArray("assigneeIds")),
                threshold);
    }

    private static List<Long> parseAssigneeIds(JSONArray raw) {
        if (raw == null) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < raw.length(); i++) {
            Object value = raw.opt(i);
            if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
                ids.add(n.longValue());
            } else if (value instanceof String s) {
                try {
                    ids.add(Long.parseLong(s.trim()));
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring non-numeric assignee id '{}'", s);
                }
            }
        }
        return ids;
    }

    private static String optTrimmedString(JSONObject obj, String key) {
        if (obj.opt(key) instanceof String s && !s.isBlank()) {
            return s.trim();
        }
        return null;
    }

    /**
     * Ids are usually strings but list/space ids are often written as bare numbers.
     */
    private static String optId(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return Long.toString(n.longValue());
        }
        return optTrimmedString(obj, key);
    }
}
