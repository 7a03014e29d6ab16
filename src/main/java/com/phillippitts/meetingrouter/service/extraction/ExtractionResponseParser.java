package com.phillippitts.meetingrouter.service.extraction;

import com.phillippitts.meetingrouter.domain.ExtractedTaskItem;
import com.phillippitts.meetingrouter.domain.ExtractedTaskItem.Priority;
import com.phillippitts.meetingrouter.domain.ExtractionResult;
import com.phillippitts.meetingrouter.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the model's message content into an {@link ExtractionResult}.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "meeting_summary": "string",
 *   "tasks": [
 *     {"task": "...", "owner": "...", "due_date": "YYYY-MM-DD or null",
 *      "priority": "high|medium|low", "confidence": 0.0, "evidence": "..."}
 *   ]
 * }
 * </pre>
 * The object may be wrapped in a {@code ```json} fence. Each malformed field falls back to its
 * default; items whose task text is empty are dropped.
 */
public final class ExtractionResponseParser {

    private static final Logger LOG = LogManager.getLogger(ExtractionResponseParser.class);

    static final String SERVICE = "groq";

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```",
            Pattern.CASE_INSENSITIVE);

    private ExtractionResponseParser() {}

    /**
     * @param content raw message content from the model
     * @return parsed result
     * @throws com.phillippitts.meetingrouter.exception.RemoteServiceException if the content is
     *         not a JSON object
     */
    public static ExtractionResult parse(String content) {
        String candidate = stripFence(content == null ? "" : content.trim());
        JSONObject root;
        try {
            Object value = new JSONTokener(candidate).nextValue();
            if (!(value instanceof JSONObject obj)) {
                throw RemoteServiceExceptionBuilder.create("Groq response is not a JSON object")
                        .service(SERVICE)
                        .remoteMessage(TextUtils.preview(candidate, 120))
                        .build();
            }
            root = obj;
        } catch (JSONException e) {
            throw RemoteServiceExceptionBuilder.create("Failed to parse Groq response JSON")
                    .service(SERVICE)
                    .remoteMessage(e.getMessage())
                    .cause(e)
                    .build();
        }

        String summary = root.opt("meeting_summary") instanceof String s ? s : "";
        JSONArray tasks = root.optJSONArray("tasks");
        List<ExtractedTaskItem> items = new ArrayList<>();
        int dropped = 0;
        if (tasks != null) {
            for (int i = 0; i < tasks.length(); i++) {
                JSONObject task = tasks.optJSONObject(i);
                ExtractedTaskItem item = task == null ? null : toItem(task);
                if (item == null) {
                    dropped++;
                } else {
                    items.add(item);
                }
            }
        }
        if (dropped > 0) {
            LOG.debug("Dropped {} extracted item(s) without task text", dropped);
        }
        return new ExtractionResult(summary, items);
    }

    static String stripFence(String content) {
        Matcher fenced = FENCE.matcher(content);
        return fenced.find() ? fenced.group(1) : content;
    }

    private static ExtractedTaskItem toItem(JSONObject task) {
        String text = task.opt("task") instanceof String s ? s.trim() : "";
        if (text.isEmpty()) {
            return null;
        }
        String owner = task.opt("owner") instanceof String s ? s : ExtractedTaskItem.UNASSIGNED;
        String dueDate = task.opt("due_date") instanceof String s ? s : null;
        Priority priority = Priority.fromWire(task.opt("priority") instanceof String s ? s : null);
        double confidence = task.opt("confidence") instanceof Number n ? n.doubleValue() : 0.0;
        String evidence = task.opt("evidence") instanceof String s ? s : "";
        return new ExtractedTaskItem(text, owner, dueDate, priority, confidence, evidence);
    }
}
