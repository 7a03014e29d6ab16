package com.phillippitts.meetingrouter.service.intake;

import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.MeetingEvent.Participant;
import com.phillippitts.meetingrouter.domain.MeetingEvent.TranscriptEntry;
import com.phillippitts.meetingrouter.exception.InvalidPayloadException;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a Fathom webhook body to a {@link MeetingEvent}.
 *
 * <p>Only the envelope is strict: the body must be a non-empty JSON object. Every optional field
 * of the wrong type is treated as absent, so a partially malformed payload still routes.
 */
public final class MeetingEventParser {

    private MeetingEventParser() {}

    /**
     * @param body raw request body
     * @return parsed event
     * @throws InvalidPayloadException if the body is blank, not a JSON object, or an empty object
     */
    public static MeetingEvent parse(String body) {
        if (TextUtils.isBlank(body)) {
            throw new InvalidPayloadException("Empty payload");
        }
        Object root;
        try {
            root = new JSONTokener(body).nextValue();
        } catch (JSONException e) {
            throw new InvalidPayloadException("Body is not valid JSON", e);
        }
        if (!(root instanceof JSONObject obj)) {
            throw new InvalidPayloadException("Body must be a JSON object");
        }
        if (obj.isEmpty()) {
            throw new InvalidPayloadException("Empty payload");
        }
        return fromJson(obj);
    }

    static MeetingEvent fromJson(JSONObject obj) {
        JSONObject defaultSummary = obj.optJSONObject("default_summary");
        return new MeetingEvent(
                str(obj, "event"),
                firstPresent(str(obj, "meeting_title"), str(obj, "title")),
                firstPresent(str(obj, "share_url"), str(obj, "url")),
                str(obj, "summary"),
                defaultSummary == null ? "" : str(defaultSummary, "markdown_formatted"),
                participant(obj.optJSONObject("recorded_by")),
                participants(obj.optJSONArray("calendar_invitees")),
                str(obj, "recording_start_time"),
                str(obj, "recording_end_time"),
                str(obj, "scheduled_start_time"),
                str(obj, "scheduled_end_time"),
                str(obj, "created_at"),
                str(obj, "timestamp"),
                transcript(obj.optJSONArray("transcript")));
    }

    private static Participant participant(JSONObject obj) {
        if (obj == null) {
            return Participant.EMPTY;
        }
        return new Participant(str(obj, "name"), str(obj, "email"), str(obj, "email_domain"));
    }

    private static List<Participant> participants(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<Participant> result = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject invitee = array.optJSONObject(i);
            if (invitee != null) {
                result.add(participant(invitee));
            }
        }
        return result;
    }

    private static List<TranscriptEntry> transcript(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<TranscriptEntry> entries = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject entry = array.optJSONObject(i);
            if (entry == null) {
                continue;
            }
            JSONObject speaker = entry.optJSONObject("speaker");
            entries.add(new TranscriptEntry(
                    str(entry, "timestamp"),
                    speaker == null ? "" : str(speaker, "display_name"),
                    str(entry, "text")));
        }
        return entries;
    }

    /** String value of {@code key}, or "" when absent or not a string. */
    private static String str(JSONObject obj, String key) {
        return obj.opt(key) instanceof String s ? s : "";
    }

    private static String firstPresent(String preferred, String fallback) {
        return preferred.isEmpty() ? fallback : preferred;
    }
}
