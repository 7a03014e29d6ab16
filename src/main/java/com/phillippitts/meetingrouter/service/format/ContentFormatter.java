package com.phillippitts.meetingrouter.service.format;

import com.phillippitts.meetingrouter.config.properties.FormatterProperties;
import com.phillippitts.meetingrouter.domain.ExtractedTaskItem;
import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.MeetingEvent.TranscriptEntry;
import com.phillippitts.meetingrouter.domain.RichTextBlock;
import com.phillippitts.meetingrouter.util.TextUtils;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds every piece of human-readable text sent to the comment/task service.
 *
 * <p>Comment body layout:
 * <pre>
 * {title} {dd-MM-yyyy} : {shareUrl}.
 *
 * Kindly check summary as below:
 *
 * {summary}
 * </pre>
 *
 * <p>Stateless apart from its immutable settings; safe to share between requests.
 */
public class ContentFormatter {

    static final String SUMMARY_HEADER = "Kindly check summary as below:";
    static final String NO_SUMMARY = "No summary provided by Fathom.";
    static final String NO_TRANSCRIPT = "Transcript not available.";
    static final String NO_EVIDENCE = "No supporting quote provided.";
    static final String TRUNCATION_MARKER = "\n\n[Truncated]";
    static final String DESCRIPTION_PREAMBLE =
            "Action items discussed in this meeting were extracted automatically from the transcript. "
                    + "Each item is tracked as a subtask of this task.";

    private final MeetingTimes times;
    private final int descriptionMaxChars;

    public ContentFormatter(FormatterProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        this.times = new MeetingTimes(props.zoneId());
        this.descriptionMaxChars = props.taskDescriptionMaxChars();
    }

    public String commentBody(MeetingEvent event) {
        String shareUrl = event.shareUrl().isEmpty() ? MeetingTimes.NOT_AVAILABLE : event.shareUrl();
        return String.join("\n",
                event.displayTitle() + " " + meetingDate(event) + " : " + shareUrl + ".",
                "",
                SUMMARY_HEADER,
                "",
                summaryText(event));
    }

    public List<RichTextBlock> commentBlocks(MeetingEvent event) {
        return RichTextConverter.toBlocks(commentBody(event));
    }

    /**
     * Formatted summary if present, else plain summary, else a fixed placeholder.
     */
    public String summaryText(MeetingEvent event) {
        if (!event.formattedSummary().isBlank()) {
            return event.formattedSummary().trim();
        }
        if (!event.summary().isBlank()) {
            return event.summary().trim();
        }
        return NO_SUMMARY;
    }

    public String meetingDate(MeetingEvent event) {
        return times.formatDate(event);
    }

    public String meetingDuration(MeetingEvent event) {
        return times.formatDuration(event);
    }

    /**
     * Renders {@code [HH:MM:SS] Speaker: text} per entry, newline-joined; "" when there is no
     * transcript.
     */
    public String renderTranscript(MeetingEvent event) {
        return event.transcript().stream()
                .map(ContentFormatter::renderEntry)
                .collect(Collectors.joining("\n"));
    }

    private static String renderEntry(TranscriptEntry entry) {
        String timestamp = entry.timestamp().isEmpty() ? "00:00:00" : entry.timestamp();
        String speaker = entry.speaker().isEmpty() ? "Unknown" : entry.speaker();
        return "[" + timestamp + "] " + speaker + ": " + entry.text();
    }

    public String parentTaskName(MeetingEvent event) {
        return meetingDate(event) + " - Meeting discussed tasks | Title: " + event.displayTitle()
                + " | Duration: " + meetingDuration(event);
    }

    /**
     * Parent task description, cut to the configured budget with a trailing marker that counts
     * toward the budget.
     */
    public String parentTaskDescription(MeetingEvent event, int extractedCount) {
        String transcript = renderTranscript(event);
        String shareUrl = event.shareUrl().isEmpty() ? MeetingTimes.NOT_AVAILABLE : event.shareUrl();
        String description = String.join("\n",
                DESCRIPTION_PREAMBLE,
                "",
                "Title: " + event.displayTitle(),
                "Date: " + meetingDate(event),
                "Duration: " + meetingDuration(event),
                "Link: " + shareUrl,
                "Extracted action items: " + extractedCount,
                "",
                "Transcript:",
                transcript.isEmpty() ? NO_TRANSCRIPT : transcript);
        return truncate(description, descriptionMaxChars);
    }

    public String subtaskDescription(ExtractedTaskItem item) {
        String evidence = TextUtils.isBlank(item.evidence()) ? NO_EVIDENCE : item.evidence();
        return "Evidence: " + evidence + "\nConfidence: "
                + String.format(Locale.ROOT, "%.2f", item.confidence());
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= TRUNCATION_MARKER.length()) {
            return TRUNCATION_MARKER.substring(0, maxChars);
        }
        return text.substring(0, maxChars - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }
}
