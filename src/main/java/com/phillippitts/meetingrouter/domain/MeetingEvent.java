package com.phillippitts.meetingrouter.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Immutable view of a completed-meeting webhook payload.
 *
 * <p>Every string field is non-null; absent values are represented by the empty string so that
 * formatting and matching code never has to null-check. Timestamps are kept as the raw strings the
 * provider sent and are parsed lazily by the formatter.
 *
 * @param eventName           provider event name, empty if not sent
 * @param meetingTitle        raw meeting title, empty if not sent
 * @param shareUrl            share link for the recording, empty if not sent
 * @param summary             plain-text summary, empty if not sent
 * @param formattedSummary    markdown summary, empty if not sent
 * @param recordedBy          the recording participant
 * @param invitees            calendar invitees in payload order
 * @param recordingStartTime  raw recording start timestamp
 * @param recordingEndTime    raw recording end timestamp
 * @param scheduledStartTime  raw scheduled start timestamp
 * @param scheduledEndTime    raw scheduled end timestamp
 * @param createdAt           raw creation timestamp
 * @param timestamp           raw generic timestamp
 * @param transcript          transcript entries in spoken order
 */
public record MeetingEvent(
        String eventName,
        String meetingTitle,
        String shareUrl,
        String summary,
        String formattedSummary,
        Participant recordedBy,
        List<Participant> invitees,
        String recordingStartTime,
        String recordingEndTime,
        String scheduledStartTime,
        String scheduledEndTime,
        String createdAt,
        String timestamp,
        List<TranscriptEntry> transcript
) {

    /** Title used whenever the payload does not carry one. */
    public static final String UNTITLED = "Untitled Meeting";

    public MeetingEvent {
        eventName = nullToEmpty(eventName);
        meetingTitle = nullToEmpty(meetingTitle);
        shareUrl = nullToEmpty(shareUrl);
        summary = nullToEmpty(summary);
        formattedSummary = nullToEmpty(formattedSummary);
        recordedBy = recordedBy == null ? Participant.EMPTY : recordedBy;
        invitees = invitees == null ? List.of() : List.copyOf(invitees);
        recordingStartTime = nullToEmpty(recordingStartTime);
        recordingEndTime = nullToEmpty(recordingEndTime);
        scheduledStartTime = nullToEmpty(scheduledStartTime);
        scheduledEndTime = nullToEmpty(scheduledEndTime);
        createdAt = nullToEmpty(createdAt);
        timestamp = nullToEmpty(timestamp);
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }

    /**
     * Returns the meeting title or {@value #UNTITLED} when the payload has none.
     */
    public String displayTitle() {
        String trimmed = meetingTitle.trim();
        return trimmed.isEmpty() ? UNTITLED : meetingTitle;
    }

    /**
     * Names of everyone attached to the meeting (recorder first), blanks removed.
     */
    public List<String> participantNames() {
        return Stream.concat(Stream.of(recordedBy), invitees.stream())
                .map(Participant::name)
                .filter(name -> !name.isBlank())
                .toList();
    }

    public boolean hasTranscript() {
        return !transcript.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * A recorder or invitee. Fields are never null.
     */
    public record Participant(String name, String email, String emailDomain) {

        public static final Participant EMPTY = new Participant("", "", "");

        public Participant {
            name = Objects.requireNonNullElse(name, "");
            email = Objects.requireNonNullElse(email, "");
            emailDomain = Objects.requireNonNullElse(emailDomain, "");
        }
    }

    /**
     * One spoken line of the transcript.
     */
    public record TranscriptEntry(String timestamp, String speaker, String text) {

        public TranscriptEntry {
            timestamp = Objects.requireNonNullElse(timestamp, "");
            speaker = Objects.requireNonNullElse(speaker, "");
            text = Objects.requireNonNullElse(text, "");
        }
    }
}
