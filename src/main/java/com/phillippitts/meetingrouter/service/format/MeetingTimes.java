package com.phillippitts.meetingrouter.service.format;

import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Parses provider timestamps and renders the meeting date and duration.
 *
 * <p>Accepted timestamp shapes: ISO offset/zoned date-time, instant, local date-time and local
 * date. Local values are interpreted in the configured zone.
 */
final class MeetingTimes {

    static final String NOT_AVAILABLE = "N/A";

    private static final Logger LOG = LogManager.getLogger(MeetingTimes.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy", Locale.ROOT);

    private static final List<BiFunction<String, ZoneId, Instant>> PARSERS = List.of(
            (value, zone) -> OffsetDateTime.parse(value).toInstant(),
            (value, zone) -> ZonedDateTime.parse(value).toInstant(),
            (value, zone) -> LocalDateTime.parse(value).atZone(zone).toInstant(),
            (value, zone) -> LocalDate.parse(value).atStartOfDay(zone).toInstant());

    private final ZoneId zone;

    MeetingTimes(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * Date of the meeting as {@code dd-MM-yyyy}, taken from the first available of recording
     * start, scheduled start, creation time and generic timestamp.
     *
     * @return formatted date or {@value #NOT_AVAILABLE}
     */
    String formatDate(MeetingEvent event) {
        String raw = TextUtils.firstNonBlank(event.recordingStartTime(), event.scheduledStartTime(),
                event.createdAt(), event.timestamp());
        return parse(raw)
                .map(instant -> DATE_FORMAT.format(instant.atZone(zone)))
                .orElse(NOT_AVAILABLE);
    }

    /**
     * Meeting length from recording times, else scheduled times.
     *
     * @return {@code HHh MMm}, {@code MMm} or {@value #NOT_AVAILABLE}
     */
    String formatDuration(MeetingEvent event) {
        Optional<Duration> duration = between(event.recordingStartTime(), event.recordingEndTime());
        if (duration.isEmpty()) {
            duration = between(event.scheduledStartTime(), event.scheduledEndTime());
        }
        return duration
                .filter(d -> !d.isNegative() && !d.isZero())
                .map(MeetingTimes::render)
                .orElse(NOT_AVAILABLE);
    }

    private Optional<Duration> between(String rawStart, String rawEnd) {
        Optional<Instant> start = parse(rawStart);
        Optional<Instant> end = parse(rawEnd);
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(start.get(), end.get()));
    }

    static String render(Duration duration) {
        long totalMinutes = duration.toMinutes();
        long hours = totalMinutes / 60;
        long minutes = totalMinutes % 60;
        if (hours >= 1) {
            return String.format(Locale.ROOT, "%02dh %02dm", hours, minutes);
        }
        return String.format(Locale.ROOT, "%02dm", minutes);
    }

    Optional<Instant> parse(String raw) {
        if (TextUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (BiFunction<String, ZoneId, Instant> parser : PARSERS) {
            try {
                return Optional.of(parser.apply(value, zone));
            } catch (DateTimeParseException e) {
                LOG.trace("Timestamp '{}' did not match: {}", value, e.getMessage());
            }
        }
        return Optional.empty();
    }
}
