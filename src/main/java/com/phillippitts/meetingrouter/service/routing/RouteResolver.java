package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.domain.DestinationRoute;
import com.phillippitts.meetingrouter.domain.MeetingEvent;
import com.phillippitts.meetingrouter.domain.MeetingEvent.Participant;
import com.phillippitts.meetingrouter.domain.ResolvedRoute;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Selects the destination route for a meeting by keyword overlap.
 *
 * <p>The matching text is the normalized meeting title plus the name, email and email domain of
 * the recorder and of every invitee. A route scores one point per keyword that is a substring of
 * any matching field. The highest score wins; ties go to the route listed first in
 * configuration. When nothing scores, the configured default destination (if any) is returned as
 * a synthetic route named {@code default}.
 *
 * <p>Stateless and thread-safe; the route table is immutable.
 */
public class RouteResolver {

    private static final Logger LOG = LogManager.getLogger(RouteResolver.class);

    private final RouteTable routeTable;
    private final String defaultTaskId;

    /**
     * @param routeTable    parsed routing table
     * @param defaultTaskId fallback destination id, or {@code null} for none
     */
    public RouteResolver(RouteTable routeTable, String defaultTaskId) {
        this.routeTable = Objects.requireNonNull(routeTable, "routeTable must not be null");
        this.defaultTaskId = TextUtils.isBlank(defaultTaskId) ? null : defaultTaskId.trim();
    }

    /**
     * Resolves the best route for the event.
     *
     * @param event inbound meeting event
     * @return best-matching route, the default route, or empty when neither exists
     */
    public Optional<ResolvedRoute> resolve(MeetingEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (routeTable.isEmpty() && defaultTaskId == null) {
            return Optional.empty();
        }

        List<String> fields = matchingFields(event);
        List<ScoredRoute> scored = new ArrayList<>();
        for (DestinationRoute route : routeTable.routes()) {
            List<String> matched = route.keywords().stream()
                    .filter(keyword -> fields.stream().anyMatch(field -> field.contains(keyword)))
                    .toList();
            if (!matched.isEmpty()) {
                scored.add(new ScoredRoute(route, matched));
            }
        }

        // List.sort is stable, so equal scores keep configuration order
        scored.sort(Comparator.comparingInt(ScoredRoute::score).reversed());

        if (!scored.isEmpty()) {
            ScoredRoute best = scored.get(0);
            LOG.debug("Route '{}' selected with score {} ({} candidate(s))",
                    best.route().name(), best.score(), scored.size());
            return Optional.of(new ResolvedRoute(best.route(), best.matched()));
        }

        if (defaultTaskId != null) {
            LOG.debug("No route keyword matched, using default destination");
            return Optional.of(new ResolvedRoute(DestinationRoute.fallback(defaultTaskId), List.of()));
        }
        return Optional.empty();
    }

    /**
     * Normalized, non-empty text fields that keywords are matched against.
     */
    static List<String> matchingFields(MeetingEvent event) {
        Stream<String> title = Stream.of(event.meetingTitle());
        Stream<String> people = Stream.concat(Stream.of(event.recordedBy()), event.invitees().stream())
                .flatMap(RouteResolver::participantFields);
        return Stream.concat(title, people)
                .map(TextUtils::normalize)
                .filter(field -> !field.isEmpty())
                .toList();
    }

    private static Stream<String> participantFields(Participant participant) {
        return Stream.of(participant.name(), participant.email(), participant.emailDomain());
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    public Optional<String> getDefaultTaskId() {
        return Optional.ofNullable(defaultTaskId);
    }

    private record ScoredRoute(DestinationRoute route, List<String> matched) {
        int score() {
            return matched.size();
        }
    }
}
