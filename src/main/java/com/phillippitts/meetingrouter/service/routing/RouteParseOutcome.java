package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.domain.DestinationRoute;

import java.util.Objects;

/**
 * Result of validating one entry of the routing table: either an accepted route or a rejection
 * with the reason it was discarded.
 *
 * @param index           zero-based position of the entry in the configured array
 * @param route           accepted route, {@code null} when rejected
 * @param rejectionReason reason for discarding, {@code null} when accepted
 */
public record RouteParseOutcome(int index, DestinationRoute route, String rejectionReason) {

    public RouteParseOutcome {
        if ((route == null) == (rejectionReason == null)) {
            throw new IllegalArgumentException("exactly one of route or rejectionReason must be set");
        }
    }

    public static RouteParseOutcome accepted(int index, DestinationRoute route) {
        return new RouteParseOutcome(index, Objects.requireNonNull(route), null);
    }

    public static RouteParseOutcome rejected(int index, String reason) {
        return new RouteParseOutcome(index, null, Objects.requireNonNull(reason));
    }

    public boolean isAccepted() {
        return route != null;
    }
}
