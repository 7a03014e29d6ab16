package com.phillippitts.meetingrouter.service.routing;

import com.phillippitts.meetingrouter.domain.DestinationRoute;

import java.util.List;

/**
 * Immutable, parsed routing table. Routes keep their configuration order, which is the tie-break
 * order used by {@link RouteResolver}.
 *
 * @param routes     accepted routes in configuration order
 * @param rejections entries that were discarded, with reasons
 */
public record RouteTable(List<DestinationRoute> routes, List<RouteParseOutcome> rejections) {

    private static final RouteTable EMPTY = new RouteTable(List.of(), List.of());

    public RouteTable {
        routes = routes == null ? List.of() : List.copyOf(routes);
        rejections = rejections == null ? List.of() : List.copyOf(rejections);
    }

    public static RouteTable empty() {
        return EMPTY;
    }

    public static RouteTable of(DestinationRoute... routes) {
        return new RouteTable(List.of(routes), List.of());
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    public int size() {
        return routes.size();
    }
}
