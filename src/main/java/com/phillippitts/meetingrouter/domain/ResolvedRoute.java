package com.phillippitts.meetingrouter.domain;

import java.util.List;
import java.util.Objects;

/**
 * The route selected for one meeting event, with the keywords that matched it in configuration
 * order.
 *
 * @param route           selected route
 * @param matchedKeywords keywords that matched; empty for the default route
 */
public record ResolvedRoute(DestinationRoute route, List<String> matchedKeywords) {

    public ResolvedRoute {
        Objects.requireNonNull(route, "route must not be null");
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public String name() {
        return route.name();
    }

    public String commentTaskId() {
        return route.commentTaskId();
    }

    public boolean isFallback() {
        return matchedKeywords.isEmpty();
    }
}
