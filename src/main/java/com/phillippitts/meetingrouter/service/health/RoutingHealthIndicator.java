package com.phillippitts.meetingrouter.service.health;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.service.extraction.ExtractionGateway;
import com.phillippitts.meetingrouter.service.routing.RouteResolver;
import com.phillippitts.meetingrouter.service.routing.RouteTable;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the routing configuration.
 *
 * <p>Reports:
 * <ul>
 *   <li>whether a global ClickUp token is configured</li>
 *   <li>loaded and rejected route counts</li>
 *   <li>the default destination, if any</li>
 *   <li>whether transcript extraction is enabled</li>
 * </ul>
 *
 * <p>DOWN when no event could ever be delivered: no routes and no default destination, or
 * no token anywhere. Exposed via /actuator/health as {@code routing}.
 */
public class RoutingHealthIndicator implements HealthIndicator {

    private final RouteResolver resolver;
    private final ClickUpProperties clickUpProperties;
    private final ExtractionGateway extractionGateway;

    public RoutingHealthIndicator(RouteResolver resolver, ClickUpProperties clickUpProperties,
                                  ExtractionGateway extractionGateway) {
        this.resolver = resolver;
        this.clickUpProperties = clickUpProperties;
        this.extractionGateway = extractionGateway;
    }

    @Override
    public Health health() {
        RouteTable table = resolver.getRouteTable();
        String defaultTaskId = resolver.getDefaultTaskId().orElse(null);
        boolean globalToken = clickUpProperties.getApiToken() != null;
        boolean anyRouteToken = table.routes().stream().anyMatch(r -> r.apiToken() != null);
        boolean hasDestination = !table.isEmpty() || defaultTaskId != null;
        boolean hasToken = globalToken || anyRouteToken;

        Health.Builder builder = hasDestination && hasToken ? Health.up() : Health.down();
        if (!hasDestination) {
            builder.withDetail("status", "No routes and no default destination configured");
        } else if (!hasToken) {
            builder.withDetail("status", "No ClickUp API token configured");
        } else {
            builder.withDetail("status", "Routing configured");
        }
        return builder
                .withDetail("globalTokenConfigured", globalToken)
                .withDetail("routesLoaded", table.size())
                .withDetail("routesRejected", table.rejections().size())
                .withDetail("defaultTaskId", defaultTaskId == null ? "none" : defaultTaskId)
                .withDetail("extractionEnabled", extractionGateway.isEnabled())
                .build();
    }
}
