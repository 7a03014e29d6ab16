package com.phillippitts.meetingrouter.config.orchestration;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.config.properties.FormatterProperties;
import com.phillippitts.meetingrouter.config.properties.GroqProperties;
import com.phillippitts.meetingrouter.service.clickup.ClickUpApiClient;
import com.phillippitts.meetingrouter.service.extraction.ExtractionGateway;
import com.phillippitts.meetingrouter.service.extraction.GroqExtractionGateway;
import com.phillippitts.meetingrouter.service.format.ContentFormatter;
import com.phillippitts.meetingrouter.service.health.RoutingHealthIndicator;
import com.phillippitts.meetingrouter.service.metrics.OrchestrationMetrics;
import com.phillippitts.meetingrouter.service.orchestration.DefaultTaskOrchestrator;
import com.phillippitts.meetingrouter.service.orchestration.TaskOrchestrator;
import com.phillippitts.meetingrouter.service.routing.ConfigResolutionChain;
import com.phillippitts.meetingrouter.service.routing.RouteResolver;
import com.phillippitts.meetingrouter.service.routing.RouteTable;
import com.phillippitts.meetingrouter.service.routing.RouteTableParser;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the meeting-event pipeline explicitly. Configuration is read once here and passed into
 * the core services as immutable objects.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    private final ClickUpProperties clickUpProperties;

    public OrchestrationConfig(ClickUpProperties clickUpProperties) {
        this.clickUpProperties = clickUpProperties;
    }

    /**
     * Routing table parsed from {@code clickup.routing-json}; malformed input yields an empty table.
     */
    @Bean
    public RouteTable routeTable() {
        return RouteTableParser.parse(clickUpProperties.getRoutingJson());
    }

    @Bean
    public RouteResolver routeResolver(RouteTable routeTable) {
        RouteResolver resolver = new RouteResolver(routeTable, clickUpProperties.getDefaultTaskId());
        if (routeTable.isEmpty() && resolver.getDefaultTaskId().isEmpty()) {
            LOG.warn("No ClickUp routes and no default task configured; every meeting will be unmatched");
        }
        return resolver;
    }

    @Bean
    public ConfigResolutionChain configResolutionChain() {
        return new ConfigResolutionChain(clickUpProperties);
    }

    @Bean
    public ContentFormatter contentFormatter(FormatterProperties formatterProperties) {
        return new ContentFormatter(formatterProperties);
    }

    @Bean
    public ClickUpApiClient clickUpApiClient(@Qualifier("clickUpRestTemplate") RestTemplate restTemplate) {
        return new ClickUpApiClient(restTemplate, clickUpProperties);
    }

    @Bean
    public ExtractionGateway extractionGateway(@Qualifier("groqRestTemplate") RestTemplate restTemplate,
                                               GroqProperties groqProperties) {
        if (!groqProperties.isConfigured()) {
            LOG.info("GROQ_API_KEY not set; action item extraction is disabled");
        }
        return new GroqExtractionGateway(restTemplate, groqProperties);
    }

    @Bean
    public OrchestrationMetrics orchestrationMetrics(MeterRegistry registry) {
        return new OrchestrationMetrics(registry);
    }

    @Bean
    public TaskOrchestrator taskOrchestrator(RouteResolver routeResolver,
                                             ConfigResolutionChain configResolutionChain,
                                             ContentFormatter contentFormatter,
                                             ClickUpApiClient clickUpApiClient,
                                             ExtractionGateway extractionGateway,
                                             OrchestrationMetrics orchestrationMetrics) {
        return new DefaultTaskOrchestrator(routeResolver, configResolutionChain, contentFormatter,
                clickUpApiClient, extractionGateway, clickUpApiClient, orchestrationMetrics);
    }

    /**
     * Exposed as {@code routing} under /actuator/health.
     */
    @Bean
    public RoutingHealthIndicator routingHealthIndicator(RouteResolver routeResolver,
                                                         ExtractionGateway extractionGateway) {
        return new RoutingHealthIndicator(routeResolver, clickUpProperties, extractionGateway);
    }
}
