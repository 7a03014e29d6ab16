package com.phillippitts.meetingrouter;

import com.phillippitts.meetingrouter.config.logging.WebhookMdcFilter;
import com.phillippitts.meetingrouter.service.orchestration.TaskOrchestrator;
import com.phillippitts.meetingrouter.service.routing.RouteResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.web.filter.RequestContextFilter;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "clickup.api-token=",
        "clickup.routing-json=",
        "clickup.default-task-id=",
        "groq.api-key="
    }
)
class MeetingRouterApplicationTests {

    @Autowired
    private TaskOrchestrator orchestrator;

    @Autowired
    private RouteResolver routeResolver;

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(routeResolver.getRouteTable().isEmpty()).isTrue();
    }

    @Test
    void mdcFilterRegistersAlongsideFrameworkRequestContextFilter() {
        assertThat(context.getBean("webhookMdcFilter")).isInstanceOf(WebhookMdcFilter.class);
        assertThat(context.getBean("requestContextFilter")).isInstanceOf(RequestContextFilter.class);
    }
}
