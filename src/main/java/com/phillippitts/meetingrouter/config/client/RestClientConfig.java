package com.phillippitts.meetingrouter.config.client;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.config.properties.GroqProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per remote service, each with its own bounded timeouts.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate clickUpRestTemplate(RestTemplateBuilder builder, ClickUpProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    @Bean
    public RestTemplate groqRestTemplate(RestTemplateBuilder builder, GroqProperties props) {
        return builder
                .setConnectTimeout(props.connectTimeout())
                .setReadTimeout(props.readTimeout())
                .build();
    }
}
