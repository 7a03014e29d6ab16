package com.phillippitts.meetingrouter;

import com.phillippitts.meetingrouter.config.properties.ClickUpProperties;
import com.phillippitts.meetingrouter.config.properties.FormatterProperties;
import com.phillippitts.meetingrouter.config.properties.GroqProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ClickUpProperties.class,
        GroqProperties.class,
        FormatterProperties.class
})
public class MeetingRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingRouterApplication.class, args);
    }

}
