package com.phillippitts.meetingrouter.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Properties for comment and task text rendering. Binds to "formatter".
 *
 * @param zone                    time zone used to render meeting dates
 * @param taskDescriptionMaxChars character budget of the parent task description
 */
@ConfigurationProperties(prefix = "formatter")
@Validated
public record FormatterProperties(
        @NotBlank String zone,
        @Positive Integer taskDescriptionMaxChars
) {

    public FormatterProperties {
        zone = zone == null || zone.isBlank() ? "UTC" : zone.trim();
        taskDescriptionMaxChars = taskDescriptionMaxChars == null ? 50_000 : taskDescriptionMaxChars;
    }

    public static FormatterProperties defaults() {
        return new FormatterProperties(null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
