package com.phillippitts.meetingrouter.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Groq chat-completions extraction service.
 * Binds to properties prefixed with "groq".
 *
 * <p>Extraction is skipped entirely when {@code apiKey} is blank.
 *
 * @param apiKey             bearer key; blank disables extraction
 * @param apiBaseUrl         OpenAI-compatible base URL
 * @param model              chat model name
 * @param maxTranscriptChars cap on transcript characters sent to the model
 * @param temperature        sampling temperature
 * @param connectTimeout     connect timeout per call
 * @param readTimeout        read timeout per call
 */
@ConfigurationProperties(prefix = "groq")
@Validated
public record GroqProperties(
        String apiKey,

        @NotBlank(message = "Groq API base URL must not be blank")
        String apiBaseUrl,

        @NotBlank(message = "Groq model must not be blank")
        String model,

        @Positive(message = "Max transcript chars must be positive")
        Integer maxTranscriptChars,

        @DecimalMin("0.0") @DecimalMax("2.0")
        Double temperature,

        Duration connectTimeout,
        Duration readTimeout
) {

    static final String DEFAULT_API_BASE_URL = "https://api.groq.com/openai/v1";
    static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";
    static final int DEFAULT_MAX_TRANSCRIPT_CHARS = 20_000;

    public GroqProperties {
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? DEFAULT_API_BASE_URL : apiBaseUrl.trim();
        if (apiBaseUrl.endsWith("/")) {
            apiBaseUrl = apiBaseUrl.substring(0, apiBaseUrl.length() - 1);
        }
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        maxTranscriptChars = maxTranscriptChars == null ? DEFAULT_MAX_TRANSCRIPT_CHARS : maxTranscriptChars;
        temperature = temperature == null ? 0.1 : temperature;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }

    /**
     * Properties with defaults and the given key.
     */
    public static GroqProperties withApiKey(String apiKey) {
        return new GroqProperties(apiKey, null, null, null, null, null, null);
    }

    public boolean isConfigured() {
        return apiKey != null;
    }
}
