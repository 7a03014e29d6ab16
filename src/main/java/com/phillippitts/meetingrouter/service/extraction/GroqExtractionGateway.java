package com.phillippitts.meetingrouter.service.extraction;

import com.phillippitts.meetingrouter.config.properties.GroqProperties;
import com.phillippitts.meetingrouter.domain.ExtractionResult;
import com.phillippitts.meetingrouter.exception.RemoteServiceExceptionBuilder;
import com.phillippitts.meetingrouter.util.TextUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * {@link ExtractionGateway} backed by Groq's OpenAI-compatible chat-completions endpoint.
 *
 * <p>Sends one system prompt with the extraction rules and output schema, and one user prompt with
 * the meeting title, participants and the transcript capped at
 * {@code groq.max-transcript-chars}.
 */
public class GroqExtractionGateway implements ExtractionGateway {

    private static final Logger LOG = LogManager.getLogger(GroqExtractionGateway.class);

    static final String SYSTEM_PROMPT = String.join("\n",
            "You are an assistant that extracts actionable tasks from meeting transcripts.",
            "",
            "Rules:",
            "1. Transcript may include English + Hindi + Gujarati mixed speech.",
            "2. Return tasks in clear English only.",
            "3. Extract only explicit or strongly implied action items.",
            "4. Do not invent deadlines, owners, or priorities.",
            "5. If owner is unclear, set owner as \"Unassigned\".",
            "6. If due date is unclear, set due_date as null.",
            "7. Keep each task concise (max 140 chars).",
            "8. Merge duplicates.",
            "9. Ignore small talk, filler, and unrelated noise.",
            "10. Output ONLY valid JSON matching this schema:",
            "{",
            "  \"meeting_summary\": \"string\",",
            "  \"tasks\": [",
            "    {",
            "      \"task\": \"string\",",
            "      \"owner\": \"string\",",
            "      \"due_date\": \"YYYY-MM-DD or null\",",
            "      \"priority\": \"high|medium|low\",",
            "      \"confidence\": 0.0,",
            "      \"evidence\": \"short quote from transcript\"",
            "    }",
            "  ]",
            "}");

    private final RestTemplate restTemplate;
    private final GroqProperties props;

    public GroqExtractionGateway(RestTemplate restTemplate, GroqProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public boolean isEnabled() {
        return props.isConfigured();
    }

    @Override
    public ExtractionResult extract(String transcript, String meetingTitle, List<String> participants) {
        if (!isEnabled()) {
            throw new IllegalStateException("Groq API key is not configured");
        }
        String url = props.apiBaseUrl() + "/chat/completions";
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(props.apiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<String> entity = new HttpEntity<>(requestBody(transcript, meetingTitle, participants), headers);

        long startNanos = System.nanoTime();
        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            throw RemoteServiceExceptionBuilder.create("Groq API error")
                    .service(ExtractionResponseParser.SERVICE)
                    .status(e.getStatusCode().value())
                    .remoteMessage(errorMessage(e.getResponseBodyAsString()))
                    .metadata("model", props.model())
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw RemoteServiceExceptionBuilder.create("Groq API unreachable")
                    .service(ExtractionResponseParser.SERVICE)
                    .remoteMessage(e.getMessage())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw RemoteServiceExceptionBuilder.create("Groq API call failed")
                    .service(ExtractionResponseParser.SERVICE)
                    .remoteMessage(e.getMessage())
                    .cause(e)
                    .build();
        }

        String content = messageContent(body);
        if (TextUtils.isBlank(content)) {
            throw RemoteServiceExceptionBuilder.create("Groq returned empty content")
                    .service(ExtractionResponseParser.SERVICE)
                    .metadata("model", props.model())
                    .build();
        }
        ExtractionResult result = ExtractionResponseParser.parse(content);
        LOG.info("Groq extraction returned {} item(s) in {} ms (model={})",
                result.itemCount(), (System.nanoTime() - startNanos) / 1_000_000L, props.model());
        return result;
    }

    String requestBody(String transcript, String meetingTitle, List<String> participants) {
        JSONObject body = new JSONObject();
        body.put("model", props.model());
        body.put("temperature", props.temperature());
        JSONArray messages = new JSONArray();
        messages.put(new JSONObject().put("role", "system").put("content", SYSTEM_PROMPT));
        messages.put(new JSONObject().put("role", "user")
                .put("content", userPrompt(transcript, meetingTitle, participants)));
        body.put("messages", messages);
        return body.toString();
    }

    String userPrompt(String transcript, String meetingTitle, List<String> participants) {
        String names = participants == null || participants.isEmpty() ? "Unknown" : String.join(", ", participants);
        String safeTranscript = transcript == null ? "" : transcript;
        int cap = props.maxTranscriptChars();
        if (safeTranscript.length() > cap) {
            LOG.debug("Transcript capped from {} to {} chars", safeTranscript.length(), cap);
            safeTranscript = safeTranscript.substring(0, cap);
        }
        return String.join("\n",
                "Extract action items from this meeting.",
                "",
                "Meeting title: " + meetingTitle,
                "Participants: " + names,
                "",
                "Transcript:",
                safeTranscript);
    }

    /** Content of {@code choices[0].message.content}, or {@code null}. */
    static String messageContent(String body) {
        if (TextUtils.isBlank(body)) {
            return null;
        }
        try {
            JSONObject root = new JSONObject(body);
            JSONArray choices = root.optJSONArray("choices");
            JSONObject first = choices == null ? null : choices.optJSONObject(0);
            JSONObject message = first == null ? null : first.optJSONObject("message");
            return message == null ? null : message.optString("content", null);
        } catch (JSONException e) {
            throw RemoteServiceExceptionBuilder.create("Failed to parse Groq response JSON")
                    .service(ExtractionResponseParser.SERVICE)
                    .remoteMessage(TextUtils.preview(body, 200))
                    .cause(e)
                    .build();
        }
    }

    /** {@code error.message} from an error body, or {@code null} when absent. */
    static String errorMessage(String body) {
        if (TextUtils.isBlank(body)) {
            return null;
        }
        try {
            JSONObject error = new JSONObject(body).optJSONObject("error");
            return error == null ? null : error.optString("message", null);
        } catch (JSONException e) {
            LOG.debug("Groq error body is not JSON: {}", TextUtils.preview(body, 200));
            return null;
        }
    }
}
