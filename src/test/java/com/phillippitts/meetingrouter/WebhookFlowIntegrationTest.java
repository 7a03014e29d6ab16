package com.phillippitts.meetingrouter;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a full webhook delivery through the wired pipeline with both remote services mocked at
 * the HTTP layer.
 */
@SpringBootTest(
    properties = {
        "clickup.api-token=pk_global",
        "clickup.routing-json=[{\"name\":\"OpenCables\",\"keywords\":[\"opencables\"],\"taskId\":\"T-OC\"}]",
        "clickup.default-task-id=",
        "clickup.list-id=901",
        "groq.api-key=gsk-test"
    }
)
@AutoConfigureMockMvc
@DirtiesContext
class WebhookFlowIntegrationTest {

    private static final String CLICKUP = "https://api.clickup.com/api/v2";
    private static final String GROQ = "https://api.groq.com/openai/v1/chat/completions";

    private static final String PAYLOAD = """
            {
              "meeting_title": "OpenCables Weekly",
              "share_url": "https://fathom.video/share/abc",
              "default_summary": {"markdown_formatted": "## Recap\\nShipped the release"},
              "recording_start_time": "2025-03-04T10:00:00Z",
              "recording_end_time": "2025-03-04T10:45:00Z",
              "recorded_by": {"name": "Sunil", "email": "sunil@opencables.com"},
              "transcript": [
                {"timestamp": "00:00:05", "speaker": {"display_name": "Asha"}, "text": "I'll send the deck"},
                {"timestamp": "00:00:09", "speaker": {"display_name": "Ravi"}, "text": "I will book the room"}
              ]
            }
            """;

    @Autowired
    private MockMvc mvc;

    @Autowired
    @Qualifier("clickUpRestTemplate")
    private RestTemplate clickUpRestTemplate;

    @Autowired
    @Qualifier("groqRestTemplate")
    private RestTemplate groqRestTemplate;

    private MockRestServiceServer clickUp;
    private MockRestServiceServer groq;

    @BeforeEach
    void setUp() {
        clickUp = MockRestServiceServer.bindTo(clickUpRestTemplate).build();
        groq = MockRestServiceServer.bindTo(groqRestTemplate).build();
    }

    private static String completion(String content) {
        JSONObject message = new JSONObject().put("role", "assistant").put("content", content);
        return new JSONObject().put("choices", List.of(new JSONObject().put("message", message))).toString();
    }

    @Test
    void postsCommentThenCreatesParentAndSubtasks() throws Exception {
        // Arrange
        clickUp.expect(requestTo(CLICKUP + "/task/T-OC/comment"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "pk_global"))
                .andExpect(jsonPath("$.notify_all").value(false))
                .andRespond(withSuccess("{\"id\": 555}", MediaType.APPLICATION_JSON));
        groq.expect(requestTo(GROQ))
                .andExpect(header("Authorization", "Bearer gsk-test"))
                .andRespond(withSuccess(completion("{\"meeting_summary\":\"s\",\"tasks\":["
                        + "{\"task\":\"Send deck\",\"owner\":\"Asha\",\"confidence\":0.9,\"evidence\":\"I'll send the deck\"},"
                        + "{\"task\":\"Book room\",\"owner\":\"Ravi\",\"confidence\":0.4}]}"),
                        MediaType.APPLICATION_JSON));
        clickUp.expect(requestTo(CLICKUP + "/list/901/task"))
                .andExpect(jsonPath("$.name").value(
                        "04-03-2025 - Meeting discussed tasks | Title: OpenCables Weekly | Duration: 45m"))
                .andExpect(jsonPath("$.status").value("backlog"))
                .andExpect(jsonPath("$.parent").doesNotExist())
                .andRespond(withSuccess("{\"id\": \"p-1\"}", MediaType.APPLICATION_JSON));
        clickUp.expect(requestTo(CLICKUP + "/list/901/task"))
                .andExpect(jsonPath("$.name").value("Send deck"))
                .andExpect(jsonPath("$.parent").value("p-1"))
                .andExpect(jsonPath("$.description").value("Evidence: I'll send the deck\nConfidence: 0.90"))
                .andRespond(withSuccess("{\"id\": \"s-1\"}", MediaType.APPLICATION_JSON));
        clickUp.expect(requestTo(CLICKUP + "/list/901/task"))
                .andExpect(jsonPath("$.name").value("Book room"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"err\": \"Task name invalid\"}"));

        // Act & Assert
        mvc.perform(post("/fathom").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(MockMvcResultMatchers.jsonPath("$.clickUpCommentId").value("555"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.route.matchedKeywords[0]").value("opencables"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.taskExtraction.extractedCount").value(2))
                .andExpect(MockMvcResultMatchers.jsonPath("$.taskExtraction.parentTaskId").value("p-1"))
                .andExpect(MockMvcResultMatchers.jsonPath("$.taskExtraction.createdSubtasks").value(1))
                .andExpect(MockMvcResultMatchers.jsonPath("$.taskExtraction.failedSubtasks").value(1));

        clickUp.verify();
        groq.verify();
    }

    @Test
    void returns500WhenCommentIsRejected() throws Exception {
        clickUp.expect(requestTo(CLICKUP + "/task/T-OC/comment"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"err\": \"Token invalid\"}"));

        mvc.perform(post("/fathom").contentType(MediaType.APPLICATION_JSON).content(PAYLOAD))
                .andExpect(status().isInternalServerError());

        clickUp.verify();
        groq.verify();
    }
}
