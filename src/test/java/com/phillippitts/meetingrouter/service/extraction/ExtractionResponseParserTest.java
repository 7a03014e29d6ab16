package com.phillippitts.meetingrouter.service.extraction;

import com.phillippitts.meetingrouter.domain.ExtractedTaskItem;
import com.phillippitts.meetingrouter.domain.ExtractedTaskItem.Priority;
import com.phillippitts.meetingrouter.domain.ExtractionResult;
import com.phillippitts.meetingrouter.exception.RemoteServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionResponseParserTest {

    @Test
    void parsesWellFormedContent() {
        // Arrange
        String content = """
                {
                  "meeting_summary": "Agreed on launch plan",
                  "tasks": [
                    {"task": "Send deck", "owner": "Asha", "due_date": "2025-03-10",
                     "priority": "high", "confidence": 0.9, "evidence": "I'll send the deck"}
                  ]
                }
                """;

        // Act
        ExtractionResult result = ExtractionResponseParser.parse(content);

        // Assert
        assertThat(result.meetingSummary()).isEqualTo("Agreed on launch plan");
        assertThat(result.items()).hasSize(1);
        ExtractedTaskItem item = result.items().get(0);
        assertThat(item.task()).isEqualTo("Send deck");
        assertThat(item.owner()).isEqualTo("Asha");
        assertThat(item.dueDate()).isEqualTo("2025-03-10");
        assertThat(item.priority()).isEqualTo(Priority.HIGH);
        assertThat(item.confidence()).isEqualTo(0.9);
        assertThat(item.evidence()).isEqualTo("I'll send the deck");
    }

    @Test
    void stripsMarkdownFence() {
        String content = "```json\n{\"tasks\":[{\"task\":\"Book room\"}]}\n```";

        ExtractionResult result = ExtractionResponseParser.parse(content);

        assertThat(result.items()).extracting(ExtractedTaskItem::task).containsExactly("Book room");
    }

    @Test
    void appliesDefaultsForMissingOrMistypedFields() {
        String content = "{\"tasks\":[{\"task\":\"Call vendor\",\"owner\":7,\"due_date\":null,"
                + "\"priority\":\"urgent\",\"confidence\":\"high\"}]}";

        ExtractedTaskItem item = ExtractionResponseParser.parse(content).items().get(0);

        assertThat(item.owner()).isEqualTo(ExtractedTaskItem.UNASSIGNED);
        assertThat(item.dueDate()).isNull();
        assertThat(item.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(item.confidence()).isZero();
        assertThat(item.evidence()).isEmpty();
    }

    @Test
    void clampsConfidenceIntoUnitRange() {
        String content = "{\"tasks\":[{\"task\":\"A\",\"confidence\":1.7},{\"task\":\"B\",\"confidence\":-2}]}";

        ExtractionResult result = ExtractionResponseParser.parse(content);

        assertThat(result.items()).extracting(ExtractedTaskItem::confidence).containsExactly(1.0, 0.0);
    }

    @Test
    void dropsItemsWithoutTaskText() {
        String content = "{\"tasks\":[{\"task\":\"  \"},{\"owner\":\"Asha\"},\"loose string\",{\"task\":\"Keep\"}]}";

        ExtractionResult result = ExtractionResponseParser.parse(content);

        assertThat(result.items()).extracting(ExtractedTaskItem::task).containsExactly("Keep");
    }

    @Test
    void missingTasksArrayYieldsEmptyResult() {
        ExtractionResult result = ExtractionResponseParser.parse("{\"meeting_summary\":\"Nothing to do\"}");

        assertThat(result.itemCount()).isZero();
        assertThat(result.meetingSummary()).isEqualTo("Nothing to do");
    }

    @Test
    void rejectsNonObjectContent() {
        assertThatThrownBy(() -> ExtractionResponseParser.parse("[{\"task\":\"x\"}]"))
                .isInstanceOf(RemoteServiceException.class)
                .satisfies(e -> assertThat(((RemoteServiceException) e).getServiceName()).isEqualTo("groq"));
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> ExtractionResponseParser.parse("{\"tasks\": [ "))
                .isInstanceOf(RemoteServiceException.class)
                .hasMessageContaining("Failed to parse Groq response JSON");
    }
}
