package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScenarioHandler")
class ScenarioHandlerTest {

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private final ScenarioHandler handler = new ScenarioHandler(new MultipleChoiceHandler(), new FillInBlankHandler());

    private Question.QuestionBuilder scenario() {
        return Question.builder()
                .id("sc-1")
                .type(QuestionType.SCENARIO)
                .text("What should the analyst do first?")
                .scenarioText("Outbound traffic from a database server at 3 AM.");
    }

    @Test
    @DisplayName("scenario with options is graded as multiple choice")
    void optionsMeanMultipleChoice() {
        Question question = scenario()
                .options(List.of("Wipe the server", "Isolate the host"))
                .correctAnswer(nodes.numberNode(1))
                .build();

        assertThat(handler.checkAnswer(question, nodes.textNode("B"))).isTrue();
        assertThat(handler.checkAnswer(question, nodes.textNode("A"))).isFalse();
        assertThat(handler.correctAnswer(question).asText()).isEqualTo("Isolate the host");
    }

    @Test
    @DisplayName("scenario without options is graded as free text")
    void noOptionsMeansFreeText() {
        Question question = scenario()
                .correctAnswer(nodes.arrayNode().add("multi-factor authentication").add("mfa"))
                .build();

        assertThat(handler.checkAnswer(question, nodes.textNode("MFA"))).isTrue();
        assertThat(handler.checkAnswer(question, nodes.textNode("B"))).isFalse();
    }

    @Test
    @DisplayName("payload carries the scenario text and the delegate's payload")
    void renderPayloadIncludesScenario() {
        Question question = scenario()
                .options(List.of("Wipe the server", "Isolate the host"))
                .correctAnswer(nodes.numberNode(1))
                .build();

        ObjectNode payload = handler.renderPayload(question);

        assertThat(payload.get("scenario").asText()).startsWith("Outbound traffic");
        assertThat(payload.get("options")).hasSize(2);
    }

    @Test
    @DisplayName("validation requires scenario text")
    void validationRequiresScenarioText() {
        Question question = scenario().scenarioText(null)
                .correctAnswer(nodes.textNode("mfa"))
                .build();

        assertThatThrownBy(() -> handler.validateContent(question))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("scenario text");
    }
}
