package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.Optional;

@Component
public class TrueFalseHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRUE_FALSE;
    }

    @Override
    public void validateContent(Question question) throws ValidationException {
        if (parse(question.getCorrectAnswer()).isEmpty()) {
            throw new ValidationException("TRUE_FALSE question " + question.getId() + " requires a boolean answer key");
        }
    }

    @Override
    protected void doRender(Question question, ObjectNode payload) {
        payload.putArray("options").add("True").add("False");
    }

    @Override
    protected boolean doCheck(Question question, JsonNode submitted) {
        Optional<Boolean> expected = parse(question.getCorrectAnswer());
        Optional<Boolean> given = parse(submitted);
        return expected.isPresent() && expected.equals(given);
    }

    @Override
    public JsonNode correctAnswer(Question question) {
        return parse(question.getCorrectAnswer())
                .<JsonNode>map(nodes::booleanNode)
                .orElse(nodes.nullNode());
    }

    private static Optional<Boolean> parse(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isTextual()) {
            return switch (normalize(value.asText())) {
                case "true" -> Optional.of(Boolean.TRUE);
                case "false" -> Optional.of(Boolean.FALSE);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }
}
