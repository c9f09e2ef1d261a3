package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Free-text answer matched against one or more accepted answers, ignoring case and surrounding whitespace.
 */
@Component
public class FillInBlankHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.FILL_IN_BLANK;
    }

    @Override
    public void validateContent(Question question) throws ValidationException {
        if (acceptedAnswers(question).isEmpty()) {
            throw new ValidationException("Question " + question.getId() + " requires at least one non-blank accepted answer");
        }
    }

    @Override
    protected void doRender(Question question, ObjectNode payload) {
        payload.put("freeText", true);
    }

    @Override
    protected boolean doCheck(Question question, JsonNode submitted) {
        if (!submitted.isValueNode()) {
            return false;
        }
        String given = normalize(submitted.asText());
        if (given.isEmpty()) {
            return false;
        }
        return acceptedAnswers(question).stream()
                .map(QuestionHandler::normalize)
                .anyMatch(given::equals);
    }

    @Override
    public JsonNode correctAnswer(Question question) {
        List<String> accepted = acceptedAnswers(question);
        return accepted.isEmpty() ? nodes.nullNode() : nodes.textNode(accepted.get(0));
    }

    List<String> acceptedAnswers(Question question) {
        JsonNode key = question.getCorrectAnswer();
        List<String> accepted = new ArrayList<>();
        if (key == null) {
            return accepted;
        }
        if (key.isArray()) {
            key.forEach(node -> addIfPresent(accepted, node));
        } else {
            addIfPresent(accepted, key);
        }
        return accepted;
    }

    private static void addIfPresent(List<String> accepted, JsonNode node) {
        if (node.isValueNode() && !node.isNull() && !node.asText().isBlank()) {
            accepted.add(node.asText().trim());
        }
    }
}
