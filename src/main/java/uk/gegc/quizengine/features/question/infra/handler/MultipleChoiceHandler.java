package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.List;

/**
 * Single-answer multiple choice. The stored key and a submitted answer may each name the option
 * by zero-based index (number or digit string), by its text, or by its letter label, tried in that order.
 * A digit string outside the option range falls through to text matching.
 */
@Component
public class MultipleChoiceHandler extends QuestionHandler {

    static final int MAX_OPTIONS = 26;

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    public void validateContent(Question question) throws ValidationException {
        List<String> options = question.getOptions();
        if (options == null || options.size() < 2) {
            throw new ValidationException("Multiple choice question " + question.getId() + " must have at least 2 options");
        }
        if (options.size() > MAX_OPTIONS) {
            throw new ValidationException("Multiple choice question " + question.getId() + " has more than "
                    + MAX_OPTIONS + " options");
        }
        for (String option : options) {
            if (option == null || option.isBlank()) {
                throw new ValidationException("Multiple choice question " + question.getId() + " has a blank option");
            }
        }
        if (resolveCorrectIndex(question) < 0) {
            throw new ValidationException("Answer key of question " + question.getId() + " does not match any option");
        }
    }

    @Override
    protected void doRender(Question question, ObjectNode payload) {
        ArrayNode options = payload.putArray("options");
        List<String> texts = question.getOptions();
        for (int i = 0; i < texts.size(); i++) {
            options.addObject()
                    .put("index", i)
                    .put("label", label(i))
                    .put("text", texts.get(i));
        }
    }

    @Override
    protected boolean doCheck(Question question, JsonNode submitted) {
        int correct = resolveCorrectIndex(question);
        return correct >= 0 && correct == resolveIndex(question.getOptions(), submitted);
    }

    @Override
    public JsonNode correctAnswer(Question question) {
        int correct = resolveCorrectIndex(question);
        return correct < 0 ? nodes.nullNode() : nodes.textNode(question.getOptions().get(correct));
    }

    /**
     * Index of the correct option, or {@code -1} when the key is absent or names no option.
     */
    public int resolveCorrectIndex(Question question) {
        JsonNode key = question.getCorrectAnswer();
        if (key == null || key.isNull() || key.isMissingNode()) {
            return -1;
        }
        return resolveIndex(question.getOptions(), key);
    }

    int resolveIndex(List<String> options, JsonNode value) {
        if (options == null || options.isEmpty()) {
            return -1;
        }
        if (value.isIntegralNumber()) {
            return inRange(value.asInt(), options.size());
        }
        if (!value.isTextual()) {
            return -1;
        }
        String raw = value.asText().trim();
        if (raw.isEmpty()) {
            return -1;
        }
        if (raw.chars().allMatch(Character::isDigit) && raw.length() < 10) {
            int index = inRange(Integer.parseInt(raw), options.size());
            if (index >= 0) {
                return index;
            }
        }
        String normalized = normalize(raw);
        for (int i = 0; i < options.size(); i++) {
            if (normalize(options.get(i)).equals(normalized)) {
                return i;
            }
        }
        if (raw.length() == 1 && Character.isLetter(raw.charAt(0))) {
            return inRange(Character.toUpperCase(raw.charAt(0)) - 'A', options.size());
        }
        return -1;
    }

    private static int inRange(int index, int size) {
        return index >= 0 && index < size ? index : -1;
    }

    static String label(int index) {
        return String.valueOf((char) ('A' + index));
    }
}
