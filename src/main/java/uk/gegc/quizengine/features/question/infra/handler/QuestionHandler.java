package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.Locale;

/**
 * Type-specific behaviour for one kind of question: checking the stored content, rendering
 * what a quiz taker sees, and grading a submitted answer.
 */
public abstract class QuestionHandler {

    protected static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * Checks that the question carries everything needed to grade it.
     *
     * @throws ValidationException when the answer key or options are missing or inconsistent
     */
    public abstract void validateContent(Question question) throws ValidationException;

    /**
     * Type-specific part of the question shown to a quiz taker. Never contains the answer key.
     */
    public ObjectNode renderPayload(Question question) {
        ObjectNode payload = nodes.objectNode();
        doRender(question, payload);
        return payload;
    }

    /**
     * Grades a submitted answer. An absent or {@code null} answer is simply incorrect.
     */
    public boolean checkAnswer(Question question, JsonNode submitted) {
        if (submitted == null || submitted.isNull() || submitted.isMissingNode()) {
            return false;
        }
        return doCheck(question, submitted);
    }

    /**
     * Correct answer in display form, or a {@code null} node when the key cannot be resolved.
     */
    public abstract JsonNode correctAnswer(Question question);

    protected abstract void doRender(Question question, ObjectNode payload);

    protected abstract boolean doCheck(Question question, JsonNode submitted);

    protected static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
