package uk.gegc.quizengine.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.ValidationException;

/**
 * A scenario question is graded like multiple choice when it lists options and like
 * fill-in-the-blank otherwise. Its scenario text is rendered alongside the payload.
 */
@Component
@RequiredArgsConstructor
public class ScenarioHandler extends QuestionHandler {

    private final MultipleChoiceHandler multipleChoiceHandler;
    private final FillInBlankHandler fillInBlankHandler;

    @Override
    public QuestionType supportedType() {
        return QuestionType.SCENARIO;
    }

    @Override
    public void validateContent(Question question) throws ValidationException {
        if (question.getScenarioText() == null || question.getScenarioText().isBlank()) {
            throw new ValidationException("SCENARIO question " + question.getId() + " requires scenario text");
        }
        delegate(question).validateContent(question);
    }

    @Override
    protected void doRender(Question question, ObjectNode payload) {
        payload.put("scenario", question.getScenarioText());
        payload.setAll(delegate(question).renderPayload(question));
    }

    @Override
    protected boolean doCheck(Question question, JsonNode submitted) {
        return delegate(question).checkAnswer(question, submitted);
    }

    @Override
    public JsonNode correctAnswer(Question question) {
        return delegate(question).correctAnswer(question);
    }

    private QuestionHandler delegate(Question question) {
        return question.getOptions().isEmpty() ? fillInBlankHandler : multipleChoiceHandler;
    }
}
