package uk.gegc.quizengine.features.question.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.features.question.infra.handler.QuestionHandler;
import uk.gegc.quizengine.shared.exception.UnknownQuestionTypeException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class QuestionHandlerFactory {
    private final Map<QuestionType, QuestionHandler> handlerMap = new EnumMap<>(QuestionType.class);

    public QuestionHandlerFactory(List<QuestionHandler> handlers) {
        handlers.forEach(handler -> handlerMap.put(handler.supportedType(), handler));
        log.info("QuestionHandlerFactory initialized with handlers for types: {}", handlerMap.keySet());
    }

    public QuestionHandler getHandler(QuestionType type) {
        QuestionHandler questionHandler = handlerMap.get(type);
        if (questionHandler == null) {
            throw new UnknownQuestionTypeException(String.valueOf(type));
        }
        return questionHandler;
    }

    /**
     * Resolves a handler from the persisted type string.
     *
     * @throws UnknownQuestionTypeException if the string names no supported type
     */
    public QuestionHandler getHandler(String type) {
        return getHandler(QuestionType.fromValue(type));
    }
}
