package uk.gegc.quizengine.features.question.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.api.dto.QuestionDto;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;

@Component
@RequiredArgsConstructor
public class QuestionMapper {

    private final QuestionHandlerFactory handlerFactory;

    public QuestionDto toDto(Question question) {
        return new QuestionDto(
                question.getId(),
                question.getType(),
                question.getText(),
                question.getScenarioText(),
                question.getCategory(),
                question.getSection(),
                question.getDifficulty(),
                question.getTags().stream().sorted().toList(),
                handlerFactory.getHandler(question.getType()).renderPayload(question)
        );
    }
}
