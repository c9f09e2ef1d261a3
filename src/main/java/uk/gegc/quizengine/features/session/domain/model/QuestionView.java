package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;

/**
 * A question as shown to the quiz taker. The answer key is never included; the explanation
 * only once the position has been answered.
 */
@Builder
public record QuestionView(
        int position,
        int totalQuestions,
        String questionId,
        QuestionType type,
        String text,
        String scenarioText,
        String category,
        Integer section,
        Difficulty difficulty,
        JsonNode payload,
        boolean answered,
        String explanation
) {
}
