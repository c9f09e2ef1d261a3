package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizengine.features.question.domain.model.Question;

public record WrongAnswerReview(
        int position,
        Question question,
        JsonNode submittedAnswer,
        JsonNode correctAnswer,
        String explanation
) {
}
