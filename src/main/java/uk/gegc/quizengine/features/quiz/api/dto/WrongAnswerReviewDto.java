package uk.gegc.quizengine.features.quiz.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;

import java.util.List;

@Schema(name = "WrongAnswerReviewDto", description = "An incorrectly answered question with the correct answer")
public record WrongAnswerReviewDto(
        @Schema(description = "Zero-based question position") int index,
        @Schema(description = "Question id") String questionId,
        @Schema(description = "Question type") QuestionType type,
        @Schema(description = "Question text") String text,
        @Schema(description = "Scenario text for scenario questions") String scenarioText,
        @Schema(description = "Options of choice questions") List<String> options,
        @Schema(description = "Answer the quiz taker submitted") JsonNode submittedAnswer,
        @Schema(description = "Correct answer in display form") JsonNode correctAnswer,
        @Schema(description = "Explanation of the correct answer") String explanation
) {
}
