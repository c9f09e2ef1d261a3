package uk.gegc.quizengine.features.quiz.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;

@Schema(name = "QuizQuestionDto", description = "A question of a session without its answer key")
public record QuizQuestionDto(
        @Schema(description = "Zero-based position in the session", example = "0") int index,
        @Schema(description = "Number of questions in the session", example = "10") int totalQuestions,
        @Schema(description = "Question id") String questionId,
        @Schema(description = "Question type") QuestionType type,
        @Schema(description = "Question text") String text,
        @Schema(description = "Scenario text for scenario questions") String scenarioText,
        @Schema(description = "Question category") String category,
        @Schema(description = "Chapter number") Integer section,
        @Schema(description = "Difficulty level") Difficulty difficulty,
        @Schema(description = "Type-specific content, e.g. the options of a multiple choice question",
                example = "{\"options\":[{\"index\":0,\"label\":\"A\",\"text\":\"Firewall\"}]}") JsonNode payload,
        @Schema(description = "Whether an answer has been submitted for this position") boolean answered,
        @Schema(description = "Explanation, present only once the position has been answered") String explanation
) {
}
