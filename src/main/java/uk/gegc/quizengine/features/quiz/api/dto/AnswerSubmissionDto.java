package uk.gegc.quizengine.features.quiz.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AnswerSubmissionDto", description = "Correctness of a submitted answer and the running score")
public record AnswerSubmissionDto(
        @Schema(description = "Zero-based question position") int index,
        @Schema(description = "Whether the answer was correct") boolean correct,
        @Schema(description = "Correct answer in display form") JsonNode correctAnswer,
        @Schema(description = "Explanation of the correct answer") String explanation,
        @Schema(description = "Correct answers so far") int score,
        @Schema(description = "Positions answered so far") int answeredCount,
        @Schema(description = "Number of questions in the session") int totalQuestions,
        @Schema(description = "True when this submission answered the last open question and completed the session") boolean completed
) {
}
