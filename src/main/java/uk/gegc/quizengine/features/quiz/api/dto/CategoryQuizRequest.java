package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@Schema(name = "CategoryQuizRequest", description = "Quiz over the questions of one category")
public record CategoryQuizRequest(
        @Schema(description = "Category name (case-insensitive)", requiredMode = Schema.RequiredMode.REQUIRED, example = "Network Security")
        @NotBlank(message = "Category is required")
        String category,

        @Schema(description = "Number of questions; all available questions are used when fewer exist", example = "10")
        @Positive(message = "Question count must be positive")
        @Max(value = 500, message = "Question count must not exceed 500")
        Integer questionCount,

        @Schema(description = "easy, medium, hard, or mixed for no filter", example = "mixed")
        String difficulty
) {
}
