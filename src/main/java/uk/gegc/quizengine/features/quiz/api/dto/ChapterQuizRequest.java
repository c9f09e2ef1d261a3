package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(name = "ChapterQuizRequest", description = "Quiz over the questions of one chapter")
public record ChapterQuizRequest(
        @Schema(description = "Chapter (section) number", requiredMode = Schema.RequiredMode.REQUIRED, example = "3")
        @NotNull(message = "Section is required")
        @Positive(message = "Section must be positive")
        Integer section,

        @Schema(description = "Number of questions; all available questions are used when fewer exist", example = "10")
        @Positive(message = "Question count must be positive")
        @Max(value = 500, message = "Question count must not exceed 500")
        Integer questionCount
) {
}
