package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.Set;

@Schema(name = "RandomQuizRequest", description = "Randomly sampled quiz, optionally restricted to sections and a difficulty")
public record RandomQuizRequest(
        @Schema(description = "Number of questions to sample", example = "20")
        @Positive(message = "Question count must be positive")
        @Max(value = 500, message = "Question count must not exceed 500")
        Integer questionCount,

        @Schema(description = "Sections to draw from; empty or absent means all sections", example = "[1, 2, 3]")
        Set<Integer> sections,

        @Schema(description = "easy, medium, hard, or mixed for no filter", example = "mixed")
        String difficulty
) {
}
