package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import java.util.Set;

@Schema(name = "PracticeTestRequest", description = "Timed exam simulation")
public record PracticeTestRequest(
        @Schema(description = "Number of questions; defaults to a full 90-question exam", example = "90")
        @Positive(message = "Question count must be positive")
        @Max(value = 500, message = "Question count must not exceed 500")
        Integer questionCount,

        @Schema(description = "Sections to draw from; empty or absent means all sections")
        Set<Integer> sections,

        @Schema(description = "easy, medium, hard, or mixed for no filter", example = "mixed")
        String difficulty,

        @Schema(description = "'auto' (75 seconds per question), a number of minutes, or 'unlimited' (default)", example = "auto")
        String timeLimit
) {
}
