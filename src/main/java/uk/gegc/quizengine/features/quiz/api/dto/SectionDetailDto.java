package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "SectionDetailDto", description = "A chapter with its question count broken down by category and difficulty")
public record SectionDetailDto(
        @Schema(description = "Chapter number", example = "3") int section,
        @Schema(description = "Number of questions in the chapter", example = "42") long questionCount,
        @Schema(description = "Question count per category, sorted by category") Map<String, Long> questionsByCategory,
        @Schema(description = "Question count per difficulty level, easiest first") Map<String, Long> questionsByDifficulty
) {
}
