package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "CatalogStatsDto", description = "Size of the question catalog")
public record CatalogStatsDto(
        @Schema(description = "Total number of questions") long totalQuestions,
        @Schema(description = "Number of distinct categories") int categoryCount,
        @Schema(description = "Number of distinct tags") int tagCount,
        @Schema(description = "Question count per category") Map<String, Long> questionsByCategory
) {
}
