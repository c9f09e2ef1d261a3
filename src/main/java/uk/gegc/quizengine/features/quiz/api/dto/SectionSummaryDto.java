package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SectionSummaryDto", description = "A chapter and how many questions it has")
public record SectionSummaryDto(
        @Schema(description = "Chapter number", example = "3") int section,
        @Schema(description = "Number of questions in the chapter", example = "42") long questionCount
) {
}
