package uk.gegc.quizengine.features.question.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;

import java.util.List;

@Schema(name = "QuestionDto", description = "A catalog question without its answer key or explanation")
public record QuestionDto(
        @Schema(description = "Question id") String id,
        @Schema(description = "Question type") QuestionType type,
        @Schema(description = "Question text") String text,
        @Schema(description = "Scenario text for scenario questions") String scenarioText,
        @Schema(description = "Question category") String category,
        @Schema(description = "Chapter number") Integer section,
        @Schema(description = "Difficulty level") Difficulty difficulty,
        @Schema(description = "Tags, sorted") List<String> tags,
        @Schema(description = "Type-specific content, e.g. the options of a multiple choice question",
                example = "{\"options\":[{\"index\":0,\"label\":\"A\",\"text\":\"Firewall\"}]}") JsonNode payload
) {
}
