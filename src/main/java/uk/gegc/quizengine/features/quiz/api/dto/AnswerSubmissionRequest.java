package uk.gegc.quizengine.features.quiz.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "AnswerSubmissionRequest", description = "Answer for one position of a session")
public record AnswerSubmissionRequest(
        @Schema(description = "Zero-based question position", requiredMode = Schema.RequiredMode.REQUIRED, example = "0")
        @NotNull(message = "Index is required")
        Integer index,

        @Schema(description = "Submitted answer: option index, letter or text; a boolean; or free text",
                requiredMode = Schema.RequiredMode.REQUIRED, example = "\"B\"")
        @NotNull(message = "Answer value must not be null")
        JsonNode value,

        @Schema(description = "Seconds spent on the question", example = "12.5")
        @PositiveOrZero(message = "Elapsed seconds must not be negative")
        Double elapsedSeconds
) {
    public AnswerSubmissionRequest {
        if (elapsedSeconds == null) {
            elapsedSeconds = 0.0;
        }
    }
}
