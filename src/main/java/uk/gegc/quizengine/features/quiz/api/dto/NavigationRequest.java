package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.quizengine.features.session.domain.model.NavigationDirection;

@Schema(name = "NavigationRequest", description = "Move the session pointer one question")
public record NavigationRequest(
        @Schema(description = "NEXT or PREVIOUS", requiredMode = Schema.RequiredMode.REQUIRED, example = "NEXT")
        @NotNull(message = "Direction is required")
        NavigationDirection direction
) {
}
