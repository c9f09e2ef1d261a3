package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizengine.features.session.domain.model.QuizMode;

import java.time.Instant;

@Schema(name = "QuizCreatedDto", description = "Metadata of a newly created quiz session. Questions are fetched by index.")
public record QuizCreatedDto(
        @Schema(description = "Session id used in every follow-up call") String sessionId,
        @Schema(description = "Quiz mode") QuizMode mode,
        @Schema(description = "Number of questions in the session") int totalQuestions,
        @Schema(description = "Time limit in seconds for practice tests; null otherwise") Long timeLimitSeconds,
        @Schema(description = "Session start timestamp (UTC)") Instant startedAt,
        @Schema(description = "When the time limit runs out; null if untimed or unlimited") Instant deadline
) {
}
