package uk.gegc.quizengine.features.quiz.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.quizengine.features.session.domain.model.QuizMode;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;

import java.time.Instant;

@Schema(name = "QuizResultDto", description = "Final score of a completed or expired session")
public record QuizResultDto(
        @Schema(description = "Session id") String sessionId,
        @Schema(description = "Quiz mode") QuizMode mode,
        @Schema(description = "COMPLETED or EXPIRED") SessionStatus status,
        @Schema(description = "Correct answers; unanswered questions count as incorrect") int score,
        @Schema(description = "Number of questions in the session") int totalQuestions,
        @Schema(description = "Positions that received an answer") int answeredCount,
        @Schema(description = "Score as a percentage, two decimals", example = "83.33") double percentage,
        @Schema(description = "Wall-clock seconds from start to completion") long durationSeconds,
        @Schema(description = "Sum of per-question elapsed time reported by the client") double timeSpentSeconds,
        @Schema(description = "Session start timestamp (UTC)") Instant startedAt,
        @Schema(description = "Completion timestamp (UTC)") Instant completedAt
) {
}
