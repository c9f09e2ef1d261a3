package uk.gegc.quizengine.features.session.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Score snapshot taken when a session leaves the active state. Unanswered positions count as incorrect.
 */
@Builder
public record SessionResult(
        String sessionId,
        QuizMode mode,
        SessionStatus status,
        int score,
        int totalQuestions,
        int answeredCount,
        double percentage,
        long durationSeconds,
        double timeSpentSeconds,
        Instant startedAt,
        Instant endedAt
) {

    public static double percentage(int score, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.round(score * 10000.0 / total) / 100.0;
    }
}
