package uk.gegc.quizengine.features.progress.domain.model;

import lombok.Builder;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;

import java.time.Instant;

/**
 * One finished quiz as written to the user progress sink.
 *
 * @param status     {@code COMPLETED}, or {@code EXPIRED} when the cleanup sweep ended the session
 * @param section    chapter number for chapter quizzes, otherwise {@code null}
 */
@Builder
public record QuizResultRecord(
        String sessionId,
        String userId,
        String quizType,
        SessionStatus status,
        Integer section,
        int score,
        int totalQuestions,
        double percentage,
        long durationSeconds,
        Instant completedAt
) {
}
