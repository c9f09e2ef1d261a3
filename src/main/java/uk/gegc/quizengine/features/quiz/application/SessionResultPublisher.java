package uk.gegc.quizengine.features.quiz.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.progress.domain.event.QuizCompletedEvent;
import uk.gegc.quizengine.features.quiz.infra.mapping.QuizSessionMapper;
import uk.gegc.quizengine.features.session.domain.event.QuizSessionExpiredEvent;
import uk.gegc.quizengine.features.session.domain.model.QuizSession;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;

/**
 * Hands finished, user-owned sessions to the progress pipeline at most once per session.
 * <p>
 * Completed sessions arrive from the quiz service; sessions expired by the cleanup sweep arrive through
 * {@link QuizSessionExpiredEvent}. Failures are logged and never reach the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionResultPublisher {

    private final QuizSessionMapper quizSessionMapper;
    private final ApplicationEventPublisher eventPublisher;

    public void publish(QuizSession session, SessionResult result) {
        if (result.status() == SessionStatus.ACTIVE || session.getOwnerUserId() == null) {
            return;
        }
        if (!session.claimResultPublication()) {
            return;
        }
        try {
            eventPublisher.publishEvent(new QuizCompletedEvent(this, quizSessionMapper.toResultRecord(session, result)));
        } catch (Exception e) {
            log.warn("Could not hand off progress record for session {}: {}", session.getId(), e.getMessage());
        }
    }

    @EventListener
    public void onSessionExpired(QuizSessionExpiredEvent event) {
        log.debug("Publishing progress for expired session {}", event.getSession().getId());
        publish(event.getSession(), event.getResult());
    }
}
