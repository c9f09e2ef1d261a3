package uk.gegc.quizengine.features.session.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.session.application.QuizSessionManager;
import uk.gegc.quizengine.features.session.config.QuizSessionProperties;

/**
 * Periodically expires abandoned sessions and evicts finished ones from the registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuizSessionCleanupScheduler {

    private final QuizSessionManager sessionManager;
    private final QuizSessionProperties properties;

    /**
     * The delay is configurable via quiz.sessions.cleanup-fixed-delay-seconds.
     * Default: 300 seconds (5 minutes)
     */
    @Scheduled(fixedDelayString = "${quiz.sessions.cleanup-fixed-delay-seconds:300}000")
    public void cleanupExpiredSessions() {
        log.debug("Running scheduled quiz session cleanup");
        try {
            sessionManager.cleanupExpired(properties.getMaxAge());
        } catch (Exception e) {
            log.error("Error during scheduled quiz session cleanup", e);
        }
    }
}
