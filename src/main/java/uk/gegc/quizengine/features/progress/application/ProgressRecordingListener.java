package uk.gegc.quizengine.features.progress.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.progress.domain.event.QuizCompletedEvent;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.progress.domain.repository.ProgressSink;
import uk.gegc.quizengine.shared.exception.ProgressSinkWriteException;

/**
 * Drains completed quiz results into the progress sink. Failures are logged and the record dropped;
 * they never reach the quiz taker.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressRecordingListener {

    private final ProgressSink progressSink;

    @Async("progressTaskExecutor")
    @EventListener
    public void onQuizCompleted(QuizCompletedEvent event) {
        QuizResultRecord record = event.getRecord();
        try {
            progressSink.write(record);
            log.debug("Recorded progress for session {} (user {})", record.sessionId(), record.userId());
        } catch (ProgressSinkWriteException e) {
            log.warn("Dropping progress record for session {}: {}", record.sessionId(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error recording progress for session {}", record.sessionId(), e);
        }
    }
}
