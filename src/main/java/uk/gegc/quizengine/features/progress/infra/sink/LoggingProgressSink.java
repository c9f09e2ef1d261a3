package uk.gegc.quizengine.features.progress.infra.sink;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.progress.domain.repository.ProgressSink;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "quiz.progress", name = "sink", havingValue = "log", matchIfMissing = true)
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void write(QuizResultRecord record) {
        log.info("Quiz progress: user={} type={} status={} section={} score={}/{} ({}%) duration={}s completedAt={}",
                record.userId(), record.quizType(), record.status(), record.section(), record.score(), record.totalQuestions(),
                record.percentage(), record.durationSeconds(), record.completedAt());
    }
}
