package uk.gegc.quizengine.features.progress.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.quizengine.features.progress.domain.event.QuizCompletedEvent;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.progress.domain.repository.ProgressSink;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;
import uk.gegc.quizengine.shared.exception.ProgressSinkWriteException;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProgressRecordingListener")
class ProgressRecordingListenerTest {

    @Mock
    private ProgressSink progressSink;

    @InjectMocks
    private ProgressRecordingListener listener;

    private final QuizResultRecord record = QuizResultRecord.builder()
            .sessionId("s-1")
            .userId("user-1")
            .quizType("chapter")
            .status(SessionStatus.COMPLETED)
            .section(2)
            .score(7)
            .totalQuestions(10)
            .percentage(70.0)
            .durationSeconds(420)
            .completedAt(Instant.parse("2024-05-01T09:07:00Z"))
            .build();

    @Test
    @DisplayName("writes the event's record to the sink")
    void writesRecord() {
        listener.onQuizCompleted(new QuizCompletedEvent(this, record));

        verify(progressSink).write(record);
    }

    @Test
    @DisplayName("a sink write failure is logged and dropped")
    void sinkFailureDropped() {
        doThrow(new ProgressSinkWriteException("disk full", new IOException("disk full")))
                .when(progressSink).write(record);

        assertThatCode(() -> listener.onQuizCompleted(new QuizCompletedEvent(this, record)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("an unexpected sink error is logged and dropped")
    void unexpectedFailureDropped() {
        doThrow(new IllegalStateException("boom")).when(progressSink).write(record);

        assertThatCode(() -> listener.onQuizCompleted(new QuizCompletedEvent(this, record)))
                .doesNotThrowAnyException();
    }
}
