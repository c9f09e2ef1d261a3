package uk.gegc.quizengine.features.progress.domain.repository;

import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.shared.exception.ProgressSinkWriteException;

/**
 * Write-only destination for completed quiz results.
 */
public interface ProgressSink {

    /**
     * @throws ProgressSinkWriteException if the record could not be stored
     */
    void write(QuizResultRecord record);
}
