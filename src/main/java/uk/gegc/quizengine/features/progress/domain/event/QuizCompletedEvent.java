package uk.gegc.quizengine.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;

/**
 * Published once when a quiz session owned by a known user completes or is expired by the cleanup sweep.
 * <p>
 * Listeners run on the progress executor so a slow or failing sink never delays scoring.
 */
public class QuizCompletedEvent extends ApplicationEvent {

    private final QuizResultRecord record;

    public QuizCompletedEvent(Object source, QuizResultRecord record) {
        super(source);
        this.record = record;
    }

    public QuizResultRecord getRecord() {
        return record;
    }
}
