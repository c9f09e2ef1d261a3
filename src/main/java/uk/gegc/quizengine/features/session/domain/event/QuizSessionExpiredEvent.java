package uk.gegc.quizengine.features.session.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.quizengine.features.session.domain.model.QuizSession;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;

/**
 * Published by the cleanup sweep for each active session it expires, after the session has been evicted.
 */
public class QuizSessionExpiredEvent extends ApplicationEvent {

    private final QuizSession session;
    private final SessionResult result;

    public QuizSessionExpiredEvent(Object source, QuizSession session, SessionResult result) {
        super(source);
        this.session = session;
        this.result = result;
    }

    public QuizSession getSession() {
        return session;
    }

    public SessionResult getResult() {
        return result;
    }
}
