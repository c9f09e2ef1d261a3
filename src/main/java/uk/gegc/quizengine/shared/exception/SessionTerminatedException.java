package uk.gegc.quizengine.shared.exception;

import uk.gegc.quizengine.features.session.domain.model.SessionStatus;

/**
 * Thrown when an operation that needs an active session reaches one that is already completed or expired.
 */
public class SessionTerminatedException extends RuntimeException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionTerminatedException(String sessionId, SessionStatus status) {
        super("Quiz session " + sessionId + " is " + status.name().toLowerCase() + " and no longer accepts this operation");
        this.sessionId = sessionId;
        this.status = status;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
