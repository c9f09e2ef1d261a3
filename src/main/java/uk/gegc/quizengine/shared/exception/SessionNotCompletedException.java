package uk.gegc.quizengine.shared.exception;

/**
 * Thrown when the wrong-answer review of a session is requested while the session is still active.
 */
public class SessionNotCompletedException extends RuntimeException {

    private final String sessionId;

    public SessionNotCompletedException(String sessionId) {
        super("Quiz session " + sessionId + " is still active. Review is only available for completed or expired sessions.");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
