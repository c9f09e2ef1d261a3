package uk.gegc.quizengine.shared.exception;

public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Quiz session " + sessionId + " not found");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
