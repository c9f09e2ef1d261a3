package uk.gegc.quizengine.shared.exception;

/**
 * Thrown when the filtered question pool for a quiz is empty.
 */
public class InsufficientQuestionsException extends RuntimeException {

    private final int requested;

    public InsufficientQuestionsException(String message, int requested) {
        super(message);
        this.requested = requested;
    }

    public int getRequested() {
        return requested;
    }
}
