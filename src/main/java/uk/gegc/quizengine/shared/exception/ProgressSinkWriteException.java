package uk.gegc.quizengine.shared.exception;

/**
 * Raised by a progress sink when a quiz result could not be stored.
 * Always handled by the progress listener; never reaches a quiz taker.
 */
public class ProgressSinkWriteException extends RuntimeException {

    public ProgressSinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
