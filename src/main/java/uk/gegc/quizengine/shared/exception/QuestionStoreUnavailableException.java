package uk.gegc.quizengine.shared.exception;

public class QuestionStoreUnavailableException extends RuntimeException {

    public QuestionStoreUnavailableException(String message) {
        super(message);
    }

    public QuestionStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
