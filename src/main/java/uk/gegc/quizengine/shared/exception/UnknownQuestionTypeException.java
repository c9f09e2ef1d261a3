package uk.gegc.quizengine.shared.exception;

/**
 * Thrown when a persisted question carries a {@code type} that is not one of the supported question kinds.
 */
public class UnknownQuestionTypeException extends RuntimeException {

    private final String type;

    public UnknownQuestionTypeException(String type) {
        super("Unknown question type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
