package uk.gegc.quizengine.shared.exception;

public class EmptyQuestionSetException extends RuntimeException {

    public EmptyQuestionSetException(String message) {
        super(message);
    }
}
