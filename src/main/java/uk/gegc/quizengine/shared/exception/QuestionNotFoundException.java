package uk.gegc.quizengine.shared.exception;

public class QuestionNotFoundException extends RuntimeException {

    private final String questionId;

    public QuestionNotFoundException(String questionId) {
        super("Question " + questionId + " not found");
        this.questionId = questionId;
    }

    public String getQuestionId() {
        return questionId;
    }
}
