package uk.gegc.quizengine.features.question.domain.model;

/**
 * Non-fatal defect found while loading a persisted question: one JSON-encoded field could not be read
 * and was replaced by its default.
 */
public record MalformedQuestionWarning(String questionId, String field, String detail) {

    @Override
    public String toString() {
        return "Malformed '" + field + "' on question " + questionId + ": " + detail;
    }
}
