package uk.gegc.quizengine.shared.api.problem;

/**
 * Stable machine-readable error codes, exposed as the {@code code} property of every problem response.
 */
public final class ErrorCodes {

    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
    public static final String SESSION_TERMINATED = "SESSION_TERMINATED";
    public static final String SESSION_NOT_COMPLETED = "SESSION_NOT_COMPLETED";
    public static final String INVALID_POSITION = "INVALID_POSITION";
    public static final String QUESTION_NOT_FOUND = "QUESTION_NOT_FOUND";
    public static final String SECTION_NOT_FOUND = "SECTION_NOT_FOUND";
    public static final String EMPTY_QUESTION_SET = "EMPTY_QUESTION_SET";
    public static final String INSUFFICIENT_QUESTIONS = "INSUFFICIENT_QUESTIONS";
    public static final String UNKNOWN_QUESTION_TYPE = "UNKNOWN_QUESTION_TYPE";
    public static final String QUESTION_STORE_UNAVAILABLE = "QUESTION_STORE_UNAVAILABLE";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String MALFORMED_JSON = "MALFORMED_JSON";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
