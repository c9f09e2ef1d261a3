package uk.gegc.quizengine.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant has a matching stable error code that clients can switch on.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://quiz-engine.gegc.uk/docs/errors";

    // ==================== Session Errors ====================
    public static final URI SESSION_NOT_FOUND = URI.create(BASE_URL + "/session-not-found");
    public static final URI SESSION_TERMINATED = URI.create(BASE_URL + "/session-terminated");
    public static final URI SESSION_NOT_COMPLETED = URI.create(BASE_URL + "/session-not-completed");
    public static final URI INVALID_POSITION = URI.create(BASE_URL + "/invalid-position");

    // ==================== Question Pool Errors ====================
    public static final URI QUESTION_NOT_FOUND = URI.create(BASE_URL + "/question-not-found");
    public static final URI SECTION_NOT_FOUND = URI.create(BASE_URL + "/section-not-found");
    public static final URI EMPTY_QUESTION_SET = URI.create(BASE_URL + "/empty-question-set");
    public static final URI INSUFFICIENT_QUESTIONS = URI.create(BASE_URL + "/insufficient-questions");
    public static final URI UNKNOWN_QUESTION_TYPE = URI.create(BASE_URL + "/unknown-question-type");
    public static final URI QUESTION_STORE_UNAVAILABLE = URI.create(BASE_URL + "/question-store-unavailable");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
