package uk.gegc.quizengine.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.quizengine.shared.api.problem.ErrorCodes;
import uk.gegc.quizengine.shared.api.problem.ErrorTypes;
import uk.gegc.quizengine.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.quizengine.shared.exception.*;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.SESSION_NOT_FOUND,
                ErrorCodes.SESSION_NOT_FOUND,
                "Quiz Session Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(SessionTerminatedException.class)
    public ResponseEntity<ProblemDetail> handleSessionTerminated(SessionTerminatedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.SESSION_TERMINATED,
                ErrorCodes.SESSION_TERMINATED,
                "Quiz Session Terminated",
                ex.getMessage(),
                request
        );
        problem.setProperty("sessionStatus", ex.getStatus().name());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(SessionNotCompletedException.class)
    public ResponseEntity<ProblemDetail> handleSessionNotCompleted(SessionNotCompletedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.SESSION_NOT_COMPLETED,
                ErrorCodes.SESSION_NOT_COMPLETED,
                "Quiz Session Not Completed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidPositionException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPosition(InvalidPositionException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_POSITION,
                ErrorCodes.INVALID_POSITION,
                "Invalid Question Position",
                ex.getMessage(),
                request
        );
        problem.setProperty("position", ex.getPosition());
        problem.setProperty("totalQuestions", ex.getSize());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(QuestionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleQuestionNotFound(QuestionNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.QUESTION_NOT_FOUND,
                ErrorCodes.QUESTION_NOT_FOUND,
                "Question Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(SectionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSectionNotFound(SectionNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.SECTION_NOT_FOUND,
                ErrorCodes.SECTION_NOT_FOUND,
                "Section Not Found",
                ex.getMessage(),
                request
        );
        problem.setProperty("section", ex.getSection());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(EmptyQuestionSetException.class)
    public ResponseEntity<ProblemDetail> handleEmptyQuestionSet(EmptyQuestionSetException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.EMPTY_QUESTION_SET,
                ErrorCodes.EMPTY_QUESTION_SET,
                "Empty Question Set",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(InsufficientQuestionsException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientQuestions(InsufficientQuestionsException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.INSUFFICIENT_QUESTIONS,
                ErrorCodes.INSUFFICIENT_QUESTIONS,
                "Insufficient Questions",
                ex.getMessage(),
                request
        );
        problem.setProperty("requested", ex.getRequested());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(UnknownQuestionTypeException.class)
    public ResponseEntity<ProblemDetail> handleUnknownQuestionType(UnknownQuestionTypeException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.UNKNOWN_QUESTION_TYPE,
                ErrorCodes.UNKNOWN_QUESTION_TYPE,
                "Unknown Question Type",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(QuestionStoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(QuestionStoreUnavailableException ex, HttpServletRequest request) {
        logger.warn("Question store unavailable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.QUESTION_STORE_UNAVAILABLE,
                ErrorCodes.QUESTION_STORE_UNAVAILABLE,
                "Question Store Unavailable",
                "The question catalog is currently unavailable. Please try again later.",
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    @ExceptionHandler({ValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleValidation(RuntimeException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                ErrorCodes.VALIDATION_FAILED,
                "Validation Failed",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<FieldValidationError> violations = ex.getConstraintViolations().stream()
                .map(v -> new FieldValidationError(v.getPropertyPath().toString(), v.getMessage(), v.getInvalidValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                ErrorCodes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more parameters",
                request
        );
        problem.setProperty("fieldErrors", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                ErrorCodes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                ErrorCodes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                ErrorCodes.INTERNAL_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    public record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
