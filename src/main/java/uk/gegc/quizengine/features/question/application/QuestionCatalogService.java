package uk.gegc.quizengine.features.question.application;

import uk.gegc.quizengine.features.question.api.dto.QuestionDto;

import java.util.List;

/**
 * Read-only browsing of the question catalog. Answer keys never leave this service.
 */
public interface QuestionCatalogService {

    /**
     * @param category   exact category, ignoring case; {@code null} for any
     * @param difficulty difficulty level name; {@code null} or blank for any
     * @param tags       questions carrying at least one of these tags; {@code null} or empty for any
     * @throws uk.gegc.quizengine.shared.exception.ValidationException if the difficulty is not recognised
     */
    List<QuestionDto> listQuestions(String category, String difficulty, List<String> tags, int limit, int skip);

    /**
     * @throws uk.gegc.quizengine.shared.exception.QuestionNotFoundException if no question has this id
     */
    QuestionDto getQuestion(String questionId);

    List<String> getCategories();

    List<String> getTags();
}
