package uk.gegc.quizengine.features.question.domain.repository;

import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionFilter;
import uk.gegc.quizengine.shared.exception.QuestionStoreUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only question catalog consumed by the quiz engine.
 * <p>
 * Every method fails fast with {@link QuestionStoreUnavailableException} when the backing catalog
 * cannot be reached or was never loaded.
 */
public interface QuestionStore {

    /**
     * @param limit maximum number of questions to return, or {@code null} for no limit
     */
    List<Question> find(QuestionFilter filter, Integer limit);

    /**
     * Pages through the matching questions in catalog order.
     *
     * @param skip  number of matching questions to pass over first
     * @param limit maximum number of questions to return, or {@code null} for no limit
     */
    List<Question> find(QuestionFilter filter, int skip, Integer limit);

    Optional<Question> findById(String id);

    long count(QuestionFilter filter);

    Set<String> getCategories();

    Set<String> getTags();
}
