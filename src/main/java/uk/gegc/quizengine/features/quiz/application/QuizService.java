package uk.gegc.quizengine.features.quiz.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.quizengine.features.quiz.api.dto.AnswerSubmissionDto;
import uk.gegc.quizengine.features.quiz.api.dto.CatalogStatsDto;
import uk.gegc.quizengine.features.quiz.api.dto.CategoryQuizRequest;
import uk.gegc.quizengine.features.quiz.api.dto.ChapterQuizRequest;
import uk.gegc.quizengine.features.quiz.api.dto.PracticeTestRequest;
import uk.gegc.quizengine.features.quiz.api.dto.QuizCreatedDto;
import uk.gegc.quizengine.features.quiz.api.dto.QuizQuestionDto;
import uk.gegc.quizengine.features.quiz.api.dto.QuizResultDto;
import uk.gegc.quizengine.features.quiz.api.dto.RandomQuizRequest;
import uk.gegc.quizengine.features.quiz.api.dto.SectionDetailDto;
import uk.gegc.quizengine.features.quiz.api.dto.SectionSummaryDto;
import uk.gegc.quizengine.features.quiz.api.dto.WrongAnswerReviewDto;
import uk.gegc.quizengine.features.session.domain.model.NavigationDirection;

import java.util.List;

/**
 * Builds quiz sessions from the question store and mediates answering, scoring and review.
 * <p>
 * {@code userId} identifies the quiz taker; sessions created without one are scored but their
 * results are not written to the progress sink.
 */
public interface QuizService {

    QuizCreatedDto createChapterQuiz(ChapterQuizRequest request, String userId);

    QuizCreatedDto createCategoryQuiz(CategoryQuizRequest request, String userId);

    QuizCreatedDto createRandomQuiz(RandomQuizRequest request, String userId);

    QuizCreatedDto createPracticeTest(PracticeTestRequest request, String userId);

    QuizQuestionDto getCurrentQuestion(String sessionId);

    QuizQuestionDto getQuizQuestion(String sessionId, int index);

    QuizQuestionDto navigate(String sessionId, NavigationDirection direction);

    AnswerSubmissionDto submitQuizAnswer(String sessionId, int index, JsonNode value, double elapsedSeconds);

    QuizResultDto getQuizResults(String sessionId);

    List<WrongAnswerReviewDto> getWrongQuestionsReview(String sessionId);

    void cleanupQuizSession(String sessionId);

    List<SectionSummaryDto> getSections();

    /**
     * @throws uk.gegc.quizengine.shared.exception.SectionNotFoundException if the chapter has no questions
     */
    SectionDetailDto getSection(int section);

    CatalogStatsDto getCatalogStats();
}
