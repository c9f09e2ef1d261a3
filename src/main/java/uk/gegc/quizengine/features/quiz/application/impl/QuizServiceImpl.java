package uk.gegc.quizengine.features.quiz.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionFilter;
import uk.gegc.quizengine.features.question.domain.repository.QuestionStore;
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
import uk.gegc.quizengine.features.quiz.application.QuestionSampler;
import uk.gegc.quizengine.features.quiz.application.QuizService;
import uk.gegc.quizengine.features.quiz.application.SessionResultPublisher;
import uk.gegc.quizengine.features.quiz.config.QuizDefaultsProperties;
import uk.gegc.quizengine.features.quiz.domain.model.PracticeTestTiming;
import uk.gegc.quizengine.features.quiz.infra.mapping.QuizSessionMapper;
import uk.gegc.quizengine.features.session.application.QuizSessionManager;
import uk.gegc.quizengine.features.session.domain.model.AnswerRecord;
import uk.gegc.quizengine.features.session.domain.model.NavigationDirection;
import uk.gegc.quizengine.features.session.domain.model.QuizMode;
import uk.gegc.quizengine.features.session.domain.model.QuizSession;
import uk.gegc.quizengine.features.session.domain.model.SessionRequest;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;
import uk.gegc.quizengine.shared.exception.EmptyQuestionSetException;
import uk.gegc.quizengine.shared.exception.InsufficientQuestionsException;
import uk.gegc.quizengine.shared.exception.SectionNotFoundException;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuizServiceImpl implements QuizService {

    private static final Set<String> NO_DIFFICULTY_FILTER = Set.of("mixed", "all", "any", "realistic");

    private final QuestionStore questionStore;
    private final QuizSessionManager sessionManager;
    private final QuestionSampler questionSampler;
    private final QuizSessionMapper quizSessionMapper;
    private final QuizDefaultsProperties defaults;
    private final SessionResultPublisher resultPublisher;

    @Override
    public QuizCreatedDto createChapterQuiz(ChapterQuizRequest request, String userId) {
        int section = request.section();
        int count = resolveCount(request.questionCount(), defaults.getChapterQuestionCount());
        List<Question> pool = questionStore.find(QuestionFilter.forSection(section), null);
        if (pool.isEmpty()) {
            throw new EmptyQuestionSetException("No questions available for section " + section);
        }
        List<Question> questions = questionSampler.sample(pool, count);
        if (questions.size() < count) {
            log.debug("Section {} has {} questions, fewer than the {} requested; using all of them",
                    section, questions.size(), count);
        }
        return open(SessionRequest.builder()
                .mode(QuizMode.CHAPTER)
                .questions(questions)
                .ownerUserId(userId)
                .section(section)
                .build());
    }

    @Override
    public QuizCreatedDto createCategoryQuiz(CategoryQuizRequest request, String userId) {
        int count = resolveCount(request.questionCount(), defaults.getCategoryQuestionCount());
        QuestionFilter filter = QuestionFilter.builder()
                .category(request.category().trim())
                .difficulty(resolveDifficulty(request.difficulty()))
                .build();
        List<Question> questions = sampleOrFail(filter, count);
        return open(SessionRequest.builder()
                .mode(QuizMode.CATEGORY)
                .questions(questions)
                .ownerUserId(userId)
                .category(request.category().trim())
                .build());
    }

    @Override
    public QuizCreatedDto createRandomQuiz(RandomQuizRequest request, String userId) {
        int count = resolveCount(request.questionCount(), defaults.getRandomQuestionCount());
        QuestionFilter filter = QuestionFilter.builder()
                .sections(request.sections())
                .difficulty(resolveDifficulty(request.difficulty()))
                .build();
        List<Question> questions = sampleOrFail(filter, count);
        return open(SessionRequest.builder()
                .mode(QuizMode.RANDOM)
                .questions(questions)
                .ownerUserId(userId)
                .build());
    }

    @Override
    public QuizCreatedDto createPracticeTest(PracticeTestRequest request, String userId) {
        int count = resolveCount(request.questionCount(), defaults.getPracticeTestQuestionCount());
        PracticeTestTiming timing = PracticeTestTiming.parse(request.timeLimit());
        QuestionFilter filter = QuestionFilter.builder()
                .sections(request.sections())
                .difficulty(resolveDifficulty(request.difficulty()))
                .build();
        List<Question> questions = sampleOrFail(filter, count);
        long timeLimitSeconds = timing.toSeconds(count, defaults.getSecondsPerQuestion(), defaults.getUnlimitedTimeLimitSeconds());
        return open(SessionRequest.builder()
                .mode(QuizMode.PRACTICE_TEST)
                .questions(questions)
                .timeLimitSeconds(timeLimitSeconds)
                .unlimitedTime(timing.isUnlimited())
                .ownerUserId(userId)
                .build());
    }

    @Override
    public QuizQuestionDto getCurrentQuestion(String sessionId) {
        QuizSession session = sessionManager.getSession(sessionId);
        return quizSessionMapper.toQuestionDto(session.getCurrentQuestion());
    }

    @Override
    public QuizQuestionDto getQuizQuestion(String sessionId, int index) {
        QuizSession session = sessionManager.getSession(sessionId);
        return quizSessionMapper.toQuestionDto(session.questionAt(index));
    }

    @Override
    public QuizQuestionDto navigate(String sessionId, NavigationDirection direction) {
        QuizSession session = sessionManager.getSession(sessionId);
        int position = session.advance(direction);
        log.debug("Session {} moved {} to position {}", sessionId, direction, position);
        return quizSessionMapper.toQuestionDto(session.getCurrentQuestion());
    }

    @Override
    public AnswerSubmissionDto submitQuizAnswer(String sessionId, int index, JsonNode value, double elapsedSeconds) {
        QuizSession session = sessionManager.getSession(sessionId);
        AnswerRecord record = session.submitAnswer(index, value, elapsedSeconds);
        if (session.isFullyAnswered()) {
            SessionResult result = session.complete();
            if (result.status() == SessionStatus.COMPLETED) {
                log.info("Quiz session {} completed with score {}/{}", sessionId, result.score(), result.totalQuestions());
            }
            resultPublisher.publish(session, result);
        }
        return quizSessionMapper.toSubmissionDto(session, record);
    }

    @Override
    public QuizResultDto getQuizResults(String sessionId) {
        QuizSession session = sessionManager.getSession(sessionId);
        boolean wasActive = session.getStatus() == SessionStatus.ACTIVE;
        SessionResult result = session.complete();
        if (wasActive) {
            log.info("Quiz session {} finished early with score {}/{}", sessionId, result.score(), result.totalQuestions());
        }
        resultPublisher.publish(session, result);
        return quizSessionMapper.toResultDto(result);
    }

    @Override
    public List<WrongAnswerReviewDto> getWrongQuestionsReview(String sessionId) {
        QuizSession session = sessionManager.getSession(sessionId);
        List<WrongAnswerReviewDto> review = new ArrayList<>();
        session.getWrongReview().forEach(item -> review.add(quizSessionMapper.toReviewDto(item)));
        return review;
    }

    @Override
    public void cleanupQuizSession(String sessionId) {
        sessionManager.deleteSession(sessionId);
    }

    @Override
    public List<SectionSummaryDto> getSections() {
        Map<Integer, Long> counts = questionStore.find(QuestionFilter.all(), null).stream()
                .map(Question::getSection)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .map(entry -> new SectionSummaryDto(entry.getKey(), entry.getValue()))
                .toList();
    }

    @Override
    public SectionDetailDto getSection(int section) {
        List<Question> questions = questionStore.find(QuestionFilter.forSection(section), null);
        if (questions.isEmpty()) {
            throw new SectionNotFoundException(section);
        }
        Map<String, Long> byCategory = questions.stream()
                .map(Question::getCategory)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(),
                        () -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER), Collectors.counting()));
        Map<String, Long> byDifficulty = new LinkedHashMap<>();
        for (Difficulty difficulty : Difficulty.values()) {
            long count = questions.stream().filter(question -> question.getDifficulty() == difficulty).count();
            if (count > 0) {
                byDifficulty.put(difficulty.getValue(), count);
            }
        }
        return new SectionDetailDto(section, questions.size(), byCategory, byDifficulty);
    }

    @Override
    public CatalogStatsDto getCatalogStats() {
        // category filters match ignoring case, so case variants are one category
        Map<String, Long> byCategory = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String category : questionStore.getCategories()) {
            byCategory.computeIfAbsent(category,
                    name -> questionStore.count(QuestionFilter.builder().category(name).build()));
        }
        return new CatalogStatsDto(
                questionStore.count(QuestionFilter.all()),
                byCategory.size(),
                questionStore.getTags().size(),
                byCategory
        );
    }

    private QuizCreatedDto open(SessionRequest request) {
        String sessionId = sessionManager.createSession(request);
        return quizSessionMapper.toCreatedDto(sessionManager.getSession(sessionId));
    }

    private List<Question> sampleOrFail(QuestionFilter filter, int count) {
        List<Question> pool = questionStore.find(filter, null);
        if (pool.isEmpty()) {
            throw new InsufficientQuestionsException("No questions match the requested filters", count);
        }
        return questionSampler.sample(pool, count);
    }

    private static int resolveCount(Integer requested, int fallback) {
        int count = requested != null ? requested : fallback;
        if (count <= 0) {
            throw new ValidationException("Question count must be positive");
        }
        return count;
    }

    /**
     * "mixed" and its synonyms (or nothing) mean no difficulty filter.
     */
    static Difficulty resolveDifficulty(String raw) {
        if (raw == null || raw.isBlank() || NO_DIFFICULTY_FILTER.contains(raw.trim().toLowerCase(Locale.ROOT))) {
            return null;
        }
        return Difficulty.parse(raw)
                .orElseThrow(() -> new ValidationException("Unknown difficulty '" + raw + "'"));
    }
}
