package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.quizengine.features.question.infra.handler.QuestionHandler;
import uk.gegc.quizengine.shared.exception.EmptyQuestionSetException;
import uk.gegc.quizengine.shared.exception.InvalidPositionException;
import uk.gegc.quizengine.shared.exception.SessionNotCompletedException;
import uk.gegc.quizengine.shared.exception.SessionTerminatedException;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One quiz attempt: an immutable, ordered snapshot of questions plus the answers submitted against it.
 * <p>
 * Status moves only from {@link SessionStatus#ACTIVE} to {@link SessionStatus#COMPLETED} or
 * {@link SessionStatus#EXPIRED}; both are terminal and freeze the answers. All state access is
 * synchronized on the session, and every operation validates before it mutates.
 */
public class QuizSession {

    @Getter
    private final String id;
    @Getter
    private final QuizMode mode;
    @Getter
    private final List<Question> questions;
    @Getter
    private final Long timeLimitSeconds;
    @Getter
    private final boolean unlimitedTime;
    @Getter
    private final String ownerUserId;
    @Getter
    private final Integer section;
    @Getter
    private final String category;
    @Getter
    private final Instant startedAt;

    private final Clock clock;
    private final QuestionHandlerFactory handlerFactory;
    private final Map<Integer, AnswerRecord> answers = new HashMap<>();
    private final AtomicBoolean resultPublished = new AtomicBoolean();

    private int currentIndex;
    private SessionStatus status;
    private SessionResult result;

    @Builder
    private QuizSession(String id,
                        QuizMode mode,
                        List<Question> questions,
                        Long timeLimitSeconds,
                        boolean unlimitedTime,
                        String ownerUserId,
                        Integer section,
                        String category,
                        Clock clock,
                        QuestionHandlerFactory handlerFactory) {
        if (questions == null || questions.isEmpty()) {
            throw new EmptyQuestionSetException("A quiz session needs at least one question");
        }
        this.id = id;
        this.mode = mode;
        this.questions = List.copyOf(questions);
        this.timeLimitSeconds = timeLimitSeconds;
        this.unlimitedTime = unlimitedTime;
        this.ownerUserId = ownerUserId;
        this.section = section;
        this.category = category;
        this.clock = clock;
        this.handlerFactory = handlerFactory;
        this.startedAt = clock.instant();
        this.currentIndex = 0;
        this.status = SessionStatus.ACTIVE;
    }

    public int size() {
        return questions.size();
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    /**
     * Time the session left the active state, or {@code null} while it is still active.
     */
    public synchronized Instant getEndedAt() {
        return result == null ? null : result.endedAt();
    }

    public synchronized int getAnsweredCount() {
        return answers.size();
    }

    public synchronized int getCorrectCount() {
        return (int) answers.values().stream().filter(AnswerRecord::correct).count();
    }

    public synchronized boolean isFullyAnswered() {
        return answers.size() == questions.size();
    }

    public synchronized Optional<AnswerRecord> getAnswer(int position) {
        return Optional.ofNullable(answers.get(position));
    }

    public synchronized Optional<SessionResult> getResult() {
        return Optional.ofNullable(result);
    }

    public synchronized QuestionView getCurrentQuestion() {
        requireActive();
        return view(currentIndex);
    }

    /**
     * Reads a position without moving the navigation pointer.
     */
    public synchronized QuestionView questionAt(int position) {
        requireActive();
        requirePosition(position);
        return view(position);
    }

    /**
     * Records an answer for a position. A second submission for the same position replaces the first.
     * Does not move the navigation pointer.
     */
    public synchronized AnswerRecord submitAnswer(int position, JsonNode submitted, double elapsedSeconds) {
        requireActive();
        requirePosition(position);
        if (Double.isNaN(elapsedSeconds) || elapsedSeconds < 0) {
            throw new ValidationException("Elapsed time must be a non-negative number of seconds");
        }
        Question question = questions.get(position);
        QuestionHandler handler = handlerFactory.getHandler(question.getType());
        boolean correct = handler.checkAnswer(question, submitted);
        AnswerRecord record = new AnswerRecord(position, submitted, correct, elapsedSeconds, clock.instant());
        answers.put(position, record);
        return record;
    }

    /**
     * Moves the navigation pointer one step, staying put at either end.
     *
     * @return the pointer after the move
     */
    public synchronized int advance(NavigationDirection direction) {
        requireActive();
        int target = currentIndex + direction.getStep();
        currentIndex = Math.max(0, Math.min(questions.size() - 1, target));
        return currentIndex;
    }

    /**
     * Completes an active session and snapshots its score. Once the session is terminal this returns
     * the snapshot taken at that point, unchanged.
     */
    public synchronized SessionResult complete() {
        if (status == SessionStatus.ACTIVE) {
            terminate(SessionStatus.COMPLETED);
        }
        return result;
    }

    /**
     * Abandons an active session, snapshotting its score under {@link SessionStatus#EXPIRED}.
     * A session that is already terminal keeps its existing status.
     */
    public synchronized SessionResult expire() {
        if (status == SessionStatus.ACTIVE) {
            terminate(SessionStatus.EXPIRED);
        }
        return result;
    }

    /**
     * Wrong answers of a completed or expired session, in position order. The returned iterable
     * reads a snapshot and can be iterated any number of times.
     *
     * @throws SessionNotCompletedException while the session is still active
     */
    public synchronized Iterable<WrongAnswerReview> getWrongReview() {
        if (status == SessionStatus.ACTIVE) {
            throw new SessionNotCompletedException(id);
        }
        List<AnswerRecord> snapshot = new ArrayList<>(answers.values());
        snapshot.sort((a, b) -> Integer.compare(a.position(), b.position()));
        List<AnswerRecord> frozen = List.copyOf(snapshot);
        return () -> frozen.stream()
                .filter(record -> !record.correct())
                .map(this::toReview)
                .iterator();
    }

    /**
     * Instant the time limit runs out, if the session is timed.
     */
    public Optional<Instant> deadline() {
        if (timeLimitSeconds == null || unlimitedTime) {
            return Optional.empty();
        }
        return Optional.of(startedAt.plusSeconds(timeLimitSeconds));
    }

    /**
     * Claims the single right to publish this session's result.
     *
     * @return {@code true} for exactly one caller over the session's lifetime
     */
    public boolean claimResultPublication() {
        return resultPublished.compareAndSet(false, true);
    }

    private void terminate(SessionStatus terminal) {
        Instant endedAt = clock.instant();
        int score = (int) answers.values().stream().filter(AnswerRecord::correct).count();
        double timeSpent = answers.values().stream().mapToDouble(AnswerRecord::timeSpentSeconds).sum();
        status = terminal;
        result = SessionResult.builder()
                .sessionId(id)
                .mode(mode)
                .status(terminal)
                .score(score)
                .totalQuestions(questions.size())
                .answeredCount(answers.size())
                .percentage(SessionResult.percentage(score, questions.size()))
                .durationSeconds(Math.max(0, Duration.between(startedAt, endedAt).getSeconds()))
                .timeSpentSeconds(timeSpent)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .build();
    }

    private WrongAnswerReview toReview(AnswerRecord record) {
        Question question = questions.get(record.position());
        JsonNode correct = handlerFactory.getHandler(question.getType()).correctAnswer(question);
        return new WrongAnswerReview(record.position(), question, record.submittedAnswer(), correct, question.getExplanation());
    }

    private QuestionView view(int position) {
        Question question = questions.get(position);
        boolean answered = answers.containsKey(position);
        return QuestionView.builder()
                .position(position)
                .totalQuestions(questions.size())
                .questionId(question.getId())
                .type(question.getType())
                .text(question.getText())
                .scenarioText(question.getScenarioText())
                .category(question.getCategory())
                .section(question.getSection())
                .difficulty(question.getDifficulty())
                .payload(handlerFactory.getHandler(question.getType()).renderPayload(question))
                .answered(answered)
                .explanation(answered ? question.getExplanation() : null)
                .build();
    }

    private void requireActive() {
        if (status != SessionStatus.ACTIVE) {
            throw new SessionTerminatedException(id, status);
        }
    }

    private void requirePosition(int position) {
        if (position < 0 || position >= questions.size()) {
            throw new InvalidPositionException(position, questions.size());
        }
    }
}
