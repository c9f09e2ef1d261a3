package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.quizengine.shared.exception.EmptyQuestionSetException;
import uk.gegc.quizengine.shared.exception.InvalidPositionException;
import uk.gegc.quizengine.shared.exception.SessionNotCompletedException;
import uk.gegc.quizengine.shared.exception.SessionTerminatedException;
import uk.gegc.quizengine.shared.exception.ValidationException;
import uk.gegc.quizengine.testsupport.MutableClock;
import uk.gegc.quizengine.testsupport.QuestionFixtures;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuizSession")
class QuizSessionTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private final QuestionHandlerFactory handlerFactory = QuestionFixtures.handlerFactory();
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private QuizSession session(Question... questions) {
        return QuizSession.builder()
                .id("s-1")
                .mode(QuizMode.CHAPTER)
                .questions(List.of(questions))
                .clock(clock)
                .handlerFactory(handlerFactory)
                .build();
    }

    private QuizSession threeQuestionSession() {
        return session(
                QuestionFixtures.multipleChoice("q-1", 1),
                QuestionFixtures.trueFalse("q-2", 1, Difficulty.EASY, true),
                QuestionFixtures.fillInBlank("q-3", "availability"));
    }

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("starts active at position 0 with the start time recorded")
        void startsActive() {
            QuizSession session = threeQuestionSession();

            assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
            assertThat(session.getCurrentIndex()).isZero();
            assertThat(session.getStartedAt()).isEqualTo(START);
            assertThat(session.getEndedAt()).isNull();
            assertThat(session.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("an empty question list is rejected")
        void emptyRejected() {
            assertThatThrownBy(this::emptySession).isInstanceOf(EmptyQuestionSetException.class);
        }

        private QuizSession emptySession() {
            return session();
        }

        @Test
        @DisplayName("the question list is a snapshot of the input")
        void questionsAreSnapshot() {
            List<Question> input = new ArrayList<>(List.of(QuestionFixtures.multipleChoice("q-1", 1)));
            QuizSession session = QuizSession.builder()
                    .id("s-2").mode(QuizMode.RANDOM).questions(input)
                    .clock(clock).handlerFactory(handlerFactory).build();

            input.add(QuestionFixtures.multipleChoice("q-2", 1));

            assertThat(session.getQuestions()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("answering")
    class Answering {

        @Test
        @DisplayName("letter B on a question whose key is index 1 is correct; C is not")
        void letterAnswers() {
            QuizSession correct = session(QuestionFixtures.multipleChoice("q-1", 1));
            QuizSession wrong = session(QuestionFixtures.multipleChoice("q-1", 1));

            assertThat(correct.submitAnswer(0, nodes.textNode("B"), 5).correct()).isTrue();
            assertThat(wrong.submitAnswer(0, nodes.textNode("C"), 5).correct()).isFalse();

            assertThat(correct.complete().score()).isEqualTo(1);
            assertThat(wrong.complete().score()).isZero();
        }

        @Test
        @DisplayName("re-submitting a position replaces the earlier answer")
        void lastWriteWins() {
            QuizSession session = threeQuestionSession();

            session.submitAnswer(0, nodes.textNode("A"), 3);
            AnswerRecord second = session.submitAnswer(0, nodes.textNode("B"), 4);

            assertThat(second.correct()).isTrue();
            assertThat(session.getAnsweredCount()).isEqualTo(1);
            assertThat(session.getAnswer(0)).contains(second);
        }

        @Test
        @DisplayName("submitting does not move the navigation pointer")
        void submitDoesNotAdvance() {
            QuizSession session = threeQuestionSession();

            session.submitAnswer(2, nodes.textNode("availability"), 1);

            assertThat(session.getCurrentIndex()).isZero();
        }

        @Test
        @DisplayName("out-of-range positions are rejected without recording anything")
        void invalidPosition() {
            QuizSession session = threeQuestionSession();

            assertThatThrownBy(() -> session.submitAnswer(3, nodes.booleanNode(true), 1))
                    .isInstanceOf(InvalidPositionException.class);
            assertThatThrownBy(() -> session.submitAnswer(-1, nodes.booleanNode(true), 1))
                    .isInstanceOf(InvalidPositionException.class);
            assertThat(session.getAnsweredCount()).isZero();
        }

        @Test
        @DisplayName("negative elapsed time is rejected")
        void negativeElapsed() {
            QuizSession session = threeQuestionSession();

            assertThatThrownBy(() -> session.submitAnswer(0, nodes.textNode("B"), -1))
                    .isInstanceOf(ValidationException.class);
            assertThat(session.getAnsweredCount()).isZero();
        }

        @Test
        @DisplayName("explanation is withheld until the position is answered")
        void explanationAfterAnswer() {
            QuizSession session = threeQuestionSession();

            assertThat(session.questionAt(1).explanation()).isNull();
            assertThat(session.questionAt(1).answered()).isFalse();

            session.submitAnswer(1, nodes.booleanNode(false), 2);

            assertThat(session.questionAt(1).answered()).isTrue();
            assertThat(session.questionAt(1).explanation()).isEqualTo("Explanation q-2");
        }

        @Test
        @DisplayName("fully answered once every position has an answer")
        void fullyAnswered() {
            QuizSession session = threeQuestionSession();
            session.submitAnswer(0, nodes.textNode("B"), 1);
            session.submitAnswer(1, nodes.booleanNode(true), 1);
            assertThat(session.isFullyAnswered()).isFalse();

            session.submitAnswer(2, nodes.textNode("Availability"), 1);

            assertThat(session.isFullyAnswered()).isTrue();
            assertThat(session.getCorrectCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("navigation")
    class Navigation {

        @Test
        @DisplayName("previous at the first question stays at 0")
        void previousAtStart() {
            QuizSession session = threeQuestionSession();

            assertThat(session.advance(NavigationDirection.PREVIOUS)).isZero();
            assertThat(session.getCurrentIndex()).isZero();
        }

        @Test
        @DisplayName("next at the last question stays at the last index")
        void nextAtEnd() {
            QuizSession session = threeQuestionSession();
            session.advance(NavigationDirection.NEXT);
            session.advance(NavigationDirection.NEXT);

            assertThat(session.advance(NavigationDirection.NEXT)).isEqualTo(2);
            assertThat(session.getCurrentQuestion().questionId()).isEqualTo("q-3");
        }

        @Test
        @DisplayName("questionAt reads a position without moving the pointer")
        void questionAtDoesNotMove() {
            QuizSession session = threeQuestionSession();

            assertThat(session.questionAt(2).questionId()).isEqualTo("q-3");
            assertThat(session.getCurrentIndex()).isZero();
        }

        @Test
        @DisplayName("the rendered view never carries the answer key")
        void viewWithoutKey() {
            QuestionView view = threeQuestionSession().getCurrentQuestion();

            assertThat(view.payload().has("correctAnswer")).isFalse();
            assertThat(view.payload().get("options")).hasSize(4);
            assertThat(view.totalQuestions()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("completion")
    class Completion {

        @Test
        @DisplayName("complete is idempotent: same score, same completion time")
        void completeIsIdempotent() {
            QuizSession session = threeQuestionSession();
            session.submitAnswer(0, nodes.textNode("B"), 10);
            clock.advance(Duration.ofSeconds(90));

            SessionResult first = session.complete();
            clock.advance(Duration.ofMinutes(5));
            SessionResult second = session.complete();

            assertThat(second).isEqualTo(first);
            assertThat(session.getEndedAt()).isEqualTo(START.plusSeconds(90));
            assertThat(first.score()).isEqualTo(1);
            assertThat(first.totalQuestions()).isEqualTo(3);
            assertThat(first.percentage()).isEqualTo(33.33);
            assertThat(first.durationSeconds()).isEqualTo(90);
            assertThat(first.status()).isEqualTo(SessionStatus.COMPLETED);
        }

        @Test
        @DisplayName("a terminal session rejects further answers, reads and navigation")
        void terminalRejectsMutation() {
            QuizSession session = threeQuestionSession();
            session.complete();

            assertThatThrownBy(() -> session.submitAnswer(0, nodes.textNode("B"), 1))
                    .isInstanceOf(SessionTerminatedException.class);
            assertThatThrownBy(session::getCurrentQuestion).isInstanceOf(SessionTerminatedException.class);
            assertThatThrownBy(() -> session.advance(NavigationDirection.NEXT))
                    .isInstanceOf(SessionTerminatedException.class);
            assertThat(session.getAnsweredCount()).isZero();
        }

        @Test
        @DisplayName("expire snapshots the score and cannot be undone by complete")
        void expireIsTerminal() {
            QuizSession session = threeQuestionSession();
            session.submitAnswer(1, nodes.booleanNode(true), 2);

            SessionResult expired = session.expire();
            SessionResult afterComplete = session.complete();

            assertThat(expired.status()).isEqualTo(SessionStatus.EXPIRED);
            assertThat(expired.score()).isEqualTo(1);
            assertThat(afterComplete).isEqualTo(expired);
            assertThat(session.getStatus()).isEqualTo(SessionStatus.EXPIRED);
        }

        @Test
        @DisplayName("expire after complete keeps the completed status")
        void expireAfterComplete() {
            QuizSession session = threeQuestionSession();
            session.complete();

            assertThat(session.expire().status()).isEqualTo(SessionStatus.COMPLETED);
        }

        @Test
        @DisplayName("publication can be claimed once")
        void publicationClaimedOnce() {
            QuizSession session = threeQuestionSession();

            assertThat(session.claimResultPublication()).isTrue();
            assertThat(session.claimResultPublication()).isFalse();
        }
    }

    @Nested
    @DisplayName("wrong-answer review")
    class Review {

        @Test
        @DisplayName("not available while active")
        void unavailableWhileActive() {
            QuizSession session = threeQuestionSession();

            assertThatThrownBy(session::getWrongReview).isInstanceOf(SessionNotCompletedException.class);
        }

        @Test
        @DisplayName("includes exactly the answered positions that were wrong, in order")
        void includesWrongAnswersOnly() {
            QuizSession session = threeQuestionSession();
            session.submitAnswer(2, nodes.textNode("uptime"), 1);
            session.submitAnswer(0, nodes.textNode("A"), 1);
            session.submitAnswer(1, nodes.booleanNode(true), 1);
            session.complete();

            List<WrongAnswerReview> review = new ArrayList<>();
            session.getWrongReview().forEach(review::add);

            assertThat(review).extracting(WrongAnswerReview::position).containsExactly(0, 2);
            assertThat(review.get(0).submittedAnswer().asText()).isEqualTo("A");
            assertThat(review.get(0).correctAnswer().asText()).isEqualTo("Firewall");
            assertThat(review.get(0).explanation()).isEqualTo("Explanation q-1");
            assertThat(review.get(1).correctAnswer().asText()).isEqualTo("availability");
        }

        @Test
        @DisplayName("unanswered positions are not part of the review")
        void unansweredExcluded() {
            QuizSession session = threeQuestionSession();
            session.expire();

            assertThat(session.getWrongReview()).isEmpty();
        }

        @Test
        @DisplayName("the review can be iterated repeatedly with the same result")
        void restartable() {
            QuizSession session = threeQuestionSession();
            session.submitAnswer(0, nodes.textNode("D"), 1);
            session.complete();

            Iterable<WrongAnswerReview> review = session.getWrongReview();
            Iterator<WrongAnswerReview> first = review.iterator();
            first.next();

            assertThat(review).hasSize(1);
            assertThat(review).hasSize(1);
            assertThat(first.hasNext()).isFalse();
        }
    }

    @Nested
    @DisplayName("deadline")
    class Deadline {

        @Test
        @DisplayName("timed sessions expose start plus limit")
        void timed() {
            QuizSession session = QuizSession.builder()
                    .id("s-3").mode(QuizMode.PRACTICE_TEST)
                    .questions(List.of(QuestionFixtures.multipleChoice("q-1", 1)))
                    .timeLimitSeconds(75L)
                    .clock(clock).handlerFactory(handlerFactory).build();

            assertThat(session.deadline()).contains(START.plusSeconds(75));
        }

        @Test
        @DisplayName("unlimited and untimed sessions have no deadline")
        void untimed() {
            QuizSession unlimited = QuizSession.builder()
                    .id("s-4").mode(QuizMode.PRACTICE_TEST)
                    .questions(List.of(QuestionFixtures.multipleChoice("q-1", 1)))
                    .timeLimitSeconds(999_999L).unlimitedTime(true)
                    .clock(clock).handlerFactory(handlerFactory).build();

            assertThat(unlimited.deadline()).isEmpty();
            assertThat(threeQuestionSession().deadline()).isEmpty();
        }
    }
}
