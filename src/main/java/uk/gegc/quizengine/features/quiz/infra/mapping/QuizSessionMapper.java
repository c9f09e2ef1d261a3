package uk.gegc.quizengine.features.quiz.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.quizengine.features.quiz.api.dto.AnswerSubmissionDto;
import uk.gegc.quizengine.features.quiz.api.dto.QuizCreatedDto;
import uk.gegc.quizengine.features.quiz.api.dto.QuizQuestionDto;
import uk.gegc.quizengine.features.quiz.api.dto.QuizResultDto;
import uk.gegc.quizengine.features.quiz.api.dto.WrongAnswerReviewDto;
import uk.gegc.quizengine.features.session.domain.model.AnswerRecord;
import uk.gegc.quizengine.features.session.domain.model.QuestionView;
import uk.gegc.quizengine.features.session.domain.model.QuizSession;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;
import uk.gegc.quizengine.features.session.domain.model.WrongAnswerReview;

@Component
@RequiredArgsConstructor
public class QuizSessionMapper {

    private final QuestionHandlerFactory handlerFactory;

    public QuizCreatedDto toCreatedDto(QuizSession session) {
        return new QuizCreatedDto(
                session.getId(),
                session.getMode(),
                session.size(),
                session.getTimeLimitSeconds(),
                session.getStartedAt(),
                session.deadline().orElse(null)
        );
    }

    public QuizQuestionDto toQuestionDto(QuestionView view) {
        return new QuizQuestionDto(
                view.position(),
                view.totalQuestions(),
                view.questionId(),
                view.type(),
                view.text(),
                view.scenarioText(),
                view.category(),
                view.section(),
                view.difficulty(),
                view.payload(),
                view.answered(),
                view.explanation()
        );
    }

    public AnswerSubmissionDto toSubmissionDto(QuizSession session, AnswerRecord record) {
        Question question = session.getQuestions().get(record.position());
        return new AnswerSubmissionDto(
                record.position(),
                record.correct(),
                handlerFactory.getHandler(question.getType()).correctAnswer(question),
                question.getExplanation(),
                session.getCorrectCount(),
                session.getAnsweredCount(),
                session.size(),
                session.getStatus() == SessionStatus.COMPLETED
        );
    }

    public QuizResultDto toResultDto(SessionResult result) {
        return new QuizResultDto(
                result.sessionId(),
                result.mode(),
                result.status(),
                result.score(),
                result.totalQuestions(),
                result.answeredCount(),
                result.percentage(),
                result.durationSeconds(),
                result.timeSpentSeconds(),
                result.startedAt(),
                result.endedAt()
        );
    }

    public WrongAnswerReviewDto toReviewDto(WrongAnswerReview review) {
        Question question = review.question();
        return new WrongAnswerReviewDto(
                review.position(),
                question.getId(),
                question.getType(),
                question.getText(),
                question.getScenarioText(),
                question.getOptions(),
                review.submittedAnswer(),
                review.correctAnswer(),
                review.explanation()
        );
    }

    public QuizResultRecord toResultRecord(QuizSession session, SessionResult result) {
        return QuizResultRecord.builder()
                .sessionId(session.getId())
                .userId(session.getOwnerUserId())
                .quizType(session.getMode().getValue())
                .status(result.status())
                .section(session.getSection())
                .score(result.score())
                .totalQuestions(result.totalQuestions())
                .percentage(result.percentage())
                .durationSeconds(result.durationSeconds())
                .completedAt(result.endedAt())
                .build();
    }
}
