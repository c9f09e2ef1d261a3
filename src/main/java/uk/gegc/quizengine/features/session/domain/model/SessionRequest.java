package uk.gegc.quizengine.features.session.domain.model;

import lombok.Builder;
import uk.gegc.quizengine.features.question.domain.model.Question;

import java.util.List;

/**
 * Everything needed to open a session apart from its id.
 *
 * @param timeLimitSeconds {@code null} when the session is not timed
 * @param unlimitedTime    the limit is the effectively-infinite sentinel and has no deadline
 */
@Builder
public record SessionRequest(
        QuizMode mode,
        List<Question> questions,
        Long timeLimitSeconds,
        boolean unlimitedTime,
        String ownerUserId,
        Integer section,
        String category
) {
}
