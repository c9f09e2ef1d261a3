package uk.gegc.quizengine.features.question.infra.mapping;

import uk.gegc.quizengine.features.question.domain.model.MalformedQuestionWarning;
import uk.gegc.quizengine.features.question.domain.model.Question;

import java.util.List;

public record QuestionLoadResult(Question question, List<MalformedQuestionWarning> warnings) {

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
