package uk.gegc.quizengine.features.question.infra.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.features.question.infra.handler.MultipleChoiceHandler;
import uk.gegc.quizengine.features.question.infra.handler.ScenarioHandler;
import uk.gegc.quizengine.features.question.infra.handler.TrueFalseHandler;
import uk.gegc.quizengine.shared.exception.UnknownQuestionTypeException;
import uk.gegc.quizengine.testsupport.QuestionFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QuestionHandlerFactory")
class QuestionHandlerFactoryTest {

    private final QuestionHandlerFactory factory = QuestionFixtures.handlerFactory();

    @Test
    @DisplayName("resolves every supported type, including legacy aliases")
    void resolvesTypesAndAliases() {
        assertThat(factory.getHandler("multiple_choice")).isInstanceOf(MultipleChoiceHandler.class);
        assertThat(factory.getHandler("concept_multiple_choice")).isInstanceOf(MultipleChoiceHandler.class);
        assertThat(factory.getHandler("TRUE_FALSE")).isInstanceOf(TrueFalseHandler.class);
        assertThat(factory.getHandler("fill_in_the_blank").supportedType()).isEqualTo(QuestionType.FILL_IN_BLANK);
        assertThat(factory.getHandler("scenario_based")).isInstanceOf(ScenarioHandler.class);
    }

    @Test
    @DisplayName("unknown type string fails with UnknownQuestionTypeException")
    void unknownTypeFails() {
        assertThatThrownBy(() -> factory.getHandler("matching"))
                .isInstanceOf(UnknownQuestionTypeException.class)
                .hasMessageContaining("matching");
        assertThatThrownBy(() -> factory.getHandler((String) null))
                .isInstanceOf(UnknownQuestionTypeException.class);
    }

    @Test
    @DisplayName("a type without a registered handler fails with UnknownQuestionTypeException")
    void missingHandlerFails() {
        QuestionHandlerFactory partial = new QuestionHandlerFactory(List.of(new TrueFalseHandler()));

        assertThatThrownBy(() -> partial.getHandler(QuestionType.SCENARIO))
                .isInstanceOf(UnknownQuestionTypeException.class);
    }
}
