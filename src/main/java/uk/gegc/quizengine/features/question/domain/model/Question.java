package uk.gegc.quizengine.features.question.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;

/**
 * Read-only question as served by the question store. Sessions hold these by reference;
 * nothing in the engine mutates them.
 * <p>
 * {@code correctAnswer} keeps the persisted answer key as JSON because its shape depends on the type:
 * an option index or option text, a boolean, one accepted string or an array of them.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"correctAnswer", "explanation"})
@EqualsAndHashCode(of = "id")
public class Question {

    private final String id;
    private final QuestionType type;
    private final String text;
    private final String scenarioText;
    private final String category;
    private final Integer section;
    private final Difficulty difficulty;

    @Builder.Default
    private final Set<String> tags = Set.of();

    @Builder.Default
    private final List<String> options = List.of();

    private final JsonNode correctAnswer;
    private final String explanation;
}
