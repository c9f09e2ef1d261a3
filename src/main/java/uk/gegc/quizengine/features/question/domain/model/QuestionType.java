package uk.gegc.quizengine.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import uk.gegc.quizengine.shared.exception.UnknownQuestionTypeException;

import java.util.List;
import java.util.Locale;

public enum QuestionType {
    MULTIPLE_CHOICE("multiple_choice", "concept_multiple_choice"),
    TRUE_FALSE("true_false"),
    FILL_IN_BLANK("fill_in_blank", "fill_in_the_blank"),
    SCENARIO("scenario", "scenario_based", "scenario_multiple_choice");

    private final String value;
    private final List<String> aliases;

    QuestionType(String value, String... aliases) {
        this.value = value;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves the persisted {@code type} column, accepting the legacy spellings found in older rows.
     *
     * @throws UnknownQuestionTypeException if the value names none of the four supported kinds
     */
    public static QuestionType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownQuestionTypeException(raw);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (QuestionType type : values()) {
            if (type.value.equals(normalized) || type.aliases.contains(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new UnknownQuestionTypeException(raw);
    }
}
