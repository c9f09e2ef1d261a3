package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QuizMode {
    CHAPTER("chapter"),
    CATEGORY("category"),
    RANDOM("random"),
    PRACTICE_TEST("practice_test");

    private final String value;

    QuizMode(String value) {
        this.value = value;
    }

    /**
     * Name recorded as the quiz type of a progress record.
     */
    @JsonValue
    public String getValue() {
        return value;
    }
}
