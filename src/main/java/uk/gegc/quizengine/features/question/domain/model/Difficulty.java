package uk.gegc.quizengine.features.question.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a difficulty level. The older four-level scale (beginner, intermediate, advanced, expert)
     * folds onto the three levels used here.
     */
    public static Optional<Difficulty> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "easy", "beginner" -> Optional.of(EASY);
            case "medium", "intermediate" -> Optional.of(MEDIUM);
            case "hard", "advanced", "expert" -> Optional.of(HARD);
            default -> Optional.empty();
        };
    }
}
