package uk.gegc.quizengine.features.quiz.domain.model;

import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.Locale;

/**
 * Requested time limit of a practice test: {@code auto} (a fixed budget per question),
 * a literal number of minutes, or {@code unlimited}. Leaving it out means unlimited.
 */
public record PracticeTestTiming(Kind kind, Integer minutes) {

    public enum Kind {
        AUTO,
        FIXED,
        UNLIMITED
    }

    public static PracticeTestTiming parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new PracticeTestTiming(Kind.UNLIMITED, null);
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("auto")) {
            return new PracticeTestTiming(Kind.AUTO, null);
        }
        if (value.equals("unlimited") || value.equals("none")) {
            return new PracticeTestTiming(Kind.UNLIMITED, null);
        }
        try {
            int minutes = Integer.parseInt(value);
            if (minutes <= 0) {
                throw new ValidationException("Time limit must be a positive number of minutes, 'auto' or 'unlimited'");
            }
            return new PracticeTestTiming(Kind.FIXED, minutes);
        } catch (NumberFormatException e) {
            throw new ValidationException("Unrecognised time limit '" + raw + "': expected minutes, 'auto' or 'unlimited'");
        }
    }

    /**
     * @param questionCount     number of questions requested
     * @param secondsPerQuestion budget per question for {@code auto}
     * @param unlimitedSeconds  sentinel recorded for {@code unlimited}
     */
    public long toSeconds(int questionCount, double secondsPerQuestion, long unlimitedSeconds) {
        return switch (kind) {
            case AUTO -> (long) Math.ceil(questionCount * secondsPerQuestion);
            case FIXED -> minutes * 60L;
            case UNLIMITED -> unlimitedSeconds;
        };
    }

    public boolean isUnlimited() {
        return kind == Kind.UNLIMITED;
    }
}
