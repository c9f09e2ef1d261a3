package uk.gegc.quizengine.features.quiz.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults applied when a quiz request leaves a value out.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.defaults")
public class QuizDefaultsProperties {

    private int chapterQuestionCount = 10;

    private int categoryQuestionCount = 10;

    private int randomQuestionCount = 10;

    /**
     * Full exam length.
     * Default: 90
     */
    private int practiceTestQuestionCount = 90;

    /**
     * Time budget per question for automatically timed practice tests.
     * Default: 75 seconds (1.25 minutes)
     */
    private double secondsPerQuestion = 75;

    /**
     * Time limit recorded for untimed practice tests.
     * Default: 999999
     */
    private long unlimitedTimeLimitSeconds = 999_999L;

    /**
     * Fixed seed for question shuffling; unset means a fresh random seed per process.
     */
    private Long samplingSeed;
}
