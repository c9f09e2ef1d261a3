package uk.gegc.quizengine.features.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Lifetime settings for in-memory quiz sessions.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.sessions")
public class QuizSessionProperties {

    /**
     * Age after which a session that is still active is expired and evicted (in seconds).
     * Default: 14400 (4 hours)
     */
    private long maxAgeSeconds = 14400;

    /**
     * How long a completed session stays addressable after it ended (in seconds).
     * Never shorter than the max age.
     * Default: 86400 (24 hours)
     */
    private long completedRetentionSeconds = 86400;

    /**
     * Fixed delay between cleanup sweeps (in seconds).
     * Default: 300 (5 minutes)
     */
    private int cleanupFixedDelaySeconds = 300;

    public Duration getMaxAge() {
        return Duration.ofSeconds(maxAgeSeconds);
    }

    public Duration getCompletedRetention() {
        return Duration.ofSeconds(completedRetentionSeconds);
    }
}
