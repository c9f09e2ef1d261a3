package uk.gegc.quizengine.features.progress.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for publishing completed quiz results to the progress sink.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.progress")
public class ProgressProperties {

    /**
     * Sink implementation: {@code log} or {@code file}.
     * Default: log
     */
    private String sink = "log";

    /**
     * JSON-lines file appended to by the {@code file} sink.
     */
    private String filePath = "data/progress.jsonl";

    /**
     * Records waiting for the sink beyond this many are dropped.
     * Default: 500
     */
    private int queueCapacity = 500;

    /**
     * Seconds to wait for queued records to drain on shutdown.
     * Default: 10
     */
    private int awaitTerminationSeconds = 10;
}
