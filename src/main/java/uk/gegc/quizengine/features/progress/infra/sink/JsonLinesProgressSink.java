package uk.gegc.quizengine.features.progress.infra.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.progress.config.ProgressProperties;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.progress.domain.repository.ProgressSink;
import uk.gegc.quizengine.shared.exception.ProgressSinkWriteException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends each record as one JSON line to a file.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "quiz.progress", name = "sink", havingValue = "file")
public class JsonLinesProgressSink implements ProgressSink {

    private final ObjectMapper objectMapper;
    private final Path file;

    public JsonLinesProgressSink(ObjectMapper objectMapper, ProgressProperties properties) {
        this.objectMapper = objectMapper;
        this.file = Path.of(properties.getFilePath());
        log.info("Progress records will be appended to {}", file.toAbsolutePath());
    }

    @Override
    public synchronized void write(QuizResultRecord record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new ProgressSinkWriteException("Could not serialize progress record for session " + record.sessionId(), e);
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ProgressSinkWriteException("Could not append progress record to " + file, e);
        }
    }
}
