package uk.gegc.quizengine.features.progress.infra.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.quizengine.features.progress.config.ProgressProperties;
import uk.gegc.quizengine.features.progress.domain.model.QuizResultRecord;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;
import uk.gegc.quizengine.shared.exception.ProgressSinkWriteException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonLinesProgressSink")
class JsonLinesProgressSinkTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static QuizResultRecord record(String sessionId, int score) {
        return QuizResultRecord.builder()
                .sessionId(sessionId)
                .userId("user-1")
                .quizType("practice_test")
                .status(SessionStatus.COMPLETED)
                .score(score)
                .totalQuestions(90)
                .percentage(SessionResult.percentage(score, 90))
                .durationSeconds(5400)
                .completedAt(Instant.parse("2024-05-01T10:30:00Z"))
                .build();
    }

    private JsonLinesProgressSink sinkWriting(Path file) {
        ProgressProperties properties = new ProgressProperties();
        properties.setFilePath(file.toString());
        return new JsonLinesProgressSink(objectMapper, properties);
    }

    @Test
    @DisplayName("appends one JSON object per line, creating missing directories")
    void appendsLines() throws IOException {
        // Given
        Path file = tempDir.resolve("nested/progress.jsonl");
        JsonLinesProgressSink sink = sinkWriting(file);

        // When
        sink.write(record("s-1", 60));
        sink.write(record("s-2", 81));

        // Then
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        JsonNode second = objectMapper.readTree(lines.get(1));
        assertThat(first.get("sessionId").asText()).isEqualTo("s-1");
        assertThat(first.get("quizType").asText()).isEqualTo("practice_test");
        assertThat(first.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(first.get("section").isNull()).isTrue();
        assertThat(first.get("completedAt").asText()).isEqualTo("2024-05-01T10:30:00Z");
        assertThat(second.get("score").asInt()).isEqualTo(81);
        assertThat(second.get("totalQuestions").asInt()).isEqualTo(90);
    }

    @Test
    @DisplayName("an unwritable target fails with ProgressSinkWriteException")
    void unwritableTarget() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("progress.jsonl"));
        JsonLinesProgressSink sink = sinkWriting(directory);

        assertThatThrownBy(() -> sink.write(record("s-3", 10)))
                .isInstanceOf(ProgressSinkWriteException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
