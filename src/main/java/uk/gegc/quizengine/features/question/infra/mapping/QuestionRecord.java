package uk.gegc.quizengine.features.question.infra.mapping;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row of the persisted question catalog as written on disk.
 * <p>
 * {@code options}, {@code tags} and {@code correct_answer} are persisted as JSON-encoded strings;
 * already-decoded JSON values are accepted too.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionRecord(
        @JsonProperty("id") @JsonAlias("question_id") String id,
        @JsonProperty("type") @JsonAlias("question_type") String type,
        @JsonProperty("text") @JsonAlias("question_text") String text,
        @JsonProperty("scenario_text") @JsonAlias("scenario") String scenarioText,
        @JsonProperty("category") String category,
        @JsonProperty("section") Integer section,
        @JsonProperty("difficulty") String difficulty,
        @JsonProperty("tags") JsonNode tags,
        @JsonProperty("options") JsonNode options,
        @JsonProperty("correct_answer") JsonNode correctAnswer,
        @JsonProperty("explanation") String explanation
) {
}
