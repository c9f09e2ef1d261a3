package uk.gegc.quizengine.features.question.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.MalformedQuestionWarning;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.shared.exception.UnknownQuestionTypeException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes persisted question rows. A malformed JSON-encoded field degrades to its default
 * (empty options, empty tags, no answer key) and is reported as a warning; it never aborts the load.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuestionRecordMapper {

    private final ObjectMapper objectMapper;

    /**
     * @throws UnknownQuestionTypeException if the row's type names no supported kind
     */
    public QuestionLoadResult toQuestion(QuestionRecord record) {
        QuestionType type = QuestionType.fromValue(record.type());
        List<MalformedQuestionWarning> warnings = new ArrayList<>();

        Difficulty difficulty = Difficulty.parse(record.difficulty()).orElseGet(() -> {
            if (record.difficulty() != null && !record.difficulty().isBlank()) {
                warnings.add(new MalformedQuestionWarning(record.id(), "difficulty",
                        "unrecognised level '" + record.difficulty() + "'"));
            }
            return Difficulty.MEDIUM;
        });

        List<String> options = decode(record.id(), "options", record.options(), warnings)
                .map(node -> toStrings(record.id(), "options", node, warnings))
                .orElseGet(List::of);
        Set<String> tags = decode(record.id(), "tags", record.tags(), warnings)
                .map(node -> Set.copyOf(new LinkedHashSet<>(toStrings(record.id(), "tags", node, warnings))))
                .orElseGet(Set::of);
        JsonNode correctAnswer = decode(record.id(), "correct_answer", record.correctAnswer(), warnings)
                .orElse(null);

        warnings.forEach(warning -> log.warn("{}", warning));

        Question question = Question.builder()
                .id(record.id())
                .type(type)
                .text(record.text())
                .scenarioText(record.scenarioText())
                .category(record.category())
                .section(record.section())
                .difficulty(difficulty)
                .tags(tags)
                .options(options)
                .correctAnswer(correctAnswer)
                .explanation(record.explanation())
                .build();
        return new QuestionLoadResult(question, List.copyOf(warnings));
    }

    private Optional<JsonNode> decode(String questionId, String field, JsonNode raw,
                                      List<MalformedQuestionWarning> warnings) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return Optional.empty();
        }
        if (!raw.isTextual()) {
            return Optional.of(raw);
        }
        String text = raw.asText();
        if (text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            warnings.add(new MalformedQuestionWarning(questionId, field, e.getOriginalMessage()));
            return Optional.empty();
        }
    }

    private static List<String> toStrings(String questionId, String field, JsonNode node,
                                          List<MalformedQuestionWarning> warnings) {
        if (!node.isArray()) {
            warnings.add(new MalformedQuestionWarning(questionId, field, "expected a JSON array but found " + node.getNodeType()));
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> values.add(element.asText()));
        return List.copyOf(values);
    }
}
