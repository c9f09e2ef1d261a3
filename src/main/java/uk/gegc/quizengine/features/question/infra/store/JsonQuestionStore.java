package uk.gegc.quizengine.features.question.infra.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.config.QuestionStoreProperties;
import uk.gegc.quizengine.features.question.domain.model.MalformedQuestionWarning;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionFilter;
import uk.gegc.quizengine.features.question.domain.repository.QuestionStore;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.quizengine.features.question.infra.mapping.QuestionLoadResult;
import uk.gegc.quizengine.features.question.infra.mapping.QuestionRecord;
import uk.gegc.quizengine.features.question.infra.mapping.QuestionRecordMapper;
import uk.gegc.quizengine.shared.exception.QuestionStoreUnavailableException;
import uk.gegc.quizengine.shared.exception.UnknownQuestionTypeException;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory question catalog loaded once from a JSON resource of persisted question rows.
 * <p>
 * A catalog that cannot be read leaves the store in the unavailable state: the application still
 * starts, and every query fails fast with {@link QuestionStoreUnavailableException}.
 */
@Component
@Slf4j
public class JsonQuestionStore implements QuestionStore {

    private static final TypeReference<List<QuestionRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final QuestionStoreProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final QuestionRecordMapper recordMapper;
    private final QuestionHandlerFactory handlerFactory;

    private volatile List<Question> questions = List.of();
    private volatile List<MalformedQuestionWarning> warnings = List.of();
    private volatile String unavailableReason = "Question catalog has not been loaded";

    public JsonQuestionStore(QuestionStoreProperties properties,
                             ResourceLoader resourceLoader,
                             ObjectMapper objectMapper,
                             QuestionRecordMapper recordMapper,
                             QuestionHandlerFactory handlerFactory) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.recordMapper = recordMapper;
        this.handlerFactory = handlerFactory;
    }

    @PostConstruct
    public void load() {
        String location = properties.getLocation();
        Resource resource = resourceLoader.getResource(location);
        List<QuestionRecord> records;
        try (InputStream in = resource.getInputStream()) {
            records = objectMapper.readValue(in, RECORD_LIST);
        } catch (IOException e) {
            markUnavailable("Question catalog at " + location + " could not be read: " + e.getMessage());
            return;
        }
        if (records == null) {
            markUnavailable("Question catalog at " + location + " does not contain a list of questions");
            return;
        }

        List<Question> loaded = new ArrayList<>(records.size());
        List<MalformedQuestionWarning> loadWarnings = new ArrayList<>();
        Set<String> seenIds = new TreeSet<>();
        for (QuestionRecord record : records) {
            if (record == null || record.id() == null || !seenIds.add(record.id())) {
                log.warn("Skipping catalog row without a unique id: {}", record);
                continue;
            }
            try {
                QuestionLoadResult result = recordMapper.toQuestion(record);
                loadWarnings.addAll(result.warnings());
                Question question = result.question();
                handlerFactory.getHandler(question.getType()).validateContent(question);
                loaded.add(question);
            } catch (UnknownQuestionTypeException e) {
                log.warn("Skipping question {}: {}", record.id(), e.getMessage());
            } catch (ValidationException e) {
                log.warn("Excluding ungradable question {}: {}", record.id(), e.getMessage());
            }
        }

        questions = List.copyOf(loaded);
        warnings = List.copyOf(loadWarnings);
        unavailableReason = null;
        log.info("Loaded {} of {} questions from {} ({} malformed field warnings)",
                loaded.size(), records.size(), location, loadWarnings.size());
    }

    private void markUnavailable(String reason) {
        unavailableReason = reason;
        questions = List.of();
        warnings = List.of();
        log.error("Question store unavailable: {}", reason);
    }

    @Override
    public List<Question> find(QuestionFilter filter, Integer limit) {
        return find(filter, 0, limit);
    }

    @Override
    public List<Question> find(QuestionFilter filter, int skip, Integer limit) {
        Stream<Question> matches = matching(filter).skip(Math.max(0, skip));
        if (limit != null) {
            matches = matches.limit(Math.max(0, limit));
        }
        return matches.toList();
    }

    @Override
    public Optional<Question> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return available().stream()
                .filter(question -> question.getId().equals(id))
                .findFirst();
    }

    @Override
    public long count(QuestionFilter filter) {
        return matching(filter).count();
    }

    /**
     * Categories compare case-insensitively, so spellings that differ only in case collapse to the one
     * seen first in the catalog.
     */
    @Override
    public Set<String> getCategories() {
        return collect(available().stream().map(Question::getCategory), String.CASE_INSENSITIVE_ORDER);
    }

    @Override
    public Set<String> getTags() {
        return collect(available().stream().map(Question::getTags).flatMap(Collection::stream), Comparator.naturalOrder());
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }

    /**
     * Malformed-field warnings raised by the last successful load.
     */
    public List<MalformedQuestionWarning> getLoadWarnings() {
        return warnings;
    }

    private Stream<Question> matching(QuestionFilter filter) {
        QuestionFilter effective = filter != null ? filter : QuestionFilter.all();
        return available().stream().filter(effective::matches);
    }

    private List<Question> available() {
        String reason = unavailableReason;
        if (reason != null) {
            throw new QuestionStoreUnavailableException(reason);
        }
        return questions;
    }

    private static Set<String> collect(Stream<String> values, Comparator<String> order) {
        return values
                .filter(Objects::nonNull)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toCollection(() -> new TreeSet<>(order)));
    }
}
