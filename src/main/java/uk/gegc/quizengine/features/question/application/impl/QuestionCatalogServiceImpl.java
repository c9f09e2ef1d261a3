package uk.gegc.quizengine.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.quizengine.features.question.api.dto.QuestionDto;
import uk.gegc.quizengine.features.question.application.QuestionCatalogService;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.QuestionFilter;
import uk.gegc.quizengine.features.question.domain.repository.QuestionStore;
import uk.gegc.quizengine.features.question.infra.mapping.QuestionMapper;
import uk.gegc.quizengine.shared.exception.QuestionNotFoundException;
import uk.gegc.quizengine.shared.exception.ValidationException;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionCatalogServiceImpl implements QuestionCatalogService {

    private final QuestionStore questionStore;
    private final QuestionMapper questionMapper;

    @Override
    public List<QuestionDto> listQuestions(String category, String difficulty, List<String> tags, int limit, int skip) {
        QuestionFilter filter = QuestionFilter.builder()
                .category(category == null || category.isBlank() ? null : category.trim())
                .difficulty(parseDifficulty(difficulty))
                .tags(normalizeTags(tags))
                .build();
        log.debug("Listing questions with {} (skip {}, limit {})", filter, skip, limit);
        return questionStore.find(filter, skip, limit).stream()
                .map(questionMapper::toDto)
                .toList();
    }

    @Override
    public QuestionDto getQuestion(String questionId) {
        return questionStore.findById(questionId)
                .map(questionMapper::toDto)
                .orElseThrow(() -> new QuestionNotFoundException(questionId));
    }

    @Override
    public List<String> getCategories() {
        return List.copyOf(questionStore.getCategories());
    }

    @Override
    public List<String> getTags() {
        return List.copyOf(questionStore.getTags());
    }

    private static Difficulty parseDifficulty(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return Difficulty.parse(raw)
                .orElseThrow(() -> new ValidationException("Unknown difficulty: " + raw));
    }

    private static Set<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return null;
        }
        Set<String> cleaned = tags.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toSet());
        return cleaned.isEmpty() ? null : cleaned;
    }
}
