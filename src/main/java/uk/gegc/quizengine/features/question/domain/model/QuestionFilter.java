package uk.gegc.quizengine.features.question.domain.model;

import lombok.Builder;

import java.util.Set;

/**
 * Query constraints for the question store. A {@code null} (or empty) component places no constraint.
 */
@Builder(toBuilder = true)
public record QuestionFilter(
        Set<Integer> sections,
        String category,
        Difficulty difficulty,
        QuestionType type,
        Set<String> tags
) {

    public static QuestionFilter all() {
        return QuestionFilter.builder().build();
    }

    public static QuestionFilter forSection(int section) {
        return QuestionFilter.builder().sections(Set.of(section)).build();
    }

    public boolean matches(Question question) {
        if (sections != null && !sections.isEmpty()
                && (question.getSection() == null || !sections.contains(question.getSection()))) {
            return false;
        }
        if (category != null && !category.equalsIgnoreCase(question.getCategory())) {
            return false;
        }
        if (difficulty != null && difficulty != question.getDifficulty()) {
            return false;
        }
        if (type != null && type != question.getType()) {
            return false;
        }
        if (tags != null && !tags.isEmpty()) {
            return question.getTags().stream().anyMatch(tags::contains);
        }
        return true;
    }
}
