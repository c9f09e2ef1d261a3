package uk.gegc.quizengine.features.question.infra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.quizengine.features.question.config.QuestionStoreProperties;
import uk.gegc.quizengine.features.question.domain.model.Difficulty;
import uk.gegc.quizengine.features.question.domain.model.Question;
import uk.gegc.quizengine.features.question.domain.model.QuestionFilter;
import uk.gegc.quizengine.features.question.domain.model.QuestionType;
import uk.gegc.quizengine.features.question.infra.mapping.QuestionRecordMapper;
import uk.gegc.quizengine.shared.exception.QuestionStoreUnavailableException;
import uk.gegc.quizengine.testsupport.QuestionFixtures;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonQuestionStore")
class JsonQuestionStoreTest {

    private JsonQuestionStore store;

    private JsonQuestionStore storeAt(String location) {
        QuestionStoreProperties properties = new QuestionStoreProperties();
        properties.setLocation(location);
        ObjectMapper objectMapper = new ObjectMapper();
        JsonQuestionStore created = new JsonQuestionStore(properties, new DefaultResourceLoader(), objectMapper,
                new QuestionRecordMapper(objectMapper), QuestionFixtures.handlerFactory());
        created.load();
        return created;
    }

    @BeforeEach
    void setUp() {
        store = storeAt("classpath:questions/test-catalog.json");
    }

    @Test
    @DisplayName("loads gradable rows and skips unknown types, ungradable keys and duplicate ids")
    void loadsOnlyGradableQuestions() {
        assertThat(store.isAvailable()).isTrue();
        assertThat(store.find(QuestionFilter.all(), null))
                .extracting(Question::getId)
                .containsExactly("t-1", "t-2", "t-3", "t-6");
    }

    @Test
    @DisplayName("malformed fields are kept as warnings and the question still loads")
    void malformedTagsAreReported() {
        assertThat(store.getLoadWarnings())
                .anySatisfy(warning -> {
                    assertThat(warning.questionId()).isEqualTo("t-3");
                    assertThat(warning.field()).isEqualTo("tags");
                });
        assertThat(store.count(QuestionFilter.builder().type(QuestionType.FILL_IN_BLANK).build())).isEqualTo(1);
    }

    @Test
    @DisplayName("filters by section, difficulty, category and tags")
    void filtersQueries() {
        assertThat(store.find(QuestionFilter.forSection(2), null))
                .extracting(Question::getId).containsExactly("t-2", "t-3");
        assertThat(store.find(QuestionFilter.builder().difficulty(Difficulty.HARD).build(), null))
                .extracting(Question::getId).containsExactly("t-3", "t-6");
        assertThat(store.count(QuestionFilter.builder().category("network security").build())).isEqualTo(1);
        assertThat(store.find(QuestionFilter.builder().tags(Set.of("phishing", "hashing")).build(), null))
                .extracting(Question::getId).containsExactly("t-2", "t-6");
    }

    @Test
    @DisplayName("limit caps the number of results")
    void limitCapsResults() {
        assertThat(store.find(QuestionFilter.all(), 2)).hasSize(2);
    }

    @Test
    @DisplayName("skip pages through matches in catalog order")
    void skipPagesThroughMatches() {
        assertThat(store.find(QuestionFilter.all(), 1, 2))
                .extracting(Question::getId).containsExactly("t-2", "t-3");
        assertThat(store.find(QuestionFilter.all(), 3, null))
                .extracting(Question::getId).containsExactly("t-6");
        assertThat(store.find(QuestionFilter.all(), 10, 5)).isEmpty();
    }

    @Test
    @DisplayName("findById returns the loaded question, never a skipped duplicate")
    void findById() {
        assertThat(store.findById("t-1")).hasValueSatisfying(question ->
                assertThat(question.getType()).isEqualTo(QuestionType.MULTIPLE_CHOICE));
        assertThat(store.findById("t-4")).isEmpty();
        assertThat(store.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("categories and tags are distinct and sorted")
    void categoriesAndTags() {
        assertThat(store.getCategories()).containsExactly("Cryptography", "Identity and Access", "Network Security");
        assertThat(store.getTags()).containsExactly("firewall", "hashing", "mfa", "network", "phishing");
    }

    @Test
    @DisplayName("categories differing only in case are one category, spelled as first seen")
    void categoriesCollapseCaseVariants(@TempDir Path tempDir) throws IOException {
        Path catalog = Files.writeString(tempDir.resolve("mixed-case.json"), """
                [
                  {"id": "c-1", "type": "true_false", "text": "One", "category": "cryptography",
                   "section": 1, "difficulty": "easy", "correct_answer": "true"},
                  {"id": "c-2", "type": "true_false", "text": "Two", "category": "Cryptography",
                   "section": 1, "difficulty": "easy", "correct_answer": "false"},
                  {"id": "c-3", "type": "true_false", "text": "Three", "category": "Malware",
                   "section": 2, "difficulty": "easy", "correct_answer": "true"}
                ]
                """);
        JsonQuestionStore mixed = storeAt(catalog.toUri().toString());

        assertThat(mixed.getCategories()).containsExactly("cryptography", "Malware");
        assertThat(mixed.count(QuestionFilter.builder().category("CRYPTOGRAPHY").build())).isEqualTo(2);
    }

    @Test
    @DisplayName("an unreadable catalog makes every query fail fast as unavailable")
    void missingCatalogIsUnavailable() {
        JsonQuestionStore missing = storeAt("classpath:questions/does-not-exist.json");

        assertThat(missing.isAvailable()).isFalse();
        assertThatThrownBy(() -> missing.find(QuestionFilter.all(), null))
                .isInstanceOf(QuestionStoreUnavailableException.class)
                .hasMessageContaining("does-not-exist.json");
        assertThatThrownBy(() -> missing.count(QuestionFilter.all()))
                .isInstanceOf(QuestionStoreUnavailableException.class);
        assertThatThrownBy(missing::getCategories)
                .isInstanceOf(QuestionStoreUnavailableException.class);
    }

    @Test
    @DisplayName("a catalog whose content is JSON null is unavailable instead of failing startup")
    void nullCatalogIsUnavailable(@TempDir Path tempDir) throws IOException {
        Path catalog = Files.writeString(tempDir.resolve("null-catalog.json"), "null");

        JsonQuestionStore nullCatalog = storeAt(catalog.toUri().toString());

        assertThat(nullCatalog.isAvailable()).isFalse();
        assertThatThrownBy(() -> nullCatalog.find(QuestionFilter.all(), null))
                .isInstanceOf(QuestionStoreUnavailableException.class)
                .hasMessageContaining("does not contain a list of questions");
    }
}
