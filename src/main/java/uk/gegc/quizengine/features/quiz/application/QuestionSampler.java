package uk.gegc.quizengine.features.quiz.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.domain.model.Question;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shuffles a question pool and draws a sample without replacement.
 */
@Component
@RequiredArgsConstructor
public class QuestionSampler {

    private final Random random;

    /**
     * @return {@code min(count, distinct pool size)} questions in random order, no question twice
     */
    public List<Question> sample(List<Question> pool, int count) {
        Map<String, Question> distinct = new LinkedHashMap<>();
        for (Question question : pool) {
            distinct.putIfAbsent(question.getId(), question);
        }
        List<Question> shuffled = new ArrayList<>(distinct.values());
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(Math.max(count, 0), shuffled.size())));
    }
}
