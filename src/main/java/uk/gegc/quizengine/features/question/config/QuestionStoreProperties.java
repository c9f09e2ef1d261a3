package uk.gegc.quizengine.features.question.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "quiz.question-store")
public class QuestionStoreProperties {

    /**
     * Spring resource location of the question catalog (JSON array of question rows).
     */
    private String location = "classpath:questions/catalog.json";
}
