package uk.gegc.quizengine.features.quiz.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
@Slf4j
public class QuizSamplingConfig {

    @Bean
    public Random quizRandom(QuizDefaultsProperties properties) {
        Long seed = properties.getSamplingSeed();
        if (seed != null) {
            log.info("Question sampling uses fixed seed {}", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
