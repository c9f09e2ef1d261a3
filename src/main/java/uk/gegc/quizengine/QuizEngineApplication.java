package uk.gegc.quizengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QuizEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuizEngineApplication.class, args);
    }
}
