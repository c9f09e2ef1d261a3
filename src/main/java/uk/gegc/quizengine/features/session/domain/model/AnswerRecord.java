package uk.gegc.quizengine.features.session.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record AnswerRecord(
        int position,
        JsonNode submittedAnswer,
        boolean correct,
        double timeSpentSeconds,
        Instant submittedAt
) {
}
