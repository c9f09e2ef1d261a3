package uk.gegc.quizengine.features.session.domain.model;

/**
 * Outcome of one registry sweep: sessions moved to expired, and sessions removed from the registry.
 */
public record CleanupReport(int expired, int evicted) {
}
