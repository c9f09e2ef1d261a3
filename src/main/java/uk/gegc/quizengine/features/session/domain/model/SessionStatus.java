package uk.gegc.quizengine.features.session.domain.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
