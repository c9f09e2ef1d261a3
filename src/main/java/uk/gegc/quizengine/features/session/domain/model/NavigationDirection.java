package uk.gegc.quizengine.features.session.domain.model;

public enum NavigationDirection {
    NEXT(1),
    PREVIOUS(-1);

    private final int step;

    NavigationDirection(int step) {
        this.step = step;
    }

    public int getStep() {
        return step;
    }
}
