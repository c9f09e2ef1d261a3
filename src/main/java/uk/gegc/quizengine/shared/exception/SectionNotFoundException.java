package uk.gegc.quizengine.shared.exception;

public class SectionNotFoundException extends RuntimeException {

    private final int section;

    public SectionNotFoundException(int section) {
        super("Section " + section + " has no questions");
        this.section = section;
    }

    public int getSection() {
        return section;
    }
}
