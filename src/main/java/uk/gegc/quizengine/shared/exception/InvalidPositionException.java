package uk.gegc.quizengine.shared.exception;

public class InvalidPositionException extends RuntimeException {

    private final int position;
    private final int size;

    public InvalidPositionException(int position, int size) {
        super("Question position " + position + " is outside [0, " + (size - 1) + "]");
        this.position = position;
        this.size = size;
    }

    public int getPosition() {
        return position;
    }

    public int getSize() {
        return size;
    }
}
