package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Thrown when two inputs with different values map to the same output slot.
 */
public class AmbiguityException extends DggsException {

    private final int firstPosition;
    private final int secondPosition;

    public AmbiguityException(int firstPosition, int secondPosition, String message) {
        super(message);
        this.firstPosition = firstPosition;
        this.secondPosition = secondPosition;
    }

    /**
     * Position of the input that was seen first
     */
    public int getFirstPosition() {
        return firstPosition;
    }

    /**
     * Position of the input that conflicts with the first one
     */
    public int getSecondPosition() {
        return secondPosition;
    }
}
