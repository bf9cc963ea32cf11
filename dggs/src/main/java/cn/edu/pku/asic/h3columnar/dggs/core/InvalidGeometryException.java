package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Thrown when an input geometry cannot be parsed or is of a type that cannot be converted to cells.
 */
public class InvalidGeometryException extends Exception {

    private final int position;

    public InvalidGeometryException(String message, int position, Throwable cause) {
        super(position >= 0 ? message + " at position " + position : message, cause);
        this.position = position;
    }

    public InvalidGeometryException(String message) {
        this(message, -1, null);
    }

    /**
     * Position of the geometry in its input array or -1 for a single geometry
     */
    public int getPosition() {
        return position;
    }
}
