package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Thrown when a requested resolution is outside [0, 15] or cannot be reached from the resolution of an input
 * cell, e.g., uncompacting a cell that is finer than the target.
 */
public class ResolutionRangeException extends DggsException {

    private final int resolution;

    public ResolutionRangeException(int resolution) {
        this(resolution, "Resolution " + resolution + " is outside the range [0, 15]");
    }

    public ResolutionRangeException(int resolution, String message) {
        super(message);
        this.resolution = resolution;
    }

    public int getResolution() {
        return resolution;
    }
}
