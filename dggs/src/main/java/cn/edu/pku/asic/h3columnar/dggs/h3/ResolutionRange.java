package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.dggs.core.ResolutionRangeException;

/**
 * An inclusive range of resolutions {@code 0 <= min <= max <= 15}.
 */
public final class ResolutionRange {

    /** All resolutions of the grid */
    public static final ResolutionRange ALL = new ResolutionRange(0, H3CellId.MAX_RESOLUTION);

    private final int min;
    private final int max;

    private ResolutionRange(int min, int max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Creates a range after checking its bounds.
     * @param min the coarsest resolution in the range
     * @param max the finest resolution in the range
     * @return the range
     * @throws ResolutionRangeException if a bound is outside [0, 15] or {@code min > max}
     */
    public static ResolutionRange of(int min, int max) {
        checkResolution(min);
        checkResolution(max);
        if (min > max)
            throw new ResolutionRangeException(min, "Empty resolution range [" + min + ", " + max + "]");
        return new ResolutionRange(min, max);
    }

    /**
     * Fails the call if the given resolution does not exist in the grid.
     * @param resolution the resolution to check
     * @throws ResolutionRangeException if the resolution is outside [0, 15]
     */
    public static void checkResolution(int resolution) {
        if (resolution < 0 || resolution > H3CellId.MAX_RESOLUTION)
            throw new ResolutionRangeException(resolution);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean contains(int resolution) {
        return resolution >= min && resolution <= max;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ResolutionRange))
            return false;
        ResolutionRange other = (ResolutionRange) o;
        return min == other.min && max == other.max;
    }

    @Override
    public int hashCode() {
        return min * 31 + max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
