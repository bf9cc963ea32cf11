package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.dggs.core.AbstractCellId;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException.Reason;
import com.uber.h3core.util.LatLng;

/**
 * =============================================================================================
 *
 * @ProjectName dggs
 * @Package cn.edu.pku.asic.h3columnar.dggs.h3
 * @ClassName H3CellId
 * @Version 1.0.0
 * @See =============================================================================================
 * @Description A validated H3 cell index. The 64 bits are laid out as follows, most significant first:
 *              one reserved bit (0), four mode bits (1 for cells), three reserved bits (0), four
 *              resolution bits, seven base cell bits and fifteen 3-bit digits. Digit r describes the
 *              child chosen at resolution r; digits beyond the resolution are all 7.
 */
public final class H3CellId extends AbstractCellId<H3CellId> {

    /** The null index, never a valid cell */
    public static final long H3_NULL = 0L;

    public static final int MAX_RESOLUTION = 15;
    public static final int NUM_BASE_CELLS = 122;

    static final int CELL_MODE = 1;
    static final int MODE_OFFSET = 59;
    static final long MODE_MASK = 15L << MODE_OFFSET;
    static final long HIGH_BIT_MASK = 1L << 63;
    static final long RESERVED_MASK = 7L << 56;
    static final int RES_OFFSET = 52;
    static final long RES_MASK = 15L << RES_OFFSET;
    static final int BASE_CELL_OFFSET = 45;
    static final long BASE_CELL_MASK = 127L << BASE_CELL_OFFSET;
    static final int DIGIT_BITS = 3;
    static final long DIGIT_MASK = 7L;

    static final int CENTER_DIGIT = 0;
    static final int K_AXES_DIGIT = 1;
    static final int INVALID_DIGIT = 7;

    private static final boolean[] PENTAGON_BASE_CELLS = new boolean[NUM_BASE_CELLS];

    static {
        for (int baseCell : new int[] {4, 14, 24, 38, 49, 58, 63, 72, 83, 97, 107, 117})
            PENTAGON_BASE_CELLS[baseCell] = true;
    }

    private final long value;

    /**
     * Wraps a value that is known to be valid, i.e., it was checked or returned by the H3 library.
     */
    H3CellId(long value) {
        this.value = value;
    }

    /**
     * Decodes and range checks a raw value. This is the only public way to turn an arbitrary integer into
     * a cell and it never fails with anything other than {@link InvalidCellException}.
     * @param raw any 64-bit value
     * @return the cell
     * @throws InvalidCellException if any field of the value is out of range
     */
    public static H3CellId validate(long raw) throws InvalidCellException {
        Reason reason = check(raw);
        if (reason != null)
            throw new InvalidCellException(raw, reason);
        return new H3CellId(raw);
    }

    public static boolean isValid(long raw) {
        return check(raw) == null;
    }

    /**
     * The cell at the given resolution that contains the given point.
     * @param lat latitude in degrees
     * @param lng longitude in degrees
     * @param resolution the resolution of the cell
     * @return the containing cell
     */
    public static H3CellId fromLatLng(double lat, double lng, int resolution) {
        ResolutionRange.checkResolution(resolution);
        return new H3CellId(H3.getInstance().getCore().latLngToCell(lat, lng, resolution));
    }

    /**
     * Finds the first field of the given value that makes it an invalid cell.
     * @param raw the value to check
     * @return the reason or {@code null} if the value is a valid cell
     */
    static Reason check(long raw) {
        if ((raw & HIGH_BIT_MASK) != 0)
            return Reason.RESERVED_BIT;
        if ((raw & MODE_MASK) >>> MODE_OFFSET != CELL_MODE)
            return Reason.MODE;
        if ((raw & RESERVED_MASK) != 0)
            return Reason.RESERVED_BIT;
        int baseCell = baseCell(raw);
        if (baseCell >= NUM_BASE_CELLS)
            return Reason.BASE_CELL;
        int res = resolution(raw);
        boolean foundFirstNonZeroDigit = false;
        for (int r = 1; r <= res; r++) {
            int digit = digit(raw, r);
            if (digit == INVALID_DIGIT)
                return Reason.DIGIT;
            if (!foundFirstNonZeroDigit && digit != CENTER_DIGIT) {
                foundFirstNonZeroDigit = true;
                if (PENTAGON_BASE_CELLS[baseCell] && digit == K_AXES_DIGIT)
                    return Reason.DELETED_SUBSEQUENCE;
            }
        }
        for (int r = res + 1; r <= MAX_RESOLUTION; r++) {
            if (digit(raw, r) != INVALID_DIGIT)
                return Reason.UNUSED_DIGIT;
        }
        return null;
    }

    static int resolution(long raw) {
        return (int) ((raw & RES_MASK) >>> RES_OFFSET);
    }

    static int baseCell(long raw) {
        return (int) ((raw & BASE_CELL_MASK) >>> BASE_CELL_OFFSET);
    }

    static int digit(long raw, int r) {
        return (int) ((raw >>> digitOffset(r)) & DIGIT_MASK);
    }

    private static int digitOffset(int r) {
        return (MAX_RESOLUTION - r) * DIGIT_BITS;
    }

    /**
     * The ancestor of a valid cell. The caller makes sure that {@code parentRes <= resolution(raw)}.
     */
    static long parentOf(long raw, int parentRes) {
        int res = resolution(raw);
        long h = (raw & ~RES_MASK) | ((long) parentRes << RES_OFFSET);
        for (int r = parentRes + 1; r <= res; r++)
            h |= DIGIT_MASK << digitOffset(r);
        return h;
    }

    /**
     * The descendant that shares the center of a valid cell. The caller makes sure that
     * {@code childRes >= resolution(raw)}.
     */
    static long centerChildOf(long raw, int childRes) {
        int res = resolution(raw);
        long h = (raw & ~RES_MASK) | ((long) childRes << RES_OFFSET);
        for (int r = res + 1; r <= childRes; r++)
            h &= ~(DIGIT_MASK << digitOffset(r));
        return h;
    }

    static boolean isPentagon(long raw) {
        if (!PENTAGON_BASE_CELLS[baseCell(raw)])
            return false;
        int res = resolution(raw);
        for (int r = 1; r <= res; r++) {
            if (digit(raw, r) != CENTER_DIGIT)
                return false;
        }
        return true;
    }

    @Override
    public long getRawValue() {
        return value;
    }

    @Override
    public int getResolution() {
        return resolution(value);
    }

    public int getBaseCell() {
        return baseCell(value);
    }

    /**
     * The digit at the given resolution, 7 for resolutions finer than this cell
     * @param r a resolution in [1, 15]
     * @return a value in [0, 7]
     */
    public int getDigit(int r) {
        if (r < 1 || r > MAX_RESOLUTION)
            throw new IllegalArgumentException("Digit resolution must be in [1, 15] but was " + r);
        return digit(value, r);
    }

    @Override
    public boolean isPentagon() {
        return isPentagon(value);
    }

    /**
     * The ancestor of this cell at the given resolution.
     * @param resolution a resolution not finer than this cell's
     * @return the parent cell
     */
    public H3CellId getParent(int resolution) {
        ResolutionRange.checkResolution(resolution);
        if (resolution > getResolution())
            throw new IllegalArgumentException("Parent resolution " + resolution
                + " is finer than the cell resolution " + getResolution());
        return resolution == getResolution() ? this : new H3CellId(parentOf(value, resolution));
    }

    public H3CellId getCenterChild(int resolution) {
        ResolutionRange.checkResolution(resolution);
        if (resolution < getResolution())
            throw new IllegalArgumentException("Child resolution " + resolution
                + " is coarser than the cell resolution " + getResolution());
        return resolution == getResolution() ? this : new H3CellId(centerChildOf(value, resolution));
    }

    /**
     * The center of this cell in degrees
     */
    public LatLng getCenter() {
        return H3.getInstance().getCore().cellToLatLng(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof H3CellId))
            return false;
        return value == ((H3CellId) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    /**
     * The usual hexadecimal form of the index, e.g., 85283473fffffff
     */
    @Override
    public String toString() {
        return Long.toHexString(value);
    }
}
