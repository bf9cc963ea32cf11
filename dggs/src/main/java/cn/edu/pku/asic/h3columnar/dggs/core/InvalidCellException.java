package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Thrown when a raw 64-bit value does not decode to a valid cell. This is a data problem, so bulk ingestion
 * either reports it or turns the value into a null depending on the ingest policy.
 */
public class InvalidCellException extends Exception {

    /**
     * The first field of the encoding that failed the check
     */
    public enum Reason {
        /** Bit 63 or one of bits 56-58 is set */
        RESERVED_BIT,
        /** The mode is not the cell mode, e.g., a directed edge or a vertex */
        MODE,
        /** The base cell is not in [0, 121] */
        BASE_CELL,
        /** A digit at or above the resolution is 7 */
        DIGIT,
        /** A digit below the resolution is not 7 */
        UNUSED_DIGIT,
        /** The first non-zero digit of a pentagon cell is the deleted K-axis digit */
        DELETED_SUBSEQUENCE
    }

    private final long rawValue;
    private final Reason reason;
    /**Position in the input array or -1 for a scalar value*/
    private final int position;

    public InvalidCellException(long rawValue, Reason reason) {
        this(rawValue, reason, -1);
    }

    public InvalidCellException(long rawValue, Reason reason, int position) {
        super(String.format("Invalid cell 0x%016x (%s)%s", rawValue, reason,
            position >= 0 ? " at position " + position : ""));
        this.rawValue = rawValue;
        this.reason = reason;
        this.position = position;
    }

    /**
     * Returns a copy of this exception that records the array position of the value.
     * @param position the position of the offending value in its array
     * @return a new exception
     */
    public InvalidCellException atPosition(int position) {
        return new InvalidCellException(rawValue, reason, position);
    }

    public long getRawValue() {
        return rawValue;
    }

    public Reason getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }
}
