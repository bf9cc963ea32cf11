package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * A call-level failure of a grid kernel. These indicate a programming error, e.g., an out of range resolution
 * or a stale index, rather than bad data, so the whole operation fails.
 */
public class DggsException extends RuntimeException {

    public DggsException(String message) {
        super(message);
    }

    public DggsException(String message, Throwable cause) {
        super(message, cause);
    }
}
