package cn.edu.pku.asic.h3columnar.dggs.h3;

import java.nio.ByteBuffer;

/**
 * The Arrow physical layout of a nullable 64-bit column: {@code 8 * length} little endian value bytes and
 * a validity bitmap of {@code ceil(length / 8)} bytes where bit {@code i % 8} of byte {@code i / 8} is set
 * when position {@code i} is not null. A {@code null} validity buffer means that there are no nulls.
 */
public final class ColumnarBuffers {

    private final int length;
    private final int nullCount;
    private final ByteBuffer values;
    private final ByteBuffer validity;

    public ColumnarBuffers(int length, int nullCount, ByteBuffer values, ByteBuffer validity) {
        if (values.remaining() < length * 8L)
            throw new IllegalArgumentException("Value buffer holds " + values.remaining()
                + " bytes but " + length + " values need " + length * 8L);
        if (validity != null && validity.remaining() < (length + 7) / 8)
            throw new IllegalArgumentException("Validity bitmap holds " + validity.remaining()
                + " bytes which is too short for " + length + " values");
        this.length = length;
        this.nullCount = nullCount;
        this.values = values;
        this.validity = validity;
    }

    public int getLength() {
        return length;
    }

    public int getNullCount() {
        return nullCount;
    }

    /**
     * A read-only view of the value bytes
     */
    public ByteBuffer getValues() {
        return values.asReadOnlyBuffer().order(values.order());
    }

    /**
     * A read-only view of the validity bitmap or {@code null} if all values are valid
     */
    public ByteBuffer getValidity() {
        return validity == null ? null : validity.asReadOnlyBuffer();
    }
}
