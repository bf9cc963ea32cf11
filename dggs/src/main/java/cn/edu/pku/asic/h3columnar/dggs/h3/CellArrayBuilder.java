package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import cn.edu.pku.asic.h3columnar.common.utils.LongArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Builds cell arrays. Raw integers only enter through the validating {@code fromRaw} methods, while cells
 * that are already known to be valid can be appended one by one.
 */
public class CellArrayBuilder {
    private static final Log LOG = LogFactory.getLog(CellArrayBuilder.class);

    private final LongArray values;
    private final BitArray validity;
    private int size;

    public CellArrayBuilder() {
        this(16);
    }

    public CellArrayBuilder(int expectedSize) {
        this.values = new LongArray();
        this.validity = new BitArray(Math.max(expectedSize, 16));
    }

    public CellArrayBuilder append(H3CellId cell) {
        if (cell == null)
            return appendNull();
        return appendTrusted(cell.getRawValue());
    }

    public CellArrayBuilder appendNull() {
        ensureCapacity();
        values.append(H3CellId.H3_NULL);
        size++;
        return this;
    }

    /**
     * Appends the cell at the given resolution that contains the given point.
     * @param lat latitude in degrees
     * @param lng longitude in degrees
     * @param resolution the resolution of the cell
     * @return this builder
     */
    public CellArrayBuilder appendPoint(double lat, double lng, int resolution) {
        ResolutionRange.checkResolution(resolution);
        return appendTrusted(H3.getInstance().getCore().latLngToCell(lat, lng, resolution));
    }

    CellArrayBuilder appendTrusted(long raw) {
        ensureCapacity();
        validity.set(size, true);
        values.append(raw);
        size++;
        return this;
    }

    private void ensureCapacity() {
        if (size == validity.size())
            validity.resize(validity.size() * 2);
    }

    public int size() {
        return size;
    }

    public CellArray build() {
        BitArray finalValidity = new BitArray(size);
        finalValidity.copyFrom(0, validity, 0, size);
        return new CellArray(values.toArray(), finalValidity);
    }

    public static IngestResult fromRaw(Long[] values, IngestPolicy policy) throws InvalidCellException {
        return fromRaw(values, policy, new KernelOptions());
    }

    /**
     * Validates boxed raw values where {@code null} stands for a missing value.
     * @param values the raw values
     * @param policy what to do with invalid values
     * @param opts options that control parallelism
     * @return the cell array and the number of nulls introduced
     * @throws InvalidCellException under {@link IngestPolicy#REJECT} for the first invalid value
     */
    public static IngestResult fromRaw(Long[] values, IngestPolicy policy, KernelOptions opts)
        throws InvalidCellException {
        long[] unboxed = new long[values.length];
        BitArray present = new BitArray(values.length);
        for (int $i = 0; $i < values.length; $i++) {
            if (values[$i] != null) {
                unboxed[$i] = values[$i];
                present.set($i, true);
            }
        }
        return fromRaw(unboxed, present, policy, opts);
    }

    public static IngestResult fromRaw(long[] values, BitArray present, IngestPolicy policy)
        throws InvalidCellException {
        return fromRaw(values, present, policy, new KernelOptions());
    }

    /**
     * Validates raw values in parallel.
     * @param values the raw values
     * @param present which values are present, {@code null} if all of them are
     * @param policy what to do with invalid values
     * @param opts options that control parallelism
     * @return the cell array and the positions that were nulled out
     * @throws InvalidCellException under {@link IngestPolicy#REJECT} for the invalid value with the lowest position
     */
    public static IngestResult fromRaw(long[] values, BitArray present, IngestPolicy policy, KernelOptions opts)
        throws InvalidCellException {
        final int n = values.length;
        final long[] out = new long[n];
        final BitArray validity = new BitArray(n);
        List<IntArray> invalidByRange = Parallel.forEach(0, n, BitArray.BitsPerEntry, opts.getMinChunkSize(), (i1, i2) -> {
            IntArray invalid = new IntArray();
            for (int $i = i1; $i < i2; $i++) {
                if (present != null && !present.get($i))
                    continue;
                if (H3CellId.check(values[$i]) == null) {
                    out[$i] = values[$i];
                    validity.set($i, true);
                } else {
                    invalid.add($i);
                }
            }
            return invalid;
        }, opts.getParallelism());
        IntArray invalidPositions = new IntArray();
        for (IntArray invalid : invalidByRange)
            invalidPositions.append(invalid, 0, invalid.size());
        if (!invalidPositions.isEmpty()) {
            if (policy == IngestPolicy.REJECT) {
                int position = invalidPositions.get(0);
                throw new InvalidCellException(values[position], H3CellId.check(values[position]), position);
            }
            LOG.warn("Replaced " + invalidPositions.size() + " invalid cell values out of " + n + " with nulls");
        }
        return new IngestResult(new CellArray(out, validity), invalidPositions.toArray());
    }

    /**
     * Checks each raw value without building a cell array.
     * @param values the raw values
     * @param present which values are present, {@code null} if all of them are
     * @return a bit per position that is set for present and valid values
     */
    public static BitArray validityMask(long[] values, BitArray present) {
        return validityMask(values, present, new KernelOptions());
    }

    public static BitArray validityMask(long[] values, BitArray present, KernelOptions opts) {
        final BitArray mask = new BitArray(values.length);
        Parallel.forEach(0, values.length, BitArray.BitsPerEntry, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                if ((present == null || present.get($i)) && H3CellId.isValid(values[$i]))
                    mask.set($i, true);
            }
            return null;
        }, opts.getParallelism());
        return mask;
    }

    /**
     * Reads and validates a column in the Arrow physical layout, e.g., one produced by
     * {@link CellArray#exportBuffers()}.
     * @param buffers the values and the validity bitmap
     * @param policy what to do with invalid values
     * @return the cell array and the number of nulls introduced
     * @throws InvalidCellException under {@link IngestPolicy#REJECT} for the first invalid value
     */
    public static IngestResult fromBuffers(ColumnarBuffers buffers, IngestPolicy policy) throws InvalidCellException {
        int n = buffers.getLength();
        long[] values = new long[n];
        ByteBuffer valueBytes = buffers.getValues().order(ByteOrder.LITTLE_ENDIAN);
        valueBytes.asLongBuffer().get(values);
        BitArray present = buffers.getValidity() == null ? null : BitArray.fromBitmap(buffers.getValidity(), n);
        return fromRaw(values, present, policy);
    }
}
