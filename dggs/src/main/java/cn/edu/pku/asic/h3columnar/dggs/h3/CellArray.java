package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongUnaryOperator;

/**
 * An immutable, fixed length and nullable column of H3 cells. The values are kept in one {@code long[]} with
 * a zero at every null slot, next to a validity bit array with the same bit order as an Arrow validity
 * bitmap. Every value whose validity bit is set is a valid cell.
 * <p>
 * Each instance gets a process-wide unique generation number which lets derived structures, e.g., a spatial
 * index, detect that they are used with a different array than the one they were built from.
 */
public final class CellArray implements Iterable<CellArray.Entry> {

    private static final AtomicLong GENERATIONS = new AtomicLong();

    final long[] values;
    final BitArray validity;
    private final int nullCount;
    private final long generation;

    /**
     * Takes ownership of the given buffers. All set bits must point to valid cells and all cleared bits to
     * zeros.
     */
    CellArray(long[] values, BitArray validity) {
        this.values = values;
        this.validity = validity;
        this.nullCount = (int) (values.length - validity.countOnes());
        this.generation = GENERATIONS.incrementAndGet();
    }

    /**
     * An array without nulls over values that are known to be valid.
     */
    static CellArray ofTrusted(long[] values) {
        return new CellArray(values, BitArray.filled(values.length, true));
    }

    public static CellArray of(H3CellId... cells) {
        CellArrayBuilder builder = new CellArrayBuilder(cells.length);
        for (H3CellId cell : cells)
            builder.append(cell);
        return builder.build();
    }

    public static CellArray nulls(int length) {
        return new CellArray(new long[length], new BitArray(length));
    }

    public int length() {
        return values.length;
    }

    public int getNullCount() {
        return nullCount;
    }

    public boolean isNull(int i) {
        return !validity.get(i);
    }

    /**
     * The cell at the given position.
     * @param i the position
     * @return the cell or {@code null} if the slot is null
     */
    public H3CellId get(int i) {
        return validity.get(i) ? new H3CellId(values[i]) : null;
    }

    /**
     * The raw value at the given position without allocating a cell object.
     * @param i the position
     * @return the raw value or {@link H3CellId#H3_NULL} for a null slot
     */
    public long getRaw(int i) {
        return values[i];
    }

    public long getGeneration() {
        return generation;
    }

    /**
     * A copy of the validity bits, one per position
     */
    public BitArray getValidity() {
        return new BitArray(validity);
    }

    /**
     * A copy of the values with zeros at null positions
     */
    public long[] toRawArray() {
        return values.clone();
    }

    /**
     * Copies a range of this array into a new array.
     * @param offset the first position to copy
     * @param length the number of positions
     * @return a new array with its own generation
     */
    public CellArray slice(int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > values.length)
            throw new IndexOutOfBoundsException("Slice [" + offset + ", " + (offset + length)
                + ") is out of bounds for length " + values.length);
        BitArray sliceValidity = new BitArray(length);
        sliceValidity.copyFrom(0, validity, offset, length);
        return new CellArray(Arrays.copyOfRange(values, offset, offset + length), sliceValidity);
    }

    /**
     * Exports the array in the Arrow physical layout of a nullable uint64 column.
     * @return little endian values and the validity bitmap
     */
    public ColumnarBuffers exportBuffers() {
        ByteBuffer valueBuffer = ByteBuffer.allocate(Math.multiplyExact(values.length, Long.BYTES))
            .order(ByteOrder.LITTLE_ENDIAN);
        valueBuffer.asLongBuffer().put(values);
        return new ColumnarBuffers(values.length, nullCount, valueBuffer, validity.toBitmap());
    }

    /**
     * Applies an element-wise function to all non-null values in parallel. The function returns
     * {@link H3CellId#H3_NULL} to produce a null and must only return valid cells otherwise.
     */
    CellArray mapValues(LongUnaryOperator fn, KernelOptions opts) {
        final int n = values.length;
        final long[] out = new long[n];
        final BitArray outValidity = new BitArray(n);
        // Ranges are multiples of 64 so that no two ranges write to the same word of the bit array
        Parallel.forEach(0, n, BitArray.BitsPerEntry, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                if (!validity.get($i))
                    continue;
                long result = fn.applyAsLong(values[$i]);
                if (result != H3CellId.H3_NULL) {
                    out[$i] = result;
                    outValidity.set($i, true);
                }
            }
            return null;
        }, opts.getParallelism());
        return new CellArray(out, outValidity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellArray))
            return false;
        CellArray other = (CellArray) o;
        return Arrays.equals(values, other.values) && validity.equals(other.validity);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder("[");
        for (int $i = 0; $i < values.length; $i++) {
            if ($i > 0)
                str.append(", ");
            str.append(validity.get($i) ? Long.toHexString(values[$i]) : "null");
        }
        return str.append(']').toString();
    }

    /**
     * Iterates over (position, cell) pairs in array order. Null slots produce an entry with a null cell.
     */
    @Override
    public Iterator<Entry> iterator() {
        return new Iterator<Entry>() {
            int i = 0;

            @Override
            public boolean hasNext() {
                return i < values.length;
            }

            @Override
            public Entry next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                Entry entry = new Entry(i, get(i));
                i++;
                return entry;
            }
        };
    }

    public static final class Entry {
        private final int index;
        private final H3CellId cell;

        Entry(int index, H3CellId cell) {
            this.index = index;
            this.cell = cell;
        }

        public int getIndex() {
            return index;
        }

        /**
         * The cell or {@code null} for a null slot
         */
        public H3CellId getCell() {
            return cell;
        }
    }
}
