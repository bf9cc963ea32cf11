package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import cn.edu.pku.asic.h3columnar.common.utils.LongArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;

import java.util.List;

/**
 * A column of cell lists in the Arrow list layout: one flat array of values and an offsets table of
 * {@code length + 1} entries where list {@code i} spans {@code [offsets[i], offsets[i+1])}. A null list has
 * an empty span and a cleared validity bit.
 */
public final class CellListArray {

    private final CellArray values;
    private final int[] offsets;
    private final BitArray validity;

    CellListArray(CellArray values, int[] offsets, BitArray validity) {
        this.values = values;
        this.offsets = offsets;
        this.validity = validity;
    }

    public int length() {
        return offsets.length - 1;
    }

    public boolean isNull(int i) {
        return !validity.get(i);
    }

    public int getNullCount() {
        return (int) (length() - validity.countOnes());
    }

    public int getListLength(int i) {
        return offsets[i + 1] - offsets[i];
    }

    /**
     * The list at the given position.
     * @param i the position
     * @return a new array with the cells of the list or {@code null} for a null list
     */
    public CellArray getList(int i) {
        if (isNull(i))
            return null;
        return values.slice(offsets[i], getListLength(i));
    }

    /**
     * All the values of all lists in order. This is the flattened form of the column.
     */
    public CellArray getValues() {
        return values;
    }

    public int[] getOffsets() {
        return offsets.clone();
    }

    /**
     * Computes one list per input value.
     */
    interface ListMapper {
        /**
         * Appends the list of the given cell to the output.
         * @param raw a valid cell
         * @param chunk the output of the current range
         * @return {@code false} to produce a null list
         */
        boolean map(long raw, Chunk chunk);
    }

    /**
     * The lists produced by one contiguous range of the input.
     */
    static final class Chunk {
        final LongArray values = new LongArray();
        /**Distances that go along with the values, only used by the neighborhood kernels*/
        final IntArray distances = new IntArray();
        /**Length of each list of the range, -1 for a null list*/
        final IntArray lengths = new IntArray();
    }

    static List<Chunk> mapChunks(CellArray cells, ListMapper mapper, KernelOptions opts) {
        return Parallel.forEach(0, cells.length(), 1, opts.getMinChunkSize(), (i1, i2) -> {
            Chunk chunk = new Chunk();
            for (int $i = i1; $i < i2; $i++) {
                if (cells.isNull($i)) {
                    chunk.lengths.add(-1);
                    continue;
                }
                int before = chunk.values.size();
                if (mapper.map(cells.values[$i], chunk))
                    chunk.lengths.add(chunk.values.size() - before);
                else
                    chunk.lengths.add(-1);
            }
            return chunk;
        }, opts.getParallelism());
    }

    static CellListArray flatMap(CellArray cells, ListMapper mapper, KernelOptions opts) {
        return assemble(cells.length(), mapChunks(cells, mapper, opts));
    }

    /**
     * Concatenates the chunks of all ranges in range order.
     */
    static CellListArray assemble(int length, List<Chunk> chunks) {
        int[] offsets = new int[length + 1];
        BitArray validity = new BitArray(length);
        LongArray allValues = new LongArray();
        int i = 0;
        for (Chunk chunk : chunks) {
            for (int listLength : chunk.lengths) {
                if (listLength >= 0) {
                    validity.set(i, true);
                    offsets[i + 1] = offsets[i] + listLength;
                } else {
                    offsets[i + 1] = offsets[i];
                }
                i++;
            }
            allValues.append(chunk.values);
        }
        return new CellListArray(CellArray.ofTrusted(allValues.toArray()), offsets, validity);
    }
}
