package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.UInt8Vector;

/**
 * Moves cell arrays in and out of Arrow vectors. Cells are exported as {@code uint64} and imported from
 * either {@code uint64} or {@code int64} columns, which have the same physical layout.
 */
public final class ArrowCells {

    /** Column name used when the caller does not give one */
    public static final String DEFAULT_CELL_COLUMN_NAME = "cell";

    private ArrowCells() { /* Enforce static use only */ }

    /**
     * Copies the cells into a new vector owned by the caller.
     * @param cells the cells to export
     * @param name the name of the vector
     * @param allocator the allocator of the vector buffers
     * @return a vector with the same values and nulls
     */
    public static UInt8Vector toVector(CellArray cells, String name, BufferAllocator allocator) {
        UInt8Vector vector = new UInt8Vector(name, allocator);
        vector.allocateNew(cells.length());
        for (int $i = 0; $i < cells.length(); $i++) {
            if (cells.isNull($i))
                vector.setNull($i);
            else
                vector.set($i, cells.values[$i]);
        }
        vector.setValueCount(cells.length());
        return vector;
    }

    public static IngestResult fromVector(UInt8Vector vector, IngestPolicy policy) throws InvalidCellException {
        long[] values = new long[vector.getValueCount()];
        for (int $i = 0; $i < values.length; $i++) {
            if (!vector.isNull($i))
                values[$i] = vector.get($i);
        }
        return CellArrayBuilder.fromRaw(values, presentBits(vector), policy);
    }

    public static IngestResult fromVector(BigIntVector vector, IngestPolicy policy) throws InvalidCellException {
        long[] values = new long[vector.getValueCount()];
        for (int $i = 0; $i < values.length; $i++) {
            if (!vector.isNull($i))
                values[$i] = vector.get($i);
        }
        return CellArrayBuilder.fromRaw(values, presentBits(vector), policy);
    }

    /**
     * Checks every value of a raw column. The result is null where the input is null and otherwise tells
     * whether the value is a valid cell.
     * @param vector the raw values
     * @param allocator the allocator of the result buffers
     * @return a new boolean vector owned by the caller
     */
    public static BitVector isValid(BigIntVector vector, BufferAllocator allocator) {
        int n = vector.getValueCount();
        long[] values = new long[n];
        for (int $i = 0; $i < n; $i++) {
            if (!vector.isNull($i))
                values[$i] = vector.get($i);
        }
        BitArray present = presentBits(vector);
        BitArray mask = CellArrayBuilder.validityMask(values, present);
        BitVector result = new BitVector(vector.getName() + "_valid", allocator);
        result.allocateNew(n);
        for (int $i = 0; $i < n; $i++) {
            if (present.get($i))
                result.set($i, mask.get($i) ? 1 : 0);
            else
                result.setNull($i);
        }
        result.setValueCount(n);
        return result;
    }

    private static BitArray presentBits(BaseFixedWidthVector vector) {
        BitArray present = new BitArray(vector.getValueCount());
        for (int $i = 0; $i < vector.getValueCount(); $i++) {
            if (!vector.isNull($i))
                present.set($i, true);
        }
        return present;
    }
}
