package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.dggs.core.InvalidCellException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.UInt8Vector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArrowCellsTest {

    private BufferAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new RootAllocator();
    }

    @AfterEach
    void tearDown() {
        allocator.close();
    }

    @Test
    void exportsAndImportsUInt64() throws InvalidCellException {
        CellArray cells = CellArrayBuilder.fromRaw(new Long[] {H3CellIdTest.SF_RES5, null}, IngestPolicy.REJECT)
            .getCells();
        try (UInt8Vector vector = ArrowCells.toVector(cells, ArrowCells.DEFAULT_CELL_COLUMN_NAME, allocator)) {
            assertThat(vector.getValueCount()).isEqualTo(2);
            assertThat(vector.isNull(1)).isTrue();
            assertThat(vector.get(0)).isEqualTo(H3CellIdTest.SF_RES5);
            assertThat(ArrowCells.fromVector(vector, IngestPolicy.REJECT).getCells()).isEqualTo(cells);
        }
    }

    @Test
    void importsInt64UnderNullOut() throws InvalidCellException {
        try (BigIntVector vector = new BigIntVector("raw", allocator)) {
            vector.allocateNew(3);
            vector.set(0, H3CellIdTest.SF_RES5);
            vector.set(1, -1L);
            vector.setNull(2);
            vector.setValueCount(3);
            IngestResult result = ArrowCells.fromVector(vector, IngestPolicy.NULL_OUT);
            assertThat(result.getNullsIntroduced()).isEqualTo(1);
            assertThat(result.getCells().getNullCount()).isEqualTo(2);

            try (BitVector valid = ArrowCells.isValid(vector, allocator)) {
                assertThat(valid.get(0)).isEqualTo(1);
                assertThat(valid.get(1)).isEqualTo(0);
                assertThat(valid.isNull(2)).isTrue();
            }
        }
    }
}
