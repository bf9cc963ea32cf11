package cn.edu.pku.asic.h3columnar.dggs.h3;

import com.uber.h3core.H3Core;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static cn.edu.pku.asic.h3columnar.dggs.h3.HierarchyKernelsTest.ingest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridKernelsTest {

    static final long SF_RES5 = H3CellIdTest.SF_RES5;

    private final H3Core h3 = H3.getInstance().getCore();
    private final GridKernels kernels = new GridKernels();

    @Test
    void diskOfAHexagon() {
        CellListArray disks = kernels.gridDisk(ingest(new Long[] {SF_RES5, null}), 1);
        assertThat(disks.getListLength(0)).isEqualTo(7);
        assertThat(disks.isNull(1)).isTrue();
        assertThat(disks.getList(0).getRaw(0)).isEqualTo(SF_RES5);
    }

    @Test
    void distancesFollowTheRings() {
        GridDiskDistances disks = kernels.gridDiskDistances(ingest(new Long[] {SF_RES5}), 2);
        assertThat(disks.getCells().getListLength(0)).isEqualTo(19);
        int[] distances = disks.getDistances(0);
        assertThat(distances).hasSize(19);
        assertThat(distances[0]).isZero();
        assertThat(Arrays.stream(distances).filter(d -> d == 1).count()).isEqualTo(6);
        assertThat(Arrays.stream(distances).filter(d -> d == 2).count()).isEqualTo(12);
    }

    @Test
    void ringsSkipTheInnerDisk() {
        GridDiskDistances rings = kernels.gridRingDistances(ingest(new Long[] {SF_RES5}), 1, 2);
        assertThat(rings.getCells().getListLength(0)).isEqualTo(18);
        assertThat(rings.getDistances()).doesNotContain(0);
        assertThatThrownBy(() -> kernels.gridRingDistances(ingest(new Long[] {SF_RES5}), 2, 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void aggregateKeepsTheMinimumOrMaximumDistance() {
        long neighbor = h3.gridDisk(SF_RES5, 1).get(1);
        CellArray origins = ingest(new Long[] {SF_RES5, neighbor});
        GridDiskAggregate min = kernels.gridDiskAggregateK(origins, 1, KAggregation.MIN);
        GridDiskAggregate max = kernels.gridDiskAggregateK(origins, 1, KAggregation.fromString("max"));
        assertThat(min.getCells()).isEqualTo(max.getCells());
        assertThat(min.getCells().toRawArray()).isSorted().doesNotHaveDuplicates();
        int origin = -1;
        for (int $i = 0; $i < min.getCells().length(); $i++) {
            if (min.getCells().getRaw($i) == SF_RES5)
                origin = $i;
        }
        assertThat(min.getDistances()[origin]).isZero();
        assertThat(max.getDistances()[origin]).isEqualTo(1);
        assertThatThrownBy(() -> KAggregation.fromString("avg")).isInstanceOf(IllegalArgumentException.class);
    }
}
