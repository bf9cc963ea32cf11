package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.utils.IntArray;
import cn.edu.pku.asic.h3columnar.common.utils.LongArray;
import com.google.common.base.Preconditions;
import com.uber.h3core.H3Core;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.util.IndexedSortable;
import org.apache.hadoop.util.QuickSort;

import java.util.List;

/**
 * Neighborhood kernels. The lists of each input position follow the order of the H3 library, i.e., the
 * origin first and then ring by ring.
 */
public class GridKernels {
    private static final Log LOG = LogFactory.getLog(GridKernels.class);

    private final KernelOptions opts;
    private final H3Core h3;

    public GridKernels() {
        this(new KernelOptions());
    }

    public GridKernels(KernelOptions opts) {
        this.opts = opts;
        this.h3 = H3.getInstance().getCore();
    }

    /**
     * All cells within grid distance {@code k} of each input cell.
     * @param cells the origins
     * @param k a non-negative distance
     * @return one list per input position
     */
    public CellListArray gridDisk(CellArray cells, int k) {
        Preconditions.checkArgument(k >= 0, "k must be non-negative but was %s", k);
        return CellListArray.flatMap(cells, (raw, chunk) -> {
            chunk.values.appendAll(h3.gridDisk(raw, k));
            return true;
        }, opts);
    }

    public GridDiskDistances gridDiskDistances(CellArray cells, int k) {
        Preconditions.checkArgument(k >= 0, "k must be non-negative but was %s", k);
        return ringDistances(cells, 0, k);
    }

    /**
     * The cells at grid distances {@code kMin} to {@code kMax}, both inclusive, of each input cell.
     * @param cells the origins
     * @param kMin the distance of the innermost ring
     * @param kMax the distance of the outermost ring, greater than {@code kMin}
     * @return one list per input position with the distance of each cell
     */
    public GridDiskDistances gridRingDistances(CellArray cells, int kMin, int kMax) {
        Preconditions.checkArgument(kMin >= 0, "kMin must be non-negative but was %s", kMin);
        Preconditions.checkArgument(kMin < kMax, "kMin must be less than kMax but was %s >= %s", kMin, kMax);
        return ringDistances(cells, kMin, kMax);
    }

    private GridDiskDistances ringDistances(CellArray cells, int kMin, int kMax) {
        List<CellListArray.Chunk> chunks = CellListArray.mapChunks(cells, (raw, chunk) -> {
            List<List<Long>> rings = h3.gridDiskDistances(raw, kMax);
            for (int k = kMin; k < rings.size(); k++) {
                for (Long neighbor : rings.get(k)) {
                    chunk.values.append(neighbor);
                    chunk.distances.append(k);
                }
            }
            return true;
        }, opts);
        IntArray distances = new IntArray();
        for (CellListArray.Chunk chunk : chunks)
            distances.append(chunk.distances, 0, chunk.distances.size());
        return new GridDiskDistances(CellListArray.assemble(cells.length(), chunks), distances.toArray());
    }

    /**
     * Computes the disks of all input cells and reports every reached cell once with the minimum or the
     * maximum distance at which it was reached.
     * @param cells the origins, nulls are ignored
     * @param k a non-negative distance
     * @param aggregation how to combine distances of the same cell
     * @return the unique reached cells sorted ascending
     */
    public GridDiskAggregate gridDiskAggregateK(CellArray cells, int k, KAggregation aggregation) {
        GridDiskDistances disks = gridDiskDistances(cells, k);
        final long[] keys = disks.getCells().getValues().toRawArray();
        final int[] distances = disks.getDistances();
        new QuickSort().sort(new IndexedSortable() {
            @Override
            public int compare(int i, int j) {
                int diff = Long.compare(keys[i], keys[j]);
                return diff != 0 ? diff : Integer.compare(distances[i], distances[j]);
            }

            @Override
            public void swap(int i, int j) {
                long tk = keys[i];
                keys[i] = keys[j];
                keys[j] = tk;
                int td = distances[i];
                distances[i] = distances[j];
                distances[j] = td;
            }
        }, 0, keys.length);
        LongArray uniqueCells = new LongArray();
        IntArray uniqueDistances = new IntArray();
        for (int $i = 0; $i < keys.length; $i++) {
            if ($i > 0 && keys[$i] == keys[$i - 1]) {
                int last = uniqueDistances.pop();
                uniqueDistances.append(aggregation.combine(last, distances[$i]));
            } else {
                uniqueCells.append(keys[$i]);
                uniqueDistances.append(distances[$i]);
            }
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Aggregated " + keys.length + " disk cells into " + uniqueCells.size() + " unique cells");
        return new GridDiskAggregate(CellArray.ofTrusted(uniqueCells.toArray()), uniqueDistances.toArray());
    }
}
