package cn.edu.pku.asic.h3columnar.dggs.h3;

import cn.edu.pku.asic.h3columnar.common.cli.KernelOptions;
import cn.edu.pku.asic.h3columnar.common.utils.BitArray;
import cn.edu.pku.asic.h3columnar.common.utils.LongArray;
import cn.edu.pku.asic.h3columnar.common.utils.Parallel;
import cn.edu.pku.asic.h3columnar.dggs.core.ResolutionRangeException;
import com.uber.h3core.H3Core;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Kernels that move cells up and down the resolution hierarchy.
 * <p>
 * {@link #parent}, {@link #children} and {@link #changeResolution} preserve the order and length of their
 * input. {@link #compact} and {@link #uncompact} are set operations: their output is sorted ascending and
 * free of duplicates regardless of the input order.
 */
public class HierarchyKernels {
    private static final Log LOG = LogFactory.getLog(HierarchyKernels.class);

    /**Lists longer than this cannot be stored in an offsets table*/
    static final long MAX_LIST_SIZE = Integer.MAX_VALUE - 8;

    private final KernelOptions opts;
    private final H3Core h3;

    public HierarchyKernels() {
        this(new KernelOptions());
    }

    public HierarchyKernels(KernelOptions opts) {
        this.opts = opts;
        this.h3 = H3.getInstance().getCore();
    }

    /**
     * The ancestor of each cell at the given resolution. Cells that are coarser than the resolution produce
     * a null.
     * @param cells the input cells
     * @param resolution the resolution of the parents
     * @return one parent per input position
     * @throws ResolutionRangeException if the resolution is outside [0, 15]
     */
    public CellArray parent(CellArray cells, int resolution) {
        ResolutionRange.checkResolution(resolution);
        return cells.mapValues(raw -> H3CellId.resolution(raw) >= resolution ?
            H3CellId.parentOf(raw, resolution) : H3CellId.H3_NULL, opts);
    }

    /**
     * All descendants of each cell at the given resolution. A hexagon has {@code 7^d} descendants
     * {@code d} levels down while a pentagon has {@code 1 + 5 (7^d - 1) / 6}. Cells that are finer than
     * the resolution produce a null list.
     * @param cells the input cells
     * @param resolution the resolution of the children
     * @return one list per input position
     */
    public CellListArray children(CellArray cells, int resolution) {
        ResolutionRange.checkResolution(resolution);
        return CellListArray.flatMap(cells, (raw, chunk) -> {
            if (H3CellId.resolution(raw) > resolution)
                return false;
            checkListSize(raw, resolution);
            chunk.values.appendAll(h3.cellToChildren(raw, resolution));
            return true;
        }, opts);
    }

    private void checkListSize(long raw, int resolution) {
        long numChildren = h3.cellToChildrenSize(raw, resolution);
        if (numChildren > MAX_LIST_SIZE)
            throw new ResolutionRangeException(resolution, "Cell " + Long.toHexString(raw) + " has "
                + numChildren + " children at resolution " + resolution + " which exceeds the list capacity");
    }

    /**
     * Moves each cell to the given resolution, taking the parent when coarsening and the center child when
     * refining.
     * @param cells the input cells
     * @param resolution the target resolution
     * @return one cell per input position
     */
    public CellArray changeResolution(CellArray cells, int resolution) {
        ResolutionRange.checkResolution(resolution);
        return cells.mapValues(raw -> {
            int res = H3CellId.resolution(raw);
            if (res > resolution)
                return H3CellId.parentOf(raw, resolution);
            if (res < resolution)
                return H3CellId.centerChildOf(raw, resolution);
            return raw;
        }, opts);
    }

    /**
     * Resolution of each cell or -1 for a null
     */
    public int[] resolutions(CellArray cells) {
        int[] resolutions = new int[cells.length()];
        for (int $i = 0; $i < resolutions.length; $i++)
            resolutions[$i] = cells.isNull($i) ? -1 : H3CellId.resolution(cells.values[$i]);
        return resolutions;
    }

    /**
     * Whether each cell is one of the twelve pentagons of its resolution, {@code null} for a null
     */
    public Boolean[] isPentagon(CellArray cells) {
        Boolean[] pentagons = new Boolean[cells.length()];
        for (int $i = 0; $i < pentagons.length; $i++)
            pentagons[$i] = cells.isNull($i) ? null : H3CellId.isPentagon(cells.values[$i]);
        return pentagons;
    }

    public CellArray compact(CellArray cells) {
        return compact(cells, ResolutionRange.ALL);
    }

    /**
     * Replaces every complete group of siblings with their parent, recursively. Input cells may have mixed
     * resolutions and duplicates. Cells covered by a coarser input cell are dropped.
     * @param cells the input cells, nulls are ignored
     * @param range groups are not merged into parents coarser than {@code range.getMin()}
     * @return the compacted set sorted ascending
     * @throws ResolutionRangeException if an input cell lies outside the range
     */
    public CellArray compact(CellArray cells, ResolutionRange range) {
        final long[] set = uniqueValues(cells);
        // Map phase: find cells that are covered by a coarser cell of the input
        final BitArray covered = new BitArray(set.length);
        Parallel.forEach(0, set.length, BitArray.BitsPerEntry, opts.getMinChunkSize(), (i1, i2) -> {
            for (int $i = i1; $i < i2; $i++) {
                long raw = set[$i];
                int res = H3CellId.resolution(raw);
                if (!range.contains(res))
                    throw new ResolutionRangeException(res, "Cell " + Long.toHexString(raw) + " at resolution "
                        + res + " is outside the range " + range);
                for (int r = 0; r < res; r++) {
                    if (Arrays.binarySearch(set, H3CellId.parentOf(raw, r)) >= 0) {
                        covered.set($i, true);
                        break;
                    }
                }
            }
            return null;
        }, opts.getParallelism());

        // Reduce phase: merge complete sibling groups from the finest resolution up
        LongArray[] byResolution = new LongArray[H3CellId.MAX_RESOLUTION + 1];
        for (int r = 0; r < byResolution.length; r++)
            byResolution[r] = new LongArray();
        for (int $i = 0; $i < set.length; $i++) {
            if (!covered.get($i))
                byResolution[H3CellId.resolution(set[$i])].append(set[$i]);
        }
        LongArray result = new LongArray();
        for (int r = range.getMax(); r > range.getMin(); r--) {
            LongArray level = byResolution[r];
            level.sortUnique();
            int groupStart = 0;
            while (groupStart < level.size()) {
                long parent = H3CellId.parentOf(level.get(groupStart), r - 1);
                int groupEnd = groupStart + 1;
                while (groupEnd < level.size() && H3CellId.parentOf(level.get(groupEnd), r - 1) == parent)
                    groupEnd++;
                int numSiblings = H3CellId.isPentagon(parent) ? 6 : 7;
                if (groupEnd - groupStart == numSiblings) {
                    byResolution[r - 1].append(parent);
                } else {
                    for (int $i = groupStart; $i < groupEnd; $i++)
                        result.append(level.get($i));
                }
                groupStart = groupEnd;
            }
        }
        result.append(byResolution[range.getMin()]);
        result.sortUnique();
        if (LOG.isDebugEnabled())
            LOG.debug("Compacted " + set.length + " unique cells into " + result.size());
        return CellArray.ofTrusted(result.toArray());
    }

    /**
     * Expands every cell to its descendants at the given resolution. Cells already at the resolution are
     * kept as they are.
     * @param cells the input cells, nulls are ignored
     * @param resolution the target resolution
     * @return the expanded set sorted ascending
     * @throws ResolutionRangeException if the resolution is outside [0, 15] or any cell is finer than it
     */
    public CellArray uncompact(CellArray cells, int resolution) {
        ResolutionRange.checkResolution(resolution);
        List<CellListArray.Chunk> chunks = CellListArray.mapChunks(cells, (raw, chunk) -> {
            int res = H3CellId.resolution(raw);
            if (res > resolution)
                throw new ResolutionRangeException(resolution, "Cell " + Long.toHexString(raw) + " at resolution "
                    + res + " cannot be uncompacted to the coarser resolution " + resolution);
            if (res == resolution) {
                chunk.values.append(raw);
            } else {
                checkListSize(raw, resolution);
                chunk.values.appendAll(h3.cellToChildren(raw, resolution));
            }
            return true;
        }, opts);
        LongArray result = new LongArray();
        for (CellListArray.Chunk chunk : chunks)
            result.append(chunk.values);
        result.sortUnique();
        return CellArray.ofTrusted(result.toArray());
    }

    private static long[] uniqueValues(CellArray cells) {
        LongArray values = new LongArray();
        for (int $i = 0; $i < cells.length(); $i++) {
            if (!cells.isNull($i))
                values.append(cells.values[$i]);
        }
        values.sortUnique();
        return values.toArray();
    }
}
