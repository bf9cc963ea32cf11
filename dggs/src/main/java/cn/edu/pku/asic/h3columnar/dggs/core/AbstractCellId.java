package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * =============================================================================================
 *
 * @ProjectName dggs
 * @Package cn.edu.pku.asic.h3columnar.dggs.core
 * @ClassName AbstractCellId
 * @Version 1.0.0
 * @See =============================================================================================
 * @Description The identifier of one cell of a hierarchical discrete global grid. Instances are always
 *              valid: the only way to obtain one is through the validating factory of the concrete grid
 *              or from the result of a kernel.
 */
public abstract class AbstractCellId<TID extends AbstractCellId<TID>> implements Comparable<TID> {

    /**
     * The encoded value of this cell
     */
    public abstract long getRawValue();

    /**
     * The zoom level of this cell, 0 is the coarsest
     */
    public abstract int getResolution();

    public abstract boolean isPentagon();

    /**
     * Cells are ordered by their encoded value which groups cells by base cell and then by their path
     * down the hierarchy.
     */
    @Override
    public int compareTo(TID other) {
        return Long.compare(getRawValue(), other.getRawValue());
    }
}
