package cn.edu.pku.asic.h3columnar.dggs.h3;

/**
 * Decides which cells cover a polygon. For a fixed polygon and resolution, the cells selected by
 * {@link #FULL} and by {@link #CENTER} are both subsets of the cells selected by {@link #OVERLAP}.
 */
public enum ContainmentMode {
    /** A cell is included if its center is inside the polygon */
    CENTER,
    /** A cell is included if its footprint intersects the polygon */
    OVERLAP,
    /** A cell is included if its footprint is entirely covered by the polygon */
    FULL
}
