package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Groups of kernels that can be left out of a deployment.
 */
public enum Feature {
    /** Parent, children, compaction and neighborhood kernels */
    HIERARCHY,
    /** Boundary, center and geometry covering kernels */
    GEOMETRY,
    /** Raster to cell conversion, shipped in the raster artifact */
    RASTER,
    /** R-tree over cell footprints, shipped in the indexing artifact */
    SPATIAL_INDEX
}
