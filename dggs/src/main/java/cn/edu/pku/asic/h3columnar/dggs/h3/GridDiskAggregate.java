package cn.edu.pku.asic.h3columnar.dggs.h3;

/**
 * Unique cells reached from a set of origins, each with one aggregated grid distance.
 */
public final class GridDiskAggregate {

    private final CellArray cells;
    private final int[] distances;

    GridDiskAggregate(CellArray cells, int[] distances) {
        this.cells = cells;
        this.distances = distances;
    }

    /**
     * The reached cells sorted ascending
     */
    public CellArray getCells() {
        return cells;
    }

    public int[] getDistances() {
        return distances.clone();
    }
}
