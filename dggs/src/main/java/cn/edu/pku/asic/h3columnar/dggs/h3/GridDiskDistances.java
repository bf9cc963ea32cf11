package cn.edu.pku.asic.h3columnar.dggs.h3;

/**
 * The neighborhood of each input cell together with the grid distance of each neighbor from its origin.
 * {@code getDistances()[j]} belongs to {@code getCells().getValues().get(j)}.
 */
public final class GridDiskDistances {

    private final CellListArray cells;
    private final int[] distances;

    GridDiskDistances(CellListArray cells, int[] distances) {
        this.cells = cells;
        this.distances = distances;
    }

    public CellListArray getCells() {
        return cells;
    }

    public int[] getDistances() {
        return distances.clone();
    }

    /**
     * The distances of the list at the given position, {@code null} for a null list
     */
    public int[] getDistances(int i) {
        if (cells.isNull(i))
            return null;
        int[] offsets = cells.getOffsets();
        int[] listDistances = new int[offsets[i + 1] - offsets[i]];
        System.arraycopy(distances, offsets[i], listDistances, 0, listDistances.length);
        return listDistances;
    }
}
