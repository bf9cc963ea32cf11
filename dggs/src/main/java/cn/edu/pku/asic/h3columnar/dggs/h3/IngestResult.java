package cn.edu.pku.asic.h3columnar.dggs.h3;

/**
 * A cell array together with the number of input values that were turned into nulls because they were
 * invalid. The count is zero under {@link IngestPolicy#REJECT}.
 */
public final class IngestResult {

    private final CellArray cells;
    private final int[] invalidPositions;

    IngestResult(CellArray cells, int[] invalidPositions) {
        this.cells = cells;
        this.invalidPositions = invalidPositions;
    }

    public CellArray getCells() {
        return cells;
    }

    public int getNullsIntroduced() {
        return invalidPositions.length;
    }

    /**
     * Positions of the values that were nulled out in ascending order
     */
    public int[] getInvalidPositions() {
        return invalidPositions.clone();
    }
}
