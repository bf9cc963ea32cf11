package cn.edu.pku.asic.h3columnar.dggs.core;

/**
 * Thrown when an index is queried against an array other than the snapshot it was built from.
 */
public class StaleIndexException extends DggsException {

    public StaleIndexException(long indexGeneration, long arrayGeneration) {
        super("Index was built for array generation " + indexGeneration
            + " but was queried with generation " + arrayGeneration + ". Rebuild the index.");
    }
}
