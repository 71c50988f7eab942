package com.cellbatch.exception;

/**
 * The cell stream ended partway through a row.
 *
 * <p>Raised when the terminal batch runs out of cells before every column of the
 * current row has a value, i.e. the total cell count is not a multiple of the
 * column count. Also raised for cells that arrive under a schema with no columns.
 */
public class TruncatedRowException extends MalformedBatchException {

    private final long rowIndex;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param batchIndex index of the batch whose cells ran out
     * @param cellIndex index of the first missing or unexpected cell
     * @param columnName the column left without a value, or null
     * @param rowIndex index of the incomplete row within the result
     */
    public TruncatedRowException(String message, int batchIndex, int cellIndex, String columnName, long rowIndex) {
        super(message, batchIndex, cellIndex, columnName);
        this.rowIndex = rowIndex;
    }

    /**
     * Returns the index of the row that could not be completed.
     *
     * @return the row index
     */
    public long getRowIndex() {
        return rowIndex;
    }
}
