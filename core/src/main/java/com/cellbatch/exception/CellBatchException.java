package com.cellbatch.exception;

/**
 * Base class for failures while turning engine results into rows.
 *
 * <p>Decode failures carry the position at which they were detected: the index of
 * the batch within the result, the index of the cell within that batch, and the
 * name of the column the cell belongs to. Positions that do not apply are reported
 * as {@code -1} and the column as {@code null}.
 *
 * <p>All subclasses are fatal to the decode pass that raised them. None is retryable
 * at this layer; re-requesting the batches is up to the transport.
 *
 * @see MalformedBatchException
 * @see UnrecognizedCellTypeException
 * @see QueryFailedException
 */
public abstract class CellBatchException extends RuntimeException {

    private final int batchIndex;
    private final int cellIndex;
    private final String columnName;

    /**
     * Creates an exception without position context.
     *
     * @param message the error message
     */
    protected CellBatchException(String message) {
        this(message, -1, -1, null);
    }

    /**
     * Creates an exception with a cause and without position context.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    protected CellBatchException(String message, Throwable cause) {
        super(message, cause);
        this.batchIndex = -1;
        this.cellIndex = -1;
        this.columnName = null;
    }

    /**
     * Creates an exception for a specific cell.
     *
     * @param message the error message
     * @param batchIndex index of the batch within the result, or -1
     * @param cellIndex index of the cell within the batch, or -1
     * @param columnName column the cell belongs to, or null
     */
    protected CellBatchException(String message, int batchIndex, int cellIndex, String columnName) {
        super(message);
        this.batchIndex = batchIndex;
        this.cellIndex = cellIndex;
        this.columnName = columnName;
    }

    /**
     * Returns the index of the batch in which the failure was detected.
     *
     * @return the batch index, or -1 if not applicable
     */
    public int getBatchIndex() {
        return batchIndex;
    }

    /**
     * Returns the index of the offending cell within its batch.
     *
     * @return the cell index, or -1 if not applicable
     */
    public int getCellIndex() {
        return cellIndex;
    }

    /**
     * Returns the column the offending cell belongs to.
     *
     * @return the column name, or null if not applicable
     */
    public String getColumnName() {
        return columnName;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (batchIndex >= 0) {
            sb.append("Batch: ").append(batchIndex).append("\n");
        }
        if (cellIndex >= 0) {
            sb.append("Cell: ").append(cellIndex).append("\n");
        }
        if (columnName != null) {
            sb.append("Column: ").append(columnName).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
