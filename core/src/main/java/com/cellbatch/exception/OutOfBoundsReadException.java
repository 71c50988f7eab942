package com.cellbatch.exception;

import com.cellbatch.batch.CellType;

/**
 * A cell referenced a value array that has no elements left.
 *
 * <p>The batch declares more cells of a type than it carries values for.
 */
public class OutOfBoundsReadException extends MalformedBatchException {

    private final CellType cellType;
    private final int available;

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param cellType the type whose value array was exhausted
     * @param available the number of elements the array holds
     * @param batchIndex index of the batch being read
     * @param cellIndex index of the cell that requested the value
     */
    public OutOfBoundsReadException(String message, CellType cellType, int available,
                                    int batchIndex, int cellIndex) {
        this(message, cellType, available, batchIndex, cellIndex, null);
    }

    private OutOfBoundsReadException(String message, CellType cellType, int available,
                                     int batchIndex, int cellIndex, String columnName) {
        super(message, batchIndex, cellIndex, columnName);
        this.cellType = cellType;
        this.available = available;
    }

    /**
     * Returns a copy of this exception attributed to the given column.
     *
     * <p>The batch cursor does not know the schema; the row decoder attaches the
     * column before propagating.
     *
     * @param columnName the column the cell belongs to
     * @return the attributed exception
     */
    public OutOfBoundsReadException forColumn(String columnName) {
        OutOfBoundsReadException attributed = new OutOfBoundsReadException(
            getMessage() + " (column '" + columnName + "')",
            cellType, available, getBatchIndex(), getCellIndex(), columnName);
        attributed.setStackTrace(getStackTrace());
        return attributed;
    }

    /**
     * Returns the cell type whose value array ran out.
     *
     * @return the cell type
     */
    public CellType getCellType() {
        return cellType;
    }

    /**
     * Returns how many values the exhausted array held.
     *
     * @return the array length
     */
    public int getAvailable() {
        return available;
    }
}
