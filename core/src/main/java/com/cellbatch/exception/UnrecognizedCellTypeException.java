package com.cellbatch.exception;

/**
 * A cell carries a type tag this decoder cannot read.
 *
 * <p>Covers the explicit {@code INVALID} tag as well as wire values that are not
 * part of the known cell types.
 */
public class UnrecognizedCellTypeException extends CellBatchException {

    private final int tag;

    /**
     * Creates the exception.
     *
     * @param tag the raw wire value of the tag
     * @param batchIndex index of the batch being read
     * @param cellIndex index of the cell within the batch
     * @param columnName the column the cell belongs to
     */
    public UnrecognizedCellTypeException(int tag, int batchIndex, int cellIndex, String columnName) {
        super("Unrecognized cell type " + tag + " for column '" + columnName
                + "' (batch " + batchIndex + ", cell " + cellIndex + ")",
            batchIndex, cellIndex, columnName);
        this.tag = tag;
    }

    /**
     * Returns the raw tag value.
     *
     * @return the wire value of the tag
     */
    public int getTag() {
        return tag;
    }
}
