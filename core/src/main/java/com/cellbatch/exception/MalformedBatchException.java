package com.cellbatch.exception;

/**
 * Raised when batches are structurally inconsistent: the cell tags, the value
 * arrays and the terminal-batch flag do not describe a complete result.
 *
 * <p>Distinct from {@link UnrecognizedCellTypeException}, which reports data in an
 * encoding this decoder does not support rather than broken data.
 */
public abstract class MalformedBatchException extends CellBatchException {

    protected MalformedBatchException(String message, int batchIndex, int cellIndex, String columnName) {
        super(message, batchIndex, cellIndex, columnName);
    }
}
