package com.cellbatch.exception;

/**
 * Bytes received from the engine could not be parsed as a query result message.
 */
public class WireFormatException extends CellBatchException {

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
