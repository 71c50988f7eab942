package com.cellbatch.exception;

/**
 * The batch sequence ended without a batch flagged as the last one.
 *
 * <p>Raised when the decoder needs to move past a non-terminal batch that has no
 * successor, including the case of a sequence with no batches at all.
 */
public class TruncatedSequenceException extends MalformedBatchException {

    /**
     * Creates the exception.
     *
     * @param message the error message
     * @param batchIndex index of the last batch that was supplied, or -1 if none was
     */
    public TruncatedSequenceException(String message, int batchIndex) {
        super(message, batchIndex, -1, null);
    }
}
