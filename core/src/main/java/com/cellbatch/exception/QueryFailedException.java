package com.cellbatch.exception;

/**
 * The engine reported that it could not execute the query.
 *
 * <p>The engine's message is available from {@link #getEngineError()}.
 */
public class QueryFailedException extends CellBatchException {

    private final String engineError;

    public QueryFailedException(String engineError) {
        super("Query failed: " + engineError);
        this.engineError = engineError;
    }

    /**
     * Returns the error message produced by the engine.
     *
     * @return the engine error
     */
    public String getEngineError() {
        return engineError;
    }
}
