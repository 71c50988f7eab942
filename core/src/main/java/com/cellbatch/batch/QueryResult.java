package com.cellbatch.batch;

import com.cellbatch.schema.ColumnSchema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the engine returned for one query: the column names, the batches
 * and, when execution failed, the engine's error message.
 */
public record QueryResult(List<String> columnNames, String error, List<CellsBatch> batches) {

    /**
     * Creates a query result.
     *
     * @param columnNames the result's column names, in order
     * @param error the engine error message, or null if the query succeeded
     * @param batches the result batches, in order
     */
    public QueryResult {
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        Objects.requireNonNull(batches, "batches must not be null");
        columnNames = List.copyOf(columnNames);
        batches = List.copyOf(batches);
    }

    /**
     * Creates a successful query result.
     *
     * @param columnNames the result's column names, in order
     * @param batches the result batches, in order
     * @return the query result
     */
    public static QueryResult of(List<String> columnNames, List<CellsBatch> batches) {
        return new QueryResult(columnNames, null, batches);
    }

    /**
     * Creates a result for a query the engine failed to execute.
     *
     * @param error the engine error message
     * @return the query result
     */
    public static QueryResult failed(String error) {
        return new QueryResult(List.of(), Objects.requireNonNull(error, "error must not be null"), List.of());
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public Optional<String> errorMessage() {
        return hasError() ? Optional.of(error) : Optional.empty();
    }

    public ColumnSchema schema() {
        return new ColumnSchema(columnNames);
    }
}
