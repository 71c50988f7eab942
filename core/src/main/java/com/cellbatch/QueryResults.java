package com.cellbatch;

import com.cellbatch.batch.QueryResult;
import com.cellbatch.decode.QueryResultRows;
import com.cellbatch.exception.QueryFailedException;
import com.cellbatch.export.ArrowTableExporter;
import com.cellbatch.wire.QueryResultParser;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.Objects;

/**
 * Entry points for turning engine responses into rows or Arrow tables.
 *
 * <p>Example usage:
 * <pre>
 *   QueryResult result = QueryResultParser.parse(responseBytes);
 *   for (Row row : QueryResults.rows(result)) {
 *       String name = row.getString("name");
 *   }
 * </pre>
 *
 * @see QueryResultRows
 * @see ArrowTableExporter
 */
public final class QueryResults {

    private QueryResults() {} // Utility class

    /**
     * Returns the rows of a query result.
     *
     * @param result the query result
     * @return the re-iterable rows
     * @throws QueryFailedException if the engine reported an error for the query
     */
    public static QueryResultRows rows(QueryResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.hasError()) {
            throw new QueryFailedException(result.error());
        }
        return new QueryResultRows(result.schema(), result.batches());
    }

    /**
     * Parses a serialized response and returns its rows.
     *
     * @param responseBytes one serialized query result message
     * @return the re-iterable rows
     * @throws com.cellbatch.exception.WireFormatException if the bytes cannot be parsed
     * @throws QueryFailedException if the engine reported an error for the query
     */
    public static QueryResultRows rows(byte[] responseBytes) {
        return rows(QueryResultParser.parse(responseBytes));
    }

    /**
     * Decodes a query result into an Arrow table.
     *
     * @param result the query result
     * @param allocator allocator for the table; not closed by this method
     * @return a new table owned by the caller
     * @throws QueryFailedException if the engine reported an error for the query
     * @throws com.cellbatch.exception.CellBatchException if decoding fails
     */
    public static VectorSchemaRoot toArrow(QueryResult result, BufferAllocator allocator) {
        QueryResultRows rows = rows(result);
        try (ArrowTableExporter exporter = new ArrowTableExporter(allocator)) {
            return exporter.export(rows);
        }
    }
}
