package com.cellbatch.decode;

import com.cellbatch.batch.CellsBatch;
import com.cellbatch.config.DecoderConfig;
import com.cellbatch.row.Row;
import com.cellbatch.schema.ColumnSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The rows of a query result as a re-iterable sequence.
 *
 * <p>Every {@link #iterator()} call starts an independent decode pass over the same
 * immutable batches. Decoded rows are not cached, so each pass decodes again and
 * raises the same errors at the same rows.
 */
public final class QueryResultRows implements Iterable<Row> {

    private final ColumnSchema schema;
    private final List<CellsBatch> batches;

    public QueryResultRows(ColumnSchema schema, List<CellsBatch> batches) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.batches = List.copyOf(Objects.requireNonNull(batches, "batches must not be null"));
    }

    public QueryResultRows(List<String> columnNames, List<CellsBatch> batches) {
        this(new ColumnSchema(columnNames), batches);
    }

    public ColumnSchema schema() {
        return schema;
    }

    public List<CellsBatch> batches() {
        return batches;
    }

    @Override
    public QueryResultIterator iterator() {
        return new QueryResultIterator(schema, batches);
    }

    /**
     * Returns a sequential stream over a fresh decode pass.
     *
     * @return the rows as a stream
     */
    public Stream<Row> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Decodes every row.
     *
     * @return all rows in decode order
     * @throws com.cellbatch.exception.CellBatchException if any row fails to decode
     */
    public List<Row> toList() {
        return toList(DecoderConfig.DEFAULT_ROW_BUFFER_CAPACITY);
    }

    /**
     * Decodes every row into a buffer sized for the expected row count.
     *
     * @param expectedRows capacity hint, normalized by {@link DecoderConfig#normalizeRowBufferCapacity(int)}
     * @return all rows in decode order
     * @throws com.cellbatch.exception.CellBatchException if any row fails to decode
     */
    public List<Row> toList(int expectedRows) {
        List<Row> rows = new ArrayList<>(DecoderConfig.normalizeRowBufferCapacity(expectedRows));
        for (Row row : this) {
            rows.add(row);
        }
        return Collections.unmodifiableList(rows);
    }
}
