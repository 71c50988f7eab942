package com.cellbatch.decode;

import com.cellbatch.batch.CellType;
import com.cellbatch.batch.CellsBatch;
import com.cellbatch.exception.CellBatchException;
import com.cellbatch.exception.OutOfBoundsReadException;
import com.cellbatch.exception.TruncatedRowException;
import com.cellbatch.exception.UnrecognizedCellTypeException;
import com.cellbatch.row.Row;
import com.cellbatch.schema.ColumnSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Decodes the rows of a query result, one row per {@link #next()} call.
 *
 * <p>The cells of all batches form one row-major stream: the first
 * {@code schema.size()} cells make up the first row, and so on. Rows may span batch
 * boundaries. The iterator moves to the next batch only when the current one has
 * no cells left and is not flagged as the last batch.
 *
 * <p>Structural problems are detected at the cell where they occur, never up front:
 * <ul>
 *   <li>{@link com.cellbatch.exception.TruncatedSequenceException} when a non-terminal
 *       batch has no successor (raised by {@link #hasNext()} when it crosses the boundary)</li>
 *   <li>{@link TruncatedRowException} when the last batch ends partway through a row</li>
 *   <li>{@link OutOfBoundsReadException} when a value array is shorter than its tags require</li>
 *   <li>{@link UnrecognizedCellTypeException} for {@code INVALID} or unknown tags</li>
 * </ul>
 * A failure ends the pass: afterwards {@link #hasError()} is true, {@link #getError()}
 * returns the exception and {@link #hasNext()} returns false. Rows returned before the
 * failure stay valid.
 *
 * <p>With an empty schema the iterator yields no rows. It still walks the batches up
 * to the last one, and rejects any cell it finds with {@link TruncatedRowException}.
 *
 * <p>Example:
 * <pre>{@code
 * QueryResultIterator rows = new QueryResultIterator(ColumnSchema.of("id", "name"), batches);
 * while (rows.hasNext()) {
 *     Row row = rows.next();
 *     long id = row.getLong("id");
 * }
 * }</pre>
 *
 * <p>Not thread-safe. Use {@link QueryResultRows} for repeated passes.
 */
public class QueryResultIterator implements Iterator<Row> {

    private static final Logger logger = LoggerFactory.getLogger(QueryResultIterator.class);

    private final ColumnSchema schema;
    private final BatchCursor cursor;

    private boolean finished = false;
    private CellBatchException error = null;
    private long rowCount = 0;

    /**
     * Creates an iterator over the given batches.
     *
     * @param schema the result columns
     * @param batches the result batches, in order
     */
    public QueryResultIterator(ColumnSchema schema, List<CellsBatch> batches) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.cursor = new BatchCursor(batches);
        logger.debug("Decode pass started: {} columns, {} batches", schema.size(), batches.size());
    }

    /**
     * Creates an iterator over the given batches.
     *
     * @param columnNames the result column names, in order
     * @param batches the result batches, in order
     */
    public QueryResultIterator(List<String> columnNames, List<CellsBatch> batches) {
        this(new ColumnSchema(columnNames), batches);
    }

    @Override
    public boolean hasNext() {
        if (finished || error != null) {
            return false;
        }
        try {
            if (positionAtRowStart()) {
                return true;
            }
        } catch (CellBatchException e) {
            throw fail(e);
        }
        finished = true;
        logger.debug("Decode pass complete: {} rows from {} batches", rowCount, cursor.batchesConsumed());
        return false;
    }

    @Override
    public Row next() {
        if (!hasNext()) {
            throw new NoSuchElementException(error != null ? "Decode pass failed: " + error.getMessage() : "No more rows");
        }
        try {
            Row row = decodeRow();
            rowCount++;
            return row;
        } catch (CellBatchException e) {
            throw fail(e);
        }
    }

    /**
     * Moves to the first cell of the next row, crossing batch boundaries as needed.
     *
     * @return false if the result has no more rows
     */
    private boolean positionAtRowStart() {
        if (schema.isEmpty()) {
            drainWithoutColumns();
            return false;
        }
        while (!cursor.hasRemainingCells()) {
            if (cursor.isLastBatch()) {
                return false;
            }
            cursor.advanceBatch();
        }
        return true;
    }

    private void drainWithoutColumns() {
        while (true) {
            if (cursor.hasRemainingCells()) {
                throw new TruncatedRowException("Batch " + cursor.batchIndex() + " carries "
                    + cursor.currentBatch().cellCount() + " cells but the result has no columns",
                    cursor.batchIndex(), cursor.cellIndex(), null, rowCount);
            }
            if (cursor.isLastBatch()) {
                return;
            }
            cursor.advanceBatch();
        }
    }

    private Row decodeRow() {
        int columnCount = schema.size();
        CellType[] types = new CellType[columnCount];
        Object[] values = new Object[columnCount];

        for (int column = 0; column < columnCount; column++) {
            if (column > 0) {
                ensureCellFor(column);
            }
            int cellIndex = cursor.cellIndex();
            int tag = cursor.nextCellTag();
            CellType type = CellType.forWireValue(tag).orElse(CellType.INVALID);
            values[column] = readValue(type, tag, column, cellIndex);
            types[column] = type;
        }
        return Row.of(schema, types, values);
    }

    private void ensureCellFor(int column) {
        while (!cursor.hasRemainingCells()) {
            if (cursor.isLastBatch()) {
                String name = schema.nameAt(column);
                throw new TruncatedRowException("Cells ended in row " + rowCount + " before column '" + name
                    + "' (" + column + " of " + schema.size() + " columns read)",
                    cursor.batchIndex(), cursor.cellIndex(), name, rowCount);
            }
            cursor.advanceBatch();
        }
    }

    private Object readValue(CellType type, int tag, int column, int cellIndex) {
        try {
            return switch (type) {
                case VARINT -> cursor.nextVarint();
                case FLOAT64 -> cursor.nextFloat64();
                case STRING -> cursor.nextString();
                case BLOB -> cursor.nextBlob();
                case NULL -> null;
                case INVALID -> throw new UnrecognizedCellTypeException(
                    tag, cursor.batchIndex(), cellIndex, schema.nameAt(column));
            };
        } catch (OutOfBoundsReadException e) {
            throw e.forColumn(schema.nameAt(column));
        }
    }

    private CellBatchException fail(CellBatchException e) {
        error = e;
        logger.debug("Decode pass failed after {} rows: {}", rowCount, e.getMessage());
        return e;
    }

    // ==================== Metadata ====================

    public ColumnSchema getSchema() {
        return schema;
    }

    /**
     * Rows returned so far.
     *
     * @return row count
     */
    public long getRowCount() {
        return rowCount;
    }

    /**
     * Number of batches entered so far.
     *
     * @return batch count
     */
    public int getBatchCount() {
        return cursor.batchesConsumed();
    }

    /**
     * Check if decoding failed.
     *
     * @return true if the pass ended with an error
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * Get the error that ended the pass.
     *
     * @return the exception, or null if hasError() returns false
     */
    public CellBatchException getError() {
        return error;
    }
}
