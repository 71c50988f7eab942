package com.cellbatch.export;

import com.cellbatch.batch.CellType;
import com.cellbatch.config.DecoderConfig;
import com.cellbatch.config.ExportConfig;
import com.cellbatch.decode.QueryResultRows;
import com.cellbatch.row.Row;
import com.cellbatch.schema.ColumnSchema;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Materializes decoded rows into an Arrow {@link VectorSchemaRoot}.
 *
 * <p>Export is all-or-nothing. Every row is decoded before any Arrow memory is
 * allocated, so a decode error propagates unchanged and no partial table is
 * produced. The table has one nullable vector per schema column, in schema order,
 * with rows in decode order. Column types are derived from the cell types seen in
 * each column (see {@link ExportColumnType#resolve(Set)}).
 *
 * <p>The returned root is owned by the caller and must be closed.
 *
 * <p>Example:
 * <pre>{@code
 * try (ArrowTableExporter exporter = new ArrowTableExporter();
 *      VectorSchemaRoot table = exporter.export(rows)) {
 *     // read table
 * }
 * }</pre>
 */
public class ArrowTableExporter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArrowTableExporter.class);

    private static final HexFormat HEX = HexFormat.of();

    private final BufferAllocator allocator;
    private final boolean ownsAllocator;
    private boolean closed = false;

    /**
     * Creates an exporter with its own root allocator, limited by
     * {@link ExportConfig#resolveAllocatorLimit()}.
     */
    public ArrowTableExporter() {
        this(new RootAllocator(ExportConfig.resolveAllocatorLimit()), true);
    }

    /**
     * Creates an exporter that allocates from the given allocator. The allocator is
     * not closed by this exporter.
     *
     * @param allocator the Arrow allocator for exported tables
     */
    public ArrowTableExporter(BufferAllocator allocator) {
        this(Objects.requireNonNull(allocator, "allocator must not be null"), false);
    }

    private ArrowTableExporter(BufferAllocator allocator, boolean ownsAllocator) {
        this.allocator = allocator;
        this.ownsAllocator = ownsAllocator;
    }

    /**
     * Exports a query result.
     *
     * @param rows the rows to export
     * @return a new table owned by the caller
     * @throws com.cellbatch.exception.CellBatchException if decoding fails
     */
    public VectorSchemaRoot export(QueryResultRows rows) {
        return export(rows, rows.schema());
    }

    /**
     * Exports rows that follow the given schema.
     *
     * @param rows the rows to export, in order
     * @param schema the columns of the rows
     * @return a new table owned by the caller
     * @throws com.cellbatch.exception.CellBatchException if decoding fails
     */
    public VectorSchemaRoot export(Iterable<Row> rows, ColumnSchema schema) {
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (closed) {
            throw new IllegalStateException("Exporter is closed");
        }

        List<Row> buffered = new ArrayList<>(DecoderConfig.DEFAULT_ROW_BUFFER_CAPACITY);
        for (Row row : rows) {
            buffered.add(row);
        }

        ExportColumnType[] columnTypes = resolveColumnTypes(buffered, schema);
        List<Field> fields = new ArrayList<>(schema.size());
        for (int col = 0; col < schema.size(); col++) {
            fields.add(Field.nullable(schema.nameAt(col), columnTypes[col].arrowType()));
        }

        VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
        try {
            root.allocateNew();
            for (int col = 0; col < schema.size(); col++) {
                fillVector(root.getVector(col), columnTypes[col], buffered, col);
            }
            root.setRowCount(buffered.size());
        } catch (RuntimeException e) {
            root.close();
            throw e;
        }

        logger.debug("Exported {} rows x {} columns", buffered.size(), schema.size());
        return root;
    }

    private static ExportColumnType[] resolveColumnTypes(List<Row> rows, ColumnSchema schema) {
        ExportColumnType[] types = new ExportColumnType[schema.size()];
        for (int col = 0; col < schema.size(); col++) {
            Set<CellType> observed = EnumSet.noneOf(CellType.class);
            for (Row row : rows) {
                CellType type = row.cellType(col);
                if (type != CellType.NULL) {
                    observed.add(type);
                }
            }
            types[col] = ExportColumnType.resolve(observed);
        }
        return types;
    }

    private static void fillVector(FieldVector vector, ExportColumnType type, List<Row> rows, int col) {
        // NullVector carries no buffers; its length comes from setRowCount
        if (type == ExportColumnType.NULL) {
            return;
        }
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            if (row.isNull(col)) {
                setNull(vector, i);
                continue;
            }
            Object value = row.get(col);
            switch (type) {
                case INT64 -> ((BigIntVector) vector).setSafe(i, (Long) value);
                case FLOAT64 -> ((Float8Vector) vector).setSafe(i, ((Number) value).doubleValue());
                case BINARY -> ((VarBinaryVector) vector).setSafe(i, (byte[]) value);
                case UTF8 -> ((VarCharVector) vector).setSafe(i, render(value).getBytes(StandardCharsets.UTF_8));
                default -> throw new IllegalStateException("Unexpected column type " + type);
            }
        }
    }

    private static void setNull(FieldVector vector, int index) {
        if (vector instanceof BigIntVector v) {
            v.setNull(index);
        } else if (vector instanceof Float8Vector v) {
            v.setNull(index);
        } else if (vector instanceof VarBinaryVector v) {
            v.setNull(index);
        } else if (vector instanceof VarCharVector v) {
            v.setNull(index);
        }
    }

    /**
     * Text form of a value in a column of mixed cell types.
     */
    static String render(Object value) {
        if (value instanceof byte[] bytes) {
            return HEX.formatHex(bytes);
        }
        return String.valueOf(value);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownsAllocator) {
            try {
                allocator.close();
            } catch (Exception e) {
                logger.warn("Error closing export allocator: {}", e.getMessage());
            }
        }
    }
}
