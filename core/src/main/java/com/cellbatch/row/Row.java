package com.cellbatch.row;

import com.cellbatch.batch.CellType;
import com.cellbatch.schema.ColumnSchema;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded record of a query result.
 *
 * <p>Values are accessible by column name or position, in schema order. Each value is
 * one of {@link Long} ({@code VARINT}), {@link Double} ({@code FLOAT64}),
 * {@link String} ({@code STRING}), {@code byte[]} ({@code BLOB}) or {@code null}
 * ({@code NULL}); {@link #cellType(String)} reports which tag produced it.
 *
 * <p>Rows are immutable and independent of the decoder that produced them.
 */
public final class Row {

    private final ColumnSchema schema;
    private final CellType[] types;
    private final Object[] values;

    private Row(ColumnSchema schema, CellType[] types, Object[] values) {
        this.schema = schema;
        this.types = types;
        this.values = values;
    }

    /**
     * Creates a row. The arrays are taken over, not copied.
     *
     * @param schema the columns of the row
     * @param types the cell type of each value, in schema order
     * @param values the decoded values, in schema order
     * @return the row
     * @throws IllegalArgumentException if the array lengths do not match the schema
     */
    public static Row of(ColumnSchema schema, CellType[] types, Object[] values) {
        Objects.requireNonNull(schema, "schema must not be null");
        if (types.length != schema.size() || values.length != schema.size()) {
            throw new IllegalArgumentException("Expected " + schema.size() + " values, got "
                + values.length + " values and " + types.length + " types");
        }
        return new Row(schema, types, values);
    }

    public ColumnSchema schema() {
        return schema;
    }

    public int size() {
        return values.length;
    }

    // ==================== Generic access ====================

    public Object get(int columnIndex) {
        Object value = values[columnIndex];
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    public Object get(String name) {
        return get(resolve(name));
    }

    public CellType cellType(int columnIndex) {
        return types[columnIndex];
    }

    public CellType cellType(String name) {
        return types[resolve(name)];
    }

    public boolean isNull(int columnIndex) {
        return values[columnIndex] == null;
    }

    public boolean isNull(String name) {
        return isNull(resolve(name));
    }

    // ==================== Typed access ====================

    /**
     * Returns an integer value.
     *
     * @param name the column name
     * @return the value, or null for a NULL cell
     * @throws IllegalArgumentException if the column does not exist or holds another type
     */
    public Long getLong(String name) {
        return (Long) typed(resolve(name), CellType.VARINT);
    }

    public Long getLong(int columnIndex) {
        return (Long) typed(columnIndex, CellType.VARINT);
    }

    /**
     * Returns a floating point value.
     *
     * @param name the column name
     * @return the value, or null for a NULL cell
     * @throws IllegalArgumentException if the column does not exist or holds another type
     */
    public Double getDouble(String name) {
        return (Double) typed(resolve(name), CellType.FLOAT64);
    }

    public Double getDouble(int columnIndex) {
        return (Double) typed(columnIndex, CellType.FLOAT64);
    }

    public String getString(String name) {
        return (String) typed(resolve(name), CellType.STRING);
    }

    public String getString(int columnIndex) {
        return (String) typed(columnIndex, CellType.STRING);
    }

    /**
     * Returns a copy of a blob value.
     *
     * @param name the column name
     * @return the bytes, or null for a NULL cell
     * @throws IllegalArgumentException if the column does not exist or holds another type
     */
    public byte[] getBytes(String name) {
        byte[] value = (byte[]) typed(resolve(name), CellType.BLOB);
        return value != null ? value.clone() : null;
    }

    public byte[] getBytes(int columnIndex) {
        byte[] value = (byte[]) typed(columnIndex, CellType.BLOB);
        return value != null ? value.clone() : null;
    }

    /**
     * Returns the values keyed by column name, in schema order.
     *
     * @return an unmodifiable ordered map; NULL cells map to null
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(schema.nameAt(i), get(i));
        }
        return Collections.unmodifiableMap(map);
    }

    private int resolve(String name) {
        int index = schema.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column '" + name + "', available columns: " + schema.names());
        }
        return index;
    }

    private Object typed(int columnIndex, CellType expected) {
        CellType actual = types[columnIndex];
        if (actual == CellType.NULL) {
            return null;
        }
        if (actual != expected) {
            throw new IllegalArgumentException("Column '" + schema.nameAt(columnIndex) + "' holds a "
                + actual + " value, not " + expected);
        }
        return values[columnIndex];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row that = (Row) o;
        return schema.equals(that.schema)
            && Arrays.equals(types, that.types)
            && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, Arrays.hashCode(types), Arrays.deepHashCode(values));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Row{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(schema.nameAt(i)).append('=');
            Object value = values[i];
            sb.append(value instanceof byte[] ? "<" + ((byte[]) value).length + " bytes>" : value);
        }
        return sb.append('}').toString();
    }
}
