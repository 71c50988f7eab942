package com.cellbatch.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of the column names of a query result.
 *
 * <p>The schema defines both the field identity of decoded rows and the modulus
 * used to map the flat, row-major cell stream of a batch onto columns: cell
 * {@code i} of the stream belongs to column {@code i % size()}.
 *
 * <p>Column names must be unique and non-null. Instances are immutable.
 */
public final class ColumnSchema {

    /** Schema with no columns. */
    public static final ColumnSchema EMPTY = new ColumnSchema(Collections.emptyList());

    private final List<String> names;
    private final Map<String, Integer> indexByName;

    /**
     * Creates a schema from the given column names.
     *
     * @param names the column names, in result order
     * @throws IllegalArgumentException if a name appears more than once
     */
    public ColumnSchema(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.indexByName = new HashMap<>(names.size() * 2);
        for (int i = 0; i < this.names.size(); i++) {
            String name = Objects.requireNonNull(this.names.get(i), "column name at index " + i + " must not be null");
            Integer previous = indexByName.putIfAbsent(name, i);
            if (previous != null) {
                throw new IllegalArgumentException(
                    "Duplicate column name '" + name + "' at indexes " + previous + " and " + i);
            }
        }
    }

    /**
     * Creates a schema from the given column names.
     *
     * @param names the column names, in result order
     * @return the schema
     */
    public static ColumnSchema of(String... names) {
        return new ColumnSchema(Arrays.asList(names));
    }

    /**
     * Returns the number of columns.
     *
     * @return the column count
     */
    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * Returns the column name at the given position.
     *
     * @param index the column index
     * @return the column name
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public String nameAt(int index) {
        return names.get(index);
    }

    /**
     * Returns the position of the named column, or -1 if the schema has no such column.
     *
     * @param name the column name
     * @return the column index, or -1 if not found
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        return index != null ? index : -1;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Returns the column names.
     *
     * @return an unmodifiable list of names
     */
    public List<String> names() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnSchema that = (ColumnSchema) o;
        return names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "ColumnSchema" + names;
    }
}
