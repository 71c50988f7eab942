package com.cellbatch.batch;

import com.cellbatch.config.DecoderConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One transfer unit of a query result.
 *
 * <p>A batch holds a flat, row-major sequence of cell type tags and four value
 * arrays, one per value-carrying cell type. The n-th {@code VARINT} cell of the
 * batch takes the n-th element of {@link #varintAt(int) varintCells}, and likewise
 * for the other types. {@code STRING} values are carried as one blob in which the
 * segments are separated by {@link DecoderConfig#STRING_CELL_DELIMITER}.
 *
 * <p>Tags are kept as raw wire values so that numbers outside {@link CellType}
 * survive until decode time.
 *
 * <p>A batch with {@link #isLastBatch()} {@code false} obligates a successor batch.
 *
 * <p>Instances are immutable; create them with {@link #builder()}.
 */
public final class CellsBatch {

    private static final int[] NO_CELLS = new int[0];
    private static final long[] NO_VARINTS = new long[0];
    private static final double[] NO_FLOATS = new double[0];

    private final int[] cells;
    private final long[] varintCells;
    private final double[] float64Cells;
    private final byte[][] blobCells;
    private final String stringCells;
    private final boolean lastBatch;

    private CellsBatch(Builder builder) {
        this.cells = builder.cells.length == 0 ? NO_CELLS : Arrays.copyOf(builder.cells, builder.cellCount);
        this.varintCells = builder.varintCount == 0 ? NO_VARINTS : Arrays.copyOf(builder.varintCells, builder.varintCount);
        this.float64Cells = builder.floatCount == 0 ? NO_FLOATS : Arrays.copyOf(builder.float64Cells, builder.floatCount);
        this.blobCells = new byte[builder.blobCells.size()][];
        for (int i = 0; i < blobCells.length; i++) {
            blobCells[i] = builder.blobCells.get(i).clone();
        }
        this.stringCells = builder.stringCells;
        this.lastBatch = builder.lastBatch;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an empty batch that terminates the result.
     *
     * @return a terminal batch without cells
     */
    public static CellsBatch emptyLast() {
        return builder().lastBatch(true).build();
    }

    // ==================== Cells ====================

    public int cellCount() {
        return cells.length;
    }

    /**
     * Returns the raw wire value of the tag at the given cell position.
     *
     * @param index the cell index
     * @return the tag's wire value
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public int cellAt(int index) {
        return cells[index];
    }

    // ==================== Value arrays ====================

    public int varintCount() {
        return varintCells.length;
    }

    public long varintAt(int index) {
        return varintCells[index];
    }

    public int float64Count() {
        return float64Cells.length;
    }

    public double float64At(int index) {
        return float64Cells[index];
    }

    public int blobCount() {
        return blobCells.length;
    }

    /**
     * Returns a copy of the blob at the given position.
     *
     * @param index the blob index
     * @return the blob bytes
     */
    public byte[] blobAt(int index) {
        return blobCells[index].clone();
    }

    /**
     * Returns whether the batch carries a string blob at all.
     *
     * <p>An absent blob holds no string segments, while an empty one holds a single
     * empty segment.
     *
     * @return true if string cells are present
     */
    public boolean hasStringCells() {
        return stringCells != null;
    }

    /**
     * Returns the joined string cells.
     *
     * @return the delimiter-joined strings, or null if absent
     */
    public String stringCells() {
        return stringCells;
    }

    public boolean isLastBatch() {
        return lastBatch;
    }

    @Override
    public String toString() {
        return "CellsBatch(cells=" + cells.length
            + ", varints=" + varintCells.length
            + ", float64s=" + float64Cells.length
            + ", blobs=" + blobCells.length
            + ", strings=" + (stringCells == null ? "absent" : stringCells.length() + " chars")
            + ", last=" + lastBatch + ")";
    }

    /**
     * Builder for {@link CellsBatch}.
     */
    public static final class Builder {

        private int[] cells = NO_CELLS;
        private int cellCount;
        private long[] varintCells = NO_VARINTS;
        private int varintCount;
        private double[] float64Cells = NO_FLOATS;
        private int floatCount;
        private final List<byte[]> blobCells = new ArrayList<>();
        private String stringCells;
        private boolean lastBatch;

        private Builder() {}

        public Builder addCells(CellType... types) {
            for (CellType type : types) {
                addRawCell(Objects.requireNonNull(type, "type must not be null").wireValue());
            }
            return this;
        }

        /**
         * Appends a tag by its wire value, including values no {@link CellType} maps to.
         *
         * @param wireValue the encoded tag
         * @return this builder
         */
        public Builder addRawCell(int wireValue) {
            if (cellCount == cells.length) {
                cells = Arrays.copyOf(cells, Math.max(8, cellCount * 2));
            }
            cells[cellCount++] = wireValue;
            return this;
        }

        public Builder addVarints(long... values) {
            for (long value : values) {
                if (varintCount == varintCells.length) {
                    varintCells = Arrays.copyOf(varintCells, Math.max(8, varintCount * 2));
                }
                varintCells[varintCount++] = value;
            }
            return this;
        }

        public Builder addFloat64s(double... values) {
            for (double value : values) {
                if (floatCount == float64Cells.length) {
                    float64Cells = Arrays.copyOf(float64Cells, Math.max(8, floatCount * 2));
                }
                float64Cells[floatCount++] = value;
            }
            return this;
        }

        public Builder addBlob(byte[] value) {
            blobCells.add(Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        /**
         * Sets the joined string blob as received from the engine.
         *
         * @param joined the delimiter-joined strings, or null for none
         * @return this builder
         */
        public Builder stringCells(String joined) {
            this.stringCells = joined;
            return this;
        }

        /**
         * Sets the string blob by joining the given values with the cell delimiter.
         * Passing no values leaves the blob absent.
         *
         * @param values the string cell values, in cell order
         * @return this builder
         */
        public Builder strings(String... values) {
            if (values.length == 0) {
                this.stringCells = null;
                return this;
            }
            this.stringCells = String.join(String.valueOf(DecoderConfig.STRING_CELL_DELIMITER), values);
            return this;
        }

        public Builder lastBatch(boolean lastBatch) {
            this.lastBatch = lastBatch;
            return this;
        }

        public CellsBatch build() {
            return new CellsBatch(this);
        }
    }
}
