package com.cellbatch.decode;

import com.cellbatch.batch.CellType;
import com.cellbatch.batch.CellsBatch;
import com.cellbatch.exception.OutOfBoundsReadException;
import com.cellbatch.exception.TruncatedSequenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Read position within a sequence of {@link CellsBatch batches}.
 *
 * <p>The cursor tracks the current batch, the next cell tag of that batch and one
 * read index per value array. It moves to the next batch only when asked to, and
 * resets all per-batch indexes when it does. Every value read checks the remaining
 * length of its array first.
 *
 * <p>A cursor serves a single decode pass and is not thread-safe.
 */
public final class BatchCursor {

    private static final Logger logger = LoggerFactory.getLogger(BatchCursor.class);

    private final List<CellsBatch> batches;

    private int batchIndex = -1;
    private CellsBatch current;
    private int cellIndex;
    private int lastCellIndex = -1;
    private int varintIndex;
    private int float64Index;
    private int blobIndex;
    private StringCellSplitter strings;

    /**
     * Creates a cursor positioned at the first batch.
     *
     * @param batches the batches of one query result, in order
     */
    public BatchCursor(List<CellsBatch> batches) {
        this.batches = Objects.requireNonNull(batches, "batches must not be null");
        if (!batches.isEmpty()) {
            load(0);
        }
    }

    /**
     * Returns the batch currently being consumed.
     *
     * @return the current batch
     * @throws TruncatedSequenceException if the sequence holds no batches
     */
    public CellsBatch currentBatch() {
        if (current == null) {
            throw new TruncatedSequenceException("No batches available: the result ended before its last batch", -1);
        }
        return current;
    }

    /**
     * Moves to the next batch and resets the cell index and all value cursors.
     *
     * @throws TruncatedSequenceException if there is no next batch
     */
    public void advanceBatch() {
        currentBatch();
        int next = batchIndex + 1;
        if (next >= batches.size()) {
            throw new TruncatedSequenceException("Batch " + batchIndex + " is not flagged as the last batch"
                + " but no further batch was supplied (" + batches.size() + " batches)", batchIndex);
        }
        load(next);
    }

    private void load(int index) {
        batchIndex = index;
        current = Objects.requireNonNull(batches.get(index), "batch " + index + " must not be null");
        cellIndex = 0;
        lastCellIndex = -1;
        varintIndex = 0;
        float64Index = 0;
        blobIndex = 0;
        strings = new StringCellSplitter(current.stringCells());
        logger.debug("Batch {}: {}", index, current);
    }

    public boolean hasRemainingCells() {
        return cellIndex < currentBatch().cellCount();
    }

    public boolean isLastBatch() {
        return currentBatch().isLastBatch();
    }

    /**
     * Returns the raw tag of the next cell and moves past it.
     *
     * @return the wire value of the tag
     * @throws IllegalStateException if the current batch has no cells left
     */
    public int nextCellTag() {
        CellsBatch batch = currentBatch();
        if (cellIndex >= batch.cellCount()) {
            throw new IllegalStateException("Batch " + batchIndex + " has no cells left");
        }
        lastCellIndex = cellIndex;
        return batch.cellAt(cellIndex++);
    }

    public long nextVarint() {
        CellsBatch batch = currentBatch();
        if (varintIndex >= batch.varintCount()) {
            throw outOfBounds(CellType.VARINT, batch.varintCount());
        }
        return batch.varintAt(varintIndex++);
    }

    public double nextFloat64() {
        CellsBatch batch = currentBatch();
        if (float64Index >= batch.float64Count()) {
            throw outOfBounds(CellType.FLOAT64, batch.float64Count());
        }
        return batch.float64At(float64Index++);
    }

    public String nextString() {
        currentBatch();
        if (!strings.hasNext()) {
            throw outOfBounds(CellType.STRING, strings.consumed());
        }
        return strings.next();
    }

    public byte[] nextBlob() {
        CellsBatch batch = currentBatch();
        if (blobIndex >= batch.blobCount()) {
            throw outOfBounds(CellType.BLOB, batch.blobCount());
        }
        return batch.blobAt(blobIndex++);
    }

    private OutOfBoundsReadException outOfBounds(CellType type, int available) {
        return new OutOfBoundsReadException("Batch " + batchIndex + " holds " + available + " " + type
            + " values but cell " + lastCellIndex + " requires another one", type, available, batchIndex, lastCellIndex);
    }

    /**
     * Returns the index of the current batch within the sequence.
     *
     * @return the batch index, or -1 if the sequence is empty
     */
    public int batchIndex() {
        return batchIndex;
    }

    /**
     * Returns the index of the next cell to be read from the current batch.
     *
     * @return the cell index
     */
    public int cellIndex() {
        return cellIndex;
    }

    /**
     * Returns how many batches have been entered so far.
     *
     * @return the number of batches consumed
     */
    public int batchesConsumed() {
        return batchIndex + 1;
    }
}
