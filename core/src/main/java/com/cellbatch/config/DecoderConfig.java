package com.cellbatch.config;

/**
 * Configuration constants for row decoding.
 */
public final class DecoderConfig {

    private DecoderConfig() {} // Utility class

    /** Separator between the segments of a batch's joined string cells */
    public static final char STRING_CELL_DELIMITER = '\0';

    /** Default capacity of the row buffer used when a result is fully materialized */
    public static final int DEFAULT_ROW_BUFFER_CAPACITY = 1024;

    /** Upper bound for the initial row buffer, larger results grow past it */
    public static final int MAX_ROW_BUFFER_CAPACITY = 1 << 20;

    /**
     * Validate and normalize an initial row buffer capacity.
     *
     * @param requested the requested capacity
     * @return normalized capacity within [1, MAX_ROW_BUFFER_CAPACITY]
     */
    public static int normalizeRowBufferCapacity(int requested) {
        if (requested <= 0) return DEFAULT_ROW_BUFFER_CAPACITY;
        if (requested > MAX_ROW_BUFFER_CAPACITY) return MAX_ROW_BUFFER_CAPACITY;
        return requested;
    }
}
