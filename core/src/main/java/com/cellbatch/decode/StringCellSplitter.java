package com.cellbatch.decode;

import com.cellbatch.config.DecoderConfig;

/**
 * Reads the segments of a batch's joined string cells one at a time.
 *
 * <p>A present blob holds one segment per delimiter plus one, so {@code ""} yields a
 * single empty string and a trailing delimiter yields a final empty string. An
 * absent (null) blob holds no segments.
 */
final class StringCellSplitter {

    private final String joined;
    private int offset;
    private int consumed;

    StringCellSplitter(String joined) {
        this.joined = joined;
        this.offset = 0;
    }

    boolean hasNext() {
        return joined != null && offset <= joined.length();
    }

    /**
     * Returns the next segment. Callers must check {@link #hasNext()} first.
     */
    String next() {
        int end = joined.indexOf(DecoderConfig.STRING_CELL_DELIMITER, offset);
        if (end < 0) {
            end = joined.length();
        }
        String segment = joined.substring(offset, end);
        offset = end + 1;
        consumed++;
        return segment;
    }

    /**
     * Number of segments handed out so far.
     */
    int consumed() {
        return consumed;
    }
}
