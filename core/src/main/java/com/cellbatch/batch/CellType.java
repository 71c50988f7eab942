package com.cellbatch.batch;

import java.util.Optional;

/**
 * Type tag of a single cell in a {@link CellsBatch}.
 *
 * <p>The tag selects the value array a cell is read from. Wire values match the
 * engine's {@code CellsBatch.CellType} enum.
 */
public enum CellType {

    INVALID(0),
    NULL(1),
    VARINT(2),
    FLOAT64(3),
    STRING(4),
    BLOB(5);

    private static final CellType[] BY_WIRE_VALUE = new CellType[6];

    static {
        for (CellType type : values()) {
            BY_WIRE_VALUE[type.wireValue] = type;
        }
    }

    private final int wireValue;

    CellType(int wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the number this tag is encoded as.
     *
     * @return the wire value
     */
    public int wireValue() {
        return wireValue;
    }

    /**
     * Looks up the tag for a wire value.
     *
     * @param wireValue the encoded tag
     * @return the tag, or empty if the value is not a known cell type
     */
    public static Optional<CellType> forWireValue(int wireValue) {
        if (wireValue < 0 || wireValue >= BY_WIRE_VALUE.length) {
            return Optional.empty();
        }
        return Optional.of(BY_WIRE_VALUE[wireValue]);
    }
}
