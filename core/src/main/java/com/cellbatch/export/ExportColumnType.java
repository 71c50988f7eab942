package com.cellbatch.export;

import com.cellbatch.batch.CellType;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

import java.util.Set;

/**
 * Arrow column type chosen for an exported column.
 *
 * <p>Cells of one column may carry different types, so the column type is derived
 * from the set of non-null cell types observed in it.
 */
enum ExportColumnType {

    NULL(ArrowType.Null.INSTANCE),
    INT64(new ArrowType.Int(64, true)),
    FLOAT64(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)),
    BINARY(ArrowType.Binary.INSTANCE),
    UTF8(ArrowType.Utf8.INSTANCE);

    private final ArrowType arrowType;

    ExportColumnType(ArrowType arrowType) {
        this.arrowType = arrowType;
    }

    ArrowType arrowType() {
        return arrowType;
    }

    /**
     * Picks the column type for the observed cell types.
     *
     * <ul>
     *   <li>nothing but nulls: NULL</li>
     *   <li>only VARINT: INT64</li>
     *   <li>FLOAT64, optionally mixed with VARINT: FLOAT64</li>
     *   <li>only BLOB: BINARY</li>
     *   <li>anything else: UTF8</li>
     * </ul>
     *
     * @param observed the non-null cell types seen in the column
     * @return the column type
     */
    static ExportColumnType resolve(Set<CellType> observed) {
        if (observed.isEmpty()) {
            return NULL;
        }
        if (observed.size() == 1) {
            CellType only = observed.iterator().next();
            switch (only) {
                case VARINT: return INT64;
                case FLOAT64: return FLOAT64;
                case BLOB: return BINARY;
                default: return UTF8;
            }
        }
        if (observed.size() == 2 && observed.contains(CellType.VARINT) && observed.contains(CellType.FLOAT64)) {
            return FLOAT64;
        }
        return UTF8;
    }
}
