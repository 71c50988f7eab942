package com.cellbatch.row;

import com.cellbatch.batch.CellType;
import com.cellbatch.schema.ColumnSchema;
import com.cellbatch.test.TestBase;
import com.cellbatch.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for Row.
 *
 * <p>Test ID prefix: TC-ROW-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Row Tests")
public class RowTest extends TestBase {

    private static final ColumnSchema SCHEMA = ColumnSchema.of("id", "score", "name", "payload", "missing");

    private static Row sampleRow() {
        return Row.of(SCHEMA,
            new CellType[]{CellType.VARINT, CellType.FLOAT64, CellType.STRING, CellType.BLOB, CellType.NULL},
            new Object[]{42L, 0.5, "alice", new byte[]{1, 2, 3}, null});
    }

    @Nested
    @DisplayName("Value access")
    class Access {

        @Test
        @DisplayName("TC-ROW-001: Typed getters by name and index agree")
        void testTypedGetters() {
            Row row = sampleRow();

            assertThat(row.size()).isEqualTo(5);
            assertThat(row.getLong("id")).isEqualTo(42L).isEqualTo(row.getLong(0));
            assertThat(row.getDouble("score")).isEqualTo(0.5).isEqualTo(row.getDouble(1));
            assertThat(row.getString("name")).isEqualTo("alice").isEqualTo(row.getString(2));
            assertThat(row.getBytes("payload")).containsExactly(1, 2, 3);
            assertThat(row.getBytes(3)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("TC-ROW-002: NULL cells read as null from every typed getter")
        void testNullCell() {
            Row row = sampleRow();

            assertThat(row.isNull("missing")).isTrue();
            assertThat(row.isNull("id")).isFalse();
            assertThat(row.cellType("missing")).isEqualTo(CellType.NULL);
            assertThat(row.get("missing")).isNull();
            assertThat(row.getLong("missing")).isNull();
            assertThat(row.getDouble("missing")).isNull();
            assertThat(row.getString("missing")).isNull();
            assertThat(row.getBytes("missing")).isNull();
        }

        @Test
        @DisplayName("TC-ROW-003: Reading a column as the wrong type fails")
        void testTypeMismatch() {
            Row row = sampleRow();

            assertThatThrownBy(() -> row.getLong("name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column 'name' holds a STRING value, not VARINT");
        }

        @Test
        @DisplayName("TC-ROW-004: Unknown column names are rejected with the available columns")
        void testUnknownColumn() {
            Row row = sampleRow();

            assertThatThrownBy(() -> row.get("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown column 'nope'")
                .hasMessageContaining("[id, score, name, payload, missing]");
        }

        @Test
        @DisplayName("TC-ROW-005: Blob values are defensive copies")
        void testBlobCopies() {
            Row row = sampleRow();

            row.getBytes("payload")[0] = 99;
            ((byte[]) row.get("payload"))[1] = 99;

            assertThat(row.getBytes("payload")).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("TC-ROW-006: toMap keeps schema order")
        void testToMap() {
            Row row = Row.of(ColumnSchema.of("b", "a"),
                new CellType[]{CellType.VARINT, CellType.NULL}, new Object[]{1L, null});

            assertThat(row.toMap()).containsExactly(entry("b", 1L), entry("a", null));
            assertThatThrownBy(() -> row.toMap().put("c", 2L))
                .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Construction and identity")
    class Identity {

        @Test
        @DisplayName("TC-ROW-010: Value count must match the schema")
        void testLengthMismatch() {
            assertThatThrownBy(() -> Row.of(ColumnSchema.of("a"), new CellType[0], new Object[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 1 values");
        }

        @Test
        @DisplayName("TC-ROW-011: Rows with equal blob contents are equal")
        void testEquality() {
            assertThat(sampleRow()).isEqualTo(sampleRow());
            assertThat(sampleRow()).hasSameHashCodeAs(sampleRow());

            Row other = Row.of(ColumnSchema.of("id"), new CellType[]{CellType.VARINT}, new Object[]{1L});
            assertThat(other).isNotEqualTo(sampleRow());
        }

        @Test
        @DisplayName("TC-ROW-012: toString summarizes blobs by size")
        void testToString() {
            assertThat(sampleRow().toString())
                .isEqualTo("Row{id=42, score=0.5, name=alice, payload=<3 bytes>, missing=null}");
        }
    }
}
