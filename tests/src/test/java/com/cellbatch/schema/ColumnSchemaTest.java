package com.cellbatch.schema;

import com.cellbatch.test.TestBase;
import com.cellbatch.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ColumnSchema.
 *
 * <p>Test ID prefix: TC-SCHEMA-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ColumnSchema Tests")
public class ColumnSchemaTest extends TestBase {

    @Test
    @DisplayName("TC-SCHEMA-001: Names are kept in result order")
    void testOrderAndLookup() {
        ColumnSchema schema = ColumnSchema.of("foo_id", "foo_num");

        assertThat(schema.size()).isEqualTo(2);
        assertThat(schema.isEmpty()).isFalse();
        assertThat(schema.nameAt(1)).isEqualTo("foo_num");
        assertThat(schema.indexOf("foo_id")).isZero();
        assertThat(schema.indexOf("bar")).isEqualTo(-1);
        assertThat(schema.contains("foo_num")).isTrue();
        assertThat(schema.names()).containsExactly("foo_id", "foo_num");
    }

    @Test
    @DisplayName("TC-SCHEMA-002: Duplicate names are rejected")
    void testDuplicateNames() {
        assertThatThrownBy(() -> ColumnSchema.of("a", "b", "a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Duplicate column name 'a' at indexes 0 and 2");
    }

    @Test
    @DisplayName("TC-SCHEMA-003: Null names are rejected")
    void testNullName() {
        assertThatThrownBy(() -> new ColumnSchema(Arrays.asList("a", null)))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("index 1");
    }

    @Test
    @DisplayName("TC-SCHEMA-004: Schema is detached from the source list")
    void testDefensiveCopy() {
        List<String> names = new ArrayList<>(List.of("a"));
        ColumnSchema schema = new ColumnSchema(names);

        names.add("b");

        assertThat(schema.size()).isEqualTo(1);
        assertThatThrownBy(() -> schema.names().add("c"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("TC-SCHEMA-005: Empty schema and value semantics")
    void testEmptyAndEquality() {
        assertThat(ColumnSchema.EMPTY.isEmpty()).isTrue();
        assertThat(ColumnSchema.of()).isEqualTo(ColumnSchema.EMPTY);
        assertThat(ColumnSchema.of("x", "y")).isEqualTo(new ColumnSchema(List.of("x", "y")))
            .hasSameHashCodeAs(new ColumnSchema(List.of("x", "y")));
        assertThat(ColumnSchema.of("x", "y")).isNotEqualTo(ColumnSchema.of("y", "x"));
        assertThat(ColumnSchema.of("x").toString()).isEqualTo("ColumnSchema[x]");
    }
}
