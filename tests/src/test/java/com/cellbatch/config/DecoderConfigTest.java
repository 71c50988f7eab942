package com.cellbatch.config;

import com.cellbatch.test.TestBase;
import com.cellbatch.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for DecoderConfig.
 *
 * <p>Test ID prefix: TC-DCONF-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DecoderConfig Tests")
public class DecoderConfigTest extends TestBase {

    @Test
    @DisplayName("TC-DCONF-001: Delimiter is the NUL character")
    void testDelimiter() {
        assertThat(DecoderConfig.STRING_CELL_DELIMITER).isEqualTo('\0');
    }

    @Test
    @DisplayName("TC-DCONF-002: Non-positive capacity falls back to the default")
    void testNonPositiveCapacity() {
        assertThat(DecoderConfig.normalizeRowBufferCapacity(0)).isEqualTo(DecoderConfig.DEFAULT_ROW_BUFFER_CAPACITY);
        assertThat(DecoderConfig.normalizeRowBufferCapacity(-1)).isEqualTo(DecoderConfig.DEFAULT_ROW_BUFFER_CAPACITY);
    }

    @Test
    @DisplayName("TC-DCONF-003: Capacity is capped at the maximum")
    void testCapacityCap() {
        assertThat(DecoderConfig.normalizeRowBufferCapacity(Integer.MAX_VALUE))
            .isEqualTo(DecoderConfig.MAX_ROW_BUFFER_CAPACITY);
        assertThat(DecoderConfig.normalizeRowBufferCapacity(10)).isEqualTo(10);
    }
}
