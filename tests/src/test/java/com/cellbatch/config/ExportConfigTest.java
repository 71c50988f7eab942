package com.cellbatch.config;

import com.cellbatch.test.TestBase;
import com.cellbatch.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ExportConfig.
 *
 * <p>Test ID prefix: TC-ECONF-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExportConfig Tests")
public class ExportConfigTest extends TestBase {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ExportConfig.ALLOCATOR_LIMIT_PROPERTY);
    }

    @Test
    @DisplayName("TC-ECONF-001: Limits are normalized into range")
    void testNormalize() {
        assertThat(ExportConfig.normalizeAllocatorLimit(0)).isEqualTo(ExportConfig.DEFAULT_ALLOCATOR_LIMIT);
        assertThat(ExportConfig.normalizeAllocatorLimit(-5)).isEqualTo(ExportConfig.DEFAULT_ALLOCATOR_LIMIT);
        assertThat(ExportConfig.normalizeAllocatorLimit(1)).isEqualTo(ExportConfig.MIN_ALLOCATOR_LIMIT);
        assertThat(ExportConfig.normalizeAllocatorLimit(1L << 24)).isEqualTo(1L << 24);
        assertThat(ExportConfig.normalizeAllocatorLimit(Long.MAX_VALUE)).isEqualTo(ExportConfig.MAX_ALLOCATOR_LIMIT);
    }

    @Test
    @DisplayName("TC-ECONF-002: Unset property resolves to the default")
    void testResolveDefault() {
        assertThat(ExportConfig.resolveAllocatorLimit()).isEqualTo(ExportConfig.DEFAULT_ALLOCATOR_LIMIT);
    }

    @Test
    @DisplayName("TC-ECONF-003: Property value is parsed and normalized")
    void testResolveFromProperty() {
        System.setProperty(ExportConfig.ALLOCATOR_LIMIT_PROPERTY, " 33554432 ");
        assertThat(ExportConfig.resolveAllocatorLimit()).isEqualTo(33554432L);

        System.setProperty(ExportConfig.ALLOCATOR_LIMIT_PROPERTY, "10");
        assertThat(ExportConfig.resolveAllocatorLimit()).isEqualTo(ExportConfig.MIN_ALLOCATOR_LIMIT);
    }

    @Test
    @DisplayName("TC-ECONF-004: Unparseable property falls back to the default")
    void testResolveInvalid() {
        System.setProperty(ExportConfig.ALLOCATOR_LIMIT_PROPERTY, "lots");

        assertThat(ExportConfig.resolveAllocatorLimit()).isEqualTo(ExportConfig.DEFAULT_ALLOCATOR_LIMIT);
    }
}
