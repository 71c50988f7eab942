package com.cellbatch.config;

/**
 * Configuration for Arrow table export.
 *
 * <p>The memory limit of the exporter's own allocator can be overridden with the
 * {@value #ALLOCATOR_LIMIT_PROPERTY} system property (bytes).
 */
public final class ExportConfig {

    private ExportConfig() {} // Utility class

    public static final String ALLOCATOR_LIMIT_PROPERTY = "cellbatch.export.allocatorLimit";

    /** Default allocator limit: 1 GiB */
    public static final long DEFAULT_ALLOCATOR_LIMIT = 1L << 30;

    /** Minimum allocator limit: 1 MiB */
    public static final long MIN_ALLOCATOR_LIMIT = 1L << 20;

    /** Maximum allocator limit, effectively unbounded */
    public static final long MAX_ALLOCATOR_LIMIT = Long.MAX_VALUE;

    /**
     * Validate and normalize an allocator limit.
     *
     * @param requested the requested limit in bytes
     * @return normalized limit within [MIN_ALLOCATOR_LIMIT, MAX_ALLOCATOR_LIMIT]
     */
    public static long normalizeAllocatorLimit(long requested) {
        if (requested <= 0) return DEFAULT_ALLOCATOR_LIMIT;
        if (requested < MIN_ALLOCATOR_LIMIT) return MIN_ALLOCATOR_LIMIT;
        return requested;
    }

    /**
     * Resolves the allocator limit from the system property, falling back to the default
     * when it is absent or not a number.
     *
     * @return the normalized allocator limit
     */
    public static long resolveAllocatorLimit() {
        String value = System.getProperty(ALLOCATOR_LIMIT_PROPERTY);
        if (value == null || value.isBlank()) {
            return DEFAULT_ALLOCATOR_LIMIT;
        }
        try {
            return normalizeAllocatorLimit(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return DEFAULT_ALLOCATOR_LIMIT;
        }
    }
}
