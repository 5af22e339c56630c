package com.libragraph.vcl.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * Counters derived directly from the version and blob tables.
 */
public record CatalogTotals(
        @ColumnName("total_versions") long totalVersions,
        @ColumnName("total_raw_bytes") long totalRawBytes,
        @ColumnName("total_compressed_bytes") long totalCompressedBytes,
        @ColumnName("priority_count") long priorityCount,
        @ColumnName("cached_versions_count") long cachedVersionsCount,
        @ColumnName("total_blobs") long totalBlobs,
        @ColumnName("unique_blobs") long uniqueBlobs,
        @ColumnName("deduplication_savings_bytes") long deduplicationSavingsBytes
) {}
