package com.libragraph.vcl.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record StatsRecord(
        @ColumnName("total_versions") long totalVersions,
        @ColumnName("total_raw_bytes") long totalRawBytes,
        @ColumnName("total_compressed_bytes") long totalCompressedBytes,
        @ColumnName("total_blobs") long totalBlobs,
        @ColumnName("unique_blobs") long uniqueBlobs,
        @ColumnName("priority_count") long priorityCount,
        @ColumnName("cached_versions_count") long cachedVersionsCount,
        @ColumnName("deduplication_savings_bytes") long deduplicationSavingsBytes,
        @ColumnName("last_priority_run_at") Instant lastPriorityRunAt,
        @ColumnName("last_cleanup_at") Instant lastCleanupAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
