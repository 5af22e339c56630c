package com.libragraph.vcl.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

@RegisterConstructorMapper(StatsRecord.class)
@RegisterConstructorMapper(CatalogTotals.class)
public interface StatsDao {

    @SqlQuery("SELECT * FROM vcl_stats WHERE id = 1")
    StatsRecord get();

    @SqlUpdate("UPDATE vcl_stats SET " +
            "total_versions = GREATEST(0, total_versions + :versions), " +
            "total_raw_bytes = GREATEST(0, total_raw_bytes + :rawBytes), " +
            "total_compressed_bytes = GREATEST(0, total_compressed_bytes + :compressedBytes), " +
            "total_blobs = GREATEST(0, total_blobs + :totalBlobs), " +
            "unique_blobs = GREATEST(0, unique_blobs + :uniqueBlobs), " +
            "priority_count = GREATEST(0, priority_count + :priority), " +
            "cached_versions_count = GREATEST(0, cached_versions_count + :cached), " +
            "deduplication_savings_bytes = GREATEST(0, deduplication_savings_bytes + :deduplicationSavings), " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = 1")
    int apply(@BindMethods StatsDelta delta);

    /**
     * Takes the row lock so concurrent increments queue behind a recompute.
     */
    @SqlUpdate("UPDATE vcl_stats SET updated_at = CURRENT_TIMESTAMP WHERE id = 1")
    int lock();

    @SqlQuery("SELECT " +
            "(SELECT COUNT(*) FROM vcl_version) AS total_versions, " +
            "(SELECT COALESCE(SUM(raw_size), 0) FROM vcl_version) AS total_raw_bytes, " +
            "(SELECT COALESCE(SUM(compressed_size), 0) FROM vcl_version) AS total_compressed_bytes, " +
            "(SELECT COUNT(*) FROM vcl_version WHERE is_priority = TRUE) AS priority_count, " +
            "(SELECT COUNT(*) FROM vcl_version WHERE was_cached = TRUE) AS cached_versions_count, " +
            "(SELECT COUNT(*) FROM vcl_blob) AS total_blobs, " +
            "(SELECT COUNT(*) FROM vcl_blob WHERE reference_count > 0) AS unique_blobs, " +
            "(SELECT COALESCE(SUM(original_size * (reference_count - 1)), 0) FROM vcl_blob " +
            "WHERE reference_count > 1) AS deduplication_savings_bytes")
    CatalogTotals computeTotals();

    @SqlUpdate("UPDATE vcl_stats SET total_versions = :totalVersions, total_raw_bytes = :totalRawBytes, " +
            "total_compressed_bytes = :totalCompressedBytes, total_blobs = :totalBlobs, " +
            "unique_blobs = :uniqueBlobs, priority_count = :priorityCount, " +
            "cached_versions_count = :cachedVersionsCount, " +
            "deduplication_savings_bytes = :deduplicationSavingsBytes, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = 1")
    int overwrite(@BindMethods CatalogTotals totals);

    @SqlUpdate("UPDATE vcl_stats SET last_priority_run_at = CURRENT_TIMESTAMP WHERE id = 1")
    int markPriorityRun();

    @SqlUpdate("UPDATE vcl_stats SET last_cleanup_at = CURRENT_TIMESTAMP WHERE id = 1")
    int markCleanup();
}
