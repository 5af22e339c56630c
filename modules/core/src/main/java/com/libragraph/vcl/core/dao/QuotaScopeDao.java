package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.core.quota.QuotaSettings;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(QuotaScopeRecord.class)
public interface QuotaScopeDao {

    @SqlQuery("SELECT * FROM vcl_quota_scope WHERE owner_id IS NULL")
    Optional<QuotaScopeRecord> findGlobal();

    @SqlQuery("SELECT * FROM vcl_quota_scope WHERE owner_id = :ownerId")
    Optional<QuotaScopeRecord> findByOwner(@Bind("ownerId") int ownerId);

    @SqlQuery("SELECT * FROM vcl_quota_scope WHERE id = :id")
    Optional<QuotaScopeRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM vcl_quota_scope ORDER BY owner_id NULLS FIRST")
    List<QuotaScopeRecord> listAll();

    @SqlUpdate("INSERT INTO vcl_quota_scope (owner_id, max_size_bytes, headroom_bytes, max_depth, enabled, " +
            "compression_enabled, debounce_window_seconds, max_batch_window_seconds) " +
            "VALUES (:ownerId, :s.maxSizeBytes, :s.headroomBytes, :s.maxDepth, :s.enabled, " +
            ":s.compressionEnabled, :s.debounceWindowSeconds, :s.maxBatchWindowSeconds)")
    @GetGeneratedKeys("id")
    long insert(@Bind("ownerId") Integer ownerId, @BindMethods("s") QuotaSettings settings);

    @SqlUpdate("UPDATE vcl_quota_scope SET max_size_bytes = :s.maxSizeBytes, headroom_bytes = :s.headroomBytes, " +
            "max_depth = :s.maxDepth, enabled = :s.enabled, compression_enabled = :s.compressionEnabled, " +
            "debounce_window_seconds = :s.debounceWindowSeconds, " +
            "max_batch_window_seconds = :s.maxBatchWindowSeconds, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = :id")
    int updateSettings(@Bind("id") long id, @BindMethods("s") QuotaSettings settings);

    /**
     * Atomic at the storage layer; clamps at zero.
     */
    @SqlUpdate("UPDATE vcl_quota_scope SET current_usage_bytes = GREATEST(0, current_usage_bytes + :delta), " +
            "updated_at = CURRENT_TIMESTAMP WHERE owner_id = :ownerId")
    int adjustUsage(@Bind("ownerId") int ownerId, @Bind("delta") long delta);

    @SqlUpdate("UPDATE vcl_quota_scope SET current_usage_bytes = (" +
            "SELECT COALESCE(SUM(v.compressed_size), 0) FROM vcl_version v " +
            "WHERE v.owner_id = vcl_quota_scope.owner_id AND v.storage_kind = 0), " +
            "updated_at = CURRENT_TIMESTAMP WHERE owner_id IS NOT NULL")
    int recomputeOwnerUsage();
}
