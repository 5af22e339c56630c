package com.libragraph.vcl.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(VersionRecord.class)
@RegisterColumnMapper(StorageKindColumnMapper.class)
@RegisterColumnMapper(ChangeKindColumnMapper.class)
@RegisterArgumentFactory(StorageKindArgumentFactory.class)
@RegisterArgumentFactory(ChangeKindArgumentFactory.class)
public interface VersionDao {

    @SqlUpdate("INSERT INTO vcl_version (file_id, owner_id, version_number, blob_id, storage_kind, change_kind, " +
            "raw_size, compressed_size, compression_ratio, digest, is_priority, comment, was_cached, " +
            "cache_duration_seconds) VALUES (:fileId, :ownerId, :versionNumber, :blobId, :storageKind, " +
            ":changeKind, :rawSize, :compressedSize, :compressionRatio, :digest, :priority, :comment, " +
            ":wasCached, :cacheDurationSeconds)")
    @GetGeneratedKeys("id")
    long insert(@BindMethods NewVersion version);

    @SqlQuery("SELECT * FROM vcl_version WHERE id = :id")
    Optional<VersionRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT COALESCE(MAX(version_number), 0) FROM vcl_version WHERE file_id = :fileId")
    int maxVersionNumber(@Bind("fileId") long fileId);

    @SqlQuery("SELECT * FROM vcl_version WHERE file_id = :fileId ORDER BY version_number DESC LIMIT 1")
    Optional<VersionRecord> findLatest(@Bind("fileId") long fileId);

    @SqlQuery("SELECT * FROM vcl_version WHERE file_id = :fileId ORDER BY version_number DESC")
    List<VersionRecord> listByFile(@Bind("fileId") long fileId);

    @SqlQuery("SELECT * FROM vcl_version WHERE file_id = :fileId ORDER BY version_number DESC " +
            "LIMIT :limit OFFSET :offset")
    List<VersionRecord> listByFile(@Bind("fileId") long fileId,
                                   @Bind("limit") int limit,
                                   @Bind("offset") int offset);

    @SqlQuery("SELECT * FROM vcl_version WHERE owner_id = :ownerId ORDER BY created_at DESC, id DESC")
    List<VersionRecord> listByOwner(@Bind("ownerId") int ownerId);

    @SqlQuery("SELECT DISTINCT owner_id FROM vcl_version ORDER BY owner_id")
    List<Integer> listOwners();

    @SqlUpdate("DELETE FROM vcl_version WHERE id = :id")
    int delete(@Bind("id") long id);

    @SqlUpdate("UPDATE vcl_version SET is_priority = :priority WHERE id = :id")
    int setPriority(@Bind("id") long id, @Bind("priority") boolean priority);

    @SqlQuery("SELECT file_id FROM vcl_version WHERE owner_id = :ownerId GROUP BY file_id " +
            "HAVING COUNT(*) > :maxDepth ORDER BY file_id")
    List<Long> filesOverDepth(@Bind("ownerId") int ownerId, @Bind("maxDepth") int maxDepth);

    @SqlQuery("SELECT COUNT(*) FROM vcl_version WHERE file_id = :fileId")
    int countByFile(@Bind("fileId") long fileId);

    /**
     * Oldest first, skipping priority versions and the newest version of the file.
     */
    @SqlQuery("SELECT * FROM vcl_version WHERE file_id = :fileId AND owner_id = :ownerId " +
            "AND is_priority = FALSE " +
            "AND version_number < (SELECT MAX(n.version_number) FROM vcl_version n WHERE n.file_id = :fileId) " +
            "ORDER BY version_number ASC LIMIT :limit")
    List<VersionRecord> oldestTrimmable(@Bind("fileId") long fileId,
                                        @Bind("ownerId") int ownerId,
                                        @Bind("limit") int limit);

    String EVICTION_CANDIDATES = "SELECT v.* FROM vcl_version v WHERE v.owner_id = :ownerId " +
            "AND v.version_number < (SELECT MAX(n.version_number) FROM vcl_version n WHERE n.file_id = v.file_id) " +
            "AND (:includePriority = TRUE OR v.is_priority = FALSE) ";

    String EVICTION_ORDER = "ORDER BY v.is_priority ASC, v.created_at ASC, v.id ASC";

    /**
     * Eviction order: non-priority before priority, then oldest first. A file's newest version
     * is never a candidate, whoever owns it.
     */
    @SqlQuery(EVICTION_CANDIDATES + EVICTION_ORDER)
    List<VersionRecord> evictionCandidates(@Bind("ownerId") int ownerId,
                                           @Bind("includePriority") boolean includePriority);

    @SqlQuery(EVICTION_CANDIDATES + "AND v.created_at < :cutoff " + EVICTION_ORDER)
    List<VersionRecord> evictionCandidatesBefore(@Bind("ownerId") int ownerId,
                                                 @Bind("includePriority") boolean includePriority,
                                                 @Bind("cutoff") Instant cutoff);

    @SqlQuery("SELECT COALESCE(SUM(compressed_size), 0) FROM vcl_version " +
            "WHERE owner_id = :ownerId AND storage_kind = 0")
    long primaryBytes(@Bind("ownerId") int ownerId);
}
