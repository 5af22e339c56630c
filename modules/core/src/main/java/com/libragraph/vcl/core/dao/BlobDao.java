package com.libragraph.vcl.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(BlobRecord.class)
public interface BlobDao {

    @SqlQuery("SELECT * FROM vcl_blob WHERE digest = :digest")
    Optional<BlobRecord> findByDigest(@Bind("digest") String digest);

    @SqlQuery("SELECT * FROM vcl_blob WHERE id = :id")
    Optional<BlobRecord> findById(@Bind("id") long id);

    @SqlUpdate("INSERT INTO vcl_blob (digest, storage_key, codec, original_size, compressed_size, reference_count) " +
            "VALUES (:digest, :storageKey, :codec, :originalSize, :compressedSize, 1)")
    @GetGeneratedKeys("id")
    long insert(@Bind("digest") String digest,
                @Bind("storageKey") String storageKey,
                @Bind("codec") String codec,
                @Bind("originalSize") long originalSize,
                @Bind("compressedSize") long compressedSize);

    @SqlUpdate("UPDATE vcl_blob SET reference_count = reference_count + 1, pending_delete = FALSE, " +
            "last_accessed = CURRENT_TIMESTAMP WHERE id = :id")
    int incrementReference(@Bind("id") long id);

    /**
     * Never drops below zero. Marks the blob pending delete when the last reference goes away.
     */
    @SqlUpdate("UPDATE vcl_blob SET reference_count = reference_count - 1, " +
            "pending_delete = CASE WHEN reference_count = 1 THEN TRUE ELSE FALSE END " +
            "WHERE id = :id AND reference_count > 0")
    int decrementReference(@Bind("id") long id);

    @SqlQuery("SELECT reference_count FROM vcl_blob WHERE id = :id")
    Optional<Integer> referenceCount(@Bind("id") long id);

    /**
     * Guarded hard delete: affects no row while references remain.
     */
    @SqlUpdate("DELETE FROM vcl_blob WHERE id = :id AND reference_count = 0")
    int deleteUnreferenced(@Bind("id") long id);

    @SqlUpdate("UPDATE vcl_blob SET last_accessed = CURRENT_TIMESTAMP WHERE id = :id")
    int touch(@Bind("id") long id);

    @SqlUpdate("UPDATE vcl_blob SET corrupt = TRUE WHERE id = :id")
    int markCorrupt(@Bind("id") long id);

    @SqlQuery("SELECT * FROM vcl_blob WHERE reference_count = 0 OR pending_delete = TRUE ORDER BY id")
    List<BlobRecord> findOrphans();
}
