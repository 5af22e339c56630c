package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.types.ChangeKind;
import com.libragraph.vcl.types.StorageKind;
import com.libragraph.vcl.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record VersionRecord(
        @ColumnName("id") long id,
        @ColumnName("file_id") long fileId,
        @ColumnName("owner_id") int ownerId,
        @ColumnName("version_number") int versionNumber,
        @ColumnName("blob_id") long blobId,
        @ColumnName("storage_kind") StorageKind storageKind,
        @ColumnName("change_kind") ChangeKind changeKind,
        @ColumnName("raw_size") long rawSize,
        @ColumnName("compressed_size") long compressedSize,
        @ColumnName("compression_ratio") double compressionRatio,
        @ColumnName("digest") String digest,
        @ColumnName("is_priority") boolean priority,
        @ColumnName("comment") String comment,
        @ColumnName("was_cached") boolean wasCached,
        @ColumnName("cache_duration_seconds") Integer cacheDurationSeconds,
        @ColumnName("created_at") Instant createdAt
) {
    public ContentHash contentHash() {
        return ContentHash.fromHex(digest);
    }

    public ScopeKey scope() {
        return ScopeKey.owner(ownerId);
    }

    public boolean isPrimary() {
        return storageKind == StorageKind.PRIMARY;
    }
}
