package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.util.ContentHash;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record BlobRecord(
        @ColumnName("id") long id,
        @ColumnName("digest") String digest,
        @ColumnName("storage_key") String storageKey,
        @ColumnName("codec") String codec,
        @ColumnName("original_size") long originalSize,
        @ColumnName("compressed_size") long compressedSize,
        @ColumnName("reference_count") int referenceCount,
        @ColumnName("pending_delete") boolean pendingDelete,
        @ColumnName("corrupt") boolean corrupt,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("last_accessed") Instant lastAccessed
) {
    public ContentHash contentHash() {
        return ContentHash.fromHex(digest);
    }

    public boolean isOrphan() {
        return referenceCount == 0 || pendingDelete;
    }
}
