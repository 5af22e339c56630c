package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.types.ChangeKind;
import com.libragraph.vcl.types.StorageKind;

/**
 * Insert payload for {@link VersionDao#insert(NewVersion)}.
 */
public record NewVersion(
        long fileId,
        int ownerId,
        int versionNumber,
        long blobId,
        StorageKind storageKind,
        ChangeKind changeKind,
        long rawSize,
        long compressedSize,
        double compressionRatio,
        String digest,
        boolean priority,
        String comment,
        boolean wasCached,
        Integer cacheDurationSeconds
) {}
