package com.libragraph.vcl.core.reclaim;

import com.libragraph.vcl.core.dao.VersionRecord;

/**
 * A version removed (or, in a dry run, selected for removal) by a reclaim stage.
 */
public record DeletedVersion(
        long versionId,
        long fileId,
        int ownerId,
        int versionNumber,
        boolean priority,
        long compressedSize,
        long freedBytes
) {
    static DeletedVersion of(VersionRecord v, long freedBytes) {
        return new DeletedVersion(v.id(), v.fileId(), v.ownerId(), v.versionNumber(), v.priority(),
                v.compressedSize(), freedBytes);
    }
}
