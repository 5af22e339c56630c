package com.libragraph.vcl.core.version;

import com.libragraph.vcl.core.dao.VersionRecord;

/**
 * A removed version and the bytes physically freed by releasing its blob.
 */
public record VersionDeletion(VersionRecord version, long freedBytes, boolean blobDeleted) {
}
