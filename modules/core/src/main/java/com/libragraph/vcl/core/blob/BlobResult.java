package com.libragraph.vcl.core.blob;

import com.libragraph.vcl.core.dao.BlobRecord;

/**
 * Outcome of get-or-create. {@code revived} means the blob existed with no references left.
 */
public record BlobResult(BlobRecord blob, boolean created, boolean revived) {
}
