package com.libragraph.vcl.core.storage;

import com.libragraph.vcl.util.ContentHash;

/**
 * Thrown when a read, delete or reference change targets a blob that does not exist,
 * either as a stored object or as a catalog row.
 */
public class BlobNotFoundException extends RuntimeException {

    private final ContentHash digest;
    private final Long blobId;

    public BlobNotFoundException(ContentHash digest) {
        super("Blob not found: digest=" + digest);
        this.digest = digest;
        this.blobId = null;
    }

    public BlobNotFoundException(long blobId) {
        super("Blob not found: id=" + blobId);
        this.digest = null;
        this.blobId = blobId;
    }

    /** Null when the lookup was by catalog id. */
    public ContentHash digest() {
        return digest;
    }

    /** Null when the lookup was by digest. */
    public Long blobId() {
        return blobId;
    }
}
