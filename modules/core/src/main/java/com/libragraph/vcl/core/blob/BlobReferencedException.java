package com.libragraph.vcl.core.blob;

/**
 * Thrown when a hard delete targets a blob that live versions still reference.
 * Always a caller bug; never swallowed.
 */
public class BlobReferencedException extends RuntimeException {

    private final long blobId;
    private final int referenceCount;

    public BlobReferencedException(long blobId, int referenceCount) {
        super("Blob " + blobId + " is still referenced (reference_count=" + referenceCount + ")");
        this.blobId = blobId;
        this.referenceCount = referenceCount;
    }

    public long blobId() {
        return blobId;
    }

    public int referenceCount() {
        return referenceCount;
    }
}
