package com.libragraph.vcl.core.storage;

import com.libragraph.vcl.util.ContentHash;
import io.smallrye.mutiny.Uni;

import java.nio.file.Path;

/**
 * Content-addressed byte storage for encoded blobs.
 *
 * <p>Callers pass already-compressed bytes; the storage layer never transforms them.
 * Only BlobStore writes here.
 */
public interface ObjectStorage {

    /**
     * Opaque key recorded in the catalog for a digest.
     */
    String keyFor(ContentHash digest);

    /**
     * @throws BlobNotFoundException if the object does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> read(ContentHash digest);

    /**
     * Writes the object atomically, replacing any previous bytes under the same digest.
     *
     * @throws StorageException on I/O errors (e.g. disk full)
     */
    Uni<Void> write(ContentHash digest, byte[] data);

    Uni<Boolean> exists(ContentHash digest);

    /**
     * @throws BlobNotFoundException if the object does not exist
     * @throws StorageException on I/O errors
     */
    Uni<Void> delete(ContentHash digest);

    /**
     * Root directory exclusively owned by the blob store.
     */
    Path root();
}
