package com.libragraph.vcl.formats.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Lossless compression used for stored blobs.
 *
 * Every blob records the {@link #name()} of the codec that wrote it, so a codec
 * name must never change once blobs exist under it.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface CompressionCodec {

    /**
     * Stable identifier persisted alongside each blob.
     */
    String name();

    /**
     * Compresses an in-memory buffer.
     */
    Compressed compress(byte[] content);

    /**
     * Streams {@code source} into {@code dest}, compressing on the way.
     *
     * @return the compressed size in bytes
     * @throws IOException if either file cannot be read or written (e.g. disk full)
     */
    long compress(Path source, Path dest) throws IOException;

    /**
     * Restores the original bytes.
     *
     * @throws DecodeException if the data is corrupt or truncated
     */
    byte[] decompress(byte[] compressed);

    /**
     * Reads a compressed file and restores the original bytes.
     *
     * @throws IOException     if the file cannot be read
     * @throws DecodeException if the file content is corrupt or truncated
     */
    byte[] decompress(Path source) throws IOException;

    /**
     * Best-effort original size without decompressing, when the format records one.
     */
    OptionalLong decompressedSizeHint(byte[] compressed);
}
