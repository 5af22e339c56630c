package com.libragraph.vcl.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Computes content addresses. In-memory and streamed input produce the same
 * {@link ContentHash} for the same bytes.
 */
public final class Checksums {

    private Checksums() {
    }

    public static ContentHash digest(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        return new ContentHash(DigestUtils.sha256(content));
    }

    /**
     * Digests the remaining bytes of the stream. The stream is not closed.
     *
     * @throws IOException if reading the stream fails
     */
    public static ContentHash digest(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input stream cannot be null");
        return new ContentHash(DigestUtils.sha256(in));
    }

    /**
     * Digests a file without loading it into memory.
     *
     * @throws IOException if the file cannot be read
     */
    public static ContentHash digest(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return digest(in);
        }
    }
}
