package com.libragraph.vcl.formats.api;

import java.util.Objects;

/**
 * Output of an in-memory compression: the encoded bytes and the size used for accounting.
 */
public record Compressed(byte[] data, long size) {

    public Compressed {
        Objects.requireNonNull(data, "data cannot be null");
    }

    public static Compressed of(byte[] data) {
        return new Compressed(data, data.length);
    }
}
