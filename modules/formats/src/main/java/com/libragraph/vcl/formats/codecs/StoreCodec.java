package com.libragraph.vcl.formats.codecs;

import com.libragraph.vcl.formats.api.Compressed;
import com.libragraph.vcl.formats.api.CompressionCodec;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.OptionalLong;

/**
 * Identity codec for scopes with compression disabled.
 */
@ApplicationScoped
public class StoreCodec implements CompressionCodec {
    public static final String NAME = "store";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Compressed compress(byte[] content) {
        return Compressed.of(content.clone());
    }

    @Override
    public long compress(Path source, Path dest) throws IOException {
        Files.copy(source, dest, StandardCopyOption.REPLACE_EXISTING);
        return Files.size(dest);
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        return compressed.clone();
    }

    @Override
    public byte[] decompress(Path source) throws IOException {
        return Files.readAllBytes(source);
    }

    @Override
    public OptionalLong decompressedSizeHint(byte[] compressed) {
        return OptionalLong.of(compressed.length);
    }
}
