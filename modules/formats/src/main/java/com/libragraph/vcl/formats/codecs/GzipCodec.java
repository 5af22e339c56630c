package com.libragraph.vcl.formats.codecs;

import com.libragraph.vcl.formats.api.Compressed;
import com.libragraph.vcl.formats.api.CompressionCodec;
import com.libragraph.vcl.formats.api.DecodeException;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Default blob codec. GZIP via Apache Commons Compress with a configurable level.
 */
@ApplicationScoped
public class GzipCodec implements CompressionCodec {
    public static final String NAME = "gzip";
    public static final int DEFAULT_LEVEL = 6;

    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};

    @ConfigProperty(name = "vcl.storage.gzip-level", defaultValue = "6")
    int level = DEFAULT_LEVEL;

    public GzipCodec() {
    }

    public GzipCodec(int level) {
        this.level = level;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Compressed compress(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(content.length / 3, 64));
        try (GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out, parameters())) {
            gzip.write(content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress with GZIP", e);
        }
        return Compressed.of(out.toByteArray());
    }

    @Override
    public long compress(Path source, Path dest) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(dest);
             GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(out, parameters())) {
            in.transferTo(gzip);
        }
        return Files.size(dest);
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        if (compressed.length < 2 || compressed[0] != GZIP_MAGIC[0] || compressed[1] != GZIP_MAGIC[1]) {
            throw new DecodeException(NAME, "Not GZIP data (missing magic bytes)");
        }
        try (GzipCompressorInputStream gzip = new GzipCompressorInputStream(
                new ByteArrayInputStream(compressed))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new DecodeException(NAME, "Failed to decompress GZIP: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] decompress(Path source) throws IOException {
        return decompress(Files.readAllBytes(source));
    }

    /**
     * Reads the ISIZE trailer, which holds the original length modulo 2^32.
     */
    @Override
    public OptionalLong decompressedSizeHint(byte[] compressed) {
        if (compressed.length < 18) {
            return OptionalLong.empty();
        }
        int n = compressed.length;
        long isize = (compressed[n - 4] & 0xFFL)
                | (compressed[n - 3] & 0xFFL) << 8
                | (compressed[n - 2] & 0xFFL) << 16
                | (compressed[n - 1] & 0xFFL) << 24;
        return OptionalLong.of(isize);
    }

    private GzipParameters parameters() {
        GzipParameters params = new GzipParameters();
        params.setCompressionLevel(level);
        return params;
    }
}
