package com.libragraph.vcl.formats.codecs;

import com.libragraph.vcl.formats.api.Compressed;
import com.libragraph.vcl.formats.api.CompressionCodec;
import com.libragraph.vcl.formats.api.DecodeException;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

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
 * BZIP2 codec. Slower than GZIP, better ratio on text-heavy content.
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements CompressionCodec {
    public static final String NAME = "bzip2";

    private static final int BLOCK_SIZE = 9;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Compressed compress(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(content.length / 3, 64));
        try (BZip2CompressorOutputStream bzip2 = new BZip2CompressorOutputStream(out, BLOCK_SIZE)) {
            bzip2.write(content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress with BZIP2", e);
        }
        return Compressed.of(out.toByteArray());
    }

    @Override
    public long compress(Path source, Path dest) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(dest);
             BZip2CompressorOutputStream bzip2 = new BZip2CompressorOutputStream(out, BLOCK_SIZE)) {
            in.transferTo(bzip2);
        }
        return Files.size(dest);
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        try (BZip2CompressorInputStream bzip2 = new BZip2CompressorInputStream(
                new ByteArrayInputStream(compressed))) {
            return bzip2.readAllBytes();
        } catch (IOException e) {
            throw new DecodeException(NAME, "Failed to decompress BZIP2: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] decompress(Path source) throws IOException {
        return decompress(Files.readAllBytes(source));
    }

    @Override
    public OptionalLong decompressedSizeHint(byte[] compressed) {
        return OptionalLong.empty();
    }
}
