package com.libragraph.vcl.core.storage;

import com.libragraph.vcl.util.Checksums;
import com.libragraph.vcl.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FilesystemObjectStorageTest {

    @TempDir
    Path tempDir;

    private FilesystemObjectStorage storage;
    private ContentHash digest;

    @BeforeEach
    void setUp() {
        storage = new FilesystemObjectStorage();
        storage.root = tempDir.toString();
        digest = Checksums.digest("object".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void keyIsTieredByDigestPrefix() {
        String hex = digest.toHex();

        assertThat(storage.keyFor(digest))
                .isEqualTo(hex.substring(0, 2) + "/" + hex.substring(2, 4) + "/" + hex);
    }

    @Test
    void writeThenRead() {
        byte[] data = {1, 2, 3, 4};

        storage.write(digest, data).await().indefinitely();

        assertThat(storage.exists(digest).await().indefinitely()).isTrue();
        assertThat(storage.read(digest).await().indefinitely()).containsExactly(1, 2, 3, 4);
        assertThat(tempDir.resolve(storage.keyFor(digest))).exists();
    }

    @Test
    void overwriteReplacesContent() {
        storage.write(digest, new byte[]{1}).await().indefinitely();
        storage.write(digest, new byte[]{2}).await().indefinitely();

        assertThat(storage.read(digest).await().indefinitely()).containsExactly(2);
    }

    @Test
    void readMissingObjectThrowsNotFound() {
        assertThatThrownBy(() -> storage.read(digest).await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void deleteRemovesObjectAndEmptyTiers() throws Exception {
        storage.write(digest, new byte[]{9}).await().indefinitely();

        storage.delete(digest).await().indefinitely();

        assertThat(storage.exists(digest).await().indefinitely()).isFalse();
        try (var entries = Files.list(tempDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void deleteMissingObjectThrowsNotFound() {
        assertThatThrownBy(() -> storage.delete(digest).await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void leavesNoTempFilesBehind() throws Exception {
        storage.write(digest, new byte[]{5, 6}).await().indefinitely();

        Path tier = tempDir.resolve(storage.keyFor(digest)).getParent();
        try (var entries = Files.list(tier)) {
            assertThat(entries.map(p -> p.getFileName().toString()))
                    .containsExactly(digest.toHex());
        }
    }
}
