package com.libragraph.vcl.core.storage;

import com.libragraph.vcl.util.ContentHash;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed ObjectStorage.
 *
 * <p>Layout: {@code {root}/{tier1}/{tier2}/{hex}} where tier1 = hex[0:2], tier2 = hex[2:4].
 * Writes go to a temp file in the target directory and are moved into place.
 */
@ApplicationScoped
public class FilesystemObjectStorage implements ObjectStorage {

    private static final Logger log = Logger.getLogger(FilesystemObjectStorage.class);

    @ConfigProperty(name = "vcl.storage.root", defaultValue = "data/vcl/blobs")
    String root;

    @Override
    public String keyFor(ContentHash digest) {
        String hex = digest.toHex();
        return hex.substring(0, 2) + "/" + hex.substring(2, 4) + "/" + hex;
    }

    private Path resolvePath(ContentHash digest) {
        String hex = digest.toHex();
        return Path.of(root, hex.substring(0, 2), hex.substring(2, 4), hex);
    }

    @Override
    public Uni<byte[]> read(ContentHash digest) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(digest);
            if (!Files.exists(path)) {
                throw new BlobNotFoundException(digest);
            }
            try {
                return Files.readAllBytes(path);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Void> write(ContentHash digest, byte[] data) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(digest);
            Path tmp = null;
            try {
                tmp = createTempIn(path.getParent());
                Files.write(tmp, data);
                try {
                    Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                deleteQuietly(tmp);
                throw new StorageException("Failed to write blob: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(ContentHash digest) {
        return Uni.createFrom().item(() -> Files.exists(resolvePath(digest)));
    }

    @Override
    public Uni<Void> delete(ContentHash digest) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(digest);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new BlobNotFoundException(digest);
                }
                pruneEmptyParents(path.getParent(), Path.of(root));
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + digest, e);
            }
        });
    }

    @Override
    public Path root() {
        return Path.of(root);
    }

    // A concurrent delete may prune the tier directory between create and use; retry once.
    private Path createTempIn(Path dir) throws IOException {
        Files.createDirectories(dir);
        try {
            return Files.createTempFile(dir, ".tmp-", null);
        } catch (NoSuchFileException e) {
            Files.createDirectories(dir);
            return Files.createTempFile(dir, ".tmp-", null);
        }
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            } catch (NoSuchFileException e) {
                break;
            }
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException | NoSuchFileException e) {
                // a concurrent writer got there first
                break;
            }
            current = current.getParent();
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warnf("Could not remove temp file %s: %s", tmp, e.getMessage());
        }
    }
}
