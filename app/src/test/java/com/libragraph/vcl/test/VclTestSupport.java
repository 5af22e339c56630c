package com.libragraph.vcl.test;

import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.QuotaSettings;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.storage.ObjectStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Resets the catalog and the blob directory between tests, and builds scope fixtures.
 */
@ApplicationScoped
public class VclTestSupport {

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectStorage storage;

    @Inject
    QuotaLedger quota;

    public void reset() {
        jdbi.useTransaction(h -> {
            h.execute("DELETE FROM vcl_version");
            h.execute("DELETE FROM vcl_blob");
            h.execute("DELETE FROM vcl_quota_scope");
            h.execute("UPDATE vcl_stats SET total_versions = 0, total_raw_bytes = 0, total_compressed_bytes = 0, " +
                    "total_blobs = 0, unique_blobs = 0, priority_count = 0, cached_versions_count = 0, " +
                    "deduplication_savings_bytes = 0, last_priority_run_at = NULL, last_cleanup_at = NULL " +
                    "WHERE id = 1");
        });
        deleteTree(storage.root());
    }

    /** Creates (or replaces) an owner scope with the given limits and otherwise default settings. */
    public QuotaScopeRecord scope(int ownerId, long maxSize, long headroom, int maxDepth) {
        ScopeKey key = ScopeKey.owner(ownerId);
        QuotaSettings settings = quota.getScope(key).settings()
                .withMaxSize(maxSize, headroom)
                .withMaxDepth(maxDepth);
        return quota.updateSettings(key, settings);
    }

    public QuotaScopeRecord update(int ownerId, QuotaSettings settings) {
        return quota.updateSettings(ScopeKey.owner(ownerId), settings);
    }

    /** Forces the stored usage, bypassing version accounting. */
    public void setUsage(int ownerId, long usage) {
        jdbi.useHandle(h -> h.createUpdate("UPDATE vcl_quota_scope SET current_usage_bytes = :usage " +
                        "WHERE owner_id = :ownerId")
                .bind("usage", usage)
                .bind("ownerId", ownerId)
                .execute());
    }

    public int versionCount() {
        return jdbi.withHandle(h -> h.createQuery("SELECT COUNT(*) FROM vcl_version").mapTo(Integer.class).one());
    }

    public int blobCount() {
        return jdbi.withHandle(h -> h.createQuery("SELECT COUNT(*) FROM vcl_blob").mapTo(Integer.class).one());
    }

    /**
     * Blobs whose reference count differs from the number of versions pointing at them.
     */
    public int referenceMismatches() {
        return jdbi.withHandle(h -> h.createQuery(
                        "SELECT COUNT(*) FROM vcl_blob b WHERE b.reference_count <> " +
                                "(SELECT COUNT(*) FROM vcl_version v WHERE v.blob_id = b.id)")
                .mapTo(Integer.class).one());
    }

    public static byte[] text(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /** Compressible content of roughly the given size, unique per seed. */
    public static byte[] content(String seed, int size) {
        StringBuilder sb = new StringBuilder(size + 64);
        sb.append(seed).append('\n');
        int line = 0;
        while (sb.length() < size) {
            sb.append("line ").append(line++).append(" of ").append(seed).append('\n');
        }
        return text(sb.substring(0, size));
    }

    private static void deleteTree(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder())
                    .filter(p -> !p.equals(root))
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
