package com.libragraph.vcl.core.version;

import com.libragraph.vcl.core.blob.BlobResult;
import com.libragraph.vcl.core.blob.BlobStore;
import com.libragraph.vcl.core.dao.BlobDao;
import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.NewVersion;
import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.core.dao.StatsDelta;
import com.libragraph.vcl.core.dao.VersionDao;
import com.libragraph.vcl.core.dao.VersionRecord;
import com.libragraph.vcl.core.lock.VclLocks;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.stats.StatsAggregator;
import com.libragraph.vcl.core.storage.BlobNotFoundException;
import com.libragraph.vcl.formats.api.CompressionCodec;
import com.libragraph.vcl.types.ChangeKind;
import com.libragraph.vcl.types.SkipReason;
import com.libragraph.vcl.types.StorageKind;
import com.libragraph.vcl.util.Checksums;
import com.libragraph.vcl.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;

/**
 * Per-file version history on top of the deduplicating {@link BlobStore}.
 *
 * <p>All mutations for a file run under its file lock, so version numbers are allocated
 * without gaps or duplicates. Primary versions are charged to their owner's quota; shared
 * versions are free.
 */
@ApplicationScoped
public class VersionStore {

    private static final Logger log = Logger.getLogger(VersionStore.class);

    @Inject
    Jdbi jdbi;

    @Inject
    BlobStore blobs;

    @Inject
    QuotaLedger quota;

    @Inject
    StatsAggregator stats;

    @Inject
    VclLocks locks;

    @ConfigProperty(name = "vcl.version.max-file-size", defaultValue = "104857600")
    long maxFileSize;

    public long maxFileSize() {
        return maxFileSize;
    }

    public VersionDecision shouldCreateVersion(long fileId, ContentHash digest, ScopeKey scope, long rawSize) {
        return shouldCreateVersion(fileId, digest, scope, rawSize, false);
    }

    /**
     * Checks, in order: size ceiling, unchanged content, disabled scope, and quota pressure.
     * {@code force} overrides only the quota check.
     */
    public VersionDecision shouldCreateVersion(long fileId, ContentHash digest, ScopeKey scope,
                                               long rawSize, boolean force) {
        if (rawSize > maxFileSize) {
            return VersionDecision.skip(SkipReason.TOO_LARGE,
                    "File size " + rawSize + " exceeds version limit " + maxFileSize);
        }
        Optional<VersionRecord> latest = latestVersion(fileId);
        if (latest.isPresent() && latest.get().digest().equals(digest.toHex())) {
            return VersionDecision.skip(SkipReason.UNCHANGED,
                    "Content matches version " + latest.get().versionNumber());
        }
        QuotaScopeRecord settings = quota.getScope(scope);
        if (!settings.enabled()) {
            return VersionDecision.skip(SkipReason.DISABLED, "Versioning disabled for " + scope);
        }
        if (!force && settings.overHeadroom()) {
            return VersionDecision.skip(SkipReason.QUOTA_EXCEEDED, String.format(
                    "Quota for %s over headroom (%d of %d bytes used)",
                    scope, settings.currentUsageBytes(), settings.maxSizeBytes()));
        }
        return VersionDecision.createVersion();
    }

    public VersionRecord createVersion(long fileId, ScopeKey scope, byte[] content, ChangeKind changeKind) {
        return createVersion(VersionRequest.of(fileId, scope, content, changeKind));
    }

    public VersionRecord createVersion(long fileId, ScopeKey scope, byte[] content, ChangeKind changeKind,
                                       ContentHash digest, boolean priority) {
        return createVersion(VersionRequest.of(fileId, scope, content, changeKind)
                .withDigest(digest)
                .withPriority(priority));
    }

    /**
     * Stores the content (deduplicated) and appends the next version for the file.
     */
    public VersionRecord createVersion(VersionRequest request) {
        ContentHash digest = request.digest() != null ? request.digest() : Checksums.digest(request.content());
        QuotaScopeRecord scope = quota.getScope(request.scope());
        CompressionCodec codec = blobs.codecFor(scope.compressionEnabled());

        VersionRecord version = locks.withFileLock(request.fileId(), () ->
                locks.withDigestLock(digest, () -> {
                    try {
                        return jdbi.inTransaction(h -> insertVersion(h, request, digest, codec));
                    } catch (RuntimeException e) {
                        blobs.discardUncatalogued(digest);
                        throw e;
                    }
                }));

        log.debugf("Created version %d of file %d (%s, %s, %d->%d bytes)",
                version.versionNumber(), version.fileId(), version.storageKind().label(),
                version.changeKind().label(), version.rawSize(), version.compressedSize());
        return version;
    }

    private VersionRecord insertVersion(Handle h, VersionRequest request, ContentHash digest,
                                        CompressionCodec codec) {
        BlobResult blob = blobs.getOrCreate(h, request.content(), digest, codec);
        VersionDao dao = h.attach(VersionDao.class);

        int number = dao.maxVersionNumber(request.fileId()) + 1;
        // a revived blob has no other holder left, so this version carries its cost
        StorageKind kind = blob.created() || blob.revived() ? StorageKind.PRIMARY : StorageKind.SHARED;
        long rawSize = request.content().length;
        long compressedSize = blob.blob().compressedSize();
        double ratio = compressedSize > 0 ? (double) rawSize / compressedSize : 1.0;

        long id = dao.insert(new NewVersion(request.fileId(), request.scope().ownerId(), number,
                blob.blob().id(), kind, request.changeKind(), rawSize, compressedSize, ratio,
                digest.toHex(), request.priority(), request.comment(), request.wasCached(),
                request.cacheDurationSeconds()));

        if (kind == StorageKind.PRIMARY) {
            quota.adjustUsage(h, request.scope(), compressedSize);
        }

        VersionRecord version = dao.findById(id).orElseThrow();
        stats.apply(h, BlobStore.deltaFor(blob).plus(StatsAggregator.versionCreated(version)));
        return version;
    }

    public byte[] getVersionContent(long versionId) {
        return getVersionContent(findVersion(versionId)
                .orElseThrow(() -> new VersionNotFoundException(versionId)));
    }

    public byte[] getVersionContent(VersionRecord version) {
        BlobRecord blob = blobs.findById(version.blobId())
                .orElseThrow(() -> new BlobNotFoundException(version.contentHash()));
        return blobs.readContent(blob);
    }

    public long deleteVersion(VersionRecord version) {
        return deleteVersion(version.id());
    }

    /**
     * Deletes the version and releases its blob; an unreferenced blob is removed at once.
     *
     * @return bytes physically freed, 0 while other versions still hold the blob
     * @throws VersionNotFoundException if the version does not exist
     */
    public long deleteVersion(long versionId) {
        VersionRecord version = findVersion(versionId)
                .orElseThrow(() -> new VersionNotFoundException(versionId));
        return delete(version.fileId(), versionId, false, true)
                .map(VersionDeletion::freedBytes)
                .orElseThrow(() -> new VersionNotFoundException(versionId));
    }

    /**
     * Reclaim-path delete. Re-checks under the file lock that the version is not its file's
     * newest and, unless {@code includePriority}, not a priority version.
     *
     * @return empty if the version is gone or no longer eligible
     */
    public Optional<VersionDeletion> deleteIfEvictable(VersionRecord version, boolean includePriority) {
        return delete(version.fileId(), version.id(), true, includePriority);
    }

    private Optional<VersionDeletion> delete(long fileId, long versionId, boolean evictableOnly,
                                             boolean includePriority) {
        return locks.withFileLock(fileId, () -> {
            Optional<VersionRecord> current = findVersion(versionId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            VersionRecord version = current.get();
            if (evictableOnly) {
                if (version.priority() && !includePriority) {
                    return Optional.empty();
                }
                Optional<VersionRecord> latest = latestVersion(fileId);
                if (latest.isEmpty() || latest.get().id() == versionId) {
                    return Optional.empty();
                }
            }

            return locks.withDigestLock(version.contentHash(), () -> {
                Optional<BlobRecord> removedBlob = jdbi.inTransaction(h -> removeVersion(h, version));
                long freed = removedBlob.map(blobs::removeObject).orElse(0L);
                log.debugf("Deleted version %d of file %d, freed %d bytes",
                        version.versionNumber(), fileId, freed);
                return Optional.of(new VersionDeletion(version, freed, removedBlob.isPresent()));
            });
        });
    }

    private Optional<BlobRecord> removeVersion(Handle h, VersionRecord version) {
        int remaining = blobs.decrementReference(h, version.blobId());
        BlobRecord blob = h.attach(BlobDao.class).findById(version.blobId()).orElseThrow();
        h.attach(VersionDao.class).delete(version.id());

        if (version.isPrimary()) {
            quota.adjustUsage(h, version.scope(), -version.compressedSize());
        }

        StatsDelta delta = StatsAggregator.versionDeleted(version)
                .plus(StatsAggregator.referenceReleased(blob, remaining));
        Optional<BlobRecord> removed = Optional.empty();
        if (remaining == 0) {
            removed = blobs.deleteRow(h, blob.id());
            if (removed.isPresent()) {
                delta = delta.plus(StatsAggregator.blobDeleted());
            }
        }
        stats.apply(h, delta);
        return removed;
    }

    public Optional<VersionRecord> findVersion(long versionId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.findById(versionId));
    }

    public Optional<VersionRecord> latestVersion(long fileId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.findLatest(fileId));
    }

    /** Newest first. */
    public List<VersionRecord> listVersions(long fileId) {
        return jdbi.withExtension(VersionDao.class, dao -> dao.listByFile(fileId));
    }

    public List<VersionRecord> listVersions(long fileId, int limit, int offset) {
        if (limit < 1 || offset < 0) {
            throw new IllegalArgumentException("limit must be >= 1 and offset >= 0");
        }
        return jdbi.withExtension(VersionDao.class, dao -> dao.listByFile(fileId, limit, offset));
    }

    /** All versions owned by the scope, newest first. */
    public List<VersionRecord> listScopeVersions(ScopeKey scope) {
        if (scope.isGlobal()) {
            return List.of();
        }
        return jdbi.withExtension(VersionDao.class, dao -> dao.listByOwner(scope.ownerId()));
    }

    /**
     * Flags or unflags a version as protected from non-forced eviction.
     */
    public VersionRecord setPriority(long versionId, boolean priority) {
        VersionRecord version = findVersion(versionId)
                .orElseThrow(() -> new VersionNotFoundException(versionId));
        return locks.withFileLock(version.fileId(), () -> jdbi.inTransaction(h -> {
            VersionDao dao = h.attach(VersionDao.class);
            VersionRecord current = dao.findById(versionId)
                    .orElseThrow(() -> new VersionNotFoundException(versionId));
            if (current.priority() == priority) {
                return current;
            }
            dao.setPriority(versionId, priority);
            stats.apply(h, StatsAggregator.priorityChanged(priority));
            return dao.findById(versionId).orElseThrow();
        }));
    }
}
