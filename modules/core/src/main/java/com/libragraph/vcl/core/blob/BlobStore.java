package com.libragraph.vcl.core.blob;

import com.libragraph.vcl.core.dao.BlobDao;
import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.StatsDelta;
import com.libragraph.vcl.core.lock.VclLocks;
import com.libragraph.vcl.core.stats.StatsAggregator;
import com.libragraph.vcl.core.storage.BlobNotFoundException;
import com.libragraph.vcl.core.storage.ObjectStorage;
import com.libragraph.vcl.formats.api.Compressed;
import com.libragraph.vcl.formats.api.CompressionCodec;
import com.libragraph.vcl.formats.api.DecodeException;
import com.libragraph.vcl.formats.codecs.StoreCodec;
import com.libragraph.vcl.formats.registry.CodecRegistry;
import com.libragraph.vcl.util.Checksums;
import com.libragraph.vcl.util.ContentHash;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the unique compressed content, keyed by digest, and its reference counts.
 *
 * <p>Every mutation for a digest runs under that digest's lock, around the whole database
 * transaction, so check-then-insert and count changes never interleave with a delete.
 * Methods taking a {@link Handle} join the caller's transaction; the caller must already hold
 * the digest lock and is responsible for the stats delta.
 */
@ApplicationScoped
public class BlobStore {

    private static final Logger log = Logger.getLogger(BlobStore.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectStorage storage;

    @Inject
    CodecRegistry codecs;

    @Inject
    VclLocks locks;

    @Inject
    StatsAggregator stats;

    @ConfigProperty(name = "vcl.storage.codec", defaultValue = "gzip")
    String codecName;

    @PostConstruct
    void init() {
        codecs.require(codecName);
        log.infof("Blob store at %s, codec=%s", storage.root().toAbsolutePath(), codecName);
    }

    public CompressionCodec defaultCodec() {
        return codecs.require(codecName);
    }

    /** Codec for new blobs in a scope; scopes with compression disabled store bytes as-is. */
    public CompressionCodec codecFor(boolean compressionEnabled) {
        return compressionEnabled ? defaultCodec() : codecs.require(StoreCodec.NAME);
    }

    public Optional<BlobRecord> find(ContentHash digest) {
        return jdbi.withExtension(BlobDao.class, dao -> dao.findByDigest(digest.toHex()));
    }

    public Optional<BlobRecord> findById(long id) {
        return jdbi.withExtension(BlobDao.class, dao -> dao.findById(id));
    }

    public List<BlobRecord> findOrphans() {
        return jdbi.withExtension(BlobDao.class, BlobDao::findOrphans);
    }

    /**
     * The dedup primitive: references the existing blob for {@code digest}, or compresses and
     * stores {@code content} as a new blob with one reference.
     */
    public BlobResult getOrCreate(byte[] content, ContentHash digest) {
        Objects.requireNonNull(content, "content cannot be null");
        ContentHash key = digest != null ? digest : Checksums.digest(content);
        CompressionCodec codec = defaultCodec();
        return locks.withDigestLock(key, () -> {
            try {
                return jdbi.inTransaction(h -> {
                    BlobResult result = getOrCreate(h, content, key, codec);
                    stats.apply(h, deltaFor(result));
                    return result;
                });
            } catch (RuntimeException e) {
                discardUncatalogued(key);
                throw e;
            }
        });
    }

    /**
     * Transactional form. The caller holds the digest lock and calls
     * {@link #discardUncatalogued} if its transaction fails.
     */
    public BlobResult getOrCreate(Handle h, byte[] content, ContentHash digest, CompressionCodec codec) {
        BlobDao dao = h.attach(BlobDao.class);
        Optional<BlobRecord> existing = dao.findByDigest(digest.toHex());

        if (existing.isPresent()) {
            BlobRecord blob = existing.get();
            dao.incrementReference(blob.id());
            if (!storage.exists(digest).await().indefinitely()) {
                log.warnf("Blob %d catalogued without stored bytes, rewriting %s", blob.id(), digest.shortHex());
                storage.write(digest, encode(content, blob.codec())).await().indefinitely();
            }
            BlobRecord updated = dao.findById(blob.id()).orElseThrow();
            log.debugf("Dedup hit: digest=%s refs=%d", digest.shortHex(), updated.referenceCount());
            return new BlobResult(updated, false, blob.referenceCount() == 0);
        }

        Compressed compressed = codec.compress(content);
        storage.write(digest, compressed.data()).await().indefinitely();
        long id = dao.insert(digest.toHex(), storage.keyFor(digest), codec.name(),
                content.length, compressed.size());
        log.debugf("New blob stored: digest=%s id=%d size=%d->%d (%s)",
                digest.shortHex(), id, content.length, compressed.size(), codec.name());
        return new BlobResult(dao.findById(id).orElseThrow(), true, false);
    }

    public static StatsDelta deltaFor(BlobResult result) {
        if (result.created()) {
            return StatsAggregator.blobCreated();
        }
        return StatsAggregator.referenceAdded(result.blob(), result.revived());
    }

    /**
     * Adds a reference for a version that independently resolved to an existing digest.
     */
    public BlobRecord incrementReference(BlobRecord blob) {
        return locks.withDigestLock(blob.contentHash(), () -> jdbi.inTransaction(h -> {
            int previous = incrementReference(h, blob.id());
            stats.apply(h, StatsAggregator.referenceAdded(blob, previous == 0));
            return h.attach(BlobDao.class).findById(blob.id()).orElseThrow();
        }));
    }

    /**
     * @return the reference count before the increment
     * @throws BlobNotFoundException if the blob row no longer exists
     */
    public int incrementReference(Handle h, long blobId) {
        BlobDao dao = h.attach(BlobDao.class);
        int previous = dao.referenceCount(blobId).orElseThrow(() -> new BlobNotFoundException(blobId));
        dao.incrementReference(blobId);
        return previous;
    }

    /**
     * Drops one reference. At zero the blob is marked pending delete; bytes stay until
     * {@link #delete} runs.
     */
    public BlobRecord decrementReference(BlobRecord blob) {
        return locks.withDigestLock(blob.contentHash(), () -> jdbi.inTransaction(h -> {
            int remaining = decrementReference(h, blob.id());
            stats.apply(h, StatsAggregator.referenceReleased(blob, remaining));
            return h.attach(BlobDao.class).findById(blob.id()).orElseThrow();
        }));
    }

    /**
     * @return the reference count after the decrement
     * @throws BlobNotFoundException if the blob row no longer exists
     * @throws IllegalStateException if the count is already zero
     */
    public int decrementReference(Handle h, long blobId) {
        BlobDao dao = h.attach(BlobDao.class);
        if (dao.referenceCount(blobId).isEmpty()) {
            throw new BlobNotFoundException(blobId);
        }
        if (dao.decrementReference(blobId) == 0) {
            throw new IllegalStateException("Blob " + blobId + " has no reference to release");
        }
        return dao.referenceCount(blobId).orElseThrow();
    }

    /**
     * Hard-deletes an unreferenced blob: catalog row first, then the stored object.
     *
     * @return bytes freed (the compressed size), or 0 if the row or object was already gone
     * @throws BlobReferencedException if the blob still has references
     */
    public long delete(BlobRecord blob) {
        return locks.withDigestLock(blob.contentHash(), () -> {
            Optional<BlobRecord> removed = jdbi.inTransaction(h -> {
                Optional<BlobRecord> row = deleteRow(h, blob.id());
                if (row.isPresent()) {
                    stats.apply(h, StatsAggregator.blobDeleted());
                }
                return row;
            });
            return removed.map(this::removeObject).orElse(0L);
        });
    }

    /**
     * Guarded catalog delete inside the caller's transaction.
     *
     * @return the deleted row, or empty if no such row exists
     * @throws BlobReferencedException if the blob still has references
     */
    public Optional<BlobRecord> deleteRow(Handle h, long blobId) {
        BlobDao dao = h.attach(BlobDao.class);
        Optional<BlobRecord> current = dao.findById(blobId);
        if (current.isEmpty()) {
            log.debugf("Blob %d already deleted", blobId);
            return Optional.empty();
        }
        if (dao.deleteUnreferenced(blobId) == 0) {
            throw new BlobReferencedException(blobId, current.get().referenceCount());
        }
        return current;
    }

    /**
     * Removes stored bytes for a blob whose row is gone. Call after the row delete committed.
     *
     * @return the compressed size, or 0 when the object was already missing
     */
    public long removeObject(BlobRecord blob) {
        try {
            storage.delete(blob.contentHash()).await().indefinitely();
            log.debugf("Deleted blob %s (id %d), freed %d bytes", blob.digest(), blob.id(), blob.compressedSize());
            return blob.compressedSize();
        } catch (BlobNotFoundException e) {
            log.warnf("Blob %d had no stored object at %s", blob.id(), blob.storageKey());
            return 0;
        }
    }

    /**
     * Removes stored bytes written by a transaction that rolled back. Caller holds the digest lock.
     */
    public void discardUncatalogued(ContentHash digest) {
        try {
            boolean catalogued = jdbi.withExtension(BlobDao.class,
                    dao -> dao.findByDigest(digest.toHex()).isPresent());
            if (!catalogued && storage.exists(digest).await().indefinitely()) {
                storage.delete(digest).await().indefinitely();
                log.debugf("Discarded uncatalogued object %s", digest.shortHex());
            }
        } catch (RuntimeException e) {
            log.warnf(e, "Could not discard uncatalogued object %s", digest.shortHex());
        }
    }

    /**
     * Decompresses and returns the original content, verifying it against the digest.
     *
     * @throws BlobNotFoundException if the stored object is missing
     * @throws DecodeException if the content is corrupt; the blob is flagged corrupt
     */
    public byte[] readContent(BlobRecord blob) {
        ContentHash digest = blob.contentHash();
        byte[] stored = storage.read(digest).await().indefinitely();
        try {
            byte[] content = codecs.require(blob.codec()).decompress(stored);
            if (!Checksums.digest(content).equals(digest)) {
                throw new DecodeException(blob.codec(), "Digest mismatch for blob " + blob.id());
            }
            jdbi.useExtension(BlobDao.class, dao -> dao.touch(blob.id()));
            return content;
        } catch (DecodeException e) {
            log.errorf("Blob %d (%s) is corrupt: %s", blob.id(), digest.shortHex(), e.getMessage());
            jdbi.useExtension(BlobDao.class, dao -> dao.markCorrupt(blob.id()));
            throw e;
        }
    }

    private byte[] encode(byte[] content, String codec) {
        return codecs.require(codec).compress(content).data();
    }
}
