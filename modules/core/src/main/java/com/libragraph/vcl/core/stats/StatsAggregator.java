package com.libragraph.vcl.core.stats;

import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.CatalogTotals;
import com.libragraph.vcl.core.dao.QuotaScopeDao;
import com.libragraph.vcl.core.dao.StatsDao;
import com.libragraph.vcl.core.dao.StatsDelta;
import com.libragraph.vcl.core.dao.VersionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

/**
 * Maintains the global counters incrementally and can rebuild them from the catalog.
 *
 * <p>The {@code Handle} variants join the caller's transaction. Callers update the stats row
 * last, after blob, version and quota rows, so row locks are always taken in that order.
 */
@ApplicationScoped
public class StatsAggregator {

    private static final Logger log = Logger.getLogger(StatsAggregator.class);

    @Inject
    Jdbi jdbi;

    public GlobalStats current() {
        return GlobalStats.of(jdbi.withExtension(StatsDao.class, StatsDao::get));
    }

    public void recordVersionCreated(VersionRecord version) {
        jdbi.useHandle(h -> apply(h, versionCreated(version)));
    }

    public void recordVersionDeleted(VersionRecord version) {
        jdbi.useHandle(h -> apply(h, versionDeleted(version)));
    }

    public void recordBlobCreated() {
        jdbi.useHandle(h -> apply(h, blobCreated()));
    }

    public void recordBlobDeleted() {
        jdbi.useHandle(h -> apply(h, blobDeleted()));
    }

    public void apply(Handle h, StatsDelta delta) {
        if (delta.isEmpty()) {
            return;
        }
        h.attach(StatsDao.class).apply(delta);
    }

    public static StatsDelta versionCreated(VersionRecord v) {
        return new StatsDelta(1, v.rawSize(), v.compressedSize(), 0, 0,
                v.priority() ? 1 : 0, v.wasCached() ? 1 : 0, 0);
    }

    public static StatsDelta versionDeleted(VersionRecord v) {
        return new StatsDelta(-1, -v.rawSize(), -v.compressedSize(), 0, 0,
                v.priority() ? -1 : 0, v.wasCached() ? -1 : 0, 0);
    }

    public static StatsDelta blobCreated() {
        return new StatsDelta(0, 0, 0, 1, 1, 0, 0, 0);
    }

    /** Row removal only; the blob stopped counting as unique when its last reference went. */
    public static StatsDelta blobDeleted() {
        return new StatsDelta(0, 0, 0, -1, 0, 0, 0, 0);
    }

    /**
     * A new reference to an existing blob: either revives an unreferenced blob or adds a
     * duplicate that saves {@code originalSize} bytes.
     */
    public static StatsDelta referenceAdded(BlobRecord blob, boolean revived) {
        if (revived) {
            return new StatsDelta(0, 0, 0, 0, 1, 0, 0, 0);
        }
        return new StatsDelta(0, 0, 0, 0, 0, 0, 0, blob.originalSize());
    }

    public static StatsDelta referenceReleased(BlobRecord blob, int remainingCount) {
        if (remainingCount == 0) {
            return new StatsDelta(0, 0, 0, 0, -1, 0, 0, 0);
        }
        return new StatsDelta(0, 0, 0, 0, 0, 0, 0, -blob.originalSize());
    }

    public static StatsDelta priorityChanged(boolean nowPriority) {
        return new StatsDelta(0, 0, 0, 0, 0, nowPriority ? 1 : -1, 0, 0);
    }

    public void recordPriorityRun() {
        jdbi.useExtension(StatsDao.class, StatsDao::markPriorityRun);
    }

    public void recordCleanup() {
        jdbi.useExtension(StatsDao.class, StatsDao::markCleanup);
    }

    /**
     * Rebuilds every counter from the version and blob tables, then re-derives each owner
     * scope's usage from its primary versions. Idempotent.
     */
    public GlobalStats recompute() {
        GlobalStats before = current();
        GlobalStats after = jdbi.inTransaction(h -> {
            StatsDao dao = h.attach(StatsDao.class);
            dao.lock();
            CatalogTotals totals = dao.computeTotals();
            dao.overwrite(totals);
            return GlobalStats.of(dao.get());
        });
        int scopes = jdbi.withExtension(QuotaScopeDao.class, QuotaScopeDao::recomputeOwnerUsage);

        if (before.totalVersions() != after.totalVersions()
                || before.totalCompressedBytes() != after.totalCompressedBytes()
                || before.totalBlobs() != after.totalBlobs()) {
            log.warnf("Stats drift corrected: versions %d -> %d, compressed %d -> %d, blobs %d -> %d",
                    before.totalVersions(), after.totalVersions(),
                    before.totalCompressedBytes(), after.totalCompressedBytes(),
                    before.totalBlobs(), after.totalBlobs());
        } else {
            log.debugf("Stats recomputed, no drift (%d scope usages refreshed)", scopes);
        }
        return after;
    }
}
