package com.libragraph.vcl.core.batch;

import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.core.dao.VersionRecord;
import com.libragraph.vcl.core.lock.VclLocks;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.version.VersionDecision;
import com.libragraph.vcl.core.version.VersionRequest;
import com.libragraph.vcl.core.version.VersionStore;
import com.libragraph.vcl.types.ChangeKind;
import com.libragraph.vcl.util.Checksums;
import com.libragraph.vcl.util.ContentHash;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Debounces rapid writes to the same file into a single {@code BATCHED} version.
 *
 * <p>A queued write replaces any pending content for the file and restarts its debounce timer.
 * The pending write is flushed after the scope's debounce window of quiet, or at the latest once
 * it has been pending for the scope's max batch window.
 *
 * <p>Persists for a file run under its file lock. A write older than one already persisted
 * for the same file is dropped, so a late scheduled flush never overtakes newer content.
 */
@ApplicationScoped
public class VersionBatchCache {

    private static final Logger log = Logger.getLogger(VersionBatchCache.class);

    @Inject
    VersionStore versions;

    @Inject
    QuotaLedger quota;

    @Inject
    VclLocks locks;

    private final ConcurrentHashMap<Long, PendingWrite> pending = new ConcurrentHashMap<>();
    // newest generation persisted (or skipped) per file
    private final ConcurrentHashMap<Long, Long> persistedGenerations = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "vcl-batch-flush");
        t.setDaemon(true);
        return t;
    });

    /**
     * Queues the content as the file's pending version, replacing earlier pending content.
     */
    public synchronized void queue(long fileId, ScopeKey scope, byte[] content) {
        QuotaScopeRecord settings = quota.getScope(scope);
        long now = System.nanoTime();

        PendingWrite previous = pending.get(fileId);
        long firstQueued = now;
        if (previous != null) {
            previous.cancelTimer();
            firstQueued = previous.firstQueuedNanos;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(now - firstQueued);
        long debounceMs = TimeUnit.SECONDS.toMillis(settings.debounceWindowSeconds());
        long remainingWindowMs = Math.max(0, TimeUnit.SECONDS.toMillis(settings.maxBatchWindowSeconds()) - elapsedMs);
        long delayMs = Math.min(debounceMs, remainingWindowMs);

        PendingWrite write = new PendingWrite(fileId, scope, content.clone(), firstQueued,
                generations.incrementAndGet());
        pending.put(fileId, write);
        write.timer = scheduler.schedule(() -> flushScheduled(fileId, write.generation),
                delayMs, TimeUnit.MILLISECONDS);
        log.debugf("Queued write for file %d (%d bytes), flush in %d ms", fileId, content.length, delayMs);
    }

    /**
     * Flushes the file's pending write now.
     *
     * @return the created version, or empty if nothing was pending or the write was skipped
     */
    public Optional<VersionRecord> flush(long fileId) {
        PendingWrite write;
        synchronized (this) {
            write = pending.remove(fileId);
            if (write == null) {
                return Optional.empty();
            }
            write.cancelTimer();
        }
        return persist(write);
    }

    public List<VersionRecord> flushAll() {
        List<VersionRecord> created = new ArrayList<>();
        for (Long fileId : List.copyOf(pending.keySet())) {
            try {
                flush(fileId).ifPresent(created::add);
            } catch (RuntimeException e) {
                log.errorf(e, "Failed to flush pending write for file %d", fileId);
            }
        }
        return created;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(long fileId) {
        return pending.containsKey(fileId);
    }

    @PreDestroy
    void shutdown() {
        List<VersionRecord> flushed = flushAll();
        if (!flushed.isEmpty()) {
            log.infof("Flushed %d pending versions at shutdown", flushed.size());
        }
        scheduler.shutdownNow();
    }

    private void flushScheduled(long fileId, long generation) {
        PendingWrite write;
        synchronized (this) {
            write = pending.get(fileId);
            if (write == null || write.generation != generation) {
                return;
            }
            pending.remove(fileId);
        }
        try {
            persist(write);
        } catch (RuntimeException e) {
            log.errorf(e, "Scheduled flush for file %d failed, pending content dropped", fileId);
        }
    }

    private Optional<VersionRecord> persist(PendingWrite write) {
        return locks.withFileLock(write.fileId, () -> {
            long newest = persistedGenerations.getOrDefault(write.fileId, 0L);
            if (newest > write.generation) {
                log.debugf("Stale batched write for file %d dropped (generation %d < %d)",
                        write.fileId, write.generation, newest);
                return Optional.empty();
            }
            persistedGenerations.put(write.fileId, write.generation);
            return persistLocked(write);
        });
    }

    private Optional<VersionRecord> persistLocked(PendingWrite write) {
        ContentHash digest = Checksums.digest(write.content);
        VersionDecision decision = versions.shouldCreateVersion(write.fileId, digest, write.scope,
                write.content.length);
        if (!decision.create()) {
            log.debugf("Batched write for file %d skipped: %s", write.fileId, decision.message());
            return Optional.empty();
        }
        int cachedSeconds = (int) TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - write.firstQueuedNanos);
        VersionRecord version = versions.createVersion(
                VersionRequest.of(write.fileId, write.scope, write.content, ChangeKind.BATCHED)
                        .withDigest(digest)
                        .cached(cachedSeconds));
        log.debugf("Flushed batched version %d of file %d after %d s",
                version.versionNumber(), write.fileId, cachedSeconds);
        return Optional.of(version);
    }

    private static final class PendingWrite {
        final long fileId;
        final ScopeKey scope;
        final byte[] content;
        final long firstQueuedNanos;
        final long generation;
        volatile ScheduledFuture<?> timer;

        PendingWrite(long fileId, ScopeKey scope, byte[] content, long firstQueuedNanos, long generation) {
            this.fileId = fileId;
            this.scope = scope;
            this.content = content;
            this.firstQueuedNanos = firstQueuedNanos;
            this.generation = generation;
        }

        void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
