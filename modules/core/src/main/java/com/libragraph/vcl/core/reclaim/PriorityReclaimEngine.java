package com.libragraph.vcl.core.reclaim;

import com.libragraph.vcl.core.blob.BlobReferencedException;
import com.libragraph.vcl.core.blob.BlobStore;
import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.core.dao.VersionDao;
import com.libragraph.vcl.core.dao.VersionRecord;
import com.libragraph.vcl.core.quota.CleanupDecision;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.stats.StatsAggregator;
import com.libragraph.vcl.core.version.VersionDeletion;
import com.libragraph.vcl.core.version.VersionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Frees version storage in three ordered stages: depth enforcement, priority-ordered eviction
 * and an orphan blob sweep.
 *
 * <p>Each deletion is atomic on its own; a pass can stop between candidates (thread interrupt)
 * and be resumed by the next run. Failures on one candidate are logged, recorded in the stage
 * report and skipped. A file's newest version is never removed.
 */
@ApplicationScoped
public class PriorityReclaimEngine {

    private static final Logger log = Logger.getLogger(PriorityReclaimEngine.class);

    @Inject
    Jdbi jdbi;

    @Inject
    VersionStore versions;

    @Inject
    BlobStore blobs;

    @Inject
    QuotaLedger quota;

    @Inject
    StatsAggregator stats;

    // --- Stage 1 ---

    /**
     * Trims every file in the scope back to its max depth, oldest non-priority versions first.
     * Runs regardless of quota pressure.
     */
    public StageReport enforceDepth(ScopeKey scope, boolean dryRun) {
        return enforceDepth(quota.getScope(scope), dryRun, new ReclaimSimulation());
    }

    private StageReport enforceDepth(QuotaScopeRecord scope, boolean dryRun, ReclaimSimulation simulation) {
        StageReport.Builder report = new StageReport.Builder(ReclaimStage.DEPTH_ENFORCING, dryRun);
        int ownerId = requireOwner(scope);
        int maxDepth = scope.maxDepth();

        List<Long> files = jdbi.withExtension(VersionDao.class, dao -> dao.filesOverDepth(ownerId, maxDepth));
        for (long fileId : files) {
            if (interrupted(ReclaimStage.DEPTH_ENFORCING)) {
                break;
            }
            report.fileProcessed();
            List<VersionRecord> excess = jdbi.withExtension(VersionDao.class, dao -> {
                int count = dao.countByFile(fileId);
                return dao.oldestTrimmable(fileId, ownerId, Math.max(0, count - maxDepth));
            });
            for (VersionRecord version : excess) {
                remove(version, false, dryRun, simulation, report);
            }
        }

        StageReport result = report.build();
        if (result.deletedVersionCount() > 0) {
            log.infof("Depth enforcement for %s%s: %d versions over %d files, %d bytes freed",
                    scope.scope(), dryRunTag(dryRun), result.deletedVersionCount(),
                    result.filesProcessed(), result.freedBytes());
        }
        return result;
    }

    // --- Stage 2 ---

    public StageReport evictByPriority(ScopeKey scope, boolean dryRun, boolean includeHighPriority) {
        return evictByPriority(scope, null, null, includeHighPriority, dryRun);
    }

    /**
     * Deletes eviction candidates (non-priority before priority, oldest first) until the freed
     * bytes reach the target or candidates run out.
     *
     * @param targetBytes bytes to free; {@code null} uses the scope's computed reduction target
     * @param minAge      only versions older than this are candidates; {@code null} for no limit
     */
    public StageReport evictByPriority(ScopeKey scope, Long targetBytes, Duration minAge,
                                       boolean includeHighPriority, boolean dryRun) {
        QuotaScopeRecord record = quota.getScope(scope);
        long target = targetBytes != null ? targetBytes : QuotaLedger.targetReductionBytes(record);
        return evictByPriority(record, target, minAge, includeHighPriority, dryRun, new ReclaimSimulation());
    }

    private StageReport evictByPriority(QuotaScopeRecord scope, long target, Duration minAge,
                                        boolean includeHighPriority, boolean dryRun,
                                        ReclaimSimulation simulation) {
        int ownerId = requireOwner(scope);
        StageReport.Builder report = new StageReport.Builder(ReclaimStage.PRIORITY_EVICTING, dryRun).target(target);
        if (target <= 0) {
            return report.build();
        }
        Instant cutoff = minAge != null ? Instant.now().minus(minAge) : null;

        List<VersionRecord> candidates = jdbi.withExtension(VersionDao.class,
                dao -> cutoff == null
                        ? dao.evictionCandidates(ownerId, includeHighPriority)
                        : dao.evictionCandidatesBefore(ownerId, includeHighPriority, cutoff));
        for (VersionRecord version : candidates) {
            if (report.freedBytes() >= target || interrupted(ReclaimStage.PRIORITY_EVICTING)) {
                break;
            }
            if (simulation.picked(version.id())) {
                continue;
            }
            remove(version, includeHighPriority, dryRun, simulation, report);
        }

        StageReport result = report.build();
        log.infof("Priority eviction for %s%s: %d versions, %d of %d target bytes freed",
                scope.scope(), dryRunTag(dryRun), result.deletedVersionCount(), result.freedBytes(), target);
        if (result.freedBytes() < target) {
            log.warnf("Priority eviction for %s ran out of candidates %d bytes short of target",
                    scope.scope(), target - result.freedBytes());
        }
        return result;
    }

    // --- Stage 3 ---

    /**
     * Deletes every unreferenced blob, whatever scope last used it.
     */
    public StageReport sweepOrphans(boolean dryRun) {
        return sweepOrphans(dryRun, new ReclaimSimulation());
    }

    private StageReport sweepOrphans(boolean dryRun, ReclaimSimulation simulation) {
        StageReport.Builder report = new StageReport.Builder(ReclaimStage.ORPHAN_SWEEPING, dryRun);
        for (BlobRecord blob : blobs.findOrphans()) {
            if (interrupted(ReclaimStage.ORPHAN_SWEEPING)) {
                break;
            }
            if (dryRun) {
                if (!simulation.blobReleased(blob.id())) {
                    report.blob(DeletedBlob.of(blob, blob.compressedSize()));
                }
                continue;
            }
            try {
                long freed = blobs.delete(blob);
                report.blob(DeletedBlob.of(blob, freed));
            } catch (BlobReferencedException e) {
                log.debugf("Blob %d was referenced again before the sweep reached it", blob.id());
            } catch (RuntimeException e) {
                log.warnf(e, "Failed to delete orphan blob %d (%s)", blob.id(), blob.digest());
                report.failure("blob " + blob.id() + ": " + e.getMessage());
            }
        }

        StageReport result = report.build();
        if (result.deletedBlobCount() > 0) {
            log.infof("Orphan sweep%s: %d blobs, %d bytes freed",
                    dryRunTag(dryRun), result.deletedBlobCount(), result.freedBytes());
        }
        return result;
    }

    // --- Passes ---

    public ReclaimReport reclaim(ScopeKey scope, boolean dryRun) {
        return reclaim(scope, dryRun, false);
    }

    /**
     * Full pass over one scope: depth enforcement, priority eviction when the scope needs
     * cleanup, then an orphan sweep.
     */
    public ReclaimReport reclaim(ScopeKey scope, boolean dryRun, boolean includeHighPriority) {
        ReclaimSimulation simulation = new ReclaimSimulation();
        ReclaimReport report = reclaimScope(scope, dryRun, includeHighPriority, simulation, true);
        if (!dryRun) {
            stats.recordCleanup();
        }
        return report;
    }

    public ReclaimReport autoCleanup(ScopeKey scope) {
        return autoCleanup(scope, false);
    }

    public ReclaimReport autoCleanup(ScopeKey scope, boolean dryRun) {
        return reclaim(scope, dryRun, false);
    }

    /**
     * Reclaims every scope that owns versions or has settings, then sweeps orphans once.
     */
    public GlobalCleanupReport globalCleanup(boolean dryRun) {
        TreeSet<Integer> owners = new TreeSet<>(jdbi.withExtension(VersionDao.class, VersionDao::listOwners));
        quota.listScopes().stream()
                .map(QuotaScopeRecord::ownerId)
                .filter(Objects::nonNull)
                .forEach(owners::add);

        log.infof("Global cleanup%s over %d scopes", dryRunTag(dryRun), owners.size());
        ReclaimSimulation simulation = new ReclaimSimulation();
        List<ReclaimReport> reports = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (int ownerId : owners) {
            if (interrupted(ReclaimStage.IDLE)) {
                break;
            }
            ScopeKey scope = ScopeKey.owner(ownerId);
            try {
                reports.add(reclaimScope(scope, dryRun, false, simulation, false));
            } catch (RuntimeException e) {
                log.warnf(e, "Cleanup of %s failed", scope);
                failures.add(scope + ": " + e.getMessage());
            }
        }
        StageReport sweep = sweepOrphans(dryRun, simulation);
        if (!dryRun) {
            stats.recordCleanup();
        }

        GlobalCleanupReport report = GlobalCleanupReport.of(dryRun, reports, sweep, failures);
        log.infof("Global cleanup%s done: %d versions, %d blobs, %d bytes freed",
                dryRunTag(dryRun), report.totalDeletedVersions(), report.totalDeletedBlobs(),
                report.totalFreedBytes());
        return report;
    }

    private ReclaimReport reclaimScope(ScopeKey scope, boolean dryRun, boolean includeHighPriority,
                                       ReclaimSimulation simulation, boolean sweep) {
        QuotaScopeRecord record = quota.getScope(scope);
        CleanupDecision decision = QuotaLedger.needsCleanup(record);
        log.debugf("Reclaim %s%s: needs cleanup=%s (%s)", scope, dryRunTag(dryRun),
                decision.needed(), decision.reason());

        StageReport depth = enforceDepth(record, dryRun, simulation);

        StageReport priority;
        if (decision.needed()) {
            long target;
            if (dryRun) {
                long usage = record.currentUsageBytes() - simulation.usageReleased(record.ownerId());
                target = QuotaLedger.targetReductionBytes(usage, record.cleanupThreshold());
            } else {
                target = QuotaLedger.targetReductionBytes(quota.getScope(scope));
            }
            priority = evictByPriority(record, target, null, includeHighPriority, dryRun, simulation);
            if (!dryRun) {
                stats.recordPriorityRun();
            }
        } else {
            priority = StageReport.skipped(ReclaimStage.PRIORITY_EVICTING, dryRun);
        }

        StageReport orphans = sweep
                ? sweepOrphans(dryRun, simulation)
                : StageReport.skipped(ReclaimStage.ORPHAN_SWEEPING, dryRun);

        log.debugf("Reclaim %s reached %s", scope, ReclaimStage.DONE);
        return ReclaimReport.of(record.ownerId(), dryRun, decision.needed(), decision.reason(),
                depth, priority, orphans);
    }

    private void remove(VersionRecord version, boolean includeHighPriority, boolean dryRun,
                        ReclaimSimulation simulation, StageReport.Builder report) {
        if (dryRun) {
            Optional<BlobRecord> released = simulation.release(version, blobs::findById);
            long freed = released.map(BlobRecord::compressedSize).orElse(0L);
            report.version(DeletedVersion.of(version, freed));
            released.ifPresent(b -> report.blobWithVersion(DeletedBlob.of(b, freed)));
            return;
        }
        try {
            Optional<VersionDeletion> deletion = versions.deleteIfEvictable(version, includeHighPriority);
            if (deletion.isEmpty()) {
                log.debugf("Version %d no longer evictable, skipped", version.id());
                return;
            }
            VersionDeletion d = deletion.get();
            report.version(DeletedVersion.of(version, d.freedBytes()));
            if (d.blobDeleted()) {
                report.blobWithVersion(new DeletedBlob(version.blobId(), version.digest(), d.freedBytes()));
            }
        } catch (RuntimeException e) {
            log.warnf(e, "Failed to delete version %d of file %d", version.id(), version.fileId());
            report.failure("version " + version.id() + ": " + e.getMessage());
        }
    }

    private static int requireOwner(QuotaScopeRecord scope) {
        if (scope.ownerId() == null) {
            throw new IllegalArgumentException("Reclaim runs per owner scope; use globalCleanup for all scopes");
        }
        return scope.ownerId();
    }

    private static boolean interrupted(ReclaimStage stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warnf("Reclaim interrupted during %s, stopping", stage);
            return true;
        }
        return false;
    }

    private static String dryRunTag(boolean dryRun) {
        return dryRun ? " (dry run)" : "";
    }
}
