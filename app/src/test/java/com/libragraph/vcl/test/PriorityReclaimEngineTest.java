package com.libragraph.vcl.test;

import com.libragraph.vcl.core.blob.BlobStore;
import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.core.dao.VersionRecord;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.reclaim.DeletedVersion;
import com.libragraph.vcl.core.reclaim.GlobalCleanupReport;
import com.libragraph.vcl.core.reclaim.PriorityReclaimEngine;
import com.libragraph.vcl.core.reclaim.ReclaimReport;
import com.libragraph.vcl.core.reclaim.ReclaimStage;
import com.libragraph.vcl.core.reclaim.StageReport;
import com.libragraph.vcl.core.stats.StatsAggregator;
import com.libragraph.vcl.core.version.VersionRequest;
import com.libragraph.vcl.core.version.VersionStore;
import com.libragraph.vcl.types.ChangeKind;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.libragraph.vcl.test.VclTestSupport.content;
import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class PriorityReclaimEngineTest {

    static final int OWNER_ID = 5;
    static final ScopeKey OWNER = ScopeKey.owner(OWNER_ID);

    @Inject
    PriorityReclaimEngine engine;

    @Inject
    VersionStore versions;

    @Inject
    BlobStore blobs;

    @Inject
    QuotaLedger quota;

    @Inject
    StatsAggregator stats;

    @Inject
    VclTestSupport support;

    @BeforeEach
    void setUp() {
        support.reset();
    }

    @Test
    void depthEnforcementRemovesOldestVersionOverLimit() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 5);
        List<VersionRecord> created = createHistory(300, 6, OWNER);

        StageReport report = engine.enforceDepth(OWNER, false);

        assertThat(report.filesProcessed()).isEqualTo(1);
        assertThat(report.deletedVersions()).extracting(DeletedVersion::versionId)
                .containsExactly(created.get(0).id());
        assertThat(versions.listVersions(300)).extracting(VersionRecord::versionNumber)
                .containsExactly(6, 5, 4, 3, 2);
    }

    @Test
    void depthEnforcementSkipsPriorityVersions() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 5);
        List<VersionRecord> created = createHistory(301, 6, OWNER);
        versions.setPriority(created.get(0).id(), true);

        StageReport report = engine.enforceDepth(OWNER, false);

        assertThat(report.deletedVersions()).extracting(DeletedVersion::versionNumber).containsExactly(2);
        assertThat(versions.findVersion(created.get(0).id())).isPresent();
    }

    @Test
    void depthEnforcementIgnoresQuotaPressure() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 2);
        createHistory(302, 3, OWNER);

        ReclaimReport report = engine.reclaim(OWNER, false);

        assertThat(report.needsCleanup()).isFalse();
        assertThat(report.depthEnforcement().deletedVersionCount()).isEqualTo(1);
        assertThat(report.priorityCleanup().deletedVersionCount()).isZero();
    }

    @Test
    void evictionTakesOldestNonPriorityFirstAndStopsAtTarget() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 10);
        List<VersionRecord> a = createHistory(400, 3, OWNER);
        List<VersionRecord> b = createHistory(401, 2, OWNER);
        versions.setPriority(a.get(0).id(), true);
        makeOverHeadroomBy(1);

        ReclaimReport report = engine.reclaim(OWNER, false);

        assertThat(report.needsCleanup()).isTrue();
        assertThat(report.priorityCleanup().targetBytes()).isEqualTo(1);
        assertThat(report.priorityCleanup().deletedVersions()).extracting(DeletedVersion::versionId)
                .containsExactly(a.get(1).id());
        assertThat(versions.findVersion(b.get(0).id())).isPresent();
    }

    @Test
    void evictionNeverTouchesPriorityUnlessForced() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 10);
        List<VersionRecord> a = createHistory(410, 3, OWNER);
        createHistory(411, 2, OWNER);
        versions.setPriority(a.get(0).id(), true);

        StageReport normal = engine.evictByPriority(OWNER, Long.MAX_VALUE, null, false, false);

        assertThat(normal.deletedVersionCount()).isEqualTo(2);
        assertThat(versions.findVersion(a.get(0).id())).isPresent();

        StageReport forced = engine.evictByPriority(OWNER, Long.MAX_VALUE, null, true, false);

        assertThat(forced.deletedVersions()).extracting(DeletedVersion::versionId)
                .containsExactly(a.get(0).id());
        assertThat(versions.listVersions(410)).hasSize(1);
        assertThat(versions.listVersions(411)).hasSize(1);
    }

    @Test
    void evictionNeverRemovesLastVersionOfAFile() {
        support.scope(OWNER_ID, 1000, 100, 10);
        for (long fileId = 420; fileId < 425; fileId++) {
            versions.createVersion(fileId, OWNER, content("only-" + fileId, 2000), ChangeKind.CREATE);
        }
        support.setUsage(OWNER_ID, 1000);

        ReclaimReport report = engine.reclaim(OWNER, false, true);

        assertThat(report.needsCleanup()).isTrue();
        assertThat(report.totalDeletedVersions()).isZero();
        for (long fileId = 420; fileId < 425; fileId++) {
            assertThat(versions.listVersions(fileId)).hasSize(1);
        }
    }

    @Test
    void minAgeExcludesRecentVersions() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 10);
        createHistory(430, 3, OWNER);

        StageReport report = engine.evictByPriority(OWNER, Long.MAX_VALUE, Duration.ofDays(1), false, false);

        assertThat(report.deletedVersionCount()).isZero();
        assertThat(versions.listVersions(430)).hasSize(3);
    }

    @Test
    void dryRunChangesNothingAndPredictsRealRun() {
        support.scope(OWNER_ID, 10_000_000, 1_000_000, 2);
        createHistory(500, 4, OWNER);
        createHistory(501, 3, OWNER);
        makeOverHeadroomBy(1);
        int versionsBefore = support.versionCount();
        int blobsBefore = support.blobCount();
        long usageBefore = quota.getScope(OWNER).currentUsageBytes();

        ReclaimReport dry = engine.reclaim(OWNER, true);

        assertThat(dry.dryRun()).isTrue();
        assertThat(support.versionCount()).isEqualTo(versionsBefore);
        assertThat(support.blobCount()).isEqualTo(blobsBefore);
        assertThat(quota.getScope(OWNER).currentUsageBytes()).isEqualTo(usageBefore);
        assertThat(stats.current().lastCleanupAt()).isNull();

        ReclaimReport real = engine.reclaim(OWNER, false);

        assertThat(real.totalFreedBytes()).isEqualTo(dry.totalFreedBytes());
        assertThat(ids(real.depthEnforcement())).isEqualTo(ids(dry.depthEnforcement()));
        assertThat(ids(real.priorityCleanup())).isEqualTo(ids(dry.priorityCleanup()));
        assertThat(stats.current().lastCleanupAt()).isNotNull();
        assertThat(stats.current().lastPriorityRunAt()).isNotNull();
    }

    @Test
    void orphanSweepDeletesUnreferencedBlobs() {
        BlobRecord orphan = blobs.getOrCreate(content("orphan", 3000), null).blob();
        blobs.decrementReference(orphan);
        versions.createVersion(600, OWNER, content("kept", 3000), ChangeKind.CREATE);

        StageReport dry = engine.sweepOrphans(true);
        assertThat(dry.deletedBlobCount()).isEqualTo(1);
        assertThat(blobs.findById(orphan.id())).isPresent();

        StageReport real = engine.sweepOrphans(false);
        assertThat(real.stage()).isEqualTo(ReclaimStage.ORPHAN_SWEEPING);
        assertThat(real.freedBytes()).isEqualTo(orphan.compressedSize());
        assertThat(blobs.findById(orphan.id())).isEmpty();
        assertThat(support.blobCount()).isEqualTo(1);
    }

    @Test
    void globalCleanupCoversEveryOwner() {
        support.scope(6, 10_000_000, 1_000_000, 1);
        support.scope(7, 10_000_000, 1_000_000, 1);
        createHistory(700, 2, ScopeKey.owner(6));
        createHistory(701, 3, ScopeKey.owner(7));
        BlobRecord orphan = blobs.getOrCreate(content("stray", 1000), null).blob();
        blobs.decrementReference(orphan);

        GlobalCleanupReport report = engine.globalCleanup(false);

        assertThat(report.scopesProcessed()).isEqualTo(2);
        assertThat(report.totalDeletedVersions()).isEqualTo(3);
        assertThat(report.blobCleanup().deletedBlobCount()).isEqualTo(1);
        assertThat(report.failures()).isEmpty();
        assertThat(versions.listVersions(700)).hasSize(1);
        assertThat(versions.listVersions(701)).hasSize(1);
        assertThat(support.referenceMismatches()).isZero();
    }

    @Test
    void globalScopeIsRejectedForScopedPasses() {
        assertThatThrownBy(() -> engine.reclaim(ScopeKey.GLOBAL, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private List<VersionRecord> createHistory(long fileId, int count, ScopeKey scope) {
        List<VersionRecord> created = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            created.add(versions.createVersion(VersionRequest.of(fileId, scope,
                    content("file " + fileId + " rev " + i, 4000), ChangeKind.UPDATE)));
        }
        return created;
    }

    /** Shrinks the scope so its current usage sits the given number of bytes past the threshold. */
    private void makeOverHeadroomBy(long bytes) {
        QuotaScopeRecord current = quota.getScope(OWNER);
        long usage = current.currentUsageBytes();
        long headroom = 1000;
        support.scope(OWNER_ID, usage - bytes + headroom, headroom, current.maxDepth());
    }

    private static List<Long> ids(StageReport report) {
        return report.deletedVersions().stream().map(DeletedVersion::versionId).toList();
    }
}
