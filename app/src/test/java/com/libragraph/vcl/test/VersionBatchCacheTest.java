package com.libragraph.vcl.test;

import com.libragraph.vcl.core.batch.VersionBatchCache;
import com.libragraph.vcl.core.dao.VersionRecord;
import com.libragraph.vcl.core.quota.QuotaLedger;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.version.VersionStore;
import com.libragraph.vcl.types.ChangeKind;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.libragraph.vcl.test.VclTestSupport.text;
import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class VersionBatchCacheTest {

    static final int OWNER_ID = 4;
    static final ScopeKey OWNER = ScopeKey.owner(OWNER_ID);

    @Inject
    VersionBatchCache cache;

    @Inject
    VersionStore versions;

    @Inject
    QuotaLedger quota;

    @Inject
    VclTestSupport support;

    @BeforeEach
    void setUp() {
        support.reset();
        batchWindows(3600, 3600);
    }

    @AfterEach
    void tearDown() {
        cache.flushAll();
    }

    @Test
    void rapidWritesCollapseIntoOneBatchedVersion() {
        cache.queue(1, OWNER, text("draft 1"));
        cache.queue(1, OWNER, text("draft 2"));
        cache.queue(1, OWNER, text("draft 3"));

        assertThat(cache.pendingCount()).isEqualTo(1);
        assertThat(versions.listVersions(1)).isEmpty();

        Optional<VersionRecord> flushed = cache.flush(1);

        assertThat(flushed).isPresent();
        VersionRecord v = flushed.get();
        assertThat(v.changeKind()).isEqualTo(ChangeKind.BATCHED);
        assertThat(v.wasCached()).isTrue();
        assertThat(v.cacheDurationSeconds()).isNotNull().isNotNegative();
        assertThat(versions.getVersionContent(v)).isEqualTo(text("draft 3"));
        assertThat(cache.isPending(1)).isFalse();
    }

    @Test
    void flushWithNothingPendingIsEmpty() {
        assertThat(cache.flush(2)).isEmpty();
    }

    @Test
    void unchangedContentIsNotVersionedAgain() {
        versions.createVersion(3, OWNER, text("stable"), ChangeKind.CREATE);
        cache.queue(3, OWNER, text("stable"));

        assertThat(cache.flush(3)).isEmpty();
        assertThat(versions.listVersions(3)).hasSize(1);
    }

    @Test
    void flushAllFlushesEveryFile() {
        cache.queue(5, OWNER, text("five"));
        cache.queue(6, OWNER, text("six"));

        List<VersionRecord> flushed = cache.flushAll();

        assertThat(flushed).extracting(VersionRecord::fileId).containsExactlyInAnyOrder(5L, 6L);
        assertThat(cache.pendingCount()).isZero();
    }

    @Test
    void queuedContentIsCopied() {
        byte[] data = text("original");
        cache.queue(7, OWNER, data);
        data[0] = 'X';

        VersionRecord v = cache.flush(7).orElseThrow();

        assertThat(versions.getVersionContent(v)).isEqualTo(text("original"));
    }

    @Test
    void debounceTimerFlushesAutomatically() throws Exception {
        batchWindows(1, 1);
        cache.queue(8, OWNER, text("timed"));

        long deadline = System.currentTimeMillis() + 10_000;
        while (versions.listVersions(8).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertThat(versions.listVersions(8)).singleElement()
                .extracting(VersionRecord::changeKind).isEqualTo(ChangeKind.BATCHED);
        assertThat(cache.isPending(8)).isFalse();
    }

    @Test
    void maxBatchWindowFlushesDespiteContinuousWrites() throws Exception {
        batchWindows(2, 3);
        long start = System.currentTimeMillis();

        // each write lands inside the 2 s debounce window, so only the 3 s cap can flush
        int round = 0;
        while (versions.listVersions(9).isEmpty() && System.currentTimeMillis() - start < 10_000) {
            cache.queue(9, OWNER, text("edit " + round++));
            Thread.sleep(1000);
        }
        long elapsed = System.currentTimeMillis() - start;

        assertThat(versions.listVersions(9)).singleElement()
                .satisfies(v -> {
                    assertThat(v.changeKind()).isEqualTo(ChangeKind.BATCHED);
                    assertThat(v.cacheDurationSeconds()).isBetween(2, 4);
                });
        assertThat(elapsed).isLessThan(6_000);
    }

    @Test
    void lateScheduledFlushNeverOvertakesNewerContent() throws Exception {
        batchWindows(0, 0);

        for (long fileId = 100; fileId < 120; fileId++) {
            cache.queue(fileId, OWNER, text("older " + fileId));
            cache.queue(fileId, OWNER, text("newer " + fileId));
            cache.flush(fileId);
        }
        Thread.sleep(500);

        for (long fileId = 100; fileId < 120; fileId++) {
            VersionRecord newest = versions.latestVersion(fileId).orElseThrow();
            assertThat(versions.getVersionContent(newest)).as("file %d", fileId)
                    .isEqualTo(text("newer " + fileId));
        }
    }

    private void batchWindows(int debounce, int maxWindow) {
        support.update(OWNER_ID, quota.getScope(OWNER).settings().withBatchWindows(debounce, maxWindow));
    }
}
