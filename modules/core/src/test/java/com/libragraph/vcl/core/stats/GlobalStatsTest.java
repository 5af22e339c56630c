package com.libragraph.vcl.core.stats;

import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.StatsDelta;
import com.libragraph.vcl.core.dao.StatsRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GlobalStatsTest {

    @Test
    void derivesRatiosFromCounters() {
        StatsRecord r = new StatsRecord(4, 1000, 250, 2, 2, 1, 0, 250, null, null, Instant.now());

        GlobalStats stats = GlobalStats.of(r);

        assertThat(stats.compressionSavingsBytes()).isEqualTo(750);
        assertThat(stats.compressionRatio()).isEqualTo(4.0);
        assertThat(stats.compressionSavingsPercent()).isEqualTo(75.0);
        assertThat(stats.deduplicationSavingsPercent()).isEqualTo(50.0);
    }

    @Test
    void emptyCatalogHasNeutralRatios() {
        GlobalStats stats = GlobalStats.of(new StatsRecord(0, 0, 0, 0, 0, 0, 0, 0, null, null, Instant.now()));

        assertThat(stats.compressionRatio()).isEqualTo(1.0);
        assertThat(stats.compressionSavingsPercent()).isZero();
        assertThat(stats.deduplicationSavingsPercent()).isZero();
    }

    @Test
    void referenceDeltas() {
        BlobRecord blob = new BlobRecord(1, "ab".repeat(32), "ab/ab/x", "gzip", 500, 100, 2,
                false, false, Instant.now(), Instant.now());

        StatsDelta duplicate = StatsAggregator.referenceAdded(blob, false);
        assertThat(duplicate.deduplicationSavings()).isEqualTo(500);
        assertThat(duplicate.uniqueBlobs()).isZero();

        StatsDelta revived = StatsAggregator.referenceAdded(blob, true);
        assertThat(revived.uniqueBlobs()).isEqualTo(1);
        assertThat(revived.deduplicationSavings()).isZero();

        assertThat(StatsAggregator.referenceReleased(blob, 1).deduplicationSavings()).isEqualTo(-500);
        assertThat(StatsAggregator.referenceReleased(blob, 0).uniqueBlobs()).isEqualTo(-1);
    }

    @Test
    void blobLifecycleDeltasCancelOut() {
        BlobRecord blob = new BlobRecord(1, "cd".repeat(32), "cd/cd/x", "gzip", 10, 10, 1,
                false, false, Instant.now(), Instant.now());

        StatsDelta total = StatsAggregator.blobCreated()
                .plus(StatsAggregator.referenceReleased(blob, 0))
                .plus(StatsAggregator.blobDeleted());

        assertThat(total.isEmpty()).isTrue();
    }
}
