package com.libragraph.vcl.core.stats;

import com.libragraph.vcl.core.dao.StatsRecord;

import java.time.Instant;

/**
 * Snapshot of the singleton counters plus the ratios derived from them.
 */
public record GlobalStats(
        long totalVersions,
        long totalRawBytes,
        long totalCompressedBytes,
        long totalBlobs,
        long uniqueBlobs,
        long priorityCount,
        long cachedVersionsCount,
        long deduplicationSavingsBytes,
        long compressionSavingsBytes,
        double compressionRatio,
        double compressionSavingsPercent,
        double deduplicationSavingsPercent,
        Instant lastPriorityRunAt,
        Instant lastCleanupAt,
        Instant updatedAt
) {
    public static GlobalStats of(StatsRecord r) {
        long raw = r.totalRawBytes();
        long compressed = r.totalCompressedBytes();
        long dedup = r.deduplicationSavingsBytes();

        double ratio = compressed == 0 ? 1.0 : (double) raw / compressed;
        double compressionPercent = raw == 0 ? 0.0 : (1 - (double) compressed / raw) * 100;
        long withoutDedup = compressed + dedup;
        double dedupPercent = withoutDedup == 0 ? 0.0 : (double) dedup / withoutDedup * 100;

        return new GlobalStats(r.totalVersions(), raw, compressed, r.totalBlobs(), r.uniqueBlobs(),
                r.priorityCount(), r.cachedVersionsCount(), dedup, raw - compressed,
                ratio, compressionPercent, dedupPercent,
                r.lastPriorityRunAt(), r.lastCleanupAt(), r.updatedAt());
    }
}
