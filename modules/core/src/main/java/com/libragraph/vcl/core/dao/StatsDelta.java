package com.libragraph.vcl.core.dao;

/**
 * Signed increments applied to the stats row in one statement.
 */
public record StatsDelta(
        long versions,
        long rawBytes,
        long compressedBytes,
        long totalBlobs,
        long uniqueBlobs,
        long priority,
        long cached,
        long deduplicationSavings
) {
    public static final StatsDelta NONE = new StatsDelta(0, 0, 0, 0, 0, 0, 0, 0);

    public StatsDelta plus(StatsDelta o) {
        return new StatsDelta(
                versions + o.versions,
                rawBytes + o.rawBytes,
                compressedBytes + o.compressedBytes,
                totalBlobs + o.totalBlobs,
                uniqueBlobs + o.uniqueBlobs,
                priority + o.priority,
                cached + o.cached,
                deduplicationSavings + o.deduplicationSavings);
    }

    public boolean isEmpty() {
        return equals(NONE);
    }
}
