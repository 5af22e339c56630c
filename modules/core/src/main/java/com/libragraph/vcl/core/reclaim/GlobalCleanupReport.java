package com.libragraph.vcl.core.reclaim;

import java.util.List;

/**
 * Result of reclaiming every known scope followed by one system-wide orphan sweep.
 */
public record GlobalCleanupReport(
        boolean dryRun,
        int scopesProcessed,
        List<ReclaimReport> scopes,
        StageReport blobCleanup,
        List<String> failures,
        long totalFreedBytes,
        int totalDeletedVersions,
        int totalDeletedBlobs
) {
    public GlobalCleanupReport {
        scopes = List.copyOf(scopes);
        failures = List.copyOf(failures);
    }

    static GlobalCleanupReport of(boolean dryRun, List<ReclaimReport> scopes, StageReport sweep,
                                  List<String> failures) {
        return new GlobalCleanupReport(dryRun, scopes.size(), scopes, sweep, failures,
                scopes.stream().mapToLong(ReclaimReport::totalFreedBytes).sum() + sweep.freedBytes(),
                scopes.stream().mapToInt(ReclaimReport::totalDeletedVersions).sum(),
                scopes.stream().mapToInt(ReclaimReport::totalDeletedBlobs).sum() + sweep.deletedBlobCount());
    }
}
