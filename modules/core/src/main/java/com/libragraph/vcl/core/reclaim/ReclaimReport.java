package com.libragraph.vcl.core.reclaim;

/**
 * Combined report of a reclaim pass over one scope.
 */
public record ReclaimReport(
        Integer ownerId,
        boolean dryRun,
        boolean needsCleanup,
        String reason,
        StageReport depthEnforcement,
        StageReport priorityCleanup,
        StageReport blobCleanup,
        long totalFreedBytes,
        int totalDeletedVersions,
        int totalDeletedBlobs,
        int totalFailures
) {
    static ReclaimReport of(Integer ownerId, boolean dryRun, boolean needsCleanup, String reason,
                            StageReport depth, StageReport priority, StageReport blobs) {
        return new ReclaimReport(ownerId, dryRun, needsCleanup, reason, depth, priority, blobs,
                depth.freedBytes() + priority.freedBytes() + blobs.freedBytes(),
                depth.deletedVersionCount() + priority.deletedVersionCount() + blobs.deletedVersionCount(),
                depth.deletedBlobCount() + priority.deletedBlobCount() + blobs.deletedBlobCount(),
                depth.failures().size() + priority.failures().size() + blobs.failures().size());
    }
}
