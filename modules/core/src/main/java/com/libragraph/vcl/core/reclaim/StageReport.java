package com.libragraph.vcl.core.reclaim;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reclaim stage. {@code targetBytes} is only set for priority eviction.
 */
public record StageReport(
        ReclaimStage stage,
        boolean dryRun,
        int filesProcessed,
        List<DeletedVersion> deletedVersions,
        List<DeletedBlob> deletedBlobs,
        long freedBytes,
        long targetBytes,
        List<String> failures
) {
    public StageReport {
        deletedVersions = List.copyOf(deletedVersions);
        deletedBlobs = List.copyOf(deletedBlobs);
        failures = List.copyOf(failures);
    }

    public static StageReport skipped(ReclaimStage stage, boolean dryRun) {
        return new StageReport(stage, dryRun, 0, List.of(), List.of(), 0, 0, List.of());
    }

    public int deletedVersionCount() {
        return deletedVersions.size();
    }

    public int deletedBlobCount() {
        return deletedBlobs.size();
    }

    /** Mutable accumulator used while a stage runs. */
    static final class Builder {
        private final ReclaimStage stage;
        private final boolean dryRun;
        private int filesProcessed;
        private final List<DeletedVersion> versions = new ArrayList<>();
        private final List<DeletedBlob> blobs = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();
        private long freedBytes;
        private long targetBytes;

        Builder(ReclaimStage stage, boolean dryRun) {
            this.stage = stage;
            this.dryRun = dryRun;
        }

        Builder fileProcessed() {
            filesProcessed++;
            return this;
        }

        Builder version(DeletedVersion version) {
            versions.add(version);
            freedBytes += version.freedBytes();
            return this;
        }

        Builder blob(DeletedBlob blob) {
            blobs.add(blob);
            freedBytes += blob.freedBytes();
            return this;
        }

        /** Records a blob that went away with a version; its bytes are already counted there. */
        Builder blobWithVersion(DeletedBlob blob) {
            blobs.add(blob);
            return this;
        }

        Builder failure(String message) {
            failures.add(message);
            return this;
        }

        Builder target(long bytes) {
            targetBytes = bytes;
            return this;
        }

        long freedBytes() {
            return freedBytes;
        }

        StageReport build() {
            return new StageReport(stage, dryRun, filesProcessed, versions, blobs, freedBytes,
                    targetBytes, failures);
        }
    }
}
