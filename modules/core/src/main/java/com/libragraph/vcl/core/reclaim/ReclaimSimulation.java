package com.libragraph.vcl.core.reclaim;

import com.libragraph.vcl.core.dao.BlobRecord;
import com.libragraph.vcl.core.dao.VersionRecord;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * Tracks what a reclaim pass has selected so far, so a dry run can estimate freed bytes
 * across stages without touching the catalog.
 */
final class ReclaimSimulation {

    private final Map<Long, Integer> references = new HashMap<>();
    private final Set<Long> versions = new HashSet<>();
    private final Set<Long> releasedBlobs = new HashSet<>();
    private final Map<Integer, Long> usageReleased = new HashMap<>();

    boolean picked(long versionId) {
        return versions.contains(versionId);
    }

    boolean blobReleased(long blobId) {
        return releasedBlobs.contains(blobId);
    }

    long usageReleased(int ownerId) {
        return usageReleased.getOrDefault(ownerId, 0L);
    }

    /**
     * Simulates deleting the version.
     *
     * @return the blob that would lose its last reference, if any
     */
    Optional<BlobRecord> release(VersionRecord version, LongFunction<Optional<BlobRecord>> blobLookup) {
        if (!versions.add(version.id())) {
            return Optional.empty();
        }
        if (version.isPrimary()) {
            usageReleased.merge(version.ownerId(), version.compressedSize(), Long::sum);
        }
        Optional<BlobRecord> blob = blobLookup.apply(version.blobId());
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        int remaining = references.merge(version.blobId(), blob.get().referenceCount() - 1,
                (current, ignored) -> current - 1);
        if (remaining <= 0 && releasedBlobs.add(version.blobId())) {
            return blob;
        }
        return Optional.empty();
    }
}
