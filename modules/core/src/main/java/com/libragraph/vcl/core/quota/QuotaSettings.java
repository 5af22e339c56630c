package com.libragraph.vcl.core.quota;

/**
 * Per-scope configuration. Changed through named {@code with*} copies, never merged from maps.
 */
public record QuotaSettings(
        long maxSizeBytes,
        long headroomBytes,
        int maxDepth,
        boolean enabled,
        boolean compressionEnabled,
        int debounceWindowSeconds,
        int maxBatchWindowSeconds
) {
    public QuotaSettings {
        if (maxSizeBytes < 0) {
            throw new IllegalArgumentException("maxSizeBytes must be >= 0, got: " + maxSizeBytes);
        }
        if (headroomBytes < 0 || headroomBytes > maxSizeBytes) {
            throw new IllegalArgumentException(
                    "headroomBytes must be between 0 and maxSizeBytes, got: " + headroomBytes);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        }
        if (debounceWindowSeconds < 0) {
            throw new IllegalArgumentException(
                    "debounceWindowSeconds must be >= 0, got: " + debounceWindowSeconds);
        }
        if (maxBatchWindowSeconds < debounceWindowSeconds) {
            throw new IllegalArgumentException(
                    "maxBatchWindowSeconds must be >= debounceWindowSeconds, got: " + maxBatchWindowSeconds);
        }
    }

    public QuotaSettings withMaxSize(long maxSizeBytes, long headroomBytes) {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }

    public QuotaSettings withMaxDepth(int maxDepth) {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }

    public QuotaSettings withEnabled(boolean enabled) {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }

    public QuotaSettings withCompressionEnabled(boolean compressionEnabled) {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }

    public QuotaSettings withBatchWindows(int debounceWindowSeconds, int maxBatchWindowSeconds) {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }
}
