package com.libragraph.vcl.core.dao;

import com.libragraph.vcl.core.quota.QuotaSettings;
import com.libragraph.vcl.core.quota.ScopeKey;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record QuotaScopeRecord(
        @ColumnName("id") long id,
        @ColumnName("owner_id") Integer ownerId,
        @ColumnName("max_size_bytes") long maxSizeBytes,
        @ColumnName("headroom_bytes") long headroomBytes,
        @ColumnName("max_depth") int maxDepth,
        @ColumnName("current_usage_bytes") long currentUsageBytes,
        @ColumnName("enabled") boolean enabled,
        @ColumnName("compression_enabled") boolean compressionEnabled,
        @ColumnName("debounce_window_seconds") int debounceWindowSeconds,
        @ColumnName("max_batch_window_seconds") int maxBatchWindowSeconds,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {
    public ScopeKey scope() {
        return new ScopeKey(ownerId);
    }

    public QuotaSettings settings() {
        return new QuotaSettings(maxSizeBytes, headroomBytes, maxDepth, enabled,
                compressionEnabled, debounceWindowSeconds, maxBatchWindowSeconds);
    }

    /** Usage level at which cleanup starts. */
    public long cleanupThreshold() {
        return maxSizeBytes - headroomBytes;
    }

    public boolean overHeadroom() {
        return currentUsageBytes >= cleanupThreshold();
    }

    public long availableBytes() {
        return maxSizeBytes - currentUsageBytes;
    }

    public double usagePercent() {
        if (maxSizeBytes <= 0) {
            return currentUsageBytes > 0 ? 100.0 : 0.0;
        }
        return currentUsageBytes * 100.0 / maxSizeBytes;
    }
}
