package com.libragraph.vcl.core.quota;

import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.types.QuotaStatus;

public record QuotaReport(
        Integer ownerId,
        QuotaStatus status,
        long maxSizeBytes,
        long headroomBytes,
        long currentUsageBytes,
        long availableBytes,
        double usagePercent,
        int maxDepth,
        boolean enabled,
        boolean overHeadroom
) {
    static QuotaReport of(QuotaScopeRecord scope, QuotaStatus status) {
        return new QuotaReport(scope.ownerId(), status, scope.maxSizeBytes(), scope.headroomBytes(),
                scope.currentUsageBytes(), scope.availableBytes(), scope.usagePercent(),
                scope.maxDepth(), scope.enabled(), scope.overHeadroom());
    }
}
