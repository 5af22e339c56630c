package com.libragraph.vcl.core.quota;

import com.libragraph.vcl.types.QuotaStatus;

/**
 * Write-path warning for a scope: {@code OK}, {@code WARNING} (>= 80 %) or {@code CRITICAL} (>= 95 %).
 */
public record QuotaWarning(QuotaStatus level, double usagePercent, String message) {
}
