package com.libragraph.vcl.core.quota;

import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.types.QuotaStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Read-only quota reporting across scopes.
 */
@ApplicationScoped
public class QuotaMonitor {

    static final double CRITICAL_PERCENT = 95.0;
    static final double WARNING_PERCENT = 90.0;

    @Inject
    QuotaLedger ledger;

    public QuotaReport status(ScopeKey scope) {
        QuotaScopeRecord record = ledger.getScope(scope);
        return QuotaReport.of(record, statusOf(record));
    }

    public static QuotaStatus statusOf(QuotaScopeRecord scope) {
        double percent = scope.usagePercent();
        if (percent >= CRITICAL_PERCENT) {
            return QuotaStatus.CRITICAL;
        }
        if (percent >= WARNING_PERCENT) {
            return QuotaStatus.WARNING;
        }
        if (scope.overHeadroom()) {
            return QuotaStatus.APPROACHING_LIMIT;
        }
        return QuotaStatus.OK;
    }

    public List<QuotaReport> allScopes() {
        return ledger.listScopes().stream()
                .map(s -> QuotaReport.of(s, statusOf(s)))
                .toList();
    }

    /** Every scope currently at or past its cleanup threshold. */
    public List<QuotaReport> scopesNeedingCleanup() {
        return ledger.listScopes().stream()
                .filter(QuotaScopeRecord::overHeadroom)
                .map(s -> QuotaReport.of(s, statusOf(s)))
                .toList();
    }
}
