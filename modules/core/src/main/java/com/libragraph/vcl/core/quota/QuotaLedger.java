package com.libragraph.vcl.core.quota;

import com.libragraph.vcl.core.dao.QuotaScopeDao;
import com.libragraph.vcl.core.dao.QuotaScopeRecord;
import com.libragraph.vcl.types.QuotaStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.Optional;

/**
 * Quota configuration and live usage per scope.
 *
 * <p>The global default row ({@code owner_id IS NULL}) is seeded from configuration on first
 * access; owner rows are seeded from the global row. Usage is only ever changed with atomic
 * SQL increments, never read-modify-write.
 */
@ApplicationScoped
public class QuotaLedger {

    private static final Logger log = Logger.getLogger(QuotaLedger.class);

    static final double WARNING_PERCENT = 80.0;
    static final double CRITICAL_PERCENT = 95.0;

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "vcl.quota.default-max-size", defaultValue = "10737418240")
    long defaultMaxSize;

    @ConfigProperty(name = "vcl.quota.default-headroom-percent", defaultValue = "10")
    int defaultHeadroomPercent;

    @ConfigProperty(name = "vcl.quota.default-depth", defaultValue = "5")
    int defaultDepth;

    @ConfigProperty(name = "vcl.batch.debounce-seconds", defaultValue = "30")
    int defaultDebounceSeconds;

    @ConfigProperty(name = "vcl.batch.max-window-seconds", defaultValue = "300")
    int defaultMaxWindowSeconds;

    private final Object seedLock = new Object();

    /** Settings the global row is seeded with. Headroom is configured as a percent of max size. */
    public QuotaSettings configuredDefaults() {
        long headroom = defaultMaxSize * defaultHeadroomPercent / 100;
        return new QuotaSettings(defaultMaxSize, headroom, defaultDepth, true, true,
                defaultDebounceSeconds, defaultMaxWindowSeconds);
    }

    /**
     * Returns the scope row, creating it on first access (owner scopes copy the global settings).
     */
    public QuotaScopeRecord getScope(ScopeKey scope) {
        Optional<QuotaScopeRecord> existing = resolveScope(scope);
        if (existing.isPresent()) {
            return existing.get();
        }
        synchronized (seedLock) {
            return jdbi.inTransaction(h -> {
                QuotaScopeDao dao = h.attach(QuotaScopeDao.class);
                QuotaScopeRecord global = dao.findGlobal().orElseGet(() -> {
                    long id = dao.insert(null, configuredDefaults());
                    log.infof("Seeded global quota scope from configuration (id=%d)", id);
                    return dao.findById(id).orElseThrow();
                });
                if (scope.isGlobal()) {
                    return global;
                }
                return dao.findByOwner(scope.ownerId()).orElseGet(() -> {
                    long id = dao.insert(scope.ownerId(), global.settings());
                    log.debugf("Seeded quota scope %s from global defaults", scope);
                    return dao.findById(id).orElseThrow();
                });
            });
        }
    }

    /** Read-only lookup; never seeds. */
    public Optional<QuotaScopeRecord> resolveScope(ScopeKey scope) {
        return jdbi.withExtension(QuotaScopeDao.class, dao ->
                scope.isGlobal() ? dao.findGlobal() : dao.findByOwner(scope.ownerId()));
    }

    public List<QuotaScopeRecord> listScopes() {
        return jdbi.withExtension(QuotaScopeDao.class, QuotaScopeDao::listAll);
    }

    public CleanupDecision needsCleanup(ScopeKey scope) {
        return needsCleanup(getScope(scope));
    }

    public static CleanupDecision needsCleanup(QuotaScopeRecord scope) {
        if (!scope.enabled()) {
            return CleanupDecision.notNeeded("VCL disabled");
        }
        if (scope.overHeadroom()) {
            long over = scope.currentUsageBytes() - scope.cleanupThreshold();
            return new CleanupDecision(true, "Over headroom by " + over + " bytes");
        }
        return CleanupDecision.notNeeded(null);
    }

    public long targetReductionBytes(ScopeKey scope) {
        return targetReductionBytes(getScope(scope));
    }

    /**
     * Bytes to free to get back under the threshold, plus a 10% buffer against re-triggering.
     */
    public static long targetReductionBytes(QuotaScopeRecord scope) {
        return targetReductionBytes(scope.currentUsageBytes(), scope.cleanupThreshold());
    }

    public static long targetReductionBytes(long usageBytes, long cleanupThreshold) {
        long excess = usageBytes - cleanupThreshold;
        if (excess <= 0) {
            return 0;
        }
        return excess * 11 / 10;
    }

    /**
     * Applies a signed usage change; the result is clamped at zero.
     */
    public void adjustUsage(ScopeKey scope, long deltaBytes) {
        getScope(scope);
        jdbi.useHandle(h -> adjustUsage(h, scope, deltaBytes));
    }

    /**
     * Joins the caller's transaction. The scope row is expected to exist already; a missing row
     * is logged and the change dropped, since there is no usage to correct.
     */
    public void adjustUsage(Handle h, ScopeKey scope, long deltaBytes) {
        if (scope.isGlobal()) {
            throw new IllegalArgumentException("Usage is tracked per owner scope, not on the global default");
        }
        if (deltaBytes == 0) {
            return;
        }
        int updated = h.attach(QuotaScopeDao.class).adjustUsage(scope.ownerId(), deltaBytes);
        if (updated == 0) {
            log.warnf("No quota scope row for %s, usage change of %d bytes not recorded", scope, deltaBytes);
        }
    }

    public QuotaScopeRecord updateSettings(ScopeKey scope, QuotaSettings settings) {
        QuotaScopeRecord current = getScope(scope);
        return jdbi.inTransaction(h -> {
            QuotaScopeDao dao = h.attach(QuotaScopeDao.class);
            dao.updateSettings(current.id(), settings);
            log.infof("Updated quota settings for %s: %s", scope, settings);
            return dao.findById(current.id()).orElseThrow();
        });
    }

    public QuotaWarning warningLevel(ScopeKey scope) {
        return warningLevel(getScope(scope));
    }

    public static QuotaWarning warningLevel(QuotaScopeRecord scope) {
        double percent = scope.usagePercent();
        if (percent >= CRITICAL_PERCENT) {
            return new QuotaWarning(QuotaStatus.CRITICAL, percent,
                    String.format("Version storage almost full (%.1f%% used)", percent));
        }
        if (percent >= WARNING_PERCENT) {
            return new QuotaWarning(QuotaStatus.WARNING, percent,
                    String.format("Version storage filling up (%.1f%% used)", percent));
        }
        return new QuotaWarning(QuotaStatus.OK, percent, null);
    }
}
