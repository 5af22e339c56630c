package com.libragraph.vcl.api;

import com.libragraph.vcl.core.quota.QuotaMonitor;
import com.libragraph.vcl.core.quota.QuotaReport;
import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.reclaim.GlobalCleanupReport;
import com.libragraph.vcl.core.reclaim.PriorityReclaimEngine;
import com.libragraph.vcl.core.reclaim.ReclaimReport;
import com.libragraph.vcl.core.stats.GlobalStats;
import com.libragraph.vcl.core.stats.StatsAggregator;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Administrative triggers over the versioning layer. Cleanup defaults to a dry run.
 */
@Path("/api/vcl/admin")
@Produces(MediaType.APPLICATION_JSON)
public class VclAdminResource {

    private static final Logger log = Logger.getLogger(VclAdminResource.class);

    @Inject
    StatsAggregator stats;

    @Inject
    QuotaMonitor monitor;

    @Inject
    PriorityReclaimEngine reclaim;

    @GET
    @Path("/stats")
    public GlobalStats stats() {
        return stats.current();
    }

    @POST
    @Path("/stats/recompute")
    public GlobalStats recompute() {
        log.info("Stats recompute requested");
        return stats.recompute();
    }

    @GET
    @Path("/quota")
    public List<QuotaReport> quotas() {
        return monitor.allScopes();
    }

    @GET
    @Path("/quota/global")
    public QuotaReport globalQuota() {
        return monitor.status(ScopeKey.GLOBAL);
    }

    @GET
    @Path("/quota/{ownerId: \\d+}")
    public QuotaReport ownerQuota(@PathParam("ownerId") int ownerId) {
        return monitor.status(ScopeKey.owner(ownerId));
    }

    @GET
    @Path("/quota/needs-cleanup")
    public List<QuotaReport> needsCleanup() {
        return monitor.scopesNeedingCleanup();
    }

    @POST
    @Path("/cleanup")
    public GlobalCleanupReport globalCleanup(@QueryParam("dryRun") @DefaultValue("true") boolean dryRun) {
        log.infof("Global cleanup requested (dryRun=%s)", dryRun);
        return reclaim.globalCleanup(dryRun);
    }

    @POST
    @Path("/cleanup/{ownerId: \\d+}")
    public ReclaimReport cleanup(@PathParam("ownerId") int ownerId,
                                 @QueryParam("dryRun") @DefaultValue("true") boolean dryRun) {
        log.infof("Cleanup of owner %d requested (dryRun=%s)", ownerId, dryRun);
        return reclaim.reclaim(ScopeKey.owner(ownerId), dryRun);
    }
}
