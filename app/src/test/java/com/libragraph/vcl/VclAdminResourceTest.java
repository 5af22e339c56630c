package com.libragraph.vcl;

import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.core.version.VersionStore;
import com.libragraph.vcl.test.VclTestSupport;
import com.libragraph.vcl.types.ChangeKind;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.libragraph.vcl.test.VclTestSupport.content;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class VclAdminResourceTest {

    @Inject
    VersionStore versions;

    @Inject
    VclTestSupport support;

    @BeforeEach
    void setUp() {
        support.reset();
    }

    @Test
    void stats_reportsCounters() {
        versions.createVersion(1, ScopeKey.owner(1), content("rest", 2000), ChangeKind.CREATE);

        given()
                .when().get("/api/vcl/admin/stats")
                .then()
                .statusCode(200)
                .body("totalVersions", is(1))
                .body("totalBlobs", is(1))
                .body("compressionRatio", greaterThan(1.0f));
    }

    @Test
    void recompute_returnsRebuiltStats() {
        versions.createVersion(2, ScopeKey.owner(1), content("recompute", 2000), ChangeKind.CREATE);

        given()
                .when().post("/api/vcl/admin/stats/recompute")
                .then()
                .statusCode(200)
                .body("totalVersions", is(1));
    }

    @Test
    void quota_globalAndOwner() {
        given()
                .when().get("/api/vcl/admin/quota/global")
                .then()
                .statusCode(200)
                .body("ownerId", nullValue())
                .body("maxDepth", is(5));

        given()
                .when().get("/api/vcl/admin/quota/21")
                .then()
                .statusCode(200)
                .body("ownerId", is(21))
                .body("status", is("OK"));
    }

    @Test
    void quota_listsEveryScope() {
        support.scope(24, 1000, 100, 5);

        given()
                .when().get("/api/vcl/admin/quota")
                .then()
                .statusCode(200)
                .body("ownerId", hasItems(nullValue(), is(24)));
    }

    @Test
    void cleanup_negativeOwnerIdIsNotRouted() {
        given()
                .when().post("/api/vcl/admin/cleanup/-5")
                .then()
                .statusCode(404);
    }

    @Test
    void quota_needsCleanupListsOverHeadroomScopes() {
        support.scope(22, 1000, 100, 5);
        support.setUsage(22, 990);

        given()
                .when().get("/api/vcl/admin/quota/needs-cleanup")
                .then()
                .statusCode(200)
                .body("ownerId", contains(22));
    }

    @Test
    void cleanup_defaultsToDryRun() {
        support.scope(23, 10_000_000, 1_000_000, 1);
        versions.createVersion(30, ScopeKey.owner(23), content("v1", 1000), ChangeKind.CREATE);
        versions.createVersion(30, ScopeKey.owner(23), content("v2", 1000), ChangeKind.UPDATE);

        given()
                .when().post("/api/vcl/admin/cleanup/23")
                .then()
                .statusCode(200)
                .body("dryRun", is(true))
                .body("totalDeletedVersions", is(1));

        given()
                .when().post("/api/vcl/admin/cleanup/23?dryRun=false")
                .then()
                .statusCode(200)
                .body("dryRun", is(false))
                .body("depthEnforcement.deletedVersions.size()", is(1));

        given()
                .when().post("/api/vcl/admin/cleanup?dryRun=false")
                .then()
                .statusCode(200)
                .body("totalDeletedVersions", is(0))
                .body("scopesProcessed", greaterThanOrEqualTo(1));
    }
}
