package com.libragraph.vcl.api;

import com.libragraph.vcl.core.dao.DatabaseDao;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;

import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @ConfigProperty(name = "vcl.storage.codec", defaultValue = "gzip")
    String codec;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        boolean db = jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping) == 1;
        return Map.of(
                "status", "ok",
                "message", "VCL is running",
                "database", db ? "up" : "down"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile,
                "codec", codec
        );
    }
}
