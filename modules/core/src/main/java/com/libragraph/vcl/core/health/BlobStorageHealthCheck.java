package com.libragraph.vcl.core.health;

import com.libragraph.vcl.core.storage.ObjectStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Up when the blob directory exists (or can be created) and is writable.
 */
@Readiness
@ApplicationScoped
public class BlobStorageHealthCheck implements HealthCheck {

    @Inject
    ObjectStorage storage;

    @Override
    public HealthCheckResponse call() {
        Path root = storage.root().toAbsolutePath();
        try {
            Files.createDirectories(root);
            if (!Files.isWritable(root)) {
                return HealthCheckResponse.named("vcl-blob-storage")
                        .down()
                        .withData("root", root.toString())
                        .withData("error", "not writable")
                        .build();
            }
            return HealthCheckResponse.named("vcl-blob-storage")
                    .up()
                    .withData("root", root.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("vcl-blob-storage")
                    .down()
                    .withData("root", root.toString())
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
