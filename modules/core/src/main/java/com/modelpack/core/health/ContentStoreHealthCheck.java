package com.modelpack.core.health;

import com.modelpack.core.storage.OciLayoutContentStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class ContentStoreHealthCheck implements HealthCheck {

    @Inject
    OciLayoutContentStore store;

    @Override
    public HealthCheckResponse call() {
        Path root = store.rootPath();
        try {
            Files.createDirectories(root);
            if (!Files.isWritable(root)) {
                return HealthCheckResponse.named("content-store")
                        .down()
                        .withData("root", root.toString())
                        .withData("error", "not writable")
                        .build();
            }
            return HealthCheckResponse.named("content-store")
                    .up()
                    .withData("root", root.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("content-store")
                    .down()
                    .withData("root", root.toString())
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
