package com.libragraph.vfs.core.health;

import com.libragraph.vfs.core.storage.FilesystemPhysicalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class PhysicalStoreHealthCheck implements HealthCheck {

    @Inject
    FilesystemPhysicalStore store;

    @Override
    public HealthCheckResponse call() {
        Path root = store.rootPath();
        boolean ready = Files.isDirectory(root) && Files.isWritable(root);
        return HealthCheckResponse.named("physical-store")
                .status(ready)
                .withData("root", root.toString())
                .build();
    }
}
