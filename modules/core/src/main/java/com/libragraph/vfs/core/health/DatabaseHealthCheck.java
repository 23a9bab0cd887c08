package com.libragraph.vfs.core.health;

import com.libragraph.vfs.core.dao.DatabaseDao;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jdbi.v3.core.Jdbi;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "vfs.document-store.type", stringValue = "postgres", enableIfMissing = true)
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    Jdbi jdbi;

    @Override
    public HealthCheckResponse call() {
        try {
            String version = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
            return HealthCheckResponse.named("document-store")
                    .up()
                    .withData("version", version)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("document-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
