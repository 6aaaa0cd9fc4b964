package ai.pipestream.history.health;

import ai.pipestream.history.store.VersionStore;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Health check for Document History Service.
 * Reports the version store and how many documents it tracks.
 */
@Readiness
@ApplicationScoped
public class HistoryHealthCheck implements HealthCheck {

    @Inject
    VersionStore store;

    @Override
    public HealthCheckResponse call() {
        try {
            long documents = store.documentCount();

            return HealthCheckResponse.named("document-history-service")
                    .withData("store", store.getClass().getSimpleName())
                    .withData("documents", documents)
                    .up()
                    .build();
        } catch (RuntimeException e) {
            return HealthCheckResponse.named("document-history-service")
                    .withData("store", "unavailable")
                    .withData("error", String.valueOf(e.getMessage()))
                    .down()
                    .build();
        }
    }
}
