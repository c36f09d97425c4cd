package relay.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import relay.core.port.in.RegistrationUseCase;

/**
 * Readiness check reporting the in-memory registry.
 *
 * <p>Always UP: the registry has no external dependency that could be unavailable.
 */
@Readiness
@ApplicationScoped
public class RegistryHealthCheck implements HealthCheck {

    private final RegistrationUseCase registration;

    @Inject
    public RegistryHealthCheck(RegistrationUseCase registration) {
        this.registration = registration;
    }

    @Override
    public HealthCheckResponse call() {
        final var status = registration.status();
        return HealthCheckResponse.named("registration-registry")
                .up()
                .withData("type", "in-memory")
                .withData("liveEntries", status.liveEntryCount())
                .withData("ttlSeconds", status.ttl().toSeconds())
                .build();
    }
}
