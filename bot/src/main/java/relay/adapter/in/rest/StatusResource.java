package relay.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import relay.core.port.in.RegistrationUseCase;

/**
 * Read-only status surface for operators.
 *
 * <p>Exposes counts only; no identifier is ever returned.
 */
@Path("/status")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    private final RegistrationUseCase registration;

    @Inject
    public StatusResource(RegistrationUseCase registration) {
        this.registration = registration;
    }

    @GET
    public Response status() {
        final var status = registration.status();
        return Response.ok(Map.of(
                        "liveEntries", status.liveEntryCount(),
                        "ttlSeconds", status.ttl().toSeconds()))
                .build();
    }
}
