package relay.adapter.in.scheduler;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import relay.core.port.out.Metrics;
import relay.core.port.out.RegistrationRepository;

/**
 * Periodically removes expired registration entries.
 *
 * <p>Runs on the scheduler's own threads and never blocks command handling.
 * Overlapping runs are skipped.
 */
@ApplicationScoped
public class RegistrySweepJob {

    private static final Logger LOG = Logger.getLogger(RegistrySweepJob.class);

    private final RegistrationRepository repository;
    private final Metrics metrics;
    private final Clock clock;

    @Inject
    public RegistrySweepJob(RegistrationRepository repository, Metrics metrics, Clock clock) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(
            identity = "registry-sweep",
            every = "${relay.registry.sweep-interval:PT45S}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        final var removed = repository.sweep(clock.instant());
        metrics.recordSwept(removed);
        if (removed > 0) {
            LOG.debugf("Swept %d expired registration entries", removed);
        }
    }
}
