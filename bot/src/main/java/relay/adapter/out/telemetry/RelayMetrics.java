package relay.adapter.out.telemetry;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import relay.config.TelemetryConfigMapping;
import relay.core.model.command.CommandOutcome;
import relay.core.port.out.Metrics;
import relay.core.port.out.RegistrationRepository;

/**
 * Records relay metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code relay.commands.total} - registration commands by outcome</li>
 *   <li>{@code relay.registry.live} - live registration entries (gauge)</li>
 *   <li>{@code relay.registry.swept.total} - entries removed by background sweeps</li>
 * </ul>
 */
@ApplicationScoped
public class RelayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final RegistrationRepository repository;
    private final boolean enabled;

    @Inject
    public RelayMetrics(MeterRegistry registry, RegistrationRepository repository, TelemetryConfigMapping config) {
        this.registry = registry;
        this.repository = repository;
        this.enabled = config != null && config.metrics().enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("relay.registry.live", repository, RegistrationRepository::liveEntryCount)
                .description("Number of live registration entries")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordCommand(CommandOutcome outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("relay.commands.total")
                .description("Registration commands handled")
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordSwept(int removed) {
        if (!enabled || removed <= 0) {
            return;
        }

        Counter.builder("relay.registry.swept.total")
                .description("Registration entries removed by background sweeps")
                .register(registry)
                .increment(removed);
    }
}
