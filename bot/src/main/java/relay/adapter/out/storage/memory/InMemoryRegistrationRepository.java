package relay.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import relay.core.config.RegistryConfig;
import relay.core.model.audit.AuditEventKind;
import relay.core.model.audit.AuditField;
import relay.core.model.registration.EntryHandle;
import relay.core.model.registration.RegistrationEntry;
import relay.core.model.registration.RegistrationState;
import relay.core.port.out.AuditLog;
import relay.core.port.out.RegistrationRepository;

/**
 * In-memory implementation of RegistrationRepository.
 *
 * <p>Entries live in RAM only: they are lost on restart and not shared across
 * instances. Expiry is enforced lazily on every read; the background sweep only
 * reclaims memory held by subjects who never come back.
 *
 * <p>Per-subject atomicity comes from {@link ConcurrentHashMap}'s per-key
 * compute/remove operations, so different subjects never contend.
 */
@ApplicationScoped
public class InMemoryRegistrationRepository implements RegistrationRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryRegistrationRepository.class);

    private final ConcurrentMap<String, RegistrationEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final RegistryConfig config;
    private final AuditLog auditLog;

    @Inject
    public InMemoryRegistrationRepository(Clock clock, RegistryConfig config, AuditLog auditLog) {
        this.clock = clock;
        this.config = config;
        this.auditLog = auditLog;
        LOG.infof("Initialized in-memory registration registry (ttl=%s)", config.ttl());
    }

    @Override
    public Uni<EntryHandle> put(String subjectId, RegistrationState state, String groupId) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            final var entry = new RegistrationEntry(subjectId, state, groupId, now, now.plus(config.ttl()));
            final var replaced = new AtomicBoolean(false);

            entries.compute(subjectId, (key, existing) -> {
                replaced.set(existing != null && !existing.isExpiredAt(now));
                return entry;
            });

            auditLog.record(
                    AuditEventKind.ENTRY_STORED,
                    AuditField.sensitive("subject", subjectId),
                    AuditField.plain("state", state),
                    AuditField.plain("replaced", replaced.get()));
            return new EntryHandle(entry, replaced.get());
        });
    }

    @Override
    public Uni<Optional<RegistrationEntry>> get(String subjectId) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(subjectId);
            if (entry == null) {
                return Optional.<RegistrationEntry>empty();
            }

            if (entry.isExpiredAt(clock.instant())) {
                // Conditional removal: a concurrent put may already have replaced it
                if (entries.remove(subjectId, entry)) {
                    auditExpired(entry);
                }
                return Optional.<RegistrationEntry>empty();
            }

            return Optional.of(entry);
        });
    }

    @Override
    public Uni<Optional<RegistrationEntry>> take(String subjectId) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.remove(subjectId);
            if (entry == null) {
                return Optional.<RegistrationEntry>empty();
            }

            if (entry.isExpiredAt(clock.instant())) {
                auditExpired(entry);
                return Optional.<RegistrationEntry>empty();
            }

            auditLog.record(
                    AuditEventKind.ENTRY_CONSUMED,
                    AuditField.sensitive("subject", subjectId),
                    AuditField.plain("state", entry.state()));
            return Optional.of(entry);
        });
    }

    @Override
    public int sweep(Instant now) {
        var removed = 0;
        for (var entry : entries.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        if (removed > 0) {
            auditLog.record(
                    AuditEventKind.SWEEP_COMPLETED,
                    AuditField.plain("removed", removed),
                    AuditField.plain("remaining", entries.size()));
        }
        return removed;
    }

    @Override
    public long liveEntryCount() {
        final var now = clock.instant();
        return entries.values().stream().filter(entry -> !entry.isExpiredAt(now)).count();
    }

    private void auditExpired(RegistrationEntry entry) {
        auditLog.record(
                AuditEventKind.ENTRY_EXPIRED,
                AuditField.sensitive("subject", entry.subjectId()),
                AuditField.plain("state", entry.state()));
    }
}
