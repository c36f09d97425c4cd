package relay.core.service.registration;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import relay.core.config.CommandConfig;
import relay.core.config.RegistryConfig;
import relay.core.model.audit.AuditEventKind;
import relay.core.model.audit.AuditField;
import relay.core.model.command.ChatContext;
import relay.core.model.command.CommandOutcome;
import relay.core.model.command.RelayStatus;
import relay.core.model.registration.RegistrationEntry;
import relay.core.model.registration.RegistrationState;
import relay.core.port.in.RegistrationUseCase;
import relay.core.port.out.AuditLog;
import relay.core.port.out.ChatGateway;
import relay.core.port.out.Metrics;
import relay.core.port.out.RegistrationRepository;

/**
 * Coordinates registration commands.
 *
 * <p>Per subject the flow is {@code NoEntry -> AWAITING_GROUP_CONTACT -> FULFILLED (consumed)}:
 * <ul>
 *   <li>A private command stores (or refreshes) an {@code AWAITING_GROUP_CONTACT} entry and
 *       replies with instructions.</li>
 *   <li>A group command always goes through the admin check, whether or not the subject
 *       registered privately. Only a confirmed administrator gets the group id, and only
 *       through a private message; the group sees a generic reply.</li>
 * </ul>
 *
 * <h2>Failure Behavior</h2>
 * <p>The admin check fails closed. A negative answer yields {@link CommandOutcome#UNAUTHORIZED};
 * an error or timeout yields {@link CommandOutcome#TRANSIENT_FAILURE}. Both leave the registry
 * untouched and show the group the same text.
 *
 * <h2>Concurrency</h2>
 * <p>No registry state is held while waiting on the chat gateway. The fulfilled entry is stored
 * and consumed right after a positive admin check; if a concurrent command for the same subject
 * consumed it first, the store-and-consume cycle is recomputed a bounded number of times.
 */
@ApplicationScoped
public class RegistrationService implements RegistrationUseCase {

    private static final Logger LOG = Logger.getLogger(RegistrationService.class);

    private final RegistrationRepository repository;
    private final ChatGateway gateway;
    private final AuditLog auditLog;
    private final Metrics metrics;
    private final RelayMessages messages;
    private final CommandConfig commandConfig;
    private final RegistryConfig registryConfig;

    @Inject
    public RegistrationService(
            RegistrationRepository repository,
            ChatGateway gateway,
            AuditLog auditLog,
            Metrics metrics,
            RelayMessages messages,
            CommandConfig commandConfig,
            RegistryConfig registryConfig) {
        this.repository = repository;
        this.gateway = gateway;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.messages = messages;
        this.commandConfig = commandConfig;
        this.registryConfig = registryConfig;
    }

    @Override
    public Uni<CommandOutcome> handleCommand(String subjectId, ChatContext context) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be null or blank");
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }

        final Uni<CommandOutcome> outcome;
        if (context instanceof ChatContext.Group group) {
            outcome = handleGroupCommand(subjectId, group);
        } else {
            outcome = handlePrivateCommand(subjectId, (ChatContext.Private) context);
        }
        return outcome.invoke(metrics::recordCommand);
    }

    @Override
    public RelayStatus status() {
        return new RelayStatus(repository.liveEntryCount(), registryConfig.ttl());
    }

    private Uni<CommandOutcome> handlePrivateCommand(String subjectId, ChatContext.Private context) {
        return repository
                .put(subjectId, RegistrationState.AWAITING_GROUP_CONTACT, null)
                .invoke(handle -> auditLog.record(
                        handle.replaced() ? AuditEventKind.REGISTRATION_REFRESHED : AuditEventKind.REGISTERED,
                        AuditField.sensitive("subject", subjectId),
                        AuditField.plain("expiresAt", handle.entry().expiresAt())))
                .flatMap(handle -> replyQuietly(context, messages.registrationAcknowledgement()))
                .replaceWith(CommandOutcome.ACKNOWLEDGED);
    }

    private Uni<CommandOutcome> handleGroupCommand(String subjectId, ChatContext.Group group) {
        // The read also evicts a stale private registration before the request proceeds
        return repository
                .get(subjectId)
                .invoke(existing -> auditLog.record(
                        AuditEventKind.GROUP_REQUEST,
                        AuditField.sensitive("subject", subjectId),
                        AuditField.sensitive("group", group.groupId()),
                        AuditField.plain("preRegistered", existing.isPresent())))
                .flatMap(existing -> checkAdmin(subjectId, group))
                .flatMap(verdict -> {
                    switch (verdict) {
                        case ADMIN:
                            return storeAndConsume(subjectId, group.groupId(), 1)
                                    .flatMap(entry -> deliver(subjectId, group, entry));
                        case NOT_ADMIN:
                            return replyQuietly(group, messages.adminsOnly()).replaceWith(CommandOutcome.UNAUTHORIZED);
                        default:
                            return replyQuietly(group, messages.adminsOnly())
                                    .replaceWith(CommandOutcome.TRANSIENT_FAILURE);
                    }
                });
    }

    private Uni<AdminVerdict> checkAdmin(String subjectId, ChatContext.Group group) {
        return Uni.createFrom()
                .deferred(() -> gateway.isGroupAdmin(subjectId, group.groupId()))
                .ifNoItem()
                .after(commandConfig.adminCheckTimeout())
                .fail()
                .map(isAdmin -> {
                    if (Boolean.TRUE.equals(isAdmin)) {
                        return AdminVerdict.ADMIN;
                    }
                    auditLog.record(
                            AuditEventKind.ADMIN_CHECK_DENIED,
                            AuditField.sensitive("subject", subjectId),
                            AuditField.sensitive("group", group.groupId()));
                    return AdminVerdict.NOT_ADMIN;
                })
                .onFailure()
                .recoverWithItem(e -> {
                    auditLog.record(
                            AuditEventKind.ADMIN_CHECK_FAILED,
                            AuditField.sensitive("subject", subjectId),
                            AuditField.sensitive("group", group.groupId()),
                            AuditField.plain("reason", e.getClass().getSimpleName()));
                    return AdminVerdict.UNAVAILABLE;
                });
    }

    private Uni<Optional<RegistrationEntry>> storeAndConsume(String subjectId, String groupId, int attempt) {
        return repository
                .put(subjectId, RegistrationState.FULFILLED, groupId)
                .flatMap(handle -> repository.take(subjectId))
                .flatMap(taken -> {
                    if (taken.isPresent() && groupId.equals(taken.get().groupId())) {
                        return Uni.createFrom().item(taken);
                    }

                    auditLog.record(
                            AuditEventKind.CONSUME_RACE,
                            AuditField.sensitive("subject", subjectId),
                            AuditField.plain("attempt", attempt));
                    if (attempt >= commandConfig.maxConsumeAttempts()) {
                        return Uni.createFrom().item(Optional.<RegistrationEntry>empty());
                    }
                    return storeAndConsume(subjectId, groupId, attempt + 1);
                });
    }

    private Uni<CommandOutcome> deliver(
            String subjectId, ChatContext.Group group, Optional<RegistrationEntry> consumed) {
        if (consumed.isEmpty()) {
            LOG.warn("Gave up consuming a fulfilled registration after repeated concurrent commands");
            return replyQuietly(group, messages.adminsOnly()).replaceWith(CommandOutcome.TRANSIENT_FAILURE);
        }

        final var payload = messages.groupIdentifier(group.title(), consumed.get().groupId());
        return Uni.createFrom()
                .deferred(() -> gateway.deliverPrivate(subjectId, payload))
                .map(ignored -> true)
                .onFailure()
                .recoverWithItem(e -> {
                    auditLog.record(
                            AuditEventKind.DELIVERY_FAILED,
                            AuditField.sensitive("subject", subjectId),
                            AuditField.sensitive("group", group.groupId()),
                            AuditField.plain("reason", e.getClass().getSimpleName()));
                    return false;
                })
                .flatMap(delivered -> {
                    if (!delivered) {
                        return replyQuietly(group, messages.privateChatRequired())
                                .replaceWith(CommandOutcome.TRANSIENT_FAILURE);
                    }
                    auditLog.record(
                            AuditEventKind.DELIVERED,
                            AuditField.sensitive("subject", subjectId),
                            AuditField.sensitive("group", group.groupId()));
                    return replyQuietly(group, messages.checkPrivateMessages()).replaceWith(CommandOutcome.DELIVERED);
                });
    }

    private Uni<Void> replyQuietly(ChatContext context, String payload) {
        return Uni.createFrom()
                .deferred(() -> gateway.replyInContext(context, payload))
                .onFailure()
                .invoke(e -> LOG.warnf("Reply in %s chat failed: %s", chatKind(context), e.getClass().getSimpleName()))
                .onFailure()
                .recoverWithNull();
    }

    private static String chatKind(ChatContext context) {
        return context instanceof ChatContext.Group ? "group" : "private";
    }

    private enum AdminVerdict {
        ADMIN,
        NOT_ADMIN,
        UNAVAILABLE
    }
}
