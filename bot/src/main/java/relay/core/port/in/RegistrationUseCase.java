package relay.core.port.in;

import io.smallrye.mutiny.Uni;

import relay.core.model.command.ChatContext;
import relay.core.model.command.CommandOutcome;
import relay.core.model.command.RelayStatus;

/**
 * Inbound port for the group identification flow.
 *
 * <p>The transport layer calls {@link #handleCommand} for every registration
 * command it receives. Group identifiers are only ever sent to the subject's
 * private chat; replies in the originating chat are generic.
 */
public interface RegistrationUseCase {

    /**
     * Handle a registration command.
     *
     * <p>In a private chat the subject is registered and instructed to send the
     * command inside the target group. In a group the subject must be an
     * administrator of that group before the identifier is released.
     *
     * @param subjectId the invoking user's identifier (must not be null or blank)
     * @param context   where the command was issued (must not be null)
     * @return Uni with the outcome; never fails for authorization or upstream errors
     * @throws IllegalArgumentException if subjectId is blank or context is null
     */
    Uni<CommandOutcome> handleCommand(String subjectId, ChatContext context);

    /**
     * Current relay status.
     *
     * @return snapshot with the live entry count and the configured TTL
     */
    RelayStatus status();
}
