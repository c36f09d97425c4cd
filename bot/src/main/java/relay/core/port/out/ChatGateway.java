package relay.core.port.out;

import io.smallrye.mutiny.Uni;

import relay.core.model.command.ChatContext;

/**
 * Capabilities of the chat platform used by the relay.
 *
 * <p>Every call may involve network I/O and may fail or stall; callers bound
 * them with timeouts and never hold registry state while waiting.
 */
public interface ChatGateway {

    /**
     * Check whether the subject administers the group.
     *
     * @param subjectId the user identifier
     * @param groupId   the group identifier
     * @return Uni with true if the subject is a creator or administrator
     */
    Uni<Boolean> isGroupAdmin(String subjectId, String groupId);

    /**
     * Send a message only the subject can see.
     *
     * @param subjectId the recipient
     * @param payload   message text
     * @return Uni completing once the platform accepted the message
     */
    Uni<Void> deliverPrivate(String subjectId, String payload);

    /**
     * Reply in the chat a command came from. Payloads must not contain identifiers.
     *
     * @param context the originating chat
     * @param payload message text
     * @return Uni completing once the platform accepted the message
     */
    Uni<Void> replyInContext(ChatContext context, String payload);
}
