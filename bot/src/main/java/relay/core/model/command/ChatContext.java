package relay.core.model.command;

/**
 * Where a command was issued.
 */
public sealed interface ChatContext {

    /**
     * A one-to-one chat between the subject and the bot.
     *
     * @param chatId the private chat identifier
     */
    record Private(String chatId) implements ChatContext {
        public Private {
            if (chatId == null || chatId.isBlank()) {
                throw new IllegalArgumentException("Chat ID cannot be null or blank");
            }
        }
    }

    /**
     * A group (or supergroup) chat.
     *
     * @param groupId the group identifier
     * @param title   the group title, may be null
     */
    record Group(String groupId, String title) implements ChatContext {
        public Group {
            if (groupId == null || groupId.isBlank()) {
                throw new IllegalArgumentException("Group ID cannot be null or blank");
            }
        }
    }
}
