package relay.adapter.out.telegram;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import relay.core.model.command.ChatContext;
import relay.core.port.out.ChatGateway;

/**
 * Chat gateway backed by the Telegram Bot API.
 *
 * <p>A user's private chat with the bot shares the user's identifier, so private
 * delivery addresses the subject id directly. Telegram only allows this once the
 * user has started a chat with the bot.
 */
@ApplicationScoped
public class TelegramChatGateway implements ChatGateway {

    private static final Set<String> ADMIN_STATUSES = Set.of("creator", "administrator");

    private final TelegramBotClient client;

    @Inject
    public TelegramChatGateway(TelegramBotClient client) {
        this.client = client;
    }

    @Override
    public Uni<Boolean> isGroupAdmin(String subjectId, String groupId) {
        return client.getChatMember(groupId, subjectId)
                .map(member -> member != null && ADMIN_STATUSES.contains(member.getString("status")));
    }

    @Override
    public Uni<Void> deliverPrivate(String subjectId, String payload) {
        return client.sendMessage(subjectId, payload);
    }

    @Override
    public Uni<Void> replyInContext(ChatContext context, String payload) {
        final String chatId;
        if (context instanceof ChatContext.Group group) {
            chatId = group.groupId();
        } else {
            chatId = ((ChatContext.Private) context).chatId();
        }
        return client.sendMessage(chatId, payload);
    }
}
