package relay.adapter.in.telegram;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import relay.core.config.CommandConfig;
import relay.core.model.command.ChatContext;
import relay.core.port.in.RegistrationUseCase;
import relay.core.port.out.ChatGateway;
import relay.core.service.audit.IdentifierDigester;
import relay.core.service.registration.RelayMessages;

/**
 * Routes Telegram updates to the relay.
 *
 * <p>Handled input:
 * <ul>
 *   <li>the registration command (private chats, groups and supergroups)</li>
 *   <li>{@code /help} anywhere</li>
 *   <li>{@code /status} in private chats only</li>
 *   <li>plain text in private chats, answered with a usage hint</li>
 * </ul>
 *
 * <p>Channels, edited messages and commands addressed to other bots are ignored.
 */
@ApplicationScoped
public class TelegramUpdateRouter {

    private static final Logger LOG = Logger.getLogger(TelegramUpdateRouter.class);

    private final RegistrationUseCase registration;
    private final ChatGateway gateway;
    private final RelayMessages messages;
    private final IdentifierDigester digester;
    private final String registrationCommand;

    private volatile String botUsername;

    @Inject
    public TelegramUpdateRouter(
            RegistrationUseCase registration,
            ChatGateway gateway,
            RelayMessages messages,
            IdentifierDigester digester,
            CommandConfig commandConfig) {
        this.registration = registration;
        this.gateway = gateway;
        this.messages = messages;
        this.digester = digester;
        this.registrationCommand = commandConfig.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Set the bot's own username so commands addressed to other bots can be skipped.
     *
     * @param botUsername the username without {@code @}, or null if unknown
     */
    public void setBotUsername(String botUsername) {
        this.botUsername = botUsername;
    }

    /**
     * Route one update.
     *
     * @param update the Telegram {@code Update} object
     * @return Uni completing when handling finished
     */
    public Uni<Void> route(JsonObject update) {
        final var message = update.getJsonObject("message");
        if (message == null) {
            return Uni.createFrom().voidItem();
        }

        final var chat = message.getJsonObject("chat");
        final var from = message.getJsonObject("from");
        final var text = message.getString("text");
        if (chat == null || from == null || text == null || from.getValue("id") == null) {
            return Uni.createFrom().voidItem();
        }

        final var context = toContext(chat);
        if (context == null) {
            return Uni.createFrom().voidItem();
        }

        final var subjectId = String.valueOf(from.getValue("id"));
        final var command = BotCommand.parse(text);
        if (command.isEmpty()) {
            if (context instanceof ChatContext.Private) {
                return reply(context, messages.privateHint());
            }
            return Uni.createFrom().voidItem();
        }

        if (!command.get().isAddressedTo(botUsername)) {
            return Uni.createFrom().voidItem();
        }

        final var name = command.get().name();
        if (name.equals(registrationCommand)) {
            LOG.debugf(
                    "Received /%s from user #%s in %s chat",
                    registrationCommand, digester.digest(subjectId), chat.getString("type"));
            return registration
                    .handleCommand(subjectId, context)
                    .invoke(outcome -> LOG.debugf("Registration command finished: %s", outcome))
                    .replaceWithVoid();
        }
        if (name.equals("help")) {
            return reply(context, messages.help());
        }
        if (name.equals("status") && context instanceof ChatContext.Private) {
            return reply(context, messages.status(registration.status()));
        }
        return Uni.createFrom().voidItem();
    }

    private static ChatContext toContext(JsonObject chat) {
        final var chatId = chat.getValue("id");
        if (chatId == null) {
            return null;
        }

        final var type = chat.getString("type", "");
        switch (type) {
            case "private":
                return new ChatContext.Private(String.valueOf(chatId));
            case "group":
            case "supergroup":
                return new ChatContext.Group(String.valueOf(chatId), chat.getString("title"));
            default:
                return null;
        }
    }

    private Uni<Void> reply(ChatContext context, String text) {
        return gateway.replyInContext(context, text)
                .onFailure()
                .invoke(e -> LOG.warnf("Failed to send reply: %s", e.getClass().getSimpleName()))
                .onFailure()
                .recoverWithNull();
    }
}
