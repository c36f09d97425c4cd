package relay.adapter.in.telegram;

import java.util.Locale;
import java.util.Optional;

/**
 * A slash command parsed from message text.
 *
 * <p>Accepts {@code /name}, {@code /name@BotName} and trailing arguments.
 *
 * @param name    lower-cased command name without the slash
 * @param mention bot username the command was addressed to, or null
 */
record BotCommand(String name, String mention) {

    static Optional<BotCommand> parse(String text) {
        if (text == null || !text.startsWith("/") || text.length() < 2) {
            return Optional.empty();
        }

        final var firstToken = text.substring(1).split("\\s+", 2)[0];
        final var at = firstToken.indexOf('@');
        final var name = at >= 0 ? firstToken.substring(0, at) : firstToken;
        final var mention = at >= 0 ? firstToken.substring(at + 1) : null;
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BotCommand(name.toLowerCase(Locale.ROOT), mention));
    }

    boolean isAddressedTo(String botUsername) {
        return mention == null || botUsername == null || mention.equalsIgnoreCase(botUsername);
    }
}
