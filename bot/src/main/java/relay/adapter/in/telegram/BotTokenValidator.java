package relay.adapter.in.telegram;

/**
 * Validates the format of Telegram bot tokens.
 *
 * <p>A token looks like {@code 123456789:AAE...}: a numeric bot id of at least
 * eight digits, a single colon, and a secret of at least twenty characters.
 */
public final class BotTokenValidator {

    private static final int MIN_BOT_ID_DIGITS = 8;
    private static final int MIN_SECRET_LENGTH = 20;

    private BotTokenValidator() {}

    public static boolean isValid(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }

        final var parts = token.split(":", -1);
        if (parts.length != 2) {
            return false;
        }

        final var botId = parts[0];
        final var secret = parts[1];
        if (botId.length() < MIN_BOT_ID_DIGITS || !botId.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return secret.length() >= MIN_SECRET_LENGTH && secret.chars().noneMatch(Character::isWhitespace);
    }
}
