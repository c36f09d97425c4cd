package relay.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the Telegram Bot API transport.
 *
 * <p>Configuration prefix: {@code relay.telegram}
 */
@ConfigMapping(prefix = "relay.telegram")
public interface TelegramConfig {

    /**
     * Start long polling on startup.
     *
     * @return true if the transport is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Bot token issued by BotFather, in the form {@code <bot-id>:<secret>}.
     *
     * <p>When absent the transport stays idle.
     *
     * @return optional bot token
     */
    Optional<String> token();

    /**
     * Bot API base URL.
     *
     * @return base URL (default: https://api.telegram.org)
     */
    @WithDefault("https://api.telegram.org")
    String apiUrl();

    /**
     * Long-poll timeout passed to {@code getUpdates}.
     *
     * @return poll timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration pollTimeout();

    /**
     * Timeout for every Bot API call other than {@code getUpdates}.
     *
     * @return request timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration requestTimeout();

    /**
     * Discard updates that queued up while the bot was offline.
     *
     * @return true to drop pending updates on startup (default: true)
     */
    @WithDefault("true")
    boolean dropPendingUpdates();
}
