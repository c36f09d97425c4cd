package relay.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for registration command handling.
 *
 * <p>Configuration prefix: {@code relay.command}
 */
@ConfigMapping(prefix = "relay.command")
public interface CommandConfig {

    /**
     * Name of the registration command, without the leading slash.
     *
     * @return command name (default: bandaid)
     */
    @WithDefault("bandaid")
    String name();

    /**
     * Upper bound on the admin check. A check that has not answered in time
     * is treated as failed.
     *
     * @return admin check timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration adminCheckTimeout();

    /**
     * How many times a store-and-consume cycle is retried when a concurrent
     * command for the same subject consumed the entry first.
     *
     * @return maximum attempts (default: 3)
     */
    @WithDefault("3")
    int maxConsumeAttempts();
}
