package relay.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the ephemeral registration registry.
 *
 * <p>Configuration prefix: {@code relay.registry}
 */
@ConfigMapping(prefix = "relay.registry")
public interface RegistryConfig {

    /**
     * Lifetime of every registration entry.
     *
     * @return entry TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Interval between background sweeps of expired entries.
     *
     * <p>Sweeps only bound memory; reads never return expired entries regardless.
     *
     * @return sweep interval (default: 45 seconds)
     */
    @WithDefault("PT45S")
    Duration sweepInterval();
}
