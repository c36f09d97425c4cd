package relay.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code relay.telemetry}
 */
@ConfigMapping(prefix = "relay.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    interface MetricsConfig {

        /**
         * Enable Micrometer metrics.
         *
         * @return true if metrics are enabled (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }
}
