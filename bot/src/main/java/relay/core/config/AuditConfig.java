package relay.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for audit logging.
 *
 * <p>Configuration prefix: {@code relay.audit}
 */
@ConfigMapping(prefix = "relay.audit")
public interface AuditConfig {

    /**
     * Number of hex characters kept from each identifier digest.
     *
     * @return digest length, 1-64 (default: 16)
     */
    @WithDefault("16")
    int digestLength();

    /**
     * Base64-encoded HMAC key for identifier digests (at least 16 bytes).
     *
     * <p>When absent a random key is generated at startup, so digests only
     * correlate within one process lifetime.
     *
     * @return optional digest key
     */
    Optional<String> digestKey();
}
