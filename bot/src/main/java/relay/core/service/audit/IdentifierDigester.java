package relay.core.service.audit;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import relay.core.config.AuditConfig;
import relay.core.util.SecureHash;

/**
 * Turns raw identifiers into stable, non-reversible digests for logging.
 *
 * <h2>Configuration</h2>
 * <pre>
 * relay.audit.digest-key=${RELAY_AUDIT_DIGEST_KEY}  # optional, base64, at least 16 bytes
 * relay.audit.digest-length=16
 * </pre>
 */
@ApplicationScoped
public class IdentifierDigester {

    private static final Logger LOG = Logger.getLogger(IdentifierDigester.class);
    private static final int GENERATED_KEY_BYTES = 32;
    private static final int MIN_KEY_BYTES = 16;

    private final byte[] key;
    private final int digestLength;

    @Inject
    public IdentifierDigester(AuditConfig config) {
        this(resolveKey(config.digestKey()), config.digestLength());
    }

    public IdentifierDigester(byte[] key, int digestLength) {
        if (key == null || key.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("Digest key must be at least " + MIN_KEY_BYTES + " bytes");
        }
        if (digestLength < 1 || digestLength > 64) {
            throw new IllegalArgumentException("Digest length must be between 1 and 64, got " + digestLength);
        }
        this.key = key.clone();
        this.digestLength = digestLength;
    }

    /**
     * Digest a raw identifier.
     *
     * @param rawIdentifier the identifier (must not be null)
     * @return hex digest of the configured length
     */
    public String digest(String rawIdentifier) {
        return SecureHash.truncatedHmacSha256(key, rawIdentifier, digestLength);
    }

    private static byte[] resolveKey(Optional<String> configuredKey) {
        if (configuredKey.isPresent() && !configuredKey.get().isBlank()) {
            return Base64.getDecoder().decode(configuredKey.get().trim());
        }
        final var generated = new byte[GENERATED_KEY_BYTES];
        new SecureRandom().nextBytes(generated);
        LOG.info("No audit digest key configured; generated a per-process key (digests do not correlate across restarts)");
        return generated;
    }
}
