package relay.core.util;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Utility for keyed, one-way hashing of sensitive identifiers.
 *
 * <p>Uses HMAC-SHA256 so that identifiers drawn from a small space (chat and
 * user ids are plain integers) cannot be recovered by hashing every candidate.
 * The same key and input always produce the same digest.
 */
public final class SecureHash {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Return a truncated HMAC-SHA256 hex digest of the input string.
     *
     * <p>Uses the first {@code hexChars} characters of the full hex digest.
     * 16 hex characters = 64 bits, enough to keep distinct identifiers apart
     * in logs while keeping lines compact.
     *
     * @param key      the secret HMAC key (must not be empty)
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if the key is empty or hexChars is out of range
     */
    public static String truncatedHmacSha256(byte[] key, String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key must not be empty");
        }
        try {
            final var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            final var hashBytes = mac.doFinal(input.getBytes(StandardCharsets.UTF_8));
            final var fullHex = HexFormat.of().formatHex(hashBytes);
            return fullHex.substring(0, hexChars);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("HmacSHA256 must be available per Java spec", e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Invalid HMAC key", e);
        }
    }
}
