package relay.core.model.registration;

import java.time.Instant;

/**
 * One subject's registration state, valid until {@code expiresAt}.
 *
 * <p>Entries are immutable. Storing a new state for the same subject replaces
 * the whole entry, so a group id is never changed on a live entry.
 *
 * @param subjectId the requesting user's platform identifier
 * @param state     current state
 * @param groupId   group being resolved, or null until a group command is matched
 * @param createdAt when the entry was stored
 * @param expiresAt {@code createdAt + ttl}
 */
public record RegistrationEntry(
        String subjectId, RegistrationState state, String groupId, Instant createdAt, Instant expiresAt) {

    public RegistrationEntry {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Timestamps cannot be null");
        }
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt cannot precede createdAt");
        }
        if (state == RegistrationState.FULFILLED && (groupId == null || groupId.isBlank())) {
            throw new IllegalArgumentException("A fulfilled entry requires a group ID");
        }
    }

    /**
     * Whether this entry is no longer live at the given instant.
     *
     * @param now the instant to test against
     * @return true once {@code now} has reached {@code expiresAt}
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
