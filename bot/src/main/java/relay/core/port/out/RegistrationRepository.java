package relay.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import relay.core.model.registration.EntryHandle;
import relay.core.model.registration.RegistrationEntry;
import relay.core.model.registration.RegistrationState;

/**
 * Ephemeral store of registration entries, keyed by subject.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>At most one entry per subject; {@code put} replaces, never duplicates</li>
 *   <li>Entries MUST expire after the configured TTL, even before a sweep runs</li>
 *   <li>{@code take} MUST be atomic: an entry is returned to one caller only</li>
 *   <li>Mutations of the same subject are linearizable; different subjects never contend</li>
 *   <li>No operation fails; absence is an empty result</li>
 * </ul>
 */
public interface RegistrationRepository {

    /**
     * Store a fresh entry for the subject, replacing any existing one.
     *
     * @param subjectId the subject identifier
     * @param state     the state to store
     * @param groupId   the group identifier, or null
     * @return Uni with a handle on the stored entry
     */
    Uni<EntryHandle> put(String subjectId, RegistrationState state, String groupId);

    /**
     * Read the live entry for the subject.
     *
     * <p>An expired entry is evicted and reported as absent.
     *
     * @param subjectId the subject identifier
     * @return Uni with the entry if present and live
     */
    Uni<Optional<RegistrationEntry>> get(String subjectId);

    /**
     * Read and remove the entry for the subject (one-time use).
     *
     * @param subjectId the subject identifier
     * @return Uni with the entry if it was present and live
     */
    Uni<Optional<RegistrationEntry>> take(String subjectId);

    /**
     * Remove every entry whose expiry is at or before {@code now}.
     *
     * @param now the reference instant
     * @return number of entries removed
     */
    int sweep(Instant now);

    /**
     * Count entries that are still live.
     *
     * @return number of unexpired entries
     */
    long liveEntryCount();
}
