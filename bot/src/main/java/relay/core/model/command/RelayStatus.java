package relay.core.model.command;

import java.time.Duration;

/**
 * Read-only snapshot of the relay's state.
 *
 * @param liveEntryCount number of unexpired registration entries
 * @param ttl            lifetime of each entry
 */
public record RelayStatus(long liveEntryCount, Duration ttl) {}
