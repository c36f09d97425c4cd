package relay.core.model.registration;

/**
 * Result of storing a registration entry.
 *
 * @param entry    the entry now live for the subject
 * @param replaced true if a live entry for the same subject was replaced
 */
public record EntryHandle(RegistrationEntry entry, boolean replaced) {}
