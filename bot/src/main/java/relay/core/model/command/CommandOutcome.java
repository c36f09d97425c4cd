package relay.core.model.command;

/**
 * Result of handling a registration command.
 */
public enum CommandOutcome {
    /** Private registration stored; the subject was told what to do next. */
    ACKNOWLEDGED,

    /** The group id was sent to the subject privately. */
    DELIVERED,

    /** The subject is not an administrator of the group. */
    UNAUTHORIZED,

    /** An upstream capability failed or timed out; safe to retry. */
    TRANSIENT_FAILURE
}
