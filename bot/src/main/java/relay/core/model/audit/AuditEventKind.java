package relay.core.model.audit;

/**
 * Kinds of audit events emitted by the relay.
 */
public enum AuditEventKind {
    REGISTERED(false),
    REGISTRATION_REFRESHED(false),
    GROUP_REQUEST(false),
    ADMIN_CHECK_DENIED(true),
    ADMIN_CHECK_FAILED(true),
    DELIVERED(false),
    DELIVERY_FAILED(true),
    CONSUME_RACE(true),
    ENTRY_STORED(false),
    ENTRY_CONSUMED(false),
    ENTRY_EXPIRED(false),
    SWEEP_COMPLETED(false);

    private final boolean warning;

    AuditEventKind(boolean warning) {
        this.warning = warning;
    }

    /**
     * Whether the event denotes a denial or failure.
     *
     * @return true for events logged at warning level
     */
    public boolean isWarning() {
        return warning;
    }
}
