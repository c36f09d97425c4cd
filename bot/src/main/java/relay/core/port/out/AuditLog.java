package relay.core.port.out;

import relay.core.model.audit.AuditEventKind;
import relay.core.model.audit.AuditField;

/**
 * Port for audit-safe event logging.
 *
 * <p>Implementations MUST replace every sensitive field with a one-way,
 * deterministic digest before writing, and MUST NOT throw: recording is
 * best-effort and never affects the caller.
 */
public interface AuditLog {

    /**
     * Record an event.
     *
     * @param kind   the event kind
     * @param fields fields attached to the event
     */
    void record(AuditEventKind kind, AuditField... fields);
}
