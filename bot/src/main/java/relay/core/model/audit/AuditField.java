package relay.core.model.audit;

/**
 * A named value attached to an audit event.
 *
 * <p>Sensitive values are digested before they reach any log sink.
 *
 * @param name      field name as written in the log line
 * @param value     raw value, may be null
 * @param sensitive whether the value is an identifier that must not be logged in clear
 */
public record AuditField(String name, Object value, boolean sensitive) {

    public AuditField {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be null or blank");
        }
    }

    public static AuditField sensitive(String name, Object value) {
        return new AuditField(name, value, true);
    }

    public static AuditField plain(String name, Object value) {
        return new AuditField(name, value, false);
    }
}
