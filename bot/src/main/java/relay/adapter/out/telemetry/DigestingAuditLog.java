package relay.adapter.out.telemetry;

import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import relay.core.model.audit.AuditEventKind;
import relay.core.model.audit.AuditField;
import relay.core.port.out.AuditLog;
import relay.core.service.audit.IdentifierDigester;

/**
 * Audit log that writes to the {@code relay.audit} category using JBoss Logging.
 *
 * <p>Line format: {@code EVENT_KIND name=value name=#digest ...}. Sensitive
 * fields are replaced by their keyed digest; raw identifiers never reach the sink.
 *
 * <p>Log levels:
 * <ul>
 *   <li>state changes → INFO</li>
 *   <li>denials and failures → WARN</li>
 * </ul>
 */
@ApplicationScoped
public class DigestingAuditLog implements AuditLog {

    private static final Logger LOG = Logger.getLogger(DigestingAuditLog.class);
    private static final String AUDIT_CATEGORY = "relay.audit";

    private final IdentifierDigester digester;
    private final Logger auditLogger;
    private final AtomicBoolean failureReported = new AtomicBoolean(false);

    @Inject
    public DigestingAuditLog(IdentifierDigester digester) {
        this(digester, Logger.getLogger(AUDIT_CATEGORY));
    }

    DigestingAuditLog(IdentifierDigester digester, Logger auditLogger) {
        this.digester = digester;
        this.auditLogger = auditLogger;
    }

    @Override
    public void record(AuditEventKind kind, AuditField... fields) {
        try {
            final var line = format(kind, fields);
            if (kind.isWarning()) {
                auditLogger.warn(line);
            } else {
                auditLogger.info(line);
            }
        } catch (RuntimeException e) {
            // Only the kind and exception type are reported; field values may be raw identifiers
            if (failureReported.compareAndSet(false, true)) {
                LOG.warnf("Dropping audit events after failure recording %s: %s", kind, e.getClass().getName());
            }
        }
    }

    String format(AuditEventKind kind, AuditField... fields) {
        final var line = new StringBuilder(kind.name());
        if (fields == null) {
            return line.toString();
        }
        for (var field : fields) {
            line.append(' ').append(field.name()).append('=').append(render(field));
        }
        return line.toString();
    }

    private String render(AuditField field) {
        if (field.value() == null) {
            return "-";
        }
        if (field.sensitive()) {
            return "#" + digester.digest(String.valueOf(field.value()));
        }
        return String.valueOf(field.value());
    }
}
