package tech.authgate.platform.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Records authorization decisions.
 *
 * Every decision point calls {@link #record} exactly once. The event is written to the
 * {@code authgate.audit} log category and appended to the audit store in a separate transaction.
 * A store failure is logged and counted; it does not change the decision already made.
 */
@ApplicationScoped
public class AuditLogger {

    private static final Logger AUDIT = Logger.getLogger("authgate.audit");
    private static final Logger LOG = Logger.getLogger(AuditLogger.class);

    private final AuditEventRepository repository;
    private final Counter writeFailures;

    @Inject
    public AuditLogger(AuditEventRepository repository, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.writeFailures = Counter.builder("authgate.audit.write.failures")
            .description("Audit events that could not be persisted")
            .register(meterRegistry);
    }

    public void record(AuditEvent event) {
        if (event.severity == AuditEvent.Severity.HIGH) {
            AUDIT.warnf("action=%s outcome=%s reason=%s severity=%s actor=%s:%s client=%s ip=%s",
                event.action, event.outcome, event.reasonCode, event.severity,
                event.actorType, event.actorId, event.clientId, event.ip);
        } else {
            AUDIT.infof("action=%s outcome=%s reason=%s severity=%s actor=%s:%s client=%s ip=%s",
                event.action, event.outcome, event.reasonCode, event.severity,
                event.actorType, event.actorId, event.clientId, event.ip);
        }

        try {
            repository.append(event);
        } catch (RuntimeException e) {
            writeFailures.increment();
            LOG.errorf(e, "Failed to persist audit event: action=%s outcome=%s reason=%s",
                event.action, event.outcome, event.reasonCode);
        }
    }
}
