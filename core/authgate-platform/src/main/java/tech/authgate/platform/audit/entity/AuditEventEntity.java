package tech.authgate.platform.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.errors.ReasonCode;

import java.time.Instant;

/**
 * JPA entity for audit_events table.
 */
@Entity
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_events_actor", columnList = "actor_id"),
    @Index(name = "idx_audit_events_created", columnList = "created_at")
})
public class AuditEventEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, length = 20)
    public AuditEvent.ActorType actorType;

    @Column(name = "actor_id", length = 100)
    public String actorId;

    @Column(name = "client_id", length = 100)
    public String clientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 50)
    public AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    public AuditEvent.Outcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason_code", nullable = false, length = 50)
    public ReasonCode reasonCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    public AuditEvent.Severity severity;

    @Column(name = "ip", length = 100)
    public String ip;

    @Column(name = "user_agent", length = 500)
    public String userAgent;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public AuditEventEntity() {
    }
}
