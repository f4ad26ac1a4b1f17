package tech.authgate.platform.audit.mapper;

import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.entity.AuditEventEntity;

import java.time.Instant;

/**
 * Mapper for converting between AuditEvent domain model and JPA entity.
 */
public final class AuditEventMapper {

    private static final int USER_AGENT_MAX = 500;

    private AuditEventMapper() {
    }

    public static AuditEvent toDomain(AuditEventEntity entity) {
        if (entity == null) {
            return null;
        }

        AuditEvent domain = new AuditEvent();
        domain.id = entity.id;
        domain.actorType = entity.actorType;
        domain.actorId = entity.actorId;
        domain.clientId = entity.clientId;
        domain.action = entity.action;
        domain.outcome = entity.outcome;
        domain.reasonCode = entity.reasonCode;
        domain.severity = entity.severity;
        domain.ip = entity.ip;
        domain.userAgent = entity.userAgent;
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static AuditEventEntity toEntity(AuditEvent domain) {
        if (domain == null) {
            return null;
        }

        AuditEventEntity entity = new AuditEventEntity();
        entity.id = domain.id;
        entity.actorType = domain.actorType;
        entity.actorId = domain.actorId;
        entity.clientId = domain.clientId;
        entity.action = domain.action;
        entity.outcome = domain.outcome;
        entity.reasonCode = domain.reasonCode;
        entity.severity = domain.severity;
        entity.ip = domain.ip;
        entity.userAgent = domain.userAgent != null && domain.userAgent.length() > USER_AGENT_MAX
            ? domain.userAgent.substring(0, USER_AGENT_MAX)
            : domain.userAgent;
        entity.createdAt = domain.createdAt != null ? domain.createdAt : Instant.now();
        return entity;
    }
}
