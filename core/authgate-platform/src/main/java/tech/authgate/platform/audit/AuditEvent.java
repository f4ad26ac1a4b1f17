package tech.authgate.platform.audit;

import tech.authgate.platform.errors.ReasonCode;

import java.time.Instant;

/**
 * One authorization decision. Append-only.
 *
 * The reason code is the internal cause and is never shown to the caller that triggered
 * the decision.
 */
public class AuditEvent {

    public String id;

    public ActorType actorType;

    /**
     * User id, OAuth client id or vendor organization id, depending on actorType. May be null
     * when the caller could not be identified.
     */
    public String actorId;

    /**
     * OAuth client or vendor key involved, if any.
     */
    public String clientId;

    public AuditAction action;

    public Outcome outcome;

    public ReasonCode reasonCode;

    public Severity severity;

    public String ip;

    public String userAgent;

    public Instant createdAt = Instant.now();

    public AuditEvent() {
    }

    public static AuditEvent success(AuditAction action, ActorType actorType, String actorId) {
        AuditEvent event = new AuditEvent();
        event.action = action;
        event.actorType = actorType;
        event.actorId = actorId;
        event.outcome = Outcome.SUCCESS;
        event.reasonCode = ReasonCode.OK;
        event.severity = Severity.INFO;
        return event;
    }

    public static AuditEvent failure(AuditAction action, ActorType actorType, String actorId, ReasonCode reason) {
        AuditEvent event = new AuditEvent();
        event.action = action;
        event.actorType = actorType;
        event.actorId = actorId;
        event.outcome = Outcome.FAILURE;
        event.reasonCode = reason;
        event.severity = Severity.WARNING;
        return event;
    }

    public AuditEvent client(String clientId) {
        this.clientId = clientId;
        return this;
    }

    public AuditEvent severity(Severity severity) {
        this.severity = severity;
        return this;
    }

    public AuditEvent origin(RequestOrigin origin) {
        if (origin != null) {
            this.ip = origin.ip();
            this.userAgent = origin.userAgent();
        }
        return this;
    }

    public enum ActorType {
        USER,
        CLIENT,
        VENDOR,
        /** Holder of the administrative API token. */
        ADMIN
    }

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    public enum Severity {
        INFO,
        WARNING,
        /** Suspected credential theft, e.g. code or refresh token reuse. */
        HIGH
    }
}
