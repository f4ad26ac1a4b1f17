package tech.authgate.platform.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditEventRepository;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the audit trail.
 */
@Path("/admin/audit-events")
@Tag(name = "Admin - Audit", description = "Authorization decision log")
@Produces(MediaType.APPLICATION_JSON)
@AdminAuthenticated
public class AuditEventAdminResource {

    private static final int MAX_LIMIT = 500;

    @Inject
    AuditEventRepository auditEvents;

    @GET
    @Operation(summary = "List recent audit events, newest first")
    public List<AuditEventDto> list(
            @Parameter(description = "Only events of this actor") @QueryParam("actorId") String actorId,
            @Parameter(description = "Maximum number of events (1-500)") @QueryParam("limit") @DefaultValue("50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<AuditEvent> events = actorId != null && !actorId.isBlank()
            ? auditEvents.findRecentByActor(actorId, bounded)
            : auditEvents.findRecent(bounded);
        return events.stream().map(AuditEventAdminResource::toDto).toList();
    }

    private static AuditEventDto toDto(AuditEvent event) {
        return new AuditEventDto(
            event.id,
            event.action != null ? event.action.name() : null,
            event.outcome != null ? event.outcome.name() : null,
            event.reasonCode != null ? event.reasonCode.name() : null,
            event.severity != null ? event.severity.name() : null,
            event.actorType != null ? event.actorType.name() : null,
            event.actorId,
            event.clientId,
            event.ip,
            event.createdAt
        );
    }

    public record AuditEventDto(
        String id,
        String action,
        String outcome,
        String reasonCode,
        String severity,
        String actorType,
        String actorId,
        String clientId,
        String ip,
        Instant createdAt
    ) {}
}
