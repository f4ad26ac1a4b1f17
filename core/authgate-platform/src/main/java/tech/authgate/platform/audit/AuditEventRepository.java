package tech.authgate.platform.audit;

import java.util.List;

/**
 * Append-only store of audit events.
 */
public interface AuditEventRepository {

    // Read operations
    List<AuditEvent> findRecent(int limit);
    List<AuditEvent> findRecentByActor(String actorId, int limit);

    /**
     * Persist an event in its own transaction, so it survives a rollback of the caller's.
     */
    void append(AuditEvent event);
}
