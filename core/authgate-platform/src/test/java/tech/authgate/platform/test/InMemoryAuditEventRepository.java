package tech.authgate.platform.test;

import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditEventRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects audit events so tests can assert on the decision trail.
 */
public class InMemoryAuditEventRepository implements AuditEventRepository {

    private final List<AuditEvent> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public List<AuditEvent> findRecent(int limit) {
        synchronized (events) {
            List<AuditEvent> copy = new ArrayList<>(events);
            Collections.reverse(copy);
            return copy.subList(0, Math.min(limit, copy.size()));
        }
    }

    @Override
    public List<AuditEvent> findRecentByActor(String actorId, int limit) {
        return findRecent(Integer.MAX_VALUE).stream()
            .filter(e -> actorId.equals(e.actorId))
            .limit(limit)
            .toList();
    }

    @Override
    public void append(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public List<AuditEvent> byAction(AuditAction action) {
        return events().stream().filter(e -> e.action == action).toList();
    }

    public AuditEvent last() {
        List<AuditEvent> all = events();
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    public void clear() {
        events.clear();
    }
}
