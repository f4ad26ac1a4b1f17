package tech.authgate.platform.audit.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditEventRepository;
import tech.authgate.platform.audit.entity.AuditEventEntity;
import tech.authgate.platform.audit.mapper.AuditEventMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.util.List;

/**
 * Panache-based implementation of AuditEventRepository.
 */
@ApplicationScoped
public class PanacheAuditEventRepository implements AuditEventRepository,
        PanacheRepositoryBase<AuditEventEntity, String> {

    @Override
    public List<AuditEvent> findRecent(int limit) {
        return findAll(Sort.descending("createdAt", "id"))
            .page(0, limit)
            .list()
            .stream()
            .map(AuditEventMapper::toDomain)
            .toList();
    }

    @Override
    public List<AuditEvent> findRecentByActor(String actorId, int limit) {
        return find("actorId", Sort.descending("createdAt", "id"), actorId)
            .page(0, limit)
            .list()
            .stream()
            .map(AuditEventMapper::toDomain)
            .toList();
    }

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void append(AuditEvent event) {
        if (event.id == null) {
            event.id = TsidGenerator.generate(EntityType.AUDIT_EVENT);
        }
        persist(AuditEventMapper.toEntity(event));
    }
}
