package tech.authgate.platform.authentication.session.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.authgate.platform.authentication.session.LegacySession;
import tech.authgate.platform.authentication.session.LegacySessionRepository;
import tech.authgate.platform.authentication.session.entity.LegacySessionEntity;
import tech.authgate.platform.authentication.session.mapper.LegacySessionMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of LegacySessionRepository.
 * Lookups by hash are idempotent and retried once on datastore failure, each
 * attempt in its own transaction.
 */
@ApplicationScoped
public class PanacheLegacySessionRepository
    implements LegacySessionRepository, PanacheRepositoryBase<LegacySessionEntity, String> {

    @Override
    @Retry(maxRetries = 1, delay = 50, retryOn = PersistenceException.class)
    public Optional<LegacySession> findByTokenHash(String tokenHash) {
        return QuarkusTransaction.requiringNew().call(() -> find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(LegacySessionMapper::toDomain));
    }

    @Override
    @Retry(maxRetries = 1, delay = 50, retryOn = PersistenceException.class)
    public Optional<LegacySession> findByRefreshTokenHash(String refreshTokenHash) {
        return QuarkusTransaction.requiringNew().call(() -> find("refreshTokenHash", refreshTokenHash)
            .firstResultOptional()
            .map(LegacySessionMapper::toDomain));
    }

    @Override
    public void persist(LegacySession session) {
        if (session.id == null) {
            session.id = TsidGenerator.generate(EntityType.LEGACY_SESSION);
        }
        persist(LegacySessionMapper.toEntity(session));
    }

    @Override
    public void extend(String sessionId, Instant expiresAt, Instant lastUsedAt) {
        update("expiresAt = ?1, lastUsedAt = ?2 where id = ?3 and revokedAt is null", expiresAt, lastUsedAt, sessionId);
    }

    @Override
    public void touch(String sessionId, Instant lastUsedAt) {
        update("lastUsedAt = ?1 where id = ?2", lastUsedAt, sessionId);
    }

    @Override
    public boolean revoke(String sessionId, Instant revokedAt) {
        return update("revokedAt = ?1 where id = ?2 and revokedAt is null", revokedAt, sessionId) == 1;
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("absoluteExpiresAt < ?1", before);
    }
}
