package tech.authgate.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.faulttolerance.Retry;
import tech.authgate.platform.authentication.oauth.OAuthToken;
import tech.authgate.platform.authentication.oauth.OAuthTokenRepository;
import tech.authgate.platform.authentication.oauth.entity.OAuthTokenEntity;
import tech.authgate.platform.authentication.oauth.mapper.OAuthTokenMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthTokenRepository.
 * The hash lookup is idempotent and retried once; revocations are never retried.
 * Each lookup attempt runs in its own transaction so a failed attempt cannot
 * mark the caller's transaction rollback-only.
 */
@ApplicationScoped
public class PanacheOAuthTokenRepository
    implements OAuthTokenRepository, PanacheRepositoryBase<OAuthTokenEntity, String> {

    @Override
    @Retry(maxRetries = 1, delay = 50, retryOn = PersistenceException.class)
    public Optional<OAuthToken> findByTokenHash(String tokenHash) {
        return QuarkusTransaction.requiringNew().call(() -> find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(OAuthTokenMapper::toDomain));
    }

    @Override
    public List<String> findIdsByParent(String parentTokenId) {
        return getEntityManager()
            .createQuery("select t.id from OAuthTokenEntity t where t.parentTokenId = :parent", String.class)
            .setParameter("parent", parentTokenId)
            .getResultList();
    }

    @Override
    public void persist(OAuthToken token) {
        if (token.id == null) {
            token.id = TsidGenerator.generate(EntityType.OAUTH_TOKEN);
        }
        persist(OAuthTokenMapper.toEntity(token));
    }

    @Override
    public boolean revoke(String tokenId, String reason, Instant revokedAt) {
        return update("revokedAt = ?1, revokedReason = ?2 where id = ?3 and revokedAt is null",
            revokedAt, reason, tokenId) == 1;
    }

    @Override
    public int revokeChain(String chainId, String reason, Instant revokedAt) {
        return update("revokedAt = ?1, revokedReason = ?2 where chainId = ?3 and revokedAt is null",
            revokedAt, reason, chainId);
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("expiresAt < ?1", before);
    }
}
