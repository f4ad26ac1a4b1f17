package tech.authgate.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authgate.platform.authentication.oauth.AuthorizationCode;
import tech.authgate.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.authgate.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import tech.authgate.platform.authentication.oauth.mapper.AuthorizationCodeMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCodeHash(String codeHash) {
        return find("codeHash", codeHash)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    public void persist(AuthorizationCode code) {
        if (code.id == null) {
            code.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        }
        if (code.createdAt == null) {
            code.createdAt = Instant.now();
        }
        persist(AuthorizationCodeMapper.toEntity(code));
    }

    @Override
    public boolean consume(String codeHash, Instant consumedAt) {
        // Single conditional UPDATE: of two concurrent callers only one sees a row count of 1
        return update("consumedAt = ?1 where codeHash = ?2 and consumedAt is null", consumedAt, codeHash) == 1;
    }

    @Override
    public long deleteExpired(Instant before) {
        return delete("expiresAt < ?1", before);
    }
}
