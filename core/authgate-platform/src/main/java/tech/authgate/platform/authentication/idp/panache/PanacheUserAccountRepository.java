package tech.authgate.platform.authentication.idp.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authgate.platform.authentication.idp.UserAccount;
import tech.authgate.platform.authentication.idp.UserAccountRepository;
import tech.authgate.platform.authentication.idp.entity.UserAccountEntity;
import tech.authgate.platform.authentication.idp.mapper.UserAccountMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Panache-based implementation of UserAccountRepository.
 */
@ApplicationScoped
public class PanacheUserAccountRepository
    implements UserAccountRepository, PanacheRepositoryBase<UserAccountEntity, String> {

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        return find("email", email.toLowerCase(Locale.ROOT))
            .firstResultOptional()
            .map(UserAccountMapper::toDomain);
    }

    @Override
    public boolean existsByEmail(String email) {
        return count("email", email.toLowerCase(Locale.ROOT)) > 0;
    }

    @Override
    public void persist(UserAccount account) {
        if (account.id == null) {
            account.id = TsidGenerator.generate(EntityType.USER_ACCOUNT);
        }
        account.email = account.email.toLowerCase(Locale.ROOT);
        persist(UserAccountMapper.toEntity(account));
    }

    @Override
    public void updateLastLogin(String accountId, Instant lastLoginAt) {
        update("lastLoginAt = ?1 where id = ?2", lastLoginAt, accountId);
    }

    @Override
    public void updatePasswordHash(String accountId, String passwordHash) {
        update("passwordHash = ?1 where id = ?2", passwordHash, accountId);
    }
}
