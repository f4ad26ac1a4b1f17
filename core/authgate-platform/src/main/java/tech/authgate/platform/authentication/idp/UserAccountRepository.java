package tech.authgate.platform.authentication.idp;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for UserAccount entities.
 */
public interface UserAccountRepository {

    // Read operations
    Optional<UserAccount> findByEmail(String email);
    boolean existsByEmail(String email);

    // Write operations
    void persist(UserAccount account);
    void updateLastLogin(String accountId, Instant lastLoginAt);
    void updatePasswordHash(String accountId, String passwordHash);
}
