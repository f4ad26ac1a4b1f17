package tech.authgate.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode entities.
 */
public interface AuthorizationCodeRepository {

    // Read operations
    Optional<AuthorizationCode> findByCodeHash(String codeHash);

    // Write operations
    void persist(AuthorizationCode code);

    /**
     * Mark a code consumed if and only if it has not been consumed yet.
     * Implementations must make this a single atomic conditional write.
     *
     * @return true if this call consumed the code, false if it was already consumed
     */
    boolean consume(String codeHash, Instant consumedAt);

    /**
     * Delete codes that expired before the given instant.
     *
     * @return number of codes removed
     */
    long deleteExpired(Instant before);
}
