package tech.authgate.platform.authentication.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for LegacySession entities.
 */
public interface LegacySessionRepository {

    // Read operations
    Optional<LegacySession> findByTokenHash(String tokenHash);
    Optional<LegacySession> findByRefreshTokenHash(String refreshTokenHash);

    // Write operations
    void persist(LegacySession session);
    void extend(String sessionId, Instant expiresAt, Instant lastUsedAt);
    void touch(String sessionId, Instant lastUsedAt);

    /**
     * @return true if this call revoked the session, false if it was already revoked
     */
    boolean revoke(String sessionId, Instant revokedAt);

    /**
     * Delete sessions whose hard cap passed before the given instant.
     *
     * @return number of sessions removed
     */
    long deleteExpired(Instant before);
}
