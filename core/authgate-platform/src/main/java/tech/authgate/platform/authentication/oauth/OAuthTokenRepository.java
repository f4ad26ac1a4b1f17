package tech.authgate.platform.authentication.oauth;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for OAuth access and refresh tokens.
 */
public interface OAuthTokenRepository {

    // Read operations
    Optional<OAuthToken> findByTokenHash(String tokenHash);
    List<String> findIdsByParent(String parentTokenId);

    // Write operations
    void persist(OAuthToken token);

    /**
     * Revoke a single token if it is not revoked yet.
     *
     * @return true if this call revoked it
     */
    boolean revoke(String tokenId, String reason, Instant revokedAt);

    /**
     * Revoke every live token sharing the chain id.
     *
     * @return number of tokens revoked
     */
    int revokeChain(String chainId, String reason, Instant revokedAt);

    /**
     * Remove tokens that expired before the cutoff, revoked or not.
     *
     * @return number of tokens removed
     */
    long deleteExpired(Instant before);
}
