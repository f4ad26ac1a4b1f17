package tech.authgate.platform.authentication.oauth;

import java.time.Instant;

/**
 * Issued OAuth access or refresh token. Only the hash is stored.
 *
 * Tokens form chains: the pair issued at code exchange has no parent, and each rotation
 * issues a pair whose parent is the refresh token that was presented. All tokens descending
 * from one authorization code share its id as chainId.
 */
public class OAuthToken {

    public String id;

    public String tokenHash;

    public TokenType tokenType;

    public String userId;

    public String clientId;

    public String scope;

    /**
     * Refresh token this one was rotated from, null for the first pair.
     */
    public String parentTokenId;

    /**
     * Id of the authorization code the chain descends from.
     */
    public String chainId;

    public Instant issuedAt = Instant.now();

    public Instant expiresAt;

    public Instant revokedAt;

    public String revokedReason;

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !isRevoked() && !isExpired(now);
    }

    public enum TokenType {
        ACCESS,
        REFRESH
    }
}
