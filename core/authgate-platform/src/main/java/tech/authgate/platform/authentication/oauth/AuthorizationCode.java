package tech.authgate.platform.authentication.oauth;

import java.time.Instant;

/**
 * Short-lived, single-use authorization code.
 *
 * Only the hash of the code is stored. The id doubles as the chain id of every token
 * derived from the code, so a reused code can revoke everything it produced.
 */
public class AuthorizationCode {

    public String id;

    /**
     * SHA-256 hex of the code handed to the client.
     */
    public String codeHash;

    public String clientId;

    public String userId;

    /**
     * Redirect URI from the authorize request. The token request must repeat it byte for byte.
     */
    public String redirectUri;

    public String codeChallenge;

    /**
     * Always S256.
     */
    public String codeChallengeMethod;

    public String scope;

    public String state;

    public String ipAddress;

    public Instant createdAt = Instant.now();

    public Instant expiresAt;

    /**
     * Set once, by an atomic conditional update. Non-null means the code is spent.
     */
    public Instant consumedAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }
}
