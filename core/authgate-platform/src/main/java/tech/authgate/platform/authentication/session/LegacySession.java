package tech.authgate.platform.authentication.session;

import java.time.Instant;

/**
 * Server-side record behind a legacy session token.
 *
 * The signed token is never trusted on its own: a session is valid only while this record
 * exists, is not revoked, and neither expiry has passed.
 */
public class LegacySession {

    public String id;

    public String userId;

    /**
     * SHA-256 hex of the signed session token. Never changes after login.
     */
    public String tokenHash;

    /**
     * SHA-256 hex of the opaque legacy refresh token.
     */
    public String refreshTokenHash;

    public ClientPlatform platform;

    public String ipAddress;

    public String userAgent;

    public Instant createdAt = Instant.now();

    public Instant lastUsedAt;

    /**
     * Sliding expiry, pushed forward by refresh.
     */
    public Instant expiresAt;

    /**
     * Hard cap, equal to the signed token's exp. Refresh never extends past it.
     */
    public Instant absoluteExpiresAt;

    public Instant revokedAt;

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt) || !now.isBefore(absoluteExpiresAt);
    }
}
