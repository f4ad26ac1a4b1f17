package tech.authgate.platform.authentication.session.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.authgate.platform.authentication.session.ClientPlatform;

import java.time.Instant;

/**
 * JPA entity for legacy_sessions table.
 */
@Entity
@Table(name = "legacy_sessions", indexes = {
    @Index(name = "idx_legacy_sessions_user", columnList = "user_id")
})
public class LegacySessionEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    public String tokenHash;

    @Column(name = "refresh_token_hash", unique = true, length = 64)
    public String refreshTokenHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 10)
    public ClientPlatform platform;

    @Column(name = "ip_address", length = 100)
    public String ipAddress;

    @Column(name = "user_agent", length = 500)
    public String userAgent;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "absolute_expires_at", nullable = false)
    public Instant absoluteExpiresAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    public LegacySessionEntity() {
    }
}
