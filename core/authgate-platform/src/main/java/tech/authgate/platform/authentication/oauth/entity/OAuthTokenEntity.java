package tech.authgate.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.authgate.platform.authentication.oauth.OAuthToken.TokenType;

import java.time.Instant;

/**
 * JPA entity for oauth_tokens table.
 */
@Entity
@Table(name = "oauth_tokens", indexes = {
    @Index(name = "idx_oauth_tokens_parent", columnList = "parent_token_id"),
    @Index(name = "idx_oauth_tokens_chain", columnList = "chain_id")
})
public class OAuthTokenEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    public String tokenHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "token_type", nullable = false, length = 10)
    public TokenType tokenType;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "scope", length = 500)
    public String scope;

    @Column(name = "parent_token_id", length = 17)
    public String parentTokenId;

    @Column(name = "chain_id", nullable = false, length = 17)
    public String chainId;

    @Column(name = "issued_at", nullable = false)
    public Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "revoked_reason", length = 50)
    public String revokedReason;

    public OAuthTokenEntity() {
    }
}
