package tech.authgate.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for oauth_authorization_codes table.
 */
@Entity
@Table(name = "oauth_authorization_codes")
public class AuthorizationCodeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "code_hash", nullable = false, unique = true, length = 64)
    public String codeHash;

    @Column(name = "client_id", nullable = false, length = 100)
    public String clientId;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Column(name = "redirect_uri", nullable = false, length = 1000)
    public String redirectUri;

    @Column(name = "code_challenge", length = 128)
    public String codeChallenge;

    @Column(name = "code_challenge_method", length = 10)
    public String codeChallengeMethod;

    @Column(name = "scope", length = 500)
    public String scope;

    @Column(name = "state", length = 500)
    public String state;

    @Column(name = "ip_address", length = 100)
    public String ipAddress;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "consumed_at")
    public Instant consumedAt;

    public AuthorizationCodeEntity() {
    }
}
