package tech.authgate.platform.authentication.idp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for user_accounts table.
 */
@Entity
@Table(name = "user_accounts")
public class UserAccountEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    public String email;

    @Column(name = "password_hash", nullable = false, length = 200)
    public String passwordHash;

    @Column(name = "role", nullable = false, length = 50)
    public String role;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    public UserAccountEntity() {
    }
}
