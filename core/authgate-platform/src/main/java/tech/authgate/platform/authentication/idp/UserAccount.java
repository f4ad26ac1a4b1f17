package tech.authgate.platform.authentication.idp;

import java.time.Instant;

/**
 * Account known to the built-in identity provider.
 */
public class UserAccount {

    public String id;

    /**
     * Lower-cased, unique.
     */
    public String email;

    /**
     * Argon2id hash (PHC format).
     */
    public String passwordHash;

    public String role;

    public boolean active = true;

    public Instant createdAt = Instant.now();

    public Instant lastLoginAt;

    public UserAccount() {
    }
}
