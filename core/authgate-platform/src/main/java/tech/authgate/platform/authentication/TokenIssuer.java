package tech.authgate.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates opaque bearer values: 32 bytes (256 bits) from {@link SecureRandom}, base64url encoded,
 * behind a short prefix that identifies the value's kind.
 *
 * The prefix only routes a presented value to the right validator. It grants nothing: every value
 * is still looked up by hash before it is trusted.
 */
@ApplicationScoped
public class TokenIssuer {

    public static final String AUTHORIZATION_CODE_PREFIX = "agac_";
    public static final String ACCESS_TOKEN_PREFIX = "agat_";
    public static final String REFRESH_TOKEN_PREFIX = "agrt_";
    public static final String LEGACY_REFRESH_PREFIX = "agls_";

    private static final int TOKEN_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public String newAuthorizationCode() {
        return AUTHORIZATION_CODE_PREFIX + randomValue();
    }

    public String newAccessToken() {
        return ACCESS_TOKEN_PREFIX + randomValue();
    }

    public String newRefreshToken() {
        return REFRESH_TOKEN_PREFIX + randomValue();
    }

    public String newLegacyRefreshToken() {
        return LEGACY_REFRESH_PREFIX + randomValue();
    }

    /**
     * Random value with no prefix. Used for client secrets, vendor key secrets and CSRF tokens.
     */
    public String randomValue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
