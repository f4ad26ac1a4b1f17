package tech.authgate.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the AuthGate authentication module.
 *
 * Example configuration:
 * <pre>
 * authgate.auth.jwt.issuer=https://auth.example.com
 * authgate.auth.jwt.private-key-path=/keys/private.pem
 * authgate.auth.jwt.public-key-path=/keys/public.pem
 * authgate.auth.oauth.login-page=https://auth.example.com/login
 * authgate.auth.hashing.memory-kib=65536
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "authgate.auth")
public interface AuthConfig {

    /**
     * Signing keys for legacy session tokens.
     */
    JwtConfig jwt();

    /**
     * OAuth2 authorization code flow.
     */
    OAuthConfig oauth();

    /**
     * Legacy session token lifetimes.
     */
    LegacyConfig legacy();

    /**
     * Browser cookies used by the authorize/login leg.
     */
    SessionConfig session();

    CsrfConfig csrf();

    HashingConfig hashing();

    /**
     * JWT configuration.
     */
    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         */
        @WithDefault("authgate")
        String issuer();

        /**
         * Path to the RSA private key for signing tokens (PEM format).
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key for validating tokens (PEM format).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Directory used to persist generated keys when no key paths are configured.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();
    }

    interface OAuthConfig {
        /**
         * Authorization code lifetime.
         * Default: 5 minutes
         */
        @WithName("authorization-code-expiry")
        @WithDefault("PT5M")
        Duration authorizationCodeExpiry();

        /**
         * Access token lifetime.
         * Default: 1 hour
         */
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        /**
         * Refresh token lifetime.
         * Default: 30 days
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        /**
         * How long after a code is consumed a second exchange counts as a concurrent
         * duplicate rather than a replay. Duplicates are rejected without revoking the
         * winner's tokens; later replays revoke the chain.
         * Default: 2 seconds
         */
        @WithName("concurrent-exchange-window")
        @WithDefault("PT2S")
        Duration concurrentExchangeWindow();

        /**
         * Login page the authorize endpoint sends unauthenticated browsers to.
         * Receives csrf_token and return_to query parameters.
         */
        @WithName("login-page")
        @WithDefault("/login")
        String loginPage();

        /**
         * Public base URL used in discovery metadata.
         */
        @WithName("external-base-url")
        Optional<String> externalBaseUrl();
    }

    interface LegacyConfig {
        /**
         * Sliding session lifetime, extended on refresh.
         * Default: 7 days
         */
        @WithName("sliding-expiry")
        @WithDefault("P7D")
        Duration slidingExpiry();

        /**
         * Hard cap on a session's lifetime. Also the signed token's exp.
         * Default: 30 days
         */
        @WithName("absolute-expiry")
        @WithDefault("P30D")
        Duration absoluteExpiry();
    }

    interface SessionConfig {
        /**
         * Whether cookies should be secure (HTTPS only).
         */
        @WithDefault("true")
        boolean secure();

        @WithName("same-site")
        @WithDefault("Lax")
        String sameSite();

        @WithName("cookie-name")
        @WithDefault("ag_session")
        String cookieName();

        /**
         * Cookie holding the browser binding id CSRF tokens are tied to.
         */
        @WithName("binding-cookie-name")
        @WithDefault("ag_binding")
        String bindingCookieName();

        /**
         * Double-submit CSRF cookie.
         */
        @WithName("csrf-cookie-name")
        @WithDefault("ag_csrf")
        String csrfCookieName();
    }

    interface CsrfConfig {
        @WithDefault("PT15M")
        Duration ttl();

        /**
         * Upper bound on outstanding tokens held in memory.
         */
        @WithName("max-outstanding")
        @WithDefault("100000")
        long maxOutstanding();
    }

    /**
     * Argon2id parameters for slow hashes (vendor secrets, client secrets, passwords).
     */
    interface HashingConfig {
        @WithName("memory-kib")
        @WithDefault("65536")
        int memoryKib();

        @WithDefault("3")
        int iterations();

        @WithDefault("4")
        int parallelism();
    }
}
