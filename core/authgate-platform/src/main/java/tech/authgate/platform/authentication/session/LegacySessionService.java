package tech.authgate.platform.authentication.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jboss.logging.Logger;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditEvent.ActorType;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.AuthConfig;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.JwtKeyService;
import tech.authgate.platform.authentication.JwtKeyService.LegacyTokenClaims;
import tech.authgate.platform.authentication.TokenIssuer;
import tech.authgate.platform.authentication.credential.PresentedCredential;
import tech.authgate.platform.authentication.idp.AuthenticatedUser;
import tech.authgate.platform.authentication.idp.IdentityProviderGateway;
import tech.authgate.platform.authentication.idp.IdentityProviderUnavailableException;
import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.AuthException;
import tech.authgate.platform.errors.ReasonCode;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Legacy session-token scheme used by CLI, MCP and machine clients, and by the browser
 * login that precedes the OAuth authorize step.
 *
 * The session token is a signed JWT, but the signature only filters out garbage cheaply.
 * Every validation goes on to find the session record by token hash, so logout and
 * revocation take effect immediately.
 *
 * OAuth-shaped tokens are rejected outright; this service never consults the OAuth store.
 */
@ApplicationScoped
public class LegacySessionService {

    private static final Logger LOG = Logger.getLogger(LegacySessionService.class);

    private final IdentityProviderGateway identityProvider;
    private final LegacySessionRepository sessions;
    private final JwtKeyService jwtKeyService;
    private final CredentialHasher hasher;
    private final TokenIssuer tokenIssuer;
    private final AuditLogger auditLogger;
    private final AuthConfig config;
    private final Clock clock;

    @Inject
    public LegacySessionService(IdentityProviderGateway identityProvider,
                                LegacySessionRepository sessions,
                                JwtKeyService jwtKeyService,
                                CredentialHasher hasher,
                                TokenIssuer tokenIssuer,
                                AuditLogger auditLogger,
                                AuthConfig config,
                                Clock clock) {
        this.identityProvider = identityProvider;
        this.sessions = sessions;
        this.jwtKeyService = jwtKeyService;
        this.hasher = hasher;
        this.tokenIssuer = tokenIssuer;
        this.auditLogger = auditLogger;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Authenticate with the identity provider and open a session.
     *
     * @throws AuthException INVALID_CREDENTIALS for any credential failure, AUTH_SERVICE_UNAVAILABLE
     *                       if the identity provider timed out or is down
     */
    @Transactional(dontRollbackOn = AuthException.class)
    public LoginResult login(String identifier, String credential, ClientPlatform platform, RequestOrigin origin) {
        Optional<AuthenticatedUser> authenticated;
        try {
            authenticated = identityProvider.authenticate(identifier, credential);
        } catch (TimeoutException e) {
            LOG.warnf("Identity provider timed out during login from %s", origin.ip());
            throw loginFailure(AuthError.AUTH_SERVICE_UNAVAILABLE, ReasonCode.IDP_TIMEOUT, origin);
        } catch (IdentityProviderUnavailableException | CircuitBreakerOpenException e) {
            LOG.warnf("Identity provider unavailable during login: %s", e.getMessage());
            throw loginFailure(AuthError.AUTH_SERVICE_UNAVAILABLE, ReasonCode.IDP_UNAVAILABLE, origin);
        }

        if (authenticated.isEmpty()) {
            throw loginFailure(AuthError.INVALID_CREDENTIALS, ReasonCode.INVALID_CREDENTIALS, origin);
        }
        AuthenticatedUser user = authenticated.get();

        Instant now = clock.instant();
        Instant absoluteExpiry = now.plus(config.legacy().absoluteExpiry());
        Instant slidingExpiry = min(now.plus(config.legacy().slidingExpiry()), absoluteExpiry);
        ClientPlatform effectivePlatform = platform != null ? platform : ClientPlatform.API;

        LegacySession session = new LegacySession();
        session.id = TsidGenerator.generate(EntityType.LEGACY_SESSION);
        String sessionToken = jwtKeyService.issueLegacySessionToken(
            session.id, user.userId(), effectivePlatform.name(), now, absoluteExpiry);
        String refreshToken = tokenIssuer.newLegacyRefreshToken();

        session.userId = user.userId();
        session.tokenHash = hasher.fastHash(sessionToken);
        session.refreshTokenHash = hasher.fastHash(refreshToken);
        session.platform = effectivePlatform;
        session.ipAddress = origin.ip();
        session.userAgent = origin.userAgent();
        session.createdAt = now;
        session.lastUsedAt = now;
        session.expiresAt = slidingExpiry;
        session.absoluteExpiresAt = absoluteExpiry;
        sessions.persist(session);

        auditLogger.record(AuditEvent.success(AuditAction.LEGACY_LOGIN, ActorType.USER, user.userId())
            .origin(origin));
        LOG.infof("Legacy session opened: user=%s, platform=%s, session=%s", user.userId(), effectivePlatform, session.id);

        return new LoginResult(
            sessionToken,
            refreshToken,
            "Bearer",
            Duration.between(now, slidingExpiry).toSeconds(),
            new UserInfo(user.userId(), user.email(), user.role()));
    }

    /**
     * Validate a legacy session token.
     *
     * @throws AuthException INVALID_TOKEN if the token is not a live legacy session token
     */
    @Transactional(dontRollbackOn = AuthException.class)
    public SessionInfo validateSession(String rawToken, RequestOrigin origin) {
        if (!(PresentedCredential.parse(rawToken) instanceof PresentedCredential.LegacySession)) {
            throw validateFailure(ReasonCode.WRONG_TOKEN_TYPE, null, origin);
        }
        Optional<LegacyTokenClaims> claims = jwtKeyService.verifyLegacySessionToken(rawToken);
        if (claims.isEmpty()) {
            throw validateFailure(ReasonCode.INVALID_SIGNATURE, null, origin);
        }

        LegacySession session = sessions.findByTokenHash(hasher.fastHash(rawToken))
            .filter(s -> s.id.equals(claims.get().sessionId()))
            .orElseThrow(() -> validateFailure(ReasonCode.SESSION_NOT_FOUND, claims.get().userId(), origin));

        Instant now = clock.instant();
        checkLive(session, now, AuditAction.LEGACY_VALIDATE, origin);

        sessions.touch(session.id, now);
        auditLogger.record(AuditEvent.success(AuditAction.LEGACY_VALIDATE, ActorType.USER, session.userId)
            .origin(origin));
        return SessionInfo.of(session, now);
    }

    /**
     * Extend a session's sliding expiry. Accepts either the session token or the legacy refresh
     * token. The session token itself does not change.
     */
    @Transactional(dontRollbackOn = AuthException.class)
    public SessionInfo refresh(String rawToken, RequestOrigin origin) {
        LegacySession session = findByPresentedToken(rawToken)
            .orElseThrow(() -> refreshFailure(ReasonCode.SESSION_NOT_FOUND, null, origin));

        Instant now = clock.instant();
        checkLive(session, now, AuditAction.LEGACY_REFRESH, origin);

        Instant extended = min(now.plus(config.legacy().slidingExpiry()), session.absoluteExpiresAt);
        sessions.extend(session.id, extended, now);
        session.expiresAt = extended;
        session.lastUsedAt = now;

        auditLogger.record(AuditEvent.success(AuditAction.LEGACY_REFRESH, ActorType.USER, session.userId)
            .origin(origin));
        return SessionInfo.of(session, now);
    }

    /**
     * Revoke the session behind a session or refresh token. Idempotent: unknown and
     * already-revoked tokens are accepted silently.
     */
    @Transactional
    public void logout(String rawToken, RequestOrigin origin) {
        Optional<LegacySession> session = findByPresentedToken(rawToken);
        if (session.isEmpty()) {
            auditLogger.record(AuditEvent.failure(AuditAction.LEGACY_LOGOUT, ActorType.USER, null,
                    ReasonCode.SESSION_NOT_FOUND)
                .severity(AuditEvent.Severity.INFO)
                .origin(origin));
            return;
        }

        boolean revoked = sessions.revoke(session.get().id, clock.instant());
        auditLogger.record(AuditEvent.success(AuditAction.LEGACY_LOGOUT, ActorType.USER, session.get().userId)
            .origin(origin));
        if (revoked) {
            LOG.infof("Legacy session closed: user=%s, session=%s", session.get().userId, session.get().id);
        }
    }

    private Optional<LegacySession> findByPresentedToken(String rawToken) {
        PresentedCredential credential = PresentedCredential.parse(rawToken);
        if (credential instanceof PresentedCredential.LegacyRefresh) {
            return sessions.findByRefreshTokenHash(hasher.fastHash(rawToken));
        }
        if (credential instanceof PresentedCredential.LegacySession) {
            if (jwtKeyService.verifyLegacySessionToken(rawToken).isEmpty()) {
                return Optional.empty();
            }
            return sessions.findByTokenHash(hasher.fastHash(rawToken));
        }
        return Optional.empty();
    }

    private void checkLive(LegacySession session, Instant now, AuditAction action, RequestOrigin origin) {
        ReasonCode reason = null;
        if (session.isRevoked()) {
            reason = ReasonCode.SESSION_REVOKED;
        } else if (session.isExpired(now)) {
            reason = ReasonCode.SESSION_EXPIRED;
        }
        if (reason != null) {
            auditLogger.record(AuditEvent.failure(action, ActorType.USER, session.userId, reason).origin(origin));
            throw new AuthException(AuthError.INVALID_TOKEN, reason);
        }
    }

    private AuthException loginFailure(AuthError error, ReasonCode reason, RequestOrigin origin) {
        auditLogger.record(AuditEvent.failure(AuditAction.LEGACY_LOGIN, ActorType.USER, null, reason).origin(origin));
        return new AuthException(error, reason);
    }

    private AuthException validateFailure(ReasonCode reason, String userId, RequestOrigin origin) {
        auditLogger.record(AuditEvent.failure(AuditAction.LEGACY_VALIDATE, ActorType.USER, userId, reason).origin(origin));
        return new AuthException(AuthError.INVALID_TOKEN, reason);
    }

    private AuthException refreshFailure(ReasonCode reason, String userId, RequestOrigin origin) {
        auditLogger.record(AuditEvent.failure(AuditAction.LEGACY_REFRESH, ActorType.USER, userId, reason).origin(origin));
        return new AuthException(AuthError.INVALID_TOKEN, reason);
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    // ==================== Results ====================

    public record UserInfo(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("role") String role
    ) {}

    public record LoginResult(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("user") UserInfo user
    ) {}

    public record SessionInfo(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("platform") ClientPlatform platform,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("expires_in") long expiresIn
    ) {
        static SessionInfo of(LegacySession session, Instant now) {
            return new SessionInfo(session.id, session.userId, session.platform, session.expiresAt,
                Math.max(0, Duration.between(now, session.expiresAt).toSeconds()));
        }
    }
}
