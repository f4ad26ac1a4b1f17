package tech.authgate.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditEvent.ActorType;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.AuthConfig;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.TokenIssuer;
import tech.authgate.platform.authentication.credential.PresentedCredential;
import tech.authgate.platform.authentication.oauth.OAuthRequests.AuthorizeRequest;
import tech.authgate.platform.authentication.oauth.OAuthRequests.IntrospectionResponse;
import tech.authgate.platform.authentication.oauth.OAuthRequests.TokenRequest;
import tech.authgate.platform.authentication.oauth.OAuthRequests.TokenResponse;
import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.AuthException;
import tech.authgate.platform.errors.ReasonCode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * OAuth2 Authorization Code + PKCE flow with refresh token rotation.
 *
 * <pre>
 * START -> AUTHORIZED (code issued) -> EXCHANGED (tokens issued) -> [REFRESHED]* -> REVOKED | EXPIRED
 * </pre>
 *
 * A code is burned the moment an exchange is attempted: consumption happens before client,
 * redirect and PKCE checks, so a failed check can never be retried with the same code.
 * Presenting a spent code or a rotated refresh token is treated as theft and revokes the
 * whole chain descending from the original code.
 *
 * Methods run with {@code dontRollbackOn = AuthException.class}: revocations and code
 * consumption performed while rejecting a request must be committed.
 */
@ApplicationScoped
public class OAuthAuthorizationService {

    private static final Logger LOG = Logger.getLogger(OAuthAuthorizationService.class);

    static final String RESPONSE_TYPE_CODE = "code";
    static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    static final String GRANT_REFRESH_TOKEN = "refresh_token";

    private final OAuthClientRepository clientRepository;
    private final AuthorizationCodeRepository codeRepository;
    private final OAuthTokenRepository tokenRepository;
    private final PkceService pkceService;
    private final CredentialHasher hasher;
    private final TokenIssuer tokenIssuer;
    private final AuditLogger auditLogger;
    private final AuthConfig config;
    private final Clock clock;

    @Inject
    public OAuthAuthorizationService(OAuthClientRepository clientRepository,
                                     AuthorizationCodeRepository codeRepository,
                                     OAuthTokenRepository tokenRepository,
                                     PkceService pkceService,
                                     CredentialHasher hasher,
                                     TokenIssuer tokenIssuer,
                                     AuditLogger auditLogger,
                                     AuthConfig config,
                                     Clock clock) {
        this.clientRepository = clientRepository;
        this.codeRepository = codeRepository;
        this.tokenRepository = tokenRepository;
        this.pkceService = pkceService;
        this.hasher = hasher;
        this.tokenIssuer = tokenIssuer;
        this.auditLogger = auditLogger;
        this.config = config;
        this.clock = clock;
    }

    // ==================== Authorize ====================

    /**
     * Resolve the client and check the redirect URI is registered. Until this passes, no error
     * may be sent to the redirect URI.
     *
     * @throws UntrustedRedirectException if the client is unknown or disabled or the redirect URI is not registered
     */
    @Transactional
    public OAuthClient resolveTrustedClient(AuthorizeRequest request, String userId, RequestOrigin origin) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            throw untrusted(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER, request, userId, origin);
        }
        Optional<OAuthClient> found = clientRepository.findByClientId(request.clientId());
        if (found.isEmpty()) {
            throw untrusted(AuthError.INVALID_CLIENT, ReasonCode.INVALID_CLIENT, request, userId, origin);
        }
        OAuthClient client = found.get();
        if (!client.enabled) {
            throw untrusted(AuthError.INVALID_CLIENT, ReasonCode.CLIENT_DISABLED, request, userId, origin);
        }
        if (!client.isRedirectUriRegistered(request.redirectUri())) {
            throw untrusted(AuthError.INVALID_REQUEST, ReasonCode.INVALID_REDIRECT_URI, request, userId, origin);
        }
        return client;
    }

    /**
     * Validate an authorize request for an authenticated user and issue an authorization code.
     *
     * @return the redirect URI carrying {@code code} and the unchanged {@code state}
     * @throws UntrustedRedirectException if the client or redirect URI cannot be trusted
     * @throws AuthException for any other failure; the caller redirects it to the trusted redirect URI
     */
    @Transactional(dontRollbackOn = AuthException.class)
    public String authorize(AuthorizeRequest request, String userId, RequestOrigin origin) {
        OAuthClient client = resolveTrustedClient(request, userId, origin);

        if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
            throw authorizeFailure(AuthError.UNSUPPORTED_RESPONSE_TYPE, ReasonCode.UNSUPPORTED_RESPONSE_TYPE,
                request, userId, origin);
        }

        String method = request.codeChallengeMethod() == null || request.codeChallengeMethod().isBlank()
            ? PkceService.METHOD_S256
            : request.codeChallengeMethod();
        boolean hasChallenge = request.codeChallenge() != null && !request.codeChallenge().isBlank();
        if (hasChallenge && !pkceService.isSupportedMethod(method)) {
            throw authorizeFailure(AuthError.INVALID_REQUEST, ReasonCode.UNSUPPORTED_CHALLENGE_METHOD,
                request, userId, origin, "Only code_challenge_method=S256 is supported");
        }
        if (!hasChallenge && client.pkceRequired()) {
            throw authorizeFailure(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PKCE,
                request, userId, origin, "code_challenge is required");
        }
        if (hasChallenge && !pkceService.isValidChallenge(request.codeChallenge())) {
            throw authorizeFailure(AuthError.INVALID_REQUEST, ReasonCode.INVALID_PKCE,
                request, userId, origin, "code_challenge is malformed");
        }

        Set<String> scopes = resolveScopes(client, request.scope());
        if (!client.allowsScopes(scopes)) {
            throw authorizeFailure(AuthError.INVALID_SCOPE, ReasonCode.INVALID_SCOPE, request, userId, origin);
        }

        Instant now = clock.instant();
        String code = tokenIssuer.newAuthorizationCode();

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.codeHash = hasher.fastHash(code);
        authCode.clientId = client.clientId;
        authCode.userId = userId;
        authCode.redirectUri = request.redirectUri();
        authCode.codeChallenge = hasChallenge ? request.codeChallenge() : null;
        authCode.codeChallengeMethod = hasChallenge ? method : null;
        authCode.scope = String.join(" ", scopes);
        authCode.state = request.state();
        authCode.ipAddress = origin.ip();
        authCode.createdAt = now;
        authCode.expiresAt = now.plus(config.oauth().authorizationCodeExpiry());
        codeRepository.persist(authCode);

        auditLogger.record(AuditEvent.success(AuditAction.OAUTH_AUTHORIZE, ActorType.USER, userId)
            .client(client.clientId)
            .origin(origin));
        LOG.infof("Authorization code issued: client=%s, user=%s", client.clientId, userId);

        StringBuilder redirect = new StringBuilder(request.redirectUri());
        redirect.append(request.redirectUri().contains("?") ? "&" : "?");
        redirect.append("code=").append(urlEncode(code));
        if (request.state() != null) {
            redirect.append("&state=").append(urlEncode(request.state()));
        }
        return redirect.toString();
    }

    // ==================== Token: authorization_code ====================

    @Transactional(dontRollbackOn = AuthException.class)
    public TokenResponse exchangeCode(TokenRequest request, RequestOrigin origin) {
        if (isBlank(request.code()) || isBlank(request.redirectUri()) || isBlank(request.clientId())) {
            throw exchangeFailure(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER, null, request, origin);
        }

        String codeHash = hasher.fastHash(request.code());
        Optional<AuthorizationCode> found = codeRepository.findByCodeHash(codeHash);
        if (found.isEmpty()) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.UNKNOWN_CODE, null, request, origin);
        }
        AuthorizationCode authCode = found.get();
        Instant now = clock.instant();

        if (authCode.isConsumed()) {
            if (isConcurrentDuplicate(authCode, now)) {
                throw lostRace(authCode, request, origin);
            }
            throw codeReuse(authCode, request, origin, now);
        }
        if (authCode.isExpired(now)) {
            codeRepository.consume(codeHash, now);
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.EXPIRED_CODE, authCode.userId, request, origin);
        }
        if (!codeRepository.consume(codeHash, now)) {
            throw lostRace(authCode, request, origin);
        }

        // The code is spent from here on; every failure below is final
        if (!authCode.clientId.equals(request.clientId())) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.CLIENT_MISMATCH, authCode.userId, request, origin);
        }
        Optional<OAuthClient> client = clientRepository.findByClientId(authCode.clientId);
        if (client.isEmpty() || !client.get().enabled) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.CLIENT_DISABLED, authCode.userId, request, origin);
        }
        if (!authCode.redirectUri.equals(request.redirectUri())) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.REDIRECT_MISMATCH, authCode.userId, request, origin);
        }
        if (!client.get().isPublic() && !hasher.verifySlow(request.clientSecret(), client.get().clientSecretHash)) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.INVALID_CLIENT_SECRET, authCode.userId, request, origin);
        }
        if (authCode.codeChallenge != null
                && !pkceService.verify(request.codeVerifier(), authCode.codeChallenge, authCode.codeChallengeMethod)) {
            throw exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.INVALID_PKCE, authCode.userId, request, origin);
        }

        TokenResponse response = issuePair(authCode.userId, authCode.clientId, authCode.scope, null, authCode.id, now);

        auditLogger.record(AuditEvent.success(AuditAction.OAUTH_CODE_EXCHANGE, ActorType.USER, authCode.userId)
            .client(authCode.clientId)
            .origin(origin));
        LOG.infof("Authorization code exchanged: client=%s, user=%s, chain=%s",
            authCode.clientId, authCode.userId, authCode.id);
        return response;
    }

    private boolean isConcurrentDuplicate(AuthorizationCode authCode, Instant now) {
        return !now.isAfter(authCode.consumedAt.plus(config.oauth().concurrentExchangeWindow()));
    }

    /**
     * A concurrent exchange of the same code won. The winner's tokens stay valid.
     */
    private AuthException lostRace(AuthorizationCode authCode, TokenRequest request, RequestOrigin origin) {
        LOG.warnf("Authorization code exchange lost race: client=%s, user=%s", authCode.clientId, authCode.userId);
        return exchangeFailure(AuthError.INVALID_GRANT, ReasonCode.CODE_RACE_LOST, authCode.userId, request, origin);
    }

    private AuthException codeReuse(AuthorizationCode authCode, TokenRequest request, RequestOrigin origin, Instant now) {
        int revoked = tokenRepository.revokeChain(authCode.id, "code_reuse", now);
        LOG.warnf("Authorization code reuse detected: client=%s, user=%s, chain=%s, tokens revoked=%d",
            authCode.clientId, authCode.userId, authCode.id, revoked);
        auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_CODE_EXCHANGE, ActorType.USER, authCode.userId,
                ReasonCode.REUSED_CODE)
            .client(request.clientId())
            .severity(AuditEvent.Severity.HIGH)
            .origin(origin));
        return new AuthException(AuthError.INVALID_GRANT, ReasonCode.REUSED_CODE);
    }

    // ==================== Token: refresh_token ====================

    @Transactional(dontRollbackOn = AuthException.class)
    public TokenResponse refresh(TokenRequest request, RequestOrigin origin) {
        if (isBlank(request.refreshToken()) || isBlank(request.clientId())) {
            throw refreshFailure(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER, null, request, origin);
        }
        if (!(PresentedCredential.parse(request.refreshToken()) instanceof PresentedCredential.OAuthRefresh)) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.WRONG_TOKEN_TYPE, null, request, origin);
        }

        Optional<OAuthToken> found = tokenRepository.findByTokenHash(hasher.fastHash(request.refreshToken()));
        if (found.isEmpty()) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.UNKNOWN_TOKEN, null, request, origin);
        }
        OAuthToken token = found.get();
        Instant now = clock.instant();

        if (token.tokenType != OAuthToken.TokenType.REFRESH) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.WRONG_TOKEN_TYPE, token.userId, request, origin);
        }
        if (token.isRevoked()) {
            throw refreshReuse(token, request, origin, now);
        }
        if (token.isExpired(now)) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.EXPIRED_TOKEN, token.userId, request, origin);
        }
        if (!token.clientId.equals(request.clientId())) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.CLIENT_MISMATCH, token.userId, request, origin);
        }
        Optional<OAuthClient> client = clientRepository.findByClientId(token.clientId);
        if (client.isEmpty() || !client.get().enabled) {
            throw refreshFailure(AuthError.INVALID_GRANT, ReasonCode.CLIENT_DISABLED, token.userId, request, origin);
        }
        if (!client.get().isPublic() && !hasher.verifySlow(request.clientSecret(), client.get().clientSecretHash)) {
            throw refreshFailure(AuthError.INVALID_CLIENT, ReasonCode.INVALID_CLIENT_SECRET, token.userId, request, origin);
        }

        // Revoke first: if a concurrent rotation already did, this presentation is a replay
        if (!tokenRepository.revoke(token.id, "rotated", now)) {
            throw refreshReuse(token, request, origin, now);
        }
        // The access token issued alongside the rotated refresh token goes with it
        for (String pairedId : tokenRepository.findIdsByParent(token.id)) {
            tokenRepository.revoke(pairedId, "ancestor_rotated", now);
        }

        TokenResponse response = issuePair(token.userId, token.clientId, token.scope, token.id, token.chainId, now);

        auditLogger.record(AuditEvent.success(AuditAction.OAUTH_REFRESH, ActorType.USER, token.userId)
            .client(token.clientId)
            .origin(origin));
        LOG.debugf("Refresh token rotated: client=%s, user=%s, chain=%s", token.clientId, token.userId, token.chainId);
        return response;
    }

    private AuthException refreshReuse(OAuthToken token, TokenRequest request, RequestOrigin origin, Instant now) {
        int revoked = tokenRepository.revokeChain(token.chainId, "refresh_reuse", now);
        LOG.warnf("Refresh token reuse detected: client=%s, user=%s, chain=%s, tokens revoked=%d",
            token.clientId, token.userId, token.chainId, revoked);
        auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_REFRESH, ActorType.USER, token.userId,
                ReasonCode.REFRESH_TOKEN_REUSED)
            .client(request.clientId())
            .severity(AuditEvent.Severity.HIGH)
            .origin(origin));
        return new AuthException(AuthError.INVALID_GRANT, ReasonCode.REFRESH_TOKEN_REUSED);
    }

    // ==================== Revoke ====================

    /**
     * Revoke an access token, or a refresh token together with everything rotated from it.
     * Never fails: unknown, already revoked and foreign tokens are silently accepted.
     *
     * @param clientId requesting client, if it identified itself; tokens of other clients are left alone
     */
    @Transactional
    public void revoke(String rawToken, String clientId, RequestOrigin origin) {
        PresentedCredential credential = PresentedCredential.parse(rawToken);
        if (!(credential instanceof PresentedCredential.OAuthAccess)
                && !(credential instanceof PresentedCredential.OAuthRefresh)) {
            auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_REVOKE, ActorType.CLIENT, clientId,
                    ReasonCode.WRONG_TOKEN_TYPE)
                .client(clientId)
                .severity(AuditEvent.Severity.INFO)
                .origin(origin));
            return;
        }

        Optional<OAuthToken> found = tokenRepository.findByTokenHash(hasher.fastHash(rawToken));
        if (found.isEmpty() || (clientId != null && !found.get().clientId.equals(clientId))) {
            auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_REVOKE, ActorType.CLIENT, clientId,
                    found.isEmpty() ? ReasonCode.UNKNOWN_TOKEN : ReasonCode.CLIENT_MISMATCH)
                .client(clientId)
                .severity(AuditEvent.Severity.INFO)
                .origin(origin));
            return;
        }

        OAuthToken token = found.get();
        Instant now = clock.instant();
        int revoked;
        if (token.tokenType == OAuthToken.TokenType.ACCESS) {
            revoked = tokenRepository.revoke(token.id, "revoked", now) ? 1 : 0;
        } else {
            revoked = revokeWithDescendants(token.id, now);
        }

        auditLogger.record(AuditEvent.success(AuditAction.OAUTH_REVOKE, ActorType.USER, token.userId)
            .client(token.clientId)
            .origin(origin));
        LOG.infof("Token revoked: client=%s, type=%s, tokens revoked=%d", token.clientId, token.tokenType, revoked);
    }

    /**
     * Breadth-first walk over parent links. Iterative so long rotation chains cannot overflow the stack.
     */
    int revokeWithDescendants(String rootTokenId, Instant now) {
        int revoked = 0;
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(rootTokenId);
        while (!pending.isEmpty()) {
            String tokenId = pending.poll();
            if (!visited.add(tokenId)) {
                continue;
            }
            if (tokenRepository.revoke(tokenId, "revoked", now)) {
                revoked++;
            }
            pending.addAll(tokenRepository.findIdsByParent(tokenId));
        }
        return revoked;
    }

    // ==================== Introspect ====================

    /**
     * Report whether an OAuth token is currently usable. Anything that is not an OAuth token,
     * including a perfectly valid legacy session token, is reported inactive.
     */
    @Transactional
    public IntrospectionResponse introspect(String rawToken, RequestOrigin origin) {
        PresentedCredential credential = PresentedCredential.parse(rawToken);
        if (!(credential instanceof PresentedCredential.OAuthAccess)
                && !(credential instanceof PresentedCredential.OAuthRefresh)) {
            recordIntrospection(null, ReasonCode.WRONG_TOKEN_TYPE, origin);
            return IntrospectionResponse.inactive();
        }

        Optional<OAuthToken> found = tokenRepository.findByTokenHash(hasher.fastHash(rawToken));
        if (found.isEmpty()) {
            recordIntrospection(null, ReasonCode.UNKNOWN_TOKEN, origin);
            return IntrospectionResponse.inactive();
        }
        OAuthToken token = found.get();
        Instant now = clock.instant();
        if (token.isRevoked()) {
            recordIntrospection(token, ReasonCode.REVOKED_TOKEN, origin);
            return IntrospectionResponse.inactive();
        }
        if (token.isExpired(now)) {
            recordIntrospection(token, ReasonCode.EXPIRED_TOKEN, origin);
            return IntrospectionResponse.inactive();
        }

        recordIntrospection(token, ReasonCode.OK, origin);
        return new IntrospectionResponse(
            true,
            token.scope,
            token.clientId,
            token.tokenType == OAuthToken.TokenType.ACCESS ? "access_token" : "refresh_token",
            token.expiresAt.getEpochSecond());
    }

    private void recordIntrospection(OAuthToken token, ReasonCode reason, RequestOrigin origin) {
        String clientId = token != null ? token.clientId : null;
        AuditEvent event = reason == ReasonCode.OK
            ? AuditEvent.success(AuditAction.OAUTH_INTROSPECT, ActorType.CLIENT, clientId)
            : AuditEvent.failure(AuditAction.OAUTH_INTROSPECT, ActorType.CLIENT, clientId, reason)
                .severity(AuditEvent.Severity.INFO);
        auditLogger.record(event.client(clientId).origin(origin));
    }

    // ==================== Helpers ====================

    private TokenResponse issuePair(String userId, String clientId, String scope,
                                    String parentTokenId, String chainId, Instant now) {
        Duration accessTtl = config.oauth().accessTokenExpiry();
        Duration refreshTtl = config.oauth().refreshTokenExpiry();

        String accessToken = tokenIssuer.newAccessToken();
        String refreshToken = tokenIssuer.newRefreshToken();

        // The refresh token descends from the one it rotates; the access token descends from its refresh token
        OAuthToken refresh = newToken(refreshToken, OAuthToken.TokenType.REFRESH, userId, clientId, scope,
            parentTokenId, chainId, now, now.plus(refreshTtl));
        tokenRepository.persist(refresh);
        tokenRepository.persist(newToken(accessToken, OAuthToken.TokenType.ACCESS, userId, clientId, scope,
            refresh.id, chainId, now, now.plus(accessTtl)));

        return new TokenResponse(accessToken, "Bearer", accessTtl.toSeconds(), refreshToken, scope);
    }

    private OAuthToken newToken(String plaintext, OAuthToken.TokenType type, String userId, String clientId,
                                String scope, String parentTokenId, String chainId, Instant issuedAt, Instant expiresAt) {
        OAuthToken token = new OAuthToken();
        token.tokenHash = hasher.fastHash(plaintext);
        token.tokenType = type;
        token.userId = userId;
        token.clientId = clientId;
        token.scope = scope;
        token.parentTokenId = parentTokenId;
        token.chainId = chainId;
        token.issuedAt = issuedAt;
        token.expiresAt = expiresAt;
        return token;
    }

    private Set<String> resolveScopes(OAuthClient client, String requested) {
        if (requested == null || requested.isBlank()) {
            return new LinkedHashSet<>(client.defaultScopes);
        }
        return new LinkedHashSet<>(Arrays.asList(requested.trim().split("\\s+")));
    }

    private UntrustedRedirectException untrusted(AuthError error, ReasonCode reason, AuthorizeRequest request,
                                                 String userId, RequestOrigin origin) {
        auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_AUTHORIZE, ActorType.USER, userId, reason)
            .client(request.clientId())
            .origin(origin));
        LOG.debugf("Authorize rejected before redirect trust: client=%s, reason=%s", request.clientId(), reason);
        return new UntrustedRedirectException(error, reason);
    }

    private AuthException authorizeFailure(AuthError error, ReasonCode reason, AuthorizeRequest request,
                                           String userId, RequestOrigin origin) {
        return authorizeFailure(error, reason, request, userId, origin, error.defaultDescription());
    }

    private AuthException authorizeFailure(AuthError error, ReasonCode reason, AuthorizeRequest request,
                                           String userId, RequestOrigin origin, String description) {
        auditLogger.record(AuditEvent.failure(AuditAction.OAUTH_AUTHORIZE, ActorType.USER, userId, reason)
            .client(request.clientId())
            .origin(origin));
        return new AuthException(error, reason, description);
    }

    private AuthException exchangeFailure(AuthError error, ReasonCode reason, String userId,
                                          TokenRequest request, RequestOrigin origin) {
        auditLogger.record(actorFailure(AuditAction.OAUTH_CODE_EXCHANGE, userId, request.clientId(), reason)
            .origin(origin));
        return new AuthException(error, reason);
    }

    private AuthException refreshFailure(AuthError error, ReasonCode reason, String userId,
                                         TokenRequest request, RequestOrigin origin) {
        auditLogger.record(actorFailure(AuditAction.OAUTH_REFRESH, userId, request.clientId(), reason)
            .origin(origin));
        return new AuthException(error, reason);
    }

    /**
     * Token endpoint failures are attributed to the user when the grant identified one, otherwise to the client.
     */
    private static AuditEvent actorFailure(AuditAction action, String userId, String clientId, ReasonCode reason) {
        AuditEvent event = userId != null
            ? AuditEvent.failure(action, ActorType.USER, userId, reason)
            : AuditEvent.failure(action, ActorType.CLIENT, clientId, reason);
        return event.client(clientId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
