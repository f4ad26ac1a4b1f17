package tech.authgate.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.AuthConfig;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.TokenIssuer;
import tech.authgate.platform.authentication.csrf.CsrfGuard;
import tech.authgate.platform.authentication.oauth.OAuthRequests.AuthorizeRequest;
import tech.authgate.platform.authentication.oauth.OAuthRequests.IntrospectionResponse;
import tech.authgate.platform.authentication.oauth.OAuthRequests.TokenRequest;
import tech.authgate.platform.authentication.oauth.OAuthRequests.TokenResponse;
import tech.authgate.platform.authentication.session.ClientPlatform;
import tech.authgate.platform.authentication.session.LegacySessionService;
import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.AuthException;
import tech.authgate.platform.errors.ReasonCode;
import tech.authgate.platform.shared.RequestOriginResolver;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * OAuth2 endpoints: Authorization Code with PKCE and the refresh token grant.
 *
 * <p>The browser routes ({@code /authorize}, {@code /login}) answer with redirects or minimal
 * HTML and never with JSON. Errors on those routes are only ever sent to a redirect URI that
 * is registered for an enabled client. The back-channel routes ({@code /token},
 * {@code /revoke}, {@code /introspect}) answer with JSON.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class OAuthResource {

    private static final Logger LOG = Logger.getLogger(OAuthResource.class);
    private static final String AUTHORIZE_PATH = "/oauth/authorize";

    @Inject
    OAuthAuthorizationService authorizationService;

    @Inject
    LegacySessionService sessionService;

    @Inject
    CsrfGuard csrfGuard;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    AuditLogger auditLogger;

    @Inject
    AuthConfig authConfig;

    @Inject
    RequestOriginResolver originResolver;

    @Context
    UriInfo uriInfo;

    // ==================== Authorization Endpoint ====================

    /**
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=web-app
     *   &redirect_uri=https://app.example.com/cb
     *   &scope=openid profile
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Start authorization code flow")
    @APIResponse(responseCode = "302", description = "Redirect with code, with an error, or to the login page")
    @APIResponse(responseCode = "400", description = "Unknown client or unregistered redirect URI")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "Registered redirect URI, matched exactly")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Opaque client state, returned unchanged")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method, S256 only")
            @QueryParam("code_challenge_method") String codeChallengeMethod,

            @Context HttpHeaders headers
    ) {
        RequestOrigin origin = originResolver.current();
        String sessionCookie = cookieValue(headers, authConfig.session().cookieName());
        String bindingCookie = cookieValue(headers, authConfig.session().bindingCookieName());
        AuthorizeRequest request = new AuthorizeRequest(
            responseType, clientId, redirectUri, scope, state, codeChallenge, codeChallengeMethod);

        try {
            authorizationService.resolveTrustedClient(request, null, origin);
        } catch (UntrustedRedirectException e) {
            return untrustedRequestPage(e);
        }

        String userId = currentUser(sessionCookie, origin);
        if (userId == null) {
            return redirectToLogin(clientId, bindingCookie);
        }

        try {
            String location = authorizationService.authorize(request, userId, origin);
            return found(URI.create(location)).build();
        } catch (UntrustedRedirectException e) {
            return untrustedRequestPage(e);
        } catch (AuthException e) {
            return errorRedirect(redirectUri, e, state);
        }
    }

    // ==================== Browser login leg ====================

    /**
     * Form post from the login page. The CSRF token must match both the double-submit cookie
     * and the outstanding token bound to this browser and client.
     */
    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Browser sign-in for the authorization flow")
    @APIResponse(responseCode = "302", description = "Signed in, back to the authorization endpoint")
    @APIResponse(responseCode = "403", description = "CSRF check failed")
    public Response login(
            @FormParam("username") String username,
            @FormParam("password") String password,
            @FormParam("csrf_token") String csrfToken,
            @FormParam("client_id") String clientId,
            @FormParam("return_to") String returnTo,
            @Context HttpHeaders headers
    ) {
        RequestOrigin origin = originResolver.current();
        String bindingCookie = cookieValue(headers, authConfig.session().bindingCookieName());
        String csrfCookie = cookieValue(headers, authConfig.session().csrfCookieName());

        boolean doubleSubmitMatches = CredentialHasher.constantTimeEquals(csrfToken, csrfCookie);
        if (!doubleSubmitMatches || !csrfGuard.validate(csrfToken, bindingCookie, clientId)) {
            auditLogger.record(AuditEvent.failure(AuditAction.BROWSER_LOGIN, AuditEvent.ActorType.USER, null,
                    ReasonCode.CSRF_INVALID)
                .client(clientId)
                .origin(origin));
            LOG.warnf("Browser login rejected: CSRF check failed for client %s", clientId);
            return htmlPage(Response.Status.FORBIDDEN, "Sign-in failed",
                "This sign-in form has expired. Please start again from the application.");
        }

        LegacySessionService.LoginResult result;
        try {
            result = sessionService.login(username, password, ClientPlatform.WEB, origin);
        } catch (AuthException e) {
            // Already audited by the session service
            return redirectToLogin(clientId, bindingCookie, e.error().code(), returnTo);
        }

        NewCookie session = cookie(authConfig.session().cookieName(), result.accessToken(), "/",
            (int) Math.min(Integer.MAX_VALUE, result.expiresIn()));
        NewCookie clearCsrf = cookie(authConfig.session().csrfCookieName(), "", "/oauth", 0);

        if (isSafeReturnTo(returnTo)) {
            return found(URI.create(returnTo)).cookie(session, clearCsrf).build();
        }
        return Response.fromResponse(htmlPage(Response.Status.OK, "Signed in",
                "You are signed in. You can close this window."))
            .cookie(session, clearCsrf)
            .build();
    }

    // ==================== Token Endpoint ====================

    /**
     * Supported grant types: authorization_code and refresh_token. Client credentials may be
     * sent as form fields or with HTTP Basic; Basic wins when both are present.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange an authorization code or refresh token for tokens")
    @APIResponse(responseCode = "200", description = "Tokens issued")
    @APIResponse(responseCode = "400", description = "invalid_request, invalid_grant or unsupported_grant_type")
    @APIResponse(responseCode = "401", description = "invalid_client")
    public Response token(
            @HeaderParam("Authorization") String authHeader,

            @Parameter(description = "authorization_code or refresh_token")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code (authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI used in the authorization request")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Client ID")
            @FormParam("client_id") String formClientId,

            @Parameter(description = "Client secret (confidential clients)")
            @FormParam("client_secret") String formClientSecret,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Refresh token (refresh_token grant)")
            @FormParam("refresh_token") String refreshToken
    ) {
        ClientCredentials credentials = clientCredentials(authHeader, formClientId, formClientSecret);
        TokenRequest request = new TokenRequest(grantType, code, redirectUri,
            credentials.clientId(), credentials.clientSecret(), codeVerifier, refreshToken);
        RequestOrigin origin = originResolver.current();

        if (grantType == null || grantType.isBlank()) {
            throw new AuthException(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER, "grant_type is required");
        }

        TokenResponse response;
        switch (grantType) {
            case OAuthAuthorizationService.GRANT_AUTHORIZATION_CODE:
                response = authorizationService.exchangeCode(request, origin);
                break;
            case OAuthAuthorizationService.GRANT_REFRESH_TOKEN:
                response = authorizationService.refresh(request, origin);
                break;
            default:
                throw new AuthException(AuthError.UNSUPPORTED_GRANT_TYPE, ReasonCode.UNSUPPORTED_GRANT_TYPE);
        }

        return Response.ok(response)
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    // ==================== Revocation / Introspection ====================

    /**
     * RFC 7009 revocation. Always 204, whether or not the token was known.
     */
    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Revoke an access or refresh token")
    @APIResponse(responseCode = "204", description = "Accepted")
    public Response revoke(
            @HeaderParam("Authorization") String authHeader,
            @FormParam("token") String token,
            @Parameter(description = "Ignored; the token's own shape decides")
            @FormParam("token_type_hint") String tokenTypeHint,
            @FormParam("client_id") String formClientId
    ) {
        ClientCredentials credentials = clientCredentials(authHeader, formClientId, null);
        authorizationService.revoke(token, credentials.clientId(), originResolver.current());
        return Response.noContent().build();
    }

    /**
     * RFC 7662 introspection. Only OAuth tokens can ever be reported active.
     */
    @POST
    @Path("/introspect")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Report whether an OAuth token is active")
    @APIResponse(responseCode = "200", description = "Introspection result")
    public Response introspect(@FormParam("token") String token) {
        IntrospectionResponse response = authorizationService.introspect(token, originResolver.current());
        return Response.ok(response).header("Cache-Control", "no-store").build();
    }

    // ==================== Helpers ====================

    /**
     * User id of a live browser session, or null. Only legacy session tokens with platform WEB
     * issued by the login leg are accepted; anything else sends the user to sign in again.
     */
    private String currentUser(String sessionCookie, RequestOrigin origin) {
        if (sessionCookie == null || sessionCookie.isBlank()) {
            return null;
        }
        try {
            LegacySessionService.SessionInfo session = sessionService.validateSession(sessionCookie, origin);
            return session.platform() == ClientPlatform.WEB ? session.userId() : null;
        } catch (AuthException e) {
            LOG.debugf("Browser session rejected (%s), redirecting to login", e.reason());
            return null;
        }
    }

    private Response redirectToLogin(String clientId, String bindingCookie) {
        return redirectToLogin(clientId, bindingCookie, null, uriInfo.getRequestUri().getRawPath()
            + (uriInfo.getRequestUri().getRawQuery() != null ? "?" + uriInfo.getRequestUri().getRawQuery() : ""));
    }

    private Response redirectToLogin(String clientId, String bindingCookie, String error, String returnTo) {
        String binding = bindingCookie != null && !bindingCookie.isBlank() ? bindingCookie : tokenIssuer.randomValue();
        String csrfToken = csrfGuard.issue(binding, clientId);

        StringBuilder loginUrl = new StringBuilder(authConfig.oauth().loginPage());
        loginUrl.append(authConfig.oauth().loginPage().contains("?") ? "&" : "?");
        loginUrl.append("csrf_token=").append(urlEncode(csrfToken));
        if (clientId != null) {
            loginUrl.append("&client_id=").append(urlEncode(clientId));
        }
        if (isSafeReturnTo(returnTo)) {
            loginUrl.append("&return_to=").append(urlEncode(returnTo));
        }
        if (error != null) {
            loginUrl.append("&error=").append(urlEncode(error));
        }

        int csrfMaxAge = (int) authConfig.csrf().ttl().toSeconds();
        return found(URI.create(loginUrl.toString()))
            .cookie(
                cookie(authConfig.session().bindingCookieName(), binding, "/oauth", -1),
                cookie(authConfig.session().csrfCookieName(), csrfToken, "/oauth", csrfMaxAge))
            .build();
    }

    private Response errorRedirect(String redirectUri, AuthException error, String state) {
        StringBuilder url = new StringBuilder(redirectUri);
        url.append(redirectUri.contains("?") ? "&" : "?");
        url.append("error=").append(urlEncode(error.error().code()));
        url.append("&error_description=").append(urlEncode(error.description()));
        if (state != null) {
            url.append("&state=").append(urlEncode(state));
        }
        return found(URI.create(url.toString())).build();
    }

    private Response untrustedRequestPage(UntrustedRedirectException e) {
        LOG.debugf("Authorize request not redirectable: %s", e.reason());
        return htmlPage(Response.Status.BAD_REQUEST, "Invalid request",
            "The application sent an invalid sign-in request.");
    }

    private static String cookieValue(HttpHeaders headers, String name) {
        Cookie cookie = headers.getCookies().get(name);
        return cookie != null ? cookie.getValue() : null;
    }

    private static Response htmlPage(Response.Status status, String title, String message) {
        String body = "<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>" + title
            + "</title></head><body><h1>" + title + "</h1><p>" + message + "</p></body></html>";
        return Response.status(status)
            .type(MediaType.TEXT_HTML_TYPE.withCharset(StandardCharsets.UTF_8.name()))
            .header("Cache-Control", "no-store")
            .entity(body)
            .build();
    }

    private static Response.ResponseBuilder found(URI location) {
        return Response.status(Response.Status.FOUND)
            .location(location)
            .header("Cache-Control", "no-store");
    }

    private NewCookie cookie(String name, String value, String path, int maxAge) {
        NewCookie.Builder builder = new NewCookie.Builder(name)
            .value(value)
            .path(path)
            .httpOnly(true)
            .secure(authConfig.session().secure())
            .sameSite(NewCookie.SameSite.valueOf(authConfig.session().sameSite().toUpperCase(Locale.ROOT)));
        if (maxAge >= 0) {
            builder.maxAge(maxAge);
        }
        return builder.build();
    }

    /**
     * Only relative paths back to the authorization endpoint are followed after login.
     */
    static boolean isSafeReturnTo(String returnTo) {
        return returnTo != null
            && returnTo.startsWith(AUTHORIZE_PATH)
            && !returnTo.startsWith("//")
            && (returnTo.length() == AUTHORIZE_PATH.length() || returnTo.charAt(AUTHORIZE_PATH.length()) == '?');
    }

    private static ClientCredentials clientCredentials(String authHeader, String formClientId, String formClientSecret) {
        if (authHeader != null && authHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            ClientCredentials basic = parseBasicAuth(authHeader);
            if (basic != null) {
                return basic;
            }
        }
        return new ClientCredentials(formClientId, formClientSecret);
    }

    /**
     * Basic credentials are form-urlencoded before base64 (RFC 6749 section 2.3.1).
     */
    private static ClientCredentials parseBasicAuth(String authHeader) {
        try {
            String base64 = authHeader.substring("Basic ".length()).trim();
            String decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
            int colonIdx = decoded.indexOf(':');
            if (colonIdx < 0) {
                return null;
            }
            return new ClientCredentials(
                URLDecoder.decode(decoded.substring(0, colonIdx), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colonIdx + 1), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            LOG.debug("Ignoring malformed Basic authorization header");
            return null;
        }
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private record ClientCredentials(String clientId, String clientSecret) {}
}
