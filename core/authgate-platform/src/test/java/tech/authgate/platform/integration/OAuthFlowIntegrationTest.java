package tech.authgate.platform.integration;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

/**
 * End-to-end authorization code flow over HTTP: registration, browser sign-in with CSRF,
 * code exchange, refresh rotation, introspection and revocation.
 */
@Tag("integration")
@QuarkusTest
class OAuthFlowIntegrationTest {

    private static final String ADMIN_TOKEN = "test-admin-token";
    private static final String REDIRECT_URI = "http://localhost:3000/callback";
    private static final String PASSWORD = "CorrectHorse42!";
    private static final String VERIFIER = "dBjftJeZ4CNP9mB92K9uQs7OIHg_4a-example-verifier-value";

    private String clientId;
    private String email;

    @BeforeEach
    void setUp() {
        clientId = "spa-" + UUID.randomUUID().toString().substring(0, 8);
        email = uniqueEmail("oauth");

        given()
            .header("X-Admin-Token", ADMIN_TOKEN)
            .contentType(ContentType.JSON)
            .body(Map.of(
                "clientId", clientId,
                "clientName", "Integration SPA",
                "clientType", "PUBLIC",
                "redirectUris", List.of(REDIRECT_URI),
                "allowedScopes", List.of("openid", "profile")))
        .when()
            .post("/admin/oauth-clients")
        .then()
            .statusCode(201)
            .body("client.clientId", equalTo(clientId))
            .body("client.pkceRequired", equalTo(true))
            .body("clientSecret", nullValue());

        given()
            .header("X-Admin-Token", ADMIN_TOKEN)
            .contentType(ContentType.JSON)
            .body(Map.of("email", email, "password", PASSWORD))
        .when()
            .post("/admin/users")
        .then()
            .statusCode(201);
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    private String uniqueEmail(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@test.com";
    }

    private static String challenge(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static Map<String, String> queryParams(String location) {
        Map<String, String> params = new HashMap<>();
        String query = URI.create(location).getRawQuery();
        if (query == null) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private Response authorize(String sessionCookie, String state) {
        var request = given()
            .redirects().follow(false)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", REDIRECT_URI)
            .queryParam("scope", "openid profile")
            .queryParam("state", state)
            .queryParam("code_challenge", challenge(VERIFIER))
            .queryParam("code_challenge_method", "S256");
        if (sessionCookie != null) {
            request.cookie("ag_session", sessionCookie);
        }
        return request.when().get("/oauth/authorize");
    }

    /**
     * Runs the browser leg and returns the session cookie value.
     */
    private String signIn() {
        Response toLogin = authorize(null, "s1");
        assertThat(toLogin.statusCode()).isEqualTo(302);

        Map<String, String> loginParams = queryParams(toLogin.header("Location"));
        String binding = toLogin.getCookie("ag_binding");
        String csrfCookie = toLogin.getCookie("ag_csrf");

        Response loggedIn = given()
            .redirects().follow(false)
            .cookie("ag_binding", binding)
            .cookie("ag_csrf", csrfCookie)
            .contentType(ContentType.URLENC)
            .formParam("username", email)
            .formParam("password", PASSWORD)
            .formParam("csrf_token", loginParams.get("csrf_token"))
            .formParam("client_id", loginParams.get("client_id"))
            .formParam("return_to", loginParams.get("return_to"))
        .when()
            .post("/oauth/login");

        assertThat(loggedIn.statusCode()).isEqualTo(302);
        assertThat(loggedIn.header("Location")).contains("/oauth/authorize");
        String session = loggedIn.getCookie("ag_session");
        assertThat(session).isNotBlank();
        return session;
    }

    private String obtainCode(String state) {
        Response withCode = authorize(signIn(), state);
        assertThat(withCode.statusCode()).isEqualTo(302);
        String location = withCode.header("Location");
        assertThat(location).startsWith(REDIRECT_URI);
        Map<String, String> params = queryParams(location);
        assertThat(params).containsEntry("state", state);
        return params.get("code");
    }

    private Response exchange(String code, String verifier) {
        return given()
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "authorization_code")
            .formParam("code", code)
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("client_id", clientId)
            .formParam("code_verifier", verifier)
        .when()
            .post("/oauth/token");
    }

    // ========================================
    // DISCOVERY
    // ========================================

    @Test
    @DisplayName("Metadata document should advertise endpoints and S256 only")
    void metadata_shouldAdvertiseEndpoints_whenRequested() {
        given()
        .when()
            .get("/.well-known/oauth-authorization-server")
        .then()
            .statusCode(200)
            .body("authorization_endpoint", endsWith("/oauth/authorize"))
            .body("token_endpoint", endsWith("/oauth/token"))
            .body("code_challenge_methods_supported", contains("S256"))
            .body("grant_types_supported", hasItems("authorization_code", "refresh_token"));
    }

    // ========================================
    // AUTHORIZATION ENDPOINT
    // ========================================

    @Test
    @DisplayName("Authorize without a session should redirect to login and set CSRF cookies")
    void authorize_shouldRedirectToLogin_whenNoSession() {
        // Act
        Response response = authorize(null, "abc");

        // Assert
        assertThat(response.statusCode()).isEqualTo(302);
        Map<String, String> params = queryParams(response.header("Location"));
        assertThat(params.get("csrf_token")).isNotBlank();
        assertThat(params).containsEntry("client_id", clientId);
        assertThat(params.get("return_to")).startsWith("/oauth/authorize");
        assertThat(response.getCookie("ag_csrf")).isEqualTo(params.get("csrf_token"));
        assertThat(response.getCookie("ag_binding")).isNotBlank();
    }

    @Test
    @DisplayName("Authorize with an unregistered redirect URI should render an error page without redirecting")
    void authorize_shouldNotRedirect_whenRedirectUriUnregistered() {
        given()
            .redirects().follow(false)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", "https://evil.example.com/cb")
            .queryParam("code_challenge", challenge(VERIFIER))
            .queryParam("code_challenge_method", "S256")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(400)
            .header("Location", nullValue());
    }

    @Test
    @DisplayName("Authorize without PKCE should redirect back with invalid_request")
    void authorize_shouldRedirectWithError_whenPkceMissing() {
        String session = signIn();

        Response response = given()
            .redirects().follow(false)
            .cookie("ag_session", session)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", REDIRECT_URI)
            .queryParam("state", "xyz")
        .when()
            .get("/oauth/authorize");

        assertThat(response.statusCode()).isEqualTo(302);
        Map<String, String> params = queryParams(response.header("Location"));
        assertThat(params).containsEntry("error", "invalid_request");
        assertThat(params).containsEntry("state", "xyz");
        assertThat(params).doesNotContainKey("code");
    }

    // ========================================
    // BROWSER LOGIN LEG
    // ========================================

    @Test
    @DisplayName("Login post should be rejected when the CSRF token does not match the cookie")
    void login_shouldReturn403_whenCsrfMismatch() {
        Response toLogin = authorize(null, "s1");
        Map<String, String> loginParams = queryParams(toLogin.header("Location"));

        Response response = given()
            .redirects().follow(false)
            .cookie("ag_binding", toLogin.getCookie("ag_binding"))
            .cookie("ag_csrf", "forged-value")
            .contentType(ContentType.URLENC)
            .formParam("username", email)
            .formParam("password", PASSWORD)
            .formParam("csrf_token", loginParams.get("csrf_token"))
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/login");

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(response.getCookie("ag_session")).isNull();
    }

    @Test
    @DisplayName("Login post with a wrong password should send the browser back to the login page")
    void login_shouldRedirectToLoginWithError_whenPasswordWrong() {
        Response toLogin = authorize(null, "s1");
        Map<String, String> loginParams = queryParams(toLogin.header("Location"));

        Response response = given()
            .redirects().follow(false)
            .cookie("ag_binding", toLogin.getCookie("ag_binding"))
            .cookie("ag_csrf", toLogin.getCookie("ag_csrf"))
            .contentType(ContentType.URLENC)
            .formParam("username", email)
            .formParam("password", "not-the-password")
            .formParam("csrf_token", loginParams.get("csrf_token"))
            .formParam("client_id", clientId)
            .formParam("return_to", loginParams.get("return_to"))
        .when()
            .post("/oauth/login");

        assertThat(response.statusCode()).isEqualTo(302);
        Map<String, String> params = queryParams(response.header("Location"));
        assertThat(params).containsEntry("error", "invalid_credentials");
        assertThat(params.get("csrf_token")).isNotEqualTo(loginParams.get("csrf_token"));
        assertThat(response.getCookie("ag_session")).isNull();
    }

    // ========================================
    // TOKEN ENDPOINT
    // ========================================

    @Test
    @DisplayName("Full flow should issue tokens, rotate refresh and revoke the chain")
    void fullFlow_shouldIssueRotateAndRevoke_whenFollowedCorrectly() {
        // Arrange
        String code = obtainCode("state-1");
        assertThat(code).startsWith("agac_");

        // Act: exchange the code
        Response tokens = exchange(code, VERIFIER);

        // Assert
        tokens.then()
            .statusCode(200)
            .header("Cache-Control", containsString("no-store"))
            .body("token_type", equalTo("Bearer"))
            .body("access_token", startsWith("agat_"))
            .body("refresh_token", startsWith("agrt_"))
            .body("scope", equalTo("openid profile"));
        String accessToken = tokens.path("access_token");
        String refreshToken = tokens.path("refresh_token");

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", accessToken)
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(true))
            .body("client_id", equalTo(clientId));

        // Act: rotate the refresh token
        Response rotated = given()
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "refresh_token")
            .formParam("refresh_token", refreshToken)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token");

        rotated.then().statusCode(200).body("refresh_token", not(equalTo(refreshToken)));
        String newAccess = rotated.path("access_token");

        // The access token paired with the rotated refresh token is retired with it
        given()
            .contentType(ContentType.URLENC)
            .formParam("token", accessToken)
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(false));

        // Replaying the old refresh token revokes the whole chain
        given()
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "refresh_token")
            .formParam("refresh_token", refreshToken)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", newAccess)
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(false))
            .body("client_id", nullValue());
    }

    @Test
    @DisplayName("Code exchange should fail with invalid_grant when the verifier is wrong, and the code is burned")
    void exchange_shouldFailAndBurnCode_whenVerifierWrong() {
        String code = obtainCode("state-2");

        exchange(code, "wrong-verifier-wrong-verifier-wrong-verifier-000")
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));

        exchange(code, VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("Concurrent exchanges of one code should yield exactly one usable token pair")
    void exchange_shouldLetOneWinnerKeepTokens_whenCodeExchangedConcurrently() throws Exception {
        // Arrange
        String code = obtainCode("state-race");
        int attempts = 6;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Response>> futures = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < attempts; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return exchange(code, VERIFIER);
                }));
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Assert
        List<Response> winners = new ArrayList<>();
        int rejected = 0;
        for (Future<Response> future : futures) {
            Response response = future.get();
            if (response.statusCode() == 200) {
                winners.add(response);
            } else {
                assertThat(response.statusCode()).isEqualTo(400);
                assertThat(response.<String>path("error")).isEqualTo("invalid_grant");
                rejected++;
            }
        }
        assertThat(winners).hasSize(1);
        assertThat(rejected).isEqualTo(attempts - 1);

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", winners.get(0).<String>path("access_token"))
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(true))
            .body("client_id", equalTo(clientId));
    }

    @Test
    @DisplayName("Unsupported grant type should be rejected")
    void token_shouldReturnUnsupportedGrantType_whenGrantUnknown() {
        given()
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "password")
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("unsupported_grant_type"));
    }

    // ========================================
    // REVOCATION / INTROSPECTION
    // ========================================

    @Test
    @DisplayName("Revoking a refresh token should deactivate its access token")
    void revoke_shouldDeactivateAccessToken_whenRefreshTokenRevoked() {
        Response tokens = exchange(obtainCode("state-3"), VERIFIER);
        String accessToken = tokens.path("access_token");
        String refreshToken = tokens.path("refresh_token");

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", refreshToken)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/revoke")
        .then()
            .statusCode(204);

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", accessToken)
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(false));
    }

    @Test
    @DisplayName("Revoking an unknown token should still return 204")
    void revoke_shouldReturn204_whenTokenUnknown() {
        given()
            .contentType(ContentType.URLENC)
            .formParam("token", "agrt_does-not-exist")
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/revoke")
        .then()
            .statusCode(204);
    }

    @Test
    @DisplayName("Introspecting a browser session token should report it inactive")
    void introspect_shouldReportInactive_whenLegacySessionTokenPresented() {
        String session = signIn();

        given()
            .contentType(ContentType.URLENC)
            .formParam("token", session)
        .when()
            .post("/oauth/introspect")
        .then()
            .statusCode(200)
            .body("active", equalTo(false));
    }
}
