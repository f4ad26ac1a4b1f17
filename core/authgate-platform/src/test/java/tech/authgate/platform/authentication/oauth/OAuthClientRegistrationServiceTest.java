package tech.authgate.platform.authentication.oauth;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.TokenIssuer;
import tech.authgate.platform.authentication.oauth.OAuthClientRegistrationService.NewClient;
import tech.authgate.platform.authentication.oauth.OAuthClientRegistrationService.Registration;
import tech.authgate.platform.test.InMemoryAuditEventRepository;
import tech.authgate.platform.test.InMemoryOAuthClientRepository;
import tech.authgate.platform.test.MutableClock;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OAuthClientRegistrationService.
 */
class OAuthClientRegistrationServiceTest {

    private static final String ADMIN = "admin-api";
    private static final RequestOrigin ORIGIN = RequestOrigin.UNKNOWN;

    private final CredentialHasher hasher = new CredentialHasher(1024, 1, 1);
    private InMemoryOAuthClientRepository clients;
    private InMemoryAuditEventRepository audit;
    private OAuthClientRegistrationService service;

    @BeforeEach
    void setUp() {
        clients = new InMemoryOAuthClientRepository();
        audit = new InMemoryAuditEventRepository();
        service = new OAuthClientRegistrationService(clients, hasher, new TokenIssuer(),
            new AuditLogger(audit, new SimpleMeterRegistry()), MutableClock.startingAt("2026-02-01T00:00:00Z"));
    }

    private static NewClient publicClient(String clientId, List<String> redirectUris) {
        return new NewClient(clientId, "Web App", OAuthClient.ClientType.PUBLIC, redirectUris,
            List.of("openid", "profile"), List.of("openid"), false);
    }

    // ========================================
    // REGISTER TESTS
    // ========================================

    @Test
    @DisplayName("register should force PKCE and issue no secret when client is public")
    void register_shouldForcePkce_whenClientIsPublic() {
        // Act
        Registration registration = service.register(
            publicClient("web-app", List.of("https://app.example.com/cb")), ADMIN, ORIGIN);

        // Assert
        assertThat(registration.clientSecret()).isNull();
        assertThat(registration.client().requiresPkce).isTrue();
        assertThat(registration.client().clientSecretHash).isNull();
        assertThat(clients.findByClientId("web-app")).isPresent();

        AuditEvent event = audit.last();
        assertThat(event.action).isEqualTo(AuditAction.ADMIN_CLIENT_REGISTER);
        assertThat(event.actorType).isEqualTo(AuditEvent.ActorType.ADMIN);
    }

    @Test
    @DisplayName("register should return the secret once and store only its Argon2 hash when client is confidential")
    void register_shouldStoreSlowHash_whenClientIsConfidential() {
        // Arrange
        NewClient request = new NewClient("backend", "Backend", OAuthClient.ClientType.CONFIDENTIAL,
            List.of("https://api.example.com/cb"), List.of("openid"), List.of(), false);

        // Act
        Registration registration = service.register(request, ADMIN, ORIGIN);

        // Assert
        assertThat(registration.clientSecret()).isNotBlank();
        assertThat(registration.client().clientSecretHash).startsWith("$argon2id$");
        assertThat(hasher.verifySlow(registration.clientSecret(), registration.client().clientSecretHash)).isTrue();
        assertThat(registration.client().requiresPkce).isFalse();
    }

    @Test
    @DisplayName("register should generate a client id when none is given")
    void register_shouldGenerateClientId_whenMissing() {
        // Act
        Registration registration = service.register(
            publicClient(null, List.of("https://app.example.com/cb")), ADMIN, ORIGIN);

        // Assert
        assertThat(registration.client().clientId).startsWith("client-");
    }

    @Test
    @DisplayName("register should reject a duplicate client id")
    void register_shouldThrowConflict_whenClientIdTaken() {
        // Arrange
        service.register(publicClient("web-app", List.of("https://app.example.com/cb")), ADMIN, ORIGIN);

        // Act & Assert
        assertThatThrownBy(() -> service.register(
                publicClient("web-app", List.of("https://other.example.com/cb")), ADMIN, ORIGIN))
            .isInstanceOf(ClientErrorException.class)
            .satisfies(e -> assertThat(((ClientErrorException) e).getResponse().getStatus()).isEqualTo(409));
    }

    @Test
    @DisplayName("register should reject default scopes outside the allowed scopes")
    void register_shouldReject_whenDefaultScopesNotAllowed() {
        // Arrange
        NewClient request = new NewClient("web-app", "Web App", OAuthClient.ClientType.PUBLIC,
            List.of("https://app.example.com/cb"), List.of("openid"), List.of("admin"), true);

        // Act & Assert
        assertThatThrownBy(() -> service.register(request, ADMIN, ORIGIN))
            .isInstanceOf(BadRequestException.class);
    }

    // ========================================
    // REDIRECT URI VALIDATION TESTS
    // ========================================

    @Test
    @DisplayName("validateRedirectUris should accept https and loopback http and keep values verbatim")
    void validateRedirectUris_shouldAcceptHttpsAndLoopback() {
        // Act
        List<String> result = OAuthClientRegistrationService.validateRedirectUris(List.of(
            "https://app.example.com/cb/",
            "http://localhost:8765/callback",
            "http://127.0.0.1:9000/cb",
            "https://app.example.com/cb/"));

        // Assert
        assertThat(result).containsExactly(
            "https://app.example.com/cb/",
            "http://localhost:8765/callback",
            "http://127.0.0.1:9000/cb");
    }

    @Test
    @DisplayName("validateRedirectUris should reject plain http, fragments and relative URIs")
    void validateRedirectUris_shouldRejectUnsafeUris() {
        assertThatThrownBy(() -> OAuthClientRegistrationService.validateRedirectUris(List.of("http://app.example.com/cb")))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> OAuthClientRegistrationService.validateRedirectUris(List.of("https://app.example.com/cb#x")))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> OAuthClientRegistrationService.validateRedirectUris(List.of("/cb")))
            .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> OAuthClientRegistrationService.validateRedirectUris(List.of()))
            .isInstanceOf(BadRequestException.class);
    }

    // ========================================
    // UPDATE TESTS
    // ========================================

    @Test
    @DisplayName("replaceRedirectUris should replace the registered set")
    void replaceRedirectUris_shouldReplaceSet_whenClientExists() {
        // Arrange
        service.register(publicClient("web-app", List.of("https://app.example.com/cb")), ADMIN, ORIGIN);

        // Act
        service.replaceRedirectUris("web-app", List.of("https://app.example.com/v2/cb"), ADMIN, ORIGIN);

        // Assert
        OAuthClient client = clients.findByClientId("web-app").orElseThrow();
        assertThat(client.redirectUris).containsExactly("https://app.example.com/v2/cb");
        assertThat(client.isRedirectUriRegistered("https://app.example.com/cb")).isFalse();
    }

    @Test
    @DisplayName("disable should soft-disable the client")
    void disable_shouldClearEnabledFlag_whenClientExists() {
        // Arrange
        service.register(publicClient("web-app", List.of("https://app.example.com/cb")), ADMIN, ORIGIN);

        // Act
        service.disable("web-app", ADMIN, ORIGIN);

        // Assert
        assertThat(clients.findByClientId("web-app").orElseThrow().enabled).isFalse();
        assertThat(audit.last().action).isEqualTo(AuditAction.ADMIN_CLIENT_DISABLE);
    }

    @Test
    @DisplayName("disable should throw not found when client is unknown")
    void disable_shouldThrowNotFound_whenClientUnknown() {
        assertThatThrownBy(() -> service.disable("missing", ADMIN, ORIGIN))
            .isInstanceOf(NotFoundException.class);
    }
}
