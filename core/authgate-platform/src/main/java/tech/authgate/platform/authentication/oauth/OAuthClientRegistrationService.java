package tech.authgate.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.TokenIssuer;
import tech.authgate.platform.shared.TsidGenerator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Registers OAuth clients and applies the two runtime changes a client supports:
 * replacing its redirect URIs and soft-disabling it.
 */
@ApplicationScoped
public class OAuthClientRegistrationService {

    private static final Logger LOG = Logger.getLogger(OAuthClientRegistrationService.class);
    private static final Pattern CLIENT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{1,99}$");

    private final OAuthClientRepository clients;
    private final CredentialHasher hasher;
    private final TokenIssuer tokenIssuer;
    private final AuditLogger audit;
    private final Clock clock;

    @Inject
    public OAuthClientRegistrationService(
            OAuthClientRepository clients,
            CredentialHasher hasher,
            TokenIssuer tokenIssuer,
            AuditLogger audit,
            Clock clock) {
        this.clients = clients;
        this.hasher = hasher;
        this.tokenIssuer = tokenIssuer;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Register a client. For confidential clients a secret is generated and returned once;
     * only its Argon2id hash is stored.
     */
    @Transactional
    public Registration register(NewClient request, String adminId, RequestOrigin origin) {
        String clientId = request.clientId() != null && !request.clientId().isBlank()
            ? request.clientId().trim()
            : "client-" + TsidGenerator.generateRaw().toLowerCase(Locale.ROOT);

        if (!CLIENT_ID_PATTERN.matcher(clientId).matches()) {
            throw new BadRequestException("client_id may only contain letters, digits, '.', '_' and '-'");
        }
        if (clients.existsByClientId(clientId)) {
            throw new ClientErrorException("client_id already registered: " + clientId, Response.Status.CONFLICT);
        }

        List<String> redirectUris = validateRedirectUris(request.redirectUris());
        List<String> allowedScopes = distinct(request.allowedScopes());
        List<String> defaultScopes = distinct(request.defaultScopes());
        if (!allowedScopes.containsAll(defaultScopes)) {
            throw new BadRequestException("default scopes must be a subset of the allowed scopes");
        }

        OAuthClient client = new OAuthClient();
        client.clientId = clientId;
        client.clientName = request.clientName();
        client.clientType = request.clientType();
        client.redirectUris = redirectUris;
        client.allowedScopes = allowedScopes;
        client.defaultScopes = defaultScopes;
        client.requiresPkce = request.clientType() == OAuthClient.ClientType.PUBLIC || request.requirePkce();
        client.enabled = true;
        client.createdAt = clock.instant();
        client.updatedAt = client.createdAt;

        String plainSecret = null;
        if (request.clientType() == OAuthClient.ClientType.CONFIDENTIAL) {
            plainSecret = tokenIssuer.randomValue();
            client.clientSecretHash = hasher.slowHash(plainSecret);
        }

        clients.persist(client);

        audit.record(AuditEvent.success(AuditAction.ADMIN_CLIENT_REGISTER, AuditEvent.ActorType.ADMIN, adminId)
            .client(clientId)
            .origin(origin));
        LOG.infof("OAuth client registered: %s (%s, pkce=%s)", clientId, client.clientType, client.requiresPkce);

        return new Registration(client, plainSecret);
    }

    @Transactional
    public OAuthClient replaceRedirectUris(String clientId, List<String> redirectUris, String adminId, RequestOrigin origin) {
        OAuthClient client = clients.findByClientId(clientId)
            .orElseThrow(() -> new NotFoundException("Unknown client: " + clientId));

        client.redirectUris = validateRedirectUris(redirectUris);
        clients.update(client);

        audit.record(AuditEvent.success(AuditAction.ADMIN_CLIENT_UPDATE, AuditEvent.ActorType.ADMIN, adminId)
            .client(clientId)
            .origin(origin));
        LOG.infof("Redirect URIs replaced for OAuth client %s (%d registered)", clientId, client.redirectUris.size());
        return client;
    }

    /**
     * Disable a client. Its refresh tokens stop working because every token request checks the
     * client's enabled flag.
     */
    @Transactional
    public OAuthClient disable(String clientId, String adminId, RequestOrigin origin) {
        OAuthClient client = clients.findByClientId(clientId)
            .orElseThrow(() -> new NotFoundException("Unknown client: " + clientId));

        if (client.enabled) {
            client.enabled = false;
            clients.update(client);
            LOG.infof("OAuth client disabled: %s", clientId);
        }

        audit.record(AuditEvent.success(AuditAction.ADMIN_CLIENT_DISABLE, AuditEvent.ActorType.ADMIN, adminId)
            .client(clientId)
            .origin(origin));
        return client;
    }

    public List<OAuthClient> listClients() {
        return clients.findAllClients();
    }

    /**
     * Redirect URIs must be absolute, without fragment, and https unless they point at a
     * loopback host. They are stored exactly as given.
     */
    static List<String> validateRedirectUris(List<String> redirectUris) {
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw new BadRequestException("At least one redirect URI is required");
        }
        for (String value : redirectUris) {
            if (value == null || value.isBlank()) {
                throw new BadRequestException("Redirect URI cannot be blank");
            }
            URI uri;
            try {
                uri = new URI(value);
            } catch (URISyntaxException e) {
                throw new BadRequestException("Malformed redirect URI: " + value);
            }
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new BadRequestException("Redirect URI must be absolute: " + value);
            }
            if (uri.getFragment() != null) {
                throw new BadRequestException("Redirect URI must not contain a fragment: " + value);
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            boolean loopback = "localhost".equalsIgnoreCase(uri.getHost()) || "127.0.0.1".equals(uri.getHost());
            if (!"https".equals(scheme) && !("http".equals(scheme) && loopback)) {
                throw new BadRequestException("Redirect URI must use https: " + value);
            }
        }
        return new ArrayList<>(new LinkedHashSet<>(redirectUris));
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        List<String> result = new ArrayList<>();
        for (String value : new LinkedHashSet<>(values)) {
            if (value != null && !value.isBlank()) {
                result.add(value.trim());
            }
        }
        return result;
    }

    /**
     * Registration input.
     */
    public record NewClient(
        String clientId,
        String clientName,
        OAuthClient.ClientType clientType,
        List<String> redirectUris,
        List<String> allowedScopes,
        List<String> defaultScopes,
        boolean requirePkce
    ) {}

    /**
     * A registered client and, for confidential clients only, its plaintext secret.
     */
    public record Registration(OAuthClient client, String clientSecret) {}
}
