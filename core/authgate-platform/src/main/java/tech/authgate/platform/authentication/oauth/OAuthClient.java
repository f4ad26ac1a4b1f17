package tech.authgate.platform.authentication.oauth;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A registered OAuth client (browser app, IDE extension, or back end).
 *
 * Only redirectUris and enabled change after registration. Clients are never deleted;
 * disabling one makes every authorize and token request for it fail with invalid_client.
 */
public class OAuthClient {

    public String id;

    /**
     * Public identifier sent as client_id.
     */
    public String clientId;

    public String clientName;

    public ClientType clientType;

    /**
     * Argon2id hash of the client secret. Only set for CONFIDENTIAL clients.
     */
    public String clientSecretHash;

    /**
     * Registered redirect URIs. Matching is exact string equality, no normalization.
     */
    public List<String> redirectUris = new ArrayList<>();

    public List<String> allowedScopes = new ArrayList<>();

    /**
     * Scopes granted when the authorize request names none.
     */
    public List<String> defaultScopes = new ArrayList<>();

    /**
     * Always true for PUBLIC clients.
     */
    public boolean requiresPkce = true;

    public boolean enabled = true;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public OAuthClient() {
    }

    public boolean isPublic() {
        return clientType == ClientType.PUBLIC;
    }

    public boolean pkceRequired() {
        return requiresPkce || isPublic();
    }

    /**
     * Exact membership check. "https://a/cb" and "https://a/cb/" are different URIs.
     */
    public boolean isRedirectUriRegistered(String redirectUri) {
        return redirectUri != null && redirectUris != null && redirectUris.contains(redirectUri);
    }

    public boolean allowsScopes(Set<String> requested) {
        return allowedScopes != null && allowedScopes.containsAll(requested);
    }

    public enum ClientType {
        /**
         * Cannot keep a secret (SPA, IDE extension). PKCE mandatory.
         */
        PUBLIC,
        /**
         * Authenticates with a client secret at the token endpoint.
         */
        CONFIDENTIAL
    }
}
