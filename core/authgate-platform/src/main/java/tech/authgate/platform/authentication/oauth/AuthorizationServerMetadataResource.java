package tech.authgate.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.authentication.AuthConfig;

import java.util.List;

/**
 * RFC 8414 authorization server metadata.
 */
@Path("/.well-known")
@Tag(name = "Discovery", description = "OAuth2 discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class AuthorizationServerMetadataResource {

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Get OAuth2 authorization server metadata")
    @APIResponse(responseCode = "200", description = "Server metadata")
    public Metadata metadata() {
        String baseUrl = getBaseUrl();
        return new Metadata(
            baseUrl,
            baseUrl + "/oauth/authorize",
            baseUrl + "/oauth/token",
            baseUrl + "/oauth/revoke",
            baseUrl + "/oauth/introspect",
            List.of(OAuthAuthorizationService.RESPONSE_TYPE_CODE),
            List.of(OAuthAuthorizationService.GRANT_AUTHORIZATION_CODE, OAuthAuthorizationService.GRANT_REFRESH_TOKEN),
            List.of(PkceService.METHOD_S256),
            List.of("client_secret_basic", "client_secret_post", "none")
        );
    }

    private String getBaseUrl() {
        return authConfig.oauth().externalBaseUrl()
            .orElseGet(() -> uriInfo.getBaseUri().toString())
            .replaceAll("/$", "");
    }

    public record Metadata(
        @JsonProperty("issuer") String issuer,
        @JsonProperty("authorization_endpoint") String authorizationEndpoint,
        @JsonProperty("token_endpoint") String tokenEndpoint,
        @JsonProperty("revocation_endpoint") String revocationEndpoint,
        @JsonProperty("introspection_endpoint") String introspectionEndpoint,
        @JsonProperty("response_types_supported") List<String> responseTypesSupported,
        @JsonProperty("grant_types_supported") List<String> grantTypesSupported,
        @JsonProperty("code_challenge_methods_supported") List<String> codeChallengeMethodsSupported,
        @JsonProperty("token_endpoint_auth_methods_supported") List<String> tokenEndpointAuthMethodsSupported
    ) {}
}
