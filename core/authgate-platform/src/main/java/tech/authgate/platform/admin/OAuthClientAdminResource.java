package tech.authgate.platform.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.authentication.oauth.OAuthClient;
import tech.authgate.platform.authentication.oauth.OAuthClient.ClientType;
import tech.authgate.platform.authentication.oauth.OAuthClientRegistrationService;
import tech.authgate.platform.shared.RequestOriginResolver;

import java.time.Instant;
import java.util.List;

/**
 * Admin API for OAuth client registration.
 */
@Path("/admin/oauth-clients")
@Tag(name = "Admin - OAuth Clients", description = "Registration and lifecycle of OAuth clients")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@AdminAuthenticated
public class OAuthClientAdminResource {

    @Inject
    OAuthClientRegistrationService registrationService;

    @Inject
    RequestOriginResolver originResolver;

    @GET
    @Operation(summary = "List all OAuth clients")
    public List<ClientDto> listClients() {
        return registrationService.listClients().stream()
            .map(OAuthClientAdminResource::toDto)
            .toList();
    }

    /**
     * For confidential clients the secret is returned once in the response and cannot be
     * retrieved again.
     */
    @POST
    @Operation(summary = "Register an OAuth client")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Client registered",
            content = @Content(schema = @Schema(implementation = CreateClientResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid request"),
        @APIResponse(responseCode = "409", description = "client_id already registered")
    })
    public Response createClient(@Valid CreateClientRequest request, @Context UriInfo uriInfo) {
        OAuthClientRegistrationService.Registration registration = registrationService.register(
            new OAuthClientRegistrationService.NewClient(
                request.clientId(),
                request.clientName(),
                request.clientType(),
                request.redirectUris(),
                request.allowedScopes(),
                request.defaultScopes(),
                request.requirePkce() == null || request.requirePkce()),
            AdminTokenFilter.ADMIN_ACTOR,
            originResolver.current());

        OAuthClient client = registration.client();
        return Response.status(Response.Status.CREATED)
            .entity(new CreateClientResponse(toDto(client), registration.clientSecret()))
            .location(uriInfo.getAbsolutePathBuilder().path(client.clientId).build())
            .build();
    }

    @PUT
    @Path("/{clientId}/redirect-uris")
    @Operation(summary = "Replace the registered redirect URIs")
    @APIResponse(responseCode = "404", description = "Client not found")
    public ClientDto replaceRedirectUris(@PathParam("clientId") String clientId, @Valid RedirectUrisRequest request) {
        return toDto(registrationService.replaceRedirectUris(
            clientId, request.redirectUris(), AdminTokenFilter.ADMIN_ACTOR, originResolver.current()));
    }

    @POST
    @Path("/{clientId}/disable")
    @Operation(summary = "Soft-disable an OAuth client")
    @APIResponse(responseCode = "404", description = "Client not found")
    public ClientDto disableClient(@PathParam("clientId") String clientId) {
        return toDto(registrationService.disable(clientId, AdminTokenFilter.ADMIN_ACTOR, originResolver.current()));
    }

    private static ClientDto toDto(OAuthClient client) {
        return new ClientDto(
            client.id,
            client.clientId,
            client.clientName,
            client.clientType,
            client.redirectUris,
            client.allowedScopes,
            client.defaultScopes,
            client.pkceRequired(),
            client.enabled,
            client.createdAt,
            client.updatedAt
        );
    }

    // ==================== DTOs ====================

    public record ClientDto(
        String id,
        String clientId,
        String clientName,
        ClientType clientType,
        List<String> redirectUris,
        List<String> allowedScopes,
        List<String> defaultScopes,
        boolean pkceRequired,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt
    ) {}

    public record CreateClientRequest(
        @Size(max = 100)
        String clientId,

        @NotBlank(message = "Client name is required")
        @Size(max = 255)
        String clientName,

        @NotNull(message = "Client type is required")
        ClientType clientType,

        @NotNull(message = "At least one redirect URI is required")
        @Size(min = 1, message = "At least one redirect URI is required")
        List<String> redirectUris,

        List<String> allowedScopes,

        List<String> defaultScopes,

        Boolean requirePkce
    ) {}

    public record RedirectUrisRequest(
        @NotNull(message = "At least one redirect URI is required")
        @Size(min = 1, message = "At least one redirect URI is required")
        List<String> redirectUris
    ) {}

    public record CreateClientResponse(
        ClientDto client,
        String clientSecret
    ) {}
}
