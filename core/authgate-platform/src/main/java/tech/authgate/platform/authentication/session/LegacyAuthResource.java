package tech.authgate.platform.authentication.session;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.authentication.credential.PresentedCredential;
import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.AuthException;
import tech.authgate.platform.errors.ReasonCode;
import tech.authgate.platform.shared.RequestOriginResolver;

/**
 * Session-token endpoints for CLI, MCP and machine clients.
 *
 * Every route consumes and produces exactly application/json, whatever the client. The
 * platform comes from the {@code platform} field or the {@code X-Client-Platform} header.
 */
@Path("/v1/auth")
@Tag(name = "Legacy Sessions", description = "Session-token login for CLI, MCP and machine clients")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LegacyAuthResource {

    public static final String PLATFORM_HEADER = "X-Client-Platform";

    @Inject
    LegacySessionService sessionService;

    @Inject
    RequestOriginResolver originResolver;

    @POST
    @Path("/login")
    @Operation(summary = "Open a session with identifier and credential")
    @APIResponse(responseCode = "200", description = "Session opened",
        content = @Content(schema = @Schema(implementation = LegacySessionService.LoginResult.class)))
    @APIResponse(responseCode = "401", description = "invalid_credentials")
    @APIResponse(responseCode = "503", description = "Identity provider unavailable")
    public Response login(LoginRequest request, @HeaderParam(PLATFORM_HEADER) String platformHeader) {
        if (request == null || isBlank(request.identifier()) || isBlank(request.credential())) {
            throw new AuthException(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER,
                "identifier and credential are required");
        }
        ClientPlatform platform = resolvePlatform(request.platform(), platformHeader);

        LegacySessionService.LoginResult result = sessionService.login(
            request.identifier(), request.credential(), platform, originResolver.current());
        return Response.ok(result).header("Cache-Control", "no-store").build();
    }

    /**
     * Accepts the session token or the refresh token, as a Bearer header or in the body.
     */
    @POST
    @Path("/refresh")
    @Operation(summary = "Extend a session")
    @APIResponse(responseCode = "200", description = "Session extended")
    @APIResponse(responseCode = "401", description = "invalid_token")
    public LegacySessionService.SessionInfo refresh(
            TokenRequest request,
            @HeaderParam("Authorization") String authorization) {
        return sessionService.refresh(presentedToken(request, authorization), originResolver.current());
    }

    @POST
    @Path("/logout")
    @Operation(summary = "Revoke a session")
    @APIResponse(responseCode = "204", description = "Session revoked, or already gone")
    public Response logout(TokenRequest request, @HeaderParam("Authorization") String authorization) {
        String token = request != null && !isBlank(request.token())
            ? request.token()
            : PresentedCredential.bearerValue(authorization);
        sessionService.logout(token, originResolver.current());
        return Response.noContent().build();
    }

    @GET
    @Path("/session")
    @Operation(summary = "Validate the presented session token")
    @APIResponse(responseCode = "200", description = "Session is live")
    @APIResponse(responseCode = "401", description = "invalid_token")
    public LegacySessionService.SessionInfo session(@HeaderParam("Authorization") String authorization) {
        return sessionService.validateSession(PresentedCredential.bearerValue(authorization), originResolver.current());
    }

    private static String presentedToken(TokenRequest request, String authorization) {
        String token = request != null && !isBlank(request.token())
            ? request.token()
            : PresentedCredential.bearerValue(authorization);
        if (isBlank(token)) {
            throw new AuthException(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER, "token is required");
        }
        return token;
    }

    /**
     * The body field wins over the header. An unrecognized value is rejected rather than guessed.
     */
    private static ClientPlatform resolvePlatform(String field, String header) {
        String value = !isBlank(field) ? field : header;
        if (isBlank(value)) {
            return null;
        }
        return ClientPlatform.parse(value)
            .orElseThrow(() -> new AuthException(AuthError.INVALID_REQUEST, ReasonCode.MISSING_PARAMETER,
                "platform must be one of CLI, WEB, API, MCP"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record LoginRequest(String identifier, String credential, String platform) {}

    public record TokenRequest(String token) {}
}
