package tech.authgate.platform.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.shared.RequestOriginResolver;
import tech.authgate.platform.vendor.VendorApiKey;
import tech.authgate.platform.vendor.VendorKeyService;
import tech.authgate.platform.vendor.VendorOrganization;
import tech.authgate.platform.vendor.VendorUsageRepository;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Admin API for vendor organizations, their API keys and their usage.
 */
@Path("/admin")
@Tag(name = "Admin - Vendors", description = "Vendor organizations and API keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@AdminAuthenticated
public class VendorAdminResource {

    @Inject
    VendorKeyService vendorKeyService;

    @Inject
    RequestOriginResolver originResolver;

    @POST
    @Path("/vendors")
    @Operation(summary = "Create a vendor organization")
    @APIResponse(responseCode = "201", description = "Organization created")
    @APIResponse(responseCode = "409", description = "Vendor code in use")
    public Response createVendor(@Valid CreateVendorRequest request) {
        VendorOrganization org = vendorKeyService.createOrganization(
            new VendorKeyService.NewOrganization(
                request.vendorCode(),
                request.name(),
                request.allowedPlatforms(),
                request.allowedServices(),
                request.rateLimitPerMinute()),
            AdminTokenFilter.ADMIN_ACTOR,
            originResolver.current());

        return Response.status(Response.Status.CREATED).entity(toDto(org)).build();
    }

    /**
     * The full API key is only returned here.
     */
    @POST
    @Path("/vendors/{orgId}/keys")
    @Operation(summary = "Issue an API key for a vendor organization")
    @APIResponse(responseCode = "201", description = "Key issued")
    @APIResponse(responseCode = "404", description = "Organization not found")
    public Response issueKey(@PathParam("orgId") String orgId, @Valid IssueKeyRequest request) {
        IssueKeyRequest body = request != null ? request : new IssueKeyRequest(null, null, null);
        VendorKeyService.IssuedKey issued = vendorKeyService.issueKey(
            orgId,
            new VendorKeyService.NewKey(body.name(), body.keyType(), body.environment()),
            AdminTokenFilter.ADMIN_ACTOR,
            originResolver.current());

        VendorApiKey key = issued.key();
        return Response.status(Response.Status.CREATED)
            .entity(new IssuedKeyResponse(key.keyId, key.orgId, key.keyType, key.environment, key.name, issued.apiKey()))
            .build();
    }

    @POST
    @Path("/vendor-keys/{keyId}/revoke")
    @Operation(summary = "Revoke a vendor API key")
    @APIResponse(responseCode = "404", description = "Key not found")
    public RevokeKeyResponse revokeKey(@PathParam("keyId") String keyId) {
        boolean revoked = vendorKeyService.revokeKey(keyId, AdminTokenFilter.ADMIN_ACTOR, originResolver.current());
        return new RevokeKeyResponse(keyId, revoked);
    }

    @GET
    @Path("/vendors/{orgId}/usage")
    @Operation(summary = "Summarize vendor usage over a time range")
    public VendorUsageRepository.UsageSummary usage(
            @PathParam("orgId") String orgId,
            @Parameter(description = "Start of range (ISO-8601 instant, inclusive)") @QueryParam("from") String from,
            @Parameter(description = "End of range (ISO-8601 instant, exclusive)") @QueryParam("to") String to) {
        return vendorKeyService.usageSummary(orgId, parseInstant("from", from), parseInstant("to", to));
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException("'" + name + "' is required");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("'" + name + "' must be an ISO-8601 instant");
        }
    }

    private static VendorDto toDto(VendorOrganization org) {
        return new VendorDto(org.id, org.vendorCode, org.name, org.allowedPlatforms, org.allowedServices,
            org.rateLimitPerMinute, org.active, org.createdAt);
    }

    // ==================== DTOs ====================

    public record CreateVendorRequest(
        @NotBlank(message = "Vendor code is required")
        @Pattern(regexp = "^[a-zA-Z0-9][a-zA-Z0-9-]{1,49}$", message = "Vendor code must be alphanumeric")
        String vendorCode,

        @NotBlank(message = "Name is required")
        @Size(max = 200)
        String name,

        List<String> allowedPlatforms,

        Map<String, Boolean> allowedServices,

        Integer rateLimitPerMinute
    ) {}

    public record IssueKeyRequest(
        @Size(max = 200)
        String name,

        VendorApiKey.KeyType keyType,

        @Size(max = 50)
        String environment
    ) {}

    public record VendorDto(
        String id,
        String vendorCode,
        String name,
        List<String> allowedPlatforms,
        Map<String, Boolean> allowedServices,
        int rateLimitPerMinute,
        boolean active,
        Instant createdAt
    ) {}

    public record IssuedKeyResponse(
        String keyId,
        String orgId,
        VendorApiKey.KeyType keyType,
        String environment,
        String name,
        String apiKey
    ) {}

    public record RevokeKeyResponse(String keyId, boolean revoked) {}
}
