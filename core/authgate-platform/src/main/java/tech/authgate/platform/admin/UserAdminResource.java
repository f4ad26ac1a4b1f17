package tech.authgate.platform.admin;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.authgate.platform.authentication.idp.UserAccount;
import tech.authgate.platform.authentication.idp.UserRegistrationService;
import tech.authgate.platform.shared.RequestOriginResolver;

/**
 * Admin API for accounts of the built-in identity provider.
 */
@Path("/admin/users")
@Tag(name = "Admin - Users", description = "Accounts of the built-in identity provider")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@AdminAuthenticated
public class UserAdminResource {

    @Inject
    UserRegistrationService registrationService;

    @Inject
    RequestOriginResolver originResolver;

    @POST
    @Operation(summary = "Register a user")
    @APIResponse(responseCode = "201", description = "User registered")
    @APIResponse(responseCode = "409", description = "Email already registered")
    public Response createUser(@Valid CreateUserRequest request) {
        UserAccount account = registrationService.register(
            request.email(), request.password(), request.role(),
            AdminTokenFilter.ADMIN_ACTOR, originResolver.current());

        return Response.status(Response.Status.CREATED)
            .entity(new UserDto(account.id, account.email, account.role, account.active))
            .build();
    }

    public record CreateUserRequest(
        @NotBlank(message = "Email is required")
        @Email
        String email,

        @NotBlank(message = "Password is required")
        @Size(min = 12, max = 256, message = "Password must be at least 12 characters")
        String password,

        @Size(max = 50)
        String role
    ) {}

    public record UserDto(String id, String email, String role, boolean active) {}
}
