package tech.authgate.platform.admin;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.ErrorResponse;

/**
 * Rejects {@link AdminAuthenticated} requests whose {@code X-Admin-Token} does not match
 * the configured token. The comparison is constant-time.
 */
@Provider
@AdminAuthenticated
@Priority(Priorities.AUTHENTICATION)
public class AdminTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AdminTokenFilter.class);

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    /**
     * Actor id recorded in audit events for admin operations.
     */
    public static final String ADMIN_ACTOR = "admin-api";

    @Inject
    AdminConfig config;

    @Override
    public void filter(ContainerRequestContext ctx) {
        String presented = ctx.getHeaderString(ADMIN_TOKEN_HEADER);
        String expected = config.apiToken().filter(token -> !token.isBlank()).orElse(null);

        if (expected == null || !CredentialHasher.constantTimeEquals(presented, expected)) {
            LOG.warnf("Rejected admin request to %s", ctx.getUriInfo().getPath());
            ctx.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(AuthError.INVALID_TOKEN.code(), "Admin token required"))
                .build());
        }
    }
}
