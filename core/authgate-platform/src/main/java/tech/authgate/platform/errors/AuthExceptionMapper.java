package tech.authgate.platform.errors;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Renders {@link AuthException} as a JSON error with the status of its {@link AuthError}.
 *
 * Browser routes never reach this mapper; they convert failures to redirects or HTML themselves.
 */
@Provider
public class AuthExceptionMapper implements ExceptionMapper<AuthException> {

    @Override
    public Response toResponse(AuthException exception) {
        var builder = Response.status(exception.error().status())
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .entity(new ErrorResponse(exception.error().code(), exception.description()));

        if (exception.error() == AuthError.INVALID_CLIENT || exception.error() == AuthError.INVALID_TOKEN) {
            builder.header("WWW-Authenticate", "Bearer error=\"" + exception.error().code() + "\"");
        }
        return builder.build();
    }
}
