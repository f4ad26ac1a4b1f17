package tech.authgate.platform.errors;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Last-resort mapper. Logs the failure and answers with a bare {@code server_error}
 * so that internal messages never reach the caller.
 */
@Provider
public class UnhandledExceptionMapper implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(UnhandledExceptionMapper.class);

    @Override
    public Response toResponse(Exception exception) {
        if (exception instanceof WebApplicationException) {
            // Framework-generated responses (404, 405, 415...) keep their status
            Response original = ((WebApplicationException) exception).getResponse();
            int status = original.getStatus();
            if (status >= 500) {
                LOG.errorf(exception, "Request failed with status %d", status);
                return Response.status(status)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(ErrorResponse.of(AuthError.SERVER_ERROR))
                    .build();
            }
            // Admin services raise 4xx with a caller-facing message
            String description = exception.getMessage() != null
                ? exception.getMessage()
                : original.getStatusInfo().getReasonPhrase();
            return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(AuthError.INVALID_REQUEST.code(), description))
                .build();
        }

        LOG.errorf(exception, "Unhandled error: %s", exception.getClass().getName());
        return Response.status(AuthError.SERVER_ERROR.status())
            .type(MediaType.APPLICATION_JSON)
            .entity(ErrorResponse.of(AuthError.SERVER_ERROR))
            .build();
    }
}
