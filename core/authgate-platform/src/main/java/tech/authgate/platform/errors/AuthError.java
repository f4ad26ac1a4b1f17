package tech.authgate.platform.errors;

/**
 * External error taxonomy. Each constant maps to one HTTP status and one OAuth-style wire code.
 *
 * The wire code is all a caller ever sees; the internal cause travels separately as a
 * {@link ReasonCode} and only reaches the audit trail.
 */
public enum AuthError {

    INVALID_REQUEST(400, "invalid_request"),
    INVALID_CLIENT(401, "invalid_client"),
    INVALID_GRANT(400, "invalid_grant"),
    UNAUTHORIZED_CLIENT(400, "unauthorized_client"),
    UNSUPPORTED_RESPONSE_TYPE(400, "unsupported_response_type"),
    UNSUPPORTED_GRANT_TYPE(400, "unsupported_grant_type"),
    INVALID_SCOPE(400, "invalid_scope"),
    ACCESS_DENIED(403, "access_denied"),
    INVALID_CREDENTIALS(401, "invalid_credentials"),
    INVALID_TOKEN(401, "invalid_token"),
    RATE_LIMIT_EXCEEDED(429, "rate_limit_exceeded"),
    AUTH_SERVICE_UNAVAILABLE(503, "auth_service_unavailable"),
    SERVER_ERROR(500, "server_error");

    private final int status;
    private final String code;

    AuthError(int status, String code) {
        this.status = status;
        this.code = code;
    }

    public int status() {
        return status;
    }

    /**
     * Value of the {@code error} field on the wire.
     */
    public String code() {
        return code;
    }

    /**
     * Generic description safe to show to any caller.
     */
    public String defaultDescription() {
        switch (this) {
            case INVALID_REQUEST:
                return "The request is missing a required parameter or is otherwise malformed";
            case INVALID_CLIENT:
                return "Client authentication failed";
            case INVALID_GRANT:
                return "The provided grant is invalid, expired or revoked";
            case UNAUTHORIZED_CLIENT:
                return "The client is not authorized to use this grant";
            case UNSUPPORTED_RESPONSE_TYPE:
                return "Only response_type=code is supported";
            case UNSUPPORTED_GRANT_TYPE:
                return "Unsupported grant type";
            case INVALID_SCOPE:
                return "The requested scope is invalid or not permitted";
            case ACCESS_DENIED:
                return "Access denied";
            case INVALID_CREDENTIALS:
                return "Invalid credentials";
            case INVALID_TOKEN:
                return "The token is invalid or expired";
            case RATE_LIMIT_EXCEEDED:
                return "Rate limit exceeded";
            case AUTH_SERVICE_UNAVAILABLE:
                return "Authentication service temporarily unavailable";
            default:
                return "Internal server error";
        }
    }
}
