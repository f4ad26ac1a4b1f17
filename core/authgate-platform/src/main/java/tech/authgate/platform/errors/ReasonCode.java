package tech.authgate.platform.errors;

/**
 * Internal cause of an authorization decision. Recorded on audit events, never returned to callers.
 */
public enum ReasonCode {

    OK,

    // Request shape
    MISSING_PARAMETER,
    UNSUPPORTED_RESPONSE_TYPE,
    UNSUPPORTED_GRANT_TYPE,
    INVALID_SCOPE,

    // Client
    INVALID_CLIENT,
    CLIENT_DISABLED,
    INVALID_CLIENT_SECRET,
    INVALID_REDIRECT_URI,
    CLIENT_MISMATCH,
    REDIRECT_MISMATCH,

    // PKCE
    MISSING_PKCE,
    UNSUPPORTED_CHALLENGE_METHOD,
    INVALID_PKCE,

    // Authorization codes
    UNKNOWN_CODE,
    EXPIRED_CODE,
    REUSED_CODE,
    CODE_RACE_LOST,

    // Tokens
    UNKNOWN_TOKEN,
    EXPIRED_TOKEN,
    REVOKED_TOKEN,
    REFRESH_TOKEN_REUSED,
    WRONG_TOKEN_TYPE,
    INVALID_SIGNATURE,

    // Legacy sessions
    INVALID_CREDENTIALS,
    ACCOUNT_DISABLED,
    IDP_TIMEOUT,
    IDP_UNAVAILABLE,
    SESSION_NOT_FOUND,
    SESSION_EXPIRED,
    SESSION_REVOKED,
    CSRF_INVALID,

    // Vendor keys
    MALFORMED_KEY,
    UNKNOWN_KEY,
    INVALID_KEY_SECRET,
    REVOKED_KEY,
    ORG_INACTIVE,
    PLATFORM_NOT_ALLOWED,
    SERVICE_NOT_ALLOWED,
    RATE_LIMITED,

    INTERNAL_ERROR
}
