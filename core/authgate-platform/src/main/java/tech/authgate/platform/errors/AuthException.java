package tech.authgate.platform.errors;

/**
 * Rejection of an authentication or authorization request.
 *
 * Carries the external {@link AuthError} plus the internal {@link ReasonCode}. The message is the
 * description shown to callers, so it must never contain the reason code or any secret.
 */
public class AuthException extends RuntimeException {

    private final AuthError error;
    private final ReasonCode reason;

    public AuthException(AuthError error, ReasonCode reason) {
        this(error, reason, error.defaultDescription());
    }

    public AuthException(AuthError error, ReasonCode reason, String description) {
        super(description);
        this.error = error;
        this.reason = reason;
    }

    public AuthException(AuthError error, ReasonCode reason, Throwable cause) {
        super(error.defaultDescription(), cause);
        this.error = error;
        this.reason = reason;
    }

    public AuthError error() {
        return error;
    }

    public ReasonCode reason() {
        return reason;
    }

    public String description() {
        return getMessage();
    }
}
