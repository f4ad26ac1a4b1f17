package tech.authgate.platform.authentication.idp;

/**
 * The identity provider could not give an answer (as opposed to rejecting the credentials).
 */
public class IdentityProviderUnavailableException extends RuntimeException {

    public IdentityProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
