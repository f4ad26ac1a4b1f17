package tech.authgate.platform.authentication.oauth;

import tech.authgate.platform.errors.AuthError;
import tech.authgate.platform.errors.AuthException;
import tech.authgate.platform.errors.ReasonCode;

/**
 * Authorize request rejected before its redirect URI could be trusted (unknown or disabled
 * client, or an unregistered redirect URI). The error must be shown to the user agent
 * directly and never sent to the redirect URI.
 */
public class UntrustedRedirectException extends AuthException {

    public UntrustedRedirectException(AuthError error, ReasonCode reason) {
        super(error, reason);
    }
}
