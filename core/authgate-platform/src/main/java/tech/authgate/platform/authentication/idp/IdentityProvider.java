package tech.authgate.platform.authentication.idp;

import java.util.Optional;

/**
 * Verifies a user's primary credential.
 *
 * Implementations return empty for any credential failure (unknown identifier, wrong password,
 * disabled account) without saying which, and throw
 * {@link IdentityProviderUnavailableException} only when no answer could be obtained.
 */
public interface IdentityProvider {

    Optional<AuthenticatedUser> authenticate(String identifier, String credential);
}
