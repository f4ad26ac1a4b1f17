package tech.authgate.platform.authentication.idp;

/**
 * Identity confirmed by an {@link IdentityProvider}.
 */
public record AuthenticatedUser(String userId, String email, String role) {}
