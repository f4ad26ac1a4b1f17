package tech.authgate.platform.authentication.idp;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;

import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Bounds every identity provider call.
 *
 * The timeout can be tuned with
 * {@code tech.authgate.platform.authentication.idp.IdentityProviderGateway/authenticate/Timeout/value}.
 * Callers translate {@link TimeoutException} and
 * {@link org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException} into
 * auth_service_unavailable.
 */
@ApplicationScoped
public class IdentityProviderGateway {

    @Inject
    IdentityProvider identityProvider;

    @Timeout(value = 3, unit = ChronoUnit.SECONDS)
    @CircuitBreaker(requestVolumeThreshold = 10, failureRatio = 0.5, delay = 10, delayUnit = ChronoUnit.SECONDS,
        failOn = {IdentityProviderUnavailableException.class, TimeoutException.class})
    public Optional<AuthenticatedUser> authenticate(String identifier, String credential) {
        return identityProvider.authenticate(identifier, credential);
    }
}
