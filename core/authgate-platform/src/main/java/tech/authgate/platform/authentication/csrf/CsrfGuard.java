package tech.authgate.platform.authentication.csrf;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.authgate.platform.authentication.AuthConfig;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.authentication.TokenIssuer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * One-time CSRF tokens for the browser login leg of the authorize flow.
 *
 * A token is bound to the browser (binding id held in a cookie) and to the OAuth client the
 * login was started for. Validation removes the token atomically, so a token passes at most
 * once. Unknown, expired, re-used or mismatched tokens all fail.
 *
 * Tokens live in memory. Caffeine evicts them after the lifetime; the expiry check against
 * the injected clock is what decides validity.
 */
@ApplicationScoped
public class CsrfGuard {

    private static final Logger LOG = Logger.getLogger(CsrfGuard.class);

    private final Cache<String, Binding> outstanding;
    private final TokenIssuer tokenIssuer;
    private final Duration ttl;
    private final Clock clock;

    @Inject
    public CsrfGuard(AuthConfig config, TokenIssuer tokenIssuer, Clock clock) {
        this(config.csrf().ttl(), config.csrf().maxOutstanding(), tokenIssuer, clock);
    }

    public CsrfGuard(Duration ttl, long maxOutstanding, TokenIssuer tokenIssuer, Clock clock) {
        this.ttl = ttl;
        this.tokenIssuer = tokenIssuer;
        this.clock = clock;
        this.outstanding = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxOutstanding)
            .build();
    }

    /**
     * Issue a token for the given browser binding and client.
     */
    public String issue(String bindingId, String clientId) {
        if (bindingId == null || bindingId.isBlank()) {
            throw new IllegalArgumentException("CSRF binding id is required");
        }
        String token = tokenIssuer.randomValue();
        outstanding.put(token, new Binding(bindingId, clientId, clock.instant().plus(ttl)));
        return token;
    }

    /**
     * Consume a token. Returns true only if it was outstanding, unexpired, and bound to
     * exactly this browser and client.
     */
    public boolean validate(String token, String bindingId, String clientId) {
        if (token == null || bindingId == null) {
            return false;
        }
        Binding binding = outstanding.asMap().remove(token);
        if (binding == null) {
            LOG.debug("CSRF token unknown or already used");
            return false;
        }
        if (!clock.instant().isBefore(binding.expiresAt())) {
            LOG.debug("CSRF token expired");
            return false;
        }
        boolean sameClient = binding.clientId() == null
            ? clientId == null
            : CredentialHasher.constantTimeEquals(binding.clientId(), clientId);
        return CredentialHasher.constantTimeEquals(binding.bindingId(), bindingId) && sameClient;
    }

    long outstandingCount() {
        outstanding.cleanUp();
        return outstanding.estimatedSize();
    }

    private record Binding(String bindingId, String clientId, Instant expiresAt) {}
}
