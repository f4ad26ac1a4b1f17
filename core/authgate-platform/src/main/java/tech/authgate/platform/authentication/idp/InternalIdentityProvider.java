package tech.authgate.platform.authentication.idp;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import tech.authgate.platform.authentication.CredentialHasher;

import java.time.Clock;
import java.util.Optional;

/**
 * Identity provider backed by the user_accounts table and Argon2id password hashes.
 *
 * Unknown identifiers still pay for one Argon2 verification so that response time does not
 * reveal whether an account exists. Hashes made under older cost parameters are replaced on
 * the next successful sign-in.
 */
@ApplicationScoped
public class InternalIdentityProvider implements IdentityProvider {

    private static final Logger LOG = Logger.getLogger(InternalIdentityProvider.class);

    @Inject
    UserAccountRepository accounts;

    @Inject
    CredentialHasher hasher;

    @Inject
    Clock clock;

    private volatile String timingDummyHash;

    @Override
    public Optional<AuthenticatedUser> authenticate(String identifier, String credential) {
        if (identifier == null || identifier.isBlank() || credential == null || credential.isEmpty()) {
            return Optional.empty();
        }

        Optional<UserAccount> found;
        try {
            found = accounts.findByEmail(identifier.trim());
        } catch (PersistenceException e) {
            throw new IdentityProviderUnavailableException("User store unavailable", e);
        }

        if (found.isEmpty()) {
            hasher.verifySlow(credential, dummyHash());
            return Optional.empty();
        }

        UserAccount account = found.get();
        if (!hasher.verifySlow(credential, account.passwordHash) || !account.active) {
            LOG.debugf("Credential check failed for account %s", account.id);
            return Optional.empty();
        }

        if (hasher.needsRehash(account.passwordHash)) {
            // Hashed under older cost parameters; upgrade while the plaintext is at hand
            accounts.updatePasswordHash(account.id, hasher.slowHash(credential));
            LOG.infof("Password hash upgraded for account %s", account.id);
        }
        accounts.updateLastLogin(account.id, clock.instant());
        return Optional.of(new AuthenticatedUser(account.id, account.email, account.role));
    }

    private String dummyHash() {
        String hash = timingDummyHash;
        if (hash == null) {
            hash = hasher.slowHash("timing-equalization-placeholder");
            timingDummyHash = hash;
        }
        return hash;
    }
}
