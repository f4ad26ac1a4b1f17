package tech.authgate.platform.authentication.idp;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.authgate.platform.audit.AuditAction;
import tech.authgate.platform.audit.AuditEvent;
import tech.authgate.platform.audit.AuditLogger;
import tech.authgate.platform.audit.RequestOrigin;
import tech.authgate.platform.authentication.CredentialHasher;

import java.time.Clock;

/**
 * Creates accounts for the built-in identity provider.
 */
@ApplicationScoped
public class UserRegistrationService {

    private static final Logger LOG = Logger.getLogger(UserRegistrationService.class);

    @Inject
    UserAccountRepository accounts;

    @Inject
    CredentialHasher hasher;

    @Inject
    AuditLogger audit;

    @Inject
    Clock clock;

    @Transactional
    public UserAccount register(String email, String password, String role, String adminId, RequestOrigin origin) {
        if (accounts.existsByEmail(email)) {
            throw new ClientErrorException("An account already exists for this email", Response.Status.CONFLICT);
        }

        UserAccount account = new UserAccount();
        account.email = email.trim();
        account.passwordHash = hasher.slowHash(password);
        account.role = role != null && !role.isBlank() ? role : "user";
        account.active = true;
        account.createdAt = clock.instant();
        accounts.persist(account);

        audit.record(AuditEvent.success(AuditAction.ADMIN_USER_REGISTER, AuditEvent.ActorType.ADMIN, adminId)
            .origin(origin));
        LOG.infof("User account registered: %s", account.id);
        return account;
    }
}
