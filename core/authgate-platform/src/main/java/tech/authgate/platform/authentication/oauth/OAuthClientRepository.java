package tech.authgate.platform.authentication.oauth;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for OAuthClient entities.
 */
public interface OAuthClientRepository {

    // Read operations
    Optional<OAuthClient> findByClientId(String clientId);
    List<OAuthClient> findAllClients();
    boolean existsByClientId(String clientId);

    // Write operations
    void persist(OAuthClient client);
    void update(OAuthClient client);
}
