package tech.authgate.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import tech.authgate.platform.authentication.oauth.OAuthClient;
import tech.authgate.platform.authentication.oauth.OAuthClientRepository;
import tech.authgate.platform.authentication.oauth.entity.OAuthClientEntity;
import tech.authgate.platform.authentication.oauth.mapper.OAuthClientMapper;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    public List<OAuthClient> findAllClients() {
        return listAll(Sort.ascending("clientId")).stream()
            .map(OAuthClientMapper::toDomain)
            .toList();
    }

    @Override
    public boolean existsByClientId(String clientId) {
        return count("clientId", clientId) > 0;
    }

    @Override
    public void persist(OAuthClient client) {
        if (client.id == null) {
            client.id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        }
        persist(OAuthClientMapper.toEntity(client));
    }

    @Override
    public void update(OAuthClient client) {
        OAuthClientEntity entity = findById(client.id);
        if (entity != null) {
            client.updatedAt = Instant.now();
            OAuthClientMapper.updateEntity(entity, client);
        }
    }
}
